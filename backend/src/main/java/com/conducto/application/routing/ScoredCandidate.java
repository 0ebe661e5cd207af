/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.application.routing;

public record ScoredCandidate(
        Candidate candidate,
        double totalScore,
        double qualityScore,
        double costScore,
        double healthScore,
        double priorityScore
) {}
