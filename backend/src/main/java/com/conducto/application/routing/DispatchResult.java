/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.application.routing;

import com.conducto.infrastructure.provider.ChatCompletion;

import java.math.BigDecimal;

public record DispatchResult(
        DispatchState state,
        ScoredCandidate chosen,
        ChatCompletion completion,
        BigDecimal cost,
        long latencyMs,
        int attempts
) {}
