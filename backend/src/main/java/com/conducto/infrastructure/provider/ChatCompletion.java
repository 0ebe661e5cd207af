/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.infrastructure.provider;

public record ChatCompletion(
        String content,
        String model,
        long inputUnits,
        long outputUnits
) {}
