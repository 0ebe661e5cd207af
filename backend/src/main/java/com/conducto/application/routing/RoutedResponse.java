/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.application.routing;

import java.math.BigDecimal;

public record RoutedResponse(
        String content,
        String providerId,
        String providerName,
        String model,
        Usage usage,
        long latencyMs,
        int trustScore,
        String tier,
        int attempts,
        String requestId
) {
    public record Usage(
            long inputUnits,
            long outputUnits,
            BigDecimal cost
    ) {}
}
