/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.application.routing;

import java.math.BigDecimal;
import java.math.RoundingMode;

public record ModelInfo(
        String modelName,
        BigDecimal costPer1kInput,
        BigDecimal costPer1kOutput,
        int qualityScore,
        int minTrustRequired,
        int contextWindow,
        int maxTokens
) {
    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

    public ModelInfo {
        if (costPer1kInput == null) costPer1kInput = BigDecimal.ZERO;
        if (costPer1kOutput == null) costPer1kOutput = BigDecimal.ZERO;
    }

    /**
     * in/1000 × costIn + out/1000 × costOut, scale 6.
     */
    public BigDecimal costFor(long inputUnits, long outputUnits) {
        BigDecimal in = BigDecimal.valueOf(Math.max(0, inputUnits)).multiply(costPer1kInput);
        BigDecimal out = BigDecimal.valueOf(Math.max(0, outputUnits)).multiply(costPer1kOutput);
        return in.add(out).divide(THOUSAND, 6, RoundingMode.HALF_UP);
    }
}
