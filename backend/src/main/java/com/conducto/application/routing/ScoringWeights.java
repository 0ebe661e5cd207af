/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.application.routing;

import com.conducto.config.AppProperties;

public record ScoringWeights(
        double quality,
        double cost,
        double health,
        double priority
) {
    public static ScoringWeights defaults() {
        return new ScoringWeights(0.4, 0.3, 0.2, 0.1);
    }

    public static ScoringWeights from(AppProperties.Weights weights) {
        if (weights == null) return defaults();
        return new ScoringWeights(weights.quality(), weights.cost(), weights.health(), weights.priority());
    }
}
