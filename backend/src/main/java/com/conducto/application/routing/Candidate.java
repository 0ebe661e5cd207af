/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.application.routing;

/**
 * A (provider, model) pair that passed the eligibility gate, with the health observed when it
 * was discovered.
 */
public record Candidate(
        ProviderInfo provider,
        ModelInfo model,
        HealthSnapshot health
) {
    public String providerId() {
        return provider.id();
    }

    public String modelName() {
        return model.modelName();
    }
}
