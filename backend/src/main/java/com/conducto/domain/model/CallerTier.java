/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.domain.model;

/**
 * Etiqueta derivada del trust score. Solo para observabilidad, nunca para gating.
 */
public enum CallerTier {
    PREMIUM("premium"),
    STANDARD("standard"),
    BASIC("basic");

    private final String label;

    CallerTier(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static CallerTier fromTrustScore(int trustScore) {
        if (trustScore >= 70) return PREMIUM;
        if (trustScore >= 50) return STANDARD;
        return BASIC;
    }
}
