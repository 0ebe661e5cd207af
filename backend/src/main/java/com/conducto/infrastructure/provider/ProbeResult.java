/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.infrastructure.provider;

public record ProbeResult(
        boolean healthy,
        long latencyMs,
        String error
) {
    public static ProbeResult healthy(long latencyMs) {
        return new ProbeResult(true, latencyMs, null);
    }

    public static ProbeResult unhealthy(long latencyMs, String error) {
        return new ProbeResult(false, latencyMs, error);
    }
}
