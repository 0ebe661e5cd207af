/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.application.routing;

import java.time.Instant;

/**
 * Read view of a provider's health row. {@code successRate} is derived from the counters and
 * is {@code null} while the provider has not served any traffic.
 */
public record HealthSnapshot(
        String providerId,
        boolean healthy,
        long totalRequests,
        long failedRequests,
        Double successRate,
        String lastError,
        Instant lastCheckedAt,
        Instant updatedAt
) {
    public static HealthSnapshot of(
            String providerId,
            boolean healthy,
            long totalRequests,
            long failedRequests,
            String lastError,
            Instant lastCheckedAt,
            Instant updatedAt
    ) {
        return new HealthSnapshot(
                providerId,
                healthy,
                totalRequests,
                failedRequests,
                successRate(totalRequests, failedRequests),
                lastError,
                lastCheckedAt,
                updatedAt
        );
    }

    /**
     * Snapshot for a provider that has no row yet: healthy, no traffic.
     */
    public static HealthSnapshot unknown(String providerId) {
        return of(providerId, true, 0, 0, null, null, null);
    }

    public static Double successRate(long totalRequests, long failedRequests) {
        if (totalRequests <= 0) return null;
        double rate = (double) (totalRequests - failedRequests) / (double) totalRequests * 100.0;
        if (rate < 0) return 0.0;
        if (rate > 100) return 100.0;
        return rate;
    }

    public double successRateOr(double neutral) {
        return successRate == null ? neutral : successRate;
    }
}
