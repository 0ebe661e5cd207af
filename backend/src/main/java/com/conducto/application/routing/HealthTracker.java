/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.application.routing;

import java.util.List;

public interface HealthTracker {
    /**
     * Passive channel: one call per real attempt.
     */
    void recordOutcome(String providerId, boolean success, String error);

    /**
     * Active channel: liveness only, counters stay untouched.
     */
    void recordProbe(String providerId, boolean healthy, String error);

    HealthSnapshot snapshot(String providerId);

    List<HealthSnapshot> snapshots();
}
