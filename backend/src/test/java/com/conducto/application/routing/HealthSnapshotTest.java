/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.application.routing;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HealthSnapshotTest {
    @Test
    void successRateIsDerivedFromCounters() {
        assertEquals(100.0, HealthSnapshot.successRate(10, 0));
        assertEquals(75.0, HealthSnapshot.successRate(4, 1));
        assertEquals(0.0, HealthSnapshot.successRate(3, 3));
    }

    @Test
    void successRateIsUndefinedWithoutTraffic() {
        assertNull(HealthSnapshot.successRate(0, 0));
        assertEquals(100.0, HealthSnapshot.unknown("p").successRateOr(100.0));
        assertTrue(HealthSnapshot.unknown("p").healthy());
    }

    @Test
    void inconsistentCountersAreClamped() {
        assertEquals(0.0, HealthSnapshot.successRate(2, 5));
    }
}
