/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.application.routing;

import com.conducto.domain.model.ProviderKind;
import com.conducto.infrastructure.persistence.entity.ProviderEntity;
import com.conducto.infrastructure.persistence.repository.ProviderRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
class ProviderHealthServiceTest {
    @Autowired
    private ProviderHealthService healthService;

    @Autowired
    private ProviderRepository providerRepository;

    @Test
    void concurrentOutcomesNeverLoseIncrements() throws Exception {
        String providerId = newProvider();
        int threads = 4;
        int perThread = 25;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Callable<Void>> tasks = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                boolean failing = t % 2 == 0;
                tasks.add(() -> {
                    for (int i = 0; i < perThread; i++) {
                        healthService.recordOutcome(providerId, !failing, failing ? "HTTP_5XX: boom" : null);
                    }
                    return null;
                });
            }
            for (Future<Void> f : pool.invokeAll(tasks)) {
                f.get();
            }
        } finally {
            pool.shutdown();
            pool.awaitTermination(10, TimeUnit.SECONDS);
        }

        HealthSnapshot snapshot = healthService.snapshot(providerId);
        assertEquals(100, snapshot.totalRequests());
        assertEquals(50, snapshot.failedRequests());
        assertEquals(50.0, snapshot.successRate());
    }

    @Test
    void firstOutcomeCreatesTheRow() {
        String providerId = newProvider();
        assertNull(healthService.snapshot(providerId).successRate());

        healthService.recordOutcome(providerId, false, "TIMEOUT: slow");

        HealthSnapshot snapshot = healthService.snapshot(providerId);
        assertEquals(1, snapshot.totalRequests());
        assertEquals(1, snapshot.failedRequests());
        assertEquals(0.0, snapshot.successRate());
        assertEquals("TIMEOUT: slow", snapshot.lastError());
        assertTrue(snapshot.healthy());
    }

    @Test
    void probesFlipHealthWithoutTouchingCounters() {
        String providerId = newProvider();
        healthService.recordOutcome(providerId, true, null);
        healthService.recordOutcome(providerId, true, null);

        healthService.recordProbe(providerId, false, "probe failed with status 500");
        HealthSnapshot down = healthService.snapshot(providerId);
        assertFalse(down.healthy());
        assertEquals(100.0, down.successRate());
        assertEquals(2, down.totalRequests());
        assertNotNull(down.lastCheckedAt());

        healthService.recordOutcome(providerId, false, "HTTP_5XX: boom");
        healthService.recordProbe(providerId, true, null);
        HealthSnapshot up = healthService.snapshot(providerId);
        assertTrue(up.healthy());
        assertEquals(3, up.totalRequests());
        assertEquals(1, up.failedRequests());
        assertEquals(200.0 / 3.0, up.successRate(), 1e-9);
    }

    @Test
    void snapshotsFollowCatalogOrder() {
        List<HealthSnapshot> snapshots = healthService.snapshots();

        assertEquals("mock", snapshots.get(0).providerId());
        assertEquals(providerRepository.count(), snapshots.size());
    }

    private String newProvider() {
        ProviderEntity p = new ProviderEntity();
        p.setId("health-" + UUID.randomUUID().toString().substring(0, 8));
        p.setName("Health test");
        p.setKind(ProviderKind.MOCK);
        p.setActive(false);
        p.setPriority(10);
        p.setCreatedAt(Instant.now());
        p.setUpdatedAt(Instant.now());
        return providerRepository.save(p).getId();
    }
}
