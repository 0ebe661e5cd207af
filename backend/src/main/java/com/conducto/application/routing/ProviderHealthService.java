/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.application.routing;

import com.conducto.infrastructure.persistence.entity.ProviderHealthEntity;
import com.conducto.infrastructure.persistence.repository.ProviderHealthRepository;
import com.conducto.infrastructure.persistence.repository.ProviderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Health rows fed by two independent channels: passive outcomes from real traffic move the
 * counters, active probes only flip the healthy flag. successRate is never stored.
 */
@Service
public class ProviderHealthService implements HealthTracker {
    private static final Logger log = LoggerFactory.getLogger(ProviderHealthService.class);
    private static final int MAX_ERROR_LENGTH = 500;

    private final ProviderHealthRepository healthRepository;
    private final ProviderRepository providerRepository;

    public ProviderHealthService(ProviderHealthRepository healthRepository, ProviderRepository providerRepository) {
        this.healthRepository = healthRepository;
        this.providerRepository = providerRepository;
    }

    @Override
    @Transactional
    public void recordOutcome(String providerId, boolean success, String error) {
        Instant now = Instant.now();
        int updated = increment(providerId, success, error, now);
        if (updated == 0) {
            healthRepository.insertIfMissing(providerId, now.toEpochMilli());
            updated = increment(providerId, success, error, now);
        }
        if (updated != 1) {
            throw new IllegalStateException("Health row missing for provider " + providerId);
        }
    }

    @Override
    @Transactional
    public void recordProbe(String providerId, boolean healthy, String error) {
        Instant now = Instant.now();
        String lastError = healthy ? null : truncate(error);
        int updated = healthRepository.applyProbe(providerId, healthy, lastError, now);
        if (updated == 0) {
            healthRepository.insertIfMissing(providerId, now.toEpochMilli());
            healthRepository.applyProbe(providerId, healthy, lastError, now);
        }
        if (!healthy) {
            log.warn("provider marked unhealthy by probe provider={} error={}", providerId, lastError);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public HealthSnapshot snapshot(String providerId) {
        return healthRepository.findById(providerId)
                .map(ProviderHealthService::toSnapshot)
                .orElseGet(() -> HealthSnapshot.unknown(providerId));
    }

    /**
     * One snapshot per catalog provider, in catalog order.
     */
    @Override
    @Transactional(readOnly = true)
    public List<HealthSnapshot> snapshots() {
        Map<String, ProviderHealthEntity> rows = healthRepository.findAll().stream()
                .collect(Collectors.toMap(ProviderHealthEntity::getProviderId, Function.identity()));
        return providerRepository.findAllByOrderByCreatedAtAscIdAsc().stream()
                .map(p -> {
                    ProviderHealthEntity row = rows.get(p.getId());
                    return row == null ? HealthSnapshot.unknown(p.getId()) : toSnapshot(row);
                })
                .toList();
    }

    private int increment(String providerId, boolean success, String error, Instant now) {
        if (success) {
            return healthRepository.incrementSuccess(providerId, now);
        }
        return healthRepository.incrementFailure(providerId, truncate(error), now);
    }

    static HealthSnapshot toSnapshot(ProviderHealthEntity e) {
        return HealthSnapshot.of(
                e.getProviderId(),
                e.isHealthy(),
                e.getTotalRequests(),
                e.getFailedRequests(),
                e.getLastError(),
                e.getLastCheckedAt(),
                e.getUpdatedAt()
        );
    }

    private static String truncate(String error) {
        if (error == null) return null;
        return error.length() <= MAX_ERROR_LENGTH ? error : error.substring(0, MAX_ERROR_LENGTH);
    }
}
