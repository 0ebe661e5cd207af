/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.application;

import com.conducto.application.routing.UsageEntry;
import com.conducto.application.routing.UsageLedger;
import com.conducto.infrastructure.persistence.entity.ProviderUsageEntity;
import com.conducto.infrastructure.persistence.repository.ProviderUsageRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Append-only usage ledger. Rows are inserted once per attempt and never updated.
 */
@Service
public class ProviderUsageService implements UsageLedger {
    private static final int MAX_WINDOW_DAYS = 365;

    private final ProviderUsageRepository usageRepository;

    public ProviderUsageService(ProviderUsageRepository usageRepository) {
        this.usageRepository = usageRepository;
    }

    /**
     * One insert per attempt, with no read before it, so concurrent writers only contend for
     * the write lock.
     */
    @Override
    @Transactional
    public void record(UsageEntry entry) {
        // "or ignore" would also swallow NOT NULL violations, so those are rejected up front
        if (entry.requestId() == null || entry.callerId() == null
                || entry.providerId() == null || entry.modelName() == null) {
            throw new IllegalArgumentException("Usage entry is missing request, caller, provider or model");
        }
        UUID attemptId = entry.attemptId() == null ? UUID.randomUUID() : entry.attemptId();
        Instant createdAt = entry.createdAt() == null ? Instant.now() : entry.createdAt();
        int inserted = usageRepository.insertIfAbsent(
                attemptId.toString(),
                entry.requestId(),
                entry.attemptNumber(),
                entry.callerId(),
                entry.providerId(),
                entry.modelName(),
                entry.inputUnits(),
                entry.outputUnits(),
                entry.cost() == null ? BigDecimal.ZERO.setScale(6) : entry.cost(),
                entry.latencyMs(),
                entry.success() ? 1 : 0,
                entry.failureKind(),
                entry.errorMessage(),
                createdAt.toEpochMilli()
        );
        if (inserted == 0) {
            throw new IllegalStateException("Usage already recorded for attempt " + attemptId);
        }
    }

    @Transactional(readOnly = true)
    public List<UsageEntry> forRequest(String requestId) {
        return usageRepository.findByRequestIdOrderByAttemptNumberAsc(requestId).stream()
                .map(ProviderUsageService::toEntry)
                .toList();
    }

    /**
     * Per-provider totals over the last {@code days} days, busiest provider first.
     */
    @Transactional(readOnly = true)
    public List<ProviderUsageSummary> summarize(int days) {
        if (days < 1 || days > MAX_WINDOW_DAYS) {
            throw new IllegalArgumentException("days must be between 1 and " + MAX_WINDOW_DAYS);
        }
        Instant from = Instant.now().minus(Duration.ofDays(days));
        return usageRepository.summarizeByProviderSince(from).stream()
                .map(ProviderUsageService::toSummary)
                .toList();
    }

    private static ProviderUsageSummary toSummary(Object[] row) {
        long requests = ((Number) row[1]).longValue();
        long successes = row[4] == null ? 0 : ((Number) row[4]).longValue();
        double successRate = requests == 0 ? 0 : (double) successes / (double) requests * 100.0;
        return new ProviderUsageSummary(
                (String) row[0],
                requests,
                toDecimal(row[2]),
                row[3] == null ? 0 : ((Number) row[3]).doubleValue(),
                successRate,
                toDecimal(row[5])
        );
    }

    private static BigDecimal toDecimal(Object value) {
        if (value == null) return BigDecimal.ZERO.setScale(6);
        if (value instanceof BigDecimal bd) return bd.setScale(6, RoundingMode.HALF_UP);
        return BigDecimal.valueOf(((Number) value).doubleValue()).setScale(6, RoundingMode.HALF_UP);
    }

    private static UsageEntry toEntry(ProviderUsageEntity e) {
        return new UsageEntry(
                e.getAttemptId(),
                e.getRequestId(),
                e.getAttemptNumber(),
                e.getCallerId(),
                e.getProviderId(),
                e.getModelName(),
                e.getInputUnits(),
                e.getOutputUnits(),
                e.getCost(),
                e.getLatencyMs(),
                e.isSuccess(),
                e.getFailureKind(),
                e.getErrorMessage(),
                e.getCreatedAt()
        );
    }

    public record ProviderUsageSummary(
            String providerId,
            long requests,
            BigDecimal averageCost,
            double averageLatencyMs,
            double successRate,
            BigDecimal totalCost
    ) {}
}
