/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.infrastructure.persistence.repository;

import com.conducto.infrastructure.persistence.entity.ProviderUsageEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface ProviderUsageRepository extends JpaRepository<ProviderUsageEntity, UUID> {
    List<ProviderUsageEntity> findByRequestIdOrderByAttemptNumberAsc(String requestId);

    /**
     * Appends one attempt row as a single statement. Returns 0 when the attempt id is already
     * present. Timestamps are epoch millis.
     */
    @Modifying
    @Query(value = """
            insert or ignore into provider_usage (
                attempt_id, request_id, attempt_number, caller_id, provider_id, model_name,
                input_units, output_units, cost, latency_ms, success, failure_kind, error_message, created_at)
            values (
                :attemptId, :requestId, :attemptNumber, :callerId, :providerId, :modelName,
                :inputUnits, :outputUnits, :cost, :latencyMs, :success, :failureKind, :errorMessage, :createdAtMillis)
            """, nativeQuery = true)
    int insertIfAbsent(
            @Param("attemptId") String attemptId,
            @Param("requestId") String requestId,
            @Param("attemptNumber") int attemptNumber,
            @Param("callerId") String callerId,
            @Param("providerId") String providerId,
            @Param("modelName") String modelName,
            @Param("inputUnits") long inputUnits,
            @Param("outputUnits") long outputUnits,
            @Param("cost") BigDecimal cost,
            @Param("latencyMs") long latencyMs,
            @Param("success") int success,
            @Param("failureKind") String failureKind,
            @Param("errorMessage") String errorMessage,
            @Param("createdAtMillis") long createdAtMillis
    );

    /**
     * Rows of [providerId, requests, avgCost, avgLatencyMs, successes, totalCost].
     */
    @Query("""
            select u.providerId,
                   count(u),
                   avg(u.cost),
                   avg(u.latencyMs),
                   sum(case when u.success = true then 1 else 0 end),
                   sum(u.cost)
              from ProviderUsageEntity u
             where u.createdAt >= :from
             group by u.providerId
             order by count(u) desc, u.providerId asc
            """)
    List<Object[]> summarizeByProviderSince(@Param("from") Instant from);
}
