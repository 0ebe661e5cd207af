/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.infrastructure.persistence.repository;

import com.conducto.infrastructure.persistence.entity.ProviderHealthEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;

/**
 * Counter updates are single UPDATE statements so concurrent writers never lose increments.
 */
public interface ProviderHealthRepository extends JpaRepository<ProviderHealthEntity, String> {
    @Modifying(clearAutomatically = true)
    @Query("""
            update ProviderHealthEntity h
               set h.totalRequests = h.totalRequests + 1,
                   h.updatedAt = :now
             where h.providerId = :providerId
            """)
    int incrementSuccess(@Param("providerId") String providerId, @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Query("""
            update ProviderHealthEntity h
               set h.totalRequests = h.totalRequests + 1,
                   h.failedRequests = h.failedRequests + 1,
                   h.lastError = :error,
                   h.updatedAt = :now
             where h.providerId = :providerId
            """)
    int incrementFailure(
            @Param("providerId") String providerId,
            @Param("error") String error,
            @Param("now") Instant now
    );

    @Modifying(clearAutomatically = true)
    @Query("""
            update ProviderHealthEntity h
               set h.healthy = :healthy,
                   h.lastError = :error,
                   h.lastCheckedAt = :now,
                   h.updatedAt = :now
             where h.providerId = :providerId
            """)
    int applyProbe(
            @Param("providerId") String providerId,
            @Param("healthy") boolean healthy,
            @Param("error") String error,
            @Param("now") Instant now
    );

    /**
     * Creates a neutral row (healthy, no traffic) unless one already exists. Timestamps are epoch millis.
     */
    @Modifying
    @Query(value = """
            insert or ignore into provider_health (provider_id, is_healthy, total_requests, failed_requests, updated_at)
            values (:providerId, 1, 0, 0, :nowMillis)
            """, nativeQuery = true)
    int insertIfMissing(@Param("providerId") String providerId, @Param("nowMillis") long nowMillis);
}
