/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Read model over the usage ledger. Rows are written by {@code ProviderUsageRepository.insertIfAbsent}.
 */
@Entity
@Immutable
@Table(name = "provider_usage")
public class ProviderUsageEntity {
    @Id
    @JdbcTypeCode(SqlTypes.CHAR)
    @Column(name = "attempt_id", nullable = false, length = 36)
    private UUID attemptId;

    @Column(name = "request_id", nullable = false)
    private String requestId;

    @Column(name = "attempt_number", nullable = false)
    private int attemptNumber;

    @Column(name = "caller_id", nullable = false)
    private String callerId;

    @Column(name = "provider_id", nullable = false, length = 64)
    private String providerId;

    @Column(name = "model_name", nullable = false)
    private String modelName;

    @Column(name = "input_units", nullable = false)
    private long inputUnits;

    @Column(name = "output_units", nullable = false)
    private long outputUnits;

    @Column(name = "cost", nullable = false, precision = 14, scale = 6)
    private BigDecimal cost;

    @Column(name = "latency_ms", nullable = false)
    private long latencyMs;

    @Column(name = "success", nullable = false)
    private boolean success;

    @Column(name = "failure_kind")
    private String failureKind;

    @Column(name = "error_message")
    private String errorMessage;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public UUID getAttemptId() {
        return attemptId;
    }

    public String getRequestId() {
        return requestId;
    }

    public int getAttemptNumber() {
        return attemptNumber;
    }

    public String getCallerId() {
        return callerId;
    }

    public String getProviderId() {
        return providerId;
    }

    public String getModelName() {
        return modelName;
    }

    public long getInputUnits() {
        return inputUnits;
    }

    public long getOutputUnits() {
        return outputUnits;
    }

    public BigDecimal getCost() {
        return cost;
    }

    public long getLatencyMs() {
        return latencyMs;
    }

    public boolean isSuccess() {
        return success;
    }

    public String getFailureKind() {
        return failureKind;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
