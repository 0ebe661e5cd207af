/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.application.routing;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One row of the ledger, one per dispatch attempt.
 */
public record UsageEntry(
        UUID attemptId,
        String requestId,
        int attemptNumber,
        String callerId,
        String providerId,
        String modelName,
        long inputUnits,
        long outputUnits,
        BigDecimal cost,
        long latencyMs,
        boolean success,
        String failureKind,
        String errorMessage,
        Instant createdAt
) {}
