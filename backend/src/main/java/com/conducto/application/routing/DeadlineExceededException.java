/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.application.routing;

import com.conducto.infrastructure.provider.ProviderException;

/**
 * The caller deadline elapsed mid-failover. Still an exhaustion, with the timeout-specific code.
 */
public class DeadlineExceededException extends AllProvidersExhaustedException {
    public DeadlineExceededException(int attempts, ProviderException lastError) {
        super(RoutingErrorCode.DEADLINE_EXCEEDED,
                "Deadline exceeded after " + attempts + " attempt(s)" + describe(lastError),
                attempts,
                lastError);
    }
}
