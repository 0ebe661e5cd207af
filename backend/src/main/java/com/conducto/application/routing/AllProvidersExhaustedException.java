/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.application.routing;

import com.conducto.infrastructure.provider.ProviderException;

public class AllProvidersExhaustedException extends RoutingException {
    private final int attempts;

    public AllProvidersExhaustedException(int attempts, ProviderException lastError) {
        this(RoutingErrorCode.ALL_PROVIDERS_EXHAUSTED,
                "All providers failed after " + attempts + " attempt(s)" + describe(lastError),
                attempts,
                lastError);
    }

    protected AllProvidersExhaustedException(RoutingErrorCode code, String message, int attempts, ProviderException lastError) {
        super(code, message, lastError);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }

    /**
     * The error of the last attempt, or null when no attempt was made.
     */
    public ProviderException getLastError() {
        return (ProviderException) getCause();
    }

    static String describe(ProviderException lastError) {
        if (lastError == null) return "";
        return ": " + lastError.getProviderId() + " " + lastError.getType() + " " + lastError.getSafeMessage();
    }
}
