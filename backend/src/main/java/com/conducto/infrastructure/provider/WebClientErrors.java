/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.infrastructure.provider;

import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.concurrent.TimeoutException;

final class WebClientErrors {
    private WebClientErrors() {
    }

    static ProviderException toProviderException(String providerId, String label, Throwable error) {
        if (error instanceof ProviderException pe) {
            return pe;
        }
        if (error instanceof WebClientResponseException e) {
            int status = e.getStatusCode().value();
            ProviderErrorType type;
            if (status >= 500 && status != 504) type = ProviderErrorType.HTTP_5XX;
            else if (status == 408 || status == 504) type = ProviderErrorType.TIMEOUT;
            else if (status == 429) type = ProviderErrorType.RATE_LIMITED;
            else type = ProviderErrorType.VALIDATION;
            return new ProviderException(providerId, type, label + " request failed with status " + status, e);
        }
        if (error instanceof TimeoutException || error.getCause() instanceof TimeoutException) {
            return new ProviderException(providerId, ProviderErrorType.TIMEOUT, label + " request timed out", error);
        }
        if (error instanceof WebClientRequestException) {
            return new ProviderException(providerId, ProviderErrorType.UNAVAILABLE, label + " is unreachable", error);
        }
        return new ProviderException(providerId, ProviderErrorType.UNKNOWN, label + " request failed", error);
    }

    static String probeError(String label, Throwable error) {
        if (error instanceof WebClientResponseException e) {
            return label + " probe failed with status " + e.getStatusCode().value();
        }
        String message = error.getMessage();
        return label + " probe failed: " + (message == null ? error.getClass().getSimpleName() : message);
    }

    static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
