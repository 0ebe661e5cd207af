/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.infrastructure.provider;

/**
 * Fallo de un único intento contra un provider. El Dispatcher siempre lo absorbe.
 */
public class ProviderException extends RuntimeException {
    private final String providerId;
    private final ProviderErrorType type;
    private final String safeMessage;

    public ProviderException(String providerId, ProviderErrorType type, String safeMessage, Throwable cause) {
        super(safeMessage, cause);
        this.providerId = providerId;
        this.type = type;
        this.safeMessage = safeMessage;
    }

    public ProviderException(String providerId, ProviderErrorType type, String safeMessage) {
        this(providerId, type, safeMessage, null);
    }

    public String getProviderId() {
        return providerId;
    }

    public ProviderErrorType getType() {
        return type;
    }

    public String getSafeMessage() {
        return safeMessage;
    }
}
