/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.application.routing;

/**
 * Terminal failure of a {@code route()} call. Per-attempt provider errors never escape as-is.
 */
public abstract class RoutingException extends RuntimeException {
    private final RoutingErrorCode code;

    protected RoutingException(RoutingErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public RoutingErrorCode getCode() {
        return code;
    }
}
