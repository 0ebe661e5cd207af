/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.application.routing;

public class TrustUnavailableException extends RoutingException {
    private final String callerId;

    public TrustUnavailableException(String callerId, Throwable cause) {
        super(RoutingErrorCode.TRUST_UNAVAILABLE, "Trust lookup failed for caller " + callerId, cause);
        this.callerId = callerId;
    }

    public String getCallerId() {
        return callerId;
    }
}
