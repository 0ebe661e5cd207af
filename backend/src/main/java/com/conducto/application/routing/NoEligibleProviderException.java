/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.application.routing;

public class NoEligibleProviderException extends RoutingException {
    private final int trustScore;

    public NoEligibleProviderException(int trustScore) {
        super(RoutingErrorCode.NO_ELIGIBLE_PROVIDER, "No eligible provider for trust score " + trustScore, null);
        this.trustScore = trustScore;
    }

    public int getTrustScore() {
        return trustScore;
    }
}
