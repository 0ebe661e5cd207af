/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.application.routing;

public enum RoutingErrorCode {
    TRUST_UNAVAILABLE,
    NO_ELIGIBLE_PROVIDER,
    ALL_PROVIDERS_EXHAUSTED,
    DEADLINE_EXCEEDED
}
