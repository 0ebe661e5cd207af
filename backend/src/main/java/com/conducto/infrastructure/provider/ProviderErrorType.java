/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.infrastructure.provider;

public enum ProviderErrorType {
    TIMEOUT,
    HTTP_5XX,
    RATE_LIMITED,
    VALIDATION,
    UNAVAILABLE,
    UNKNOWN
}
