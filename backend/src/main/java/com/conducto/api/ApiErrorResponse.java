/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.api;

public record ApiErrorResponse(
        String error,
        String code,
        String message,
        String requestId
) {}
