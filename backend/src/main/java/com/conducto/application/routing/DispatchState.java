/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.application.routing;

public enum DispatchState {
    ATTEMPTING,
    SUCCEEDED,
    EXHAUSTED,
    DEADLINE_EXCEEDED,
    NO_CANDIDATES
}
