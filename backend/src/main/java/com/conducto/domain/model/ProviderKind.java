/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.domain.model;

public enum ProviderKind {
    OPENAI,
    ANTHROPIC,
    COHERE,
    MOCK
}
