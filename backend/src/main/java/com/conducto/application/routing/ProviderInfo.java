/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.application.routing;

import com.conducto.domain.model.ProviderKind;

import java.time.Instant;

public record ProviderInfo(
        String id,
        String name,
        ProviderKind kind,
        String baseUrl,
        boolean active,
        int priority,
        Instant createdAt
) {}
