/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.application.routing;

import java.time.Instant;

public record DispatchContext(
        String requestId,
        String callerId,
        int trustScore,
        ChatRequest request,
        Instant deadline
) {}
