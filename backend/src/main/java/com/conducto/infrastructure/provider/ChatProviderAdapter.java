/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.infrastructure.provider;

import com.conducto.domain.model.ProviderKind;
import reactor.core.publisher.Mono;

/**
 * One implementation per {@link ProviderKind}. Provider quirks (auth headers, payload shape,
 * token accounting) stay behind this interface.
 */
public interface ChatProviderAdapter {
    ProviderKind kind();

    /**
     * Errors must surface as {@link ProviderException}; anything else is wrapped as UNKNOWN by the caller.
     */
    Mono<ChatCompletion> chat(ChatCommand command);

    /**
     * Out-of-band liveness check. Never touches request counters.
     */
    Mono<ProbeResult> probe(String providerId, String baseUrl);
}
