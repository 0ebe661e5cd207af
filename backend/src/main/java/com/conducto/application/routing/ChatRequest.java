/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.application.routing;

import com.conducto.domain.model.ChatMessage;

import java.util.List;

/**
 * {@code deadlineMs} is the overall budget for the whole failover; null means the configured
 * default.
 */
public record ChatRequest(
        List<ChatMessage> messages,
        Double temperature,
        Integer maxTokens,
        Long deadlineMs
) {
    public static final double DEFAULT_TEMPERATURE = 0.7;
    public static final int DEFAULT_MAX_TOKENS = 2048;

    public ChatRequest {
        messages = messages == null ? List.of() : List.copyOf(messages);
        if (temperature == null) temperature = DEFAULT_TEMPERATURE;
        if (maxTokens == null) maxTokens = DEFAULT_MAX_TOKENS;
    }

    public static ChatRequest of(List<ChatMessage> messages) {
        return new ChatRequest(messages, null, null, null);
    }
}
