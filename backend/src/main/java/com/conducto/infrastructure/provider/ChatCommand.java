/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.infrastructure.provider;

import com.conducto.domain.model.ChatMessage;

import java.util.List;

public record ChatCommand(
        String providerId,
        String baseUrl,
        String modelName,
        List<ChatMessage> messages,
        double temperature,
        int maxTokens
) {
    public String lastUserContent() {
        for (int i = messages.size() - 1; i >= 0; i--) {
            ChatMessage m = messages.get(i);
            if ("user".equalsIgnoreCase(m.role())) return m.content();
        }
        return messages.isEmpty() ? "" : messages.get(messages.size() - 1).content();
    }
}
