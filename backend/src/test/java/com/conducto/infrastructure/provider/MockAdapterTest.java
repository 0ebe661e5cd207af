/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.infrastructure.provider;

import com.conducto.config.AppProperties;
import com.conducto.domain.model.ChatMessage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MockAdapterTest {
    private final MockAdapter adapter = new MockAdapter(new AppProperties(null, null, null, null));

    @Test
    void premiumAndBasicModelsAnswerDifferently() {
        ChatCompletion basic = adapter.chat(command(MockAdapter.BASIC_MODEL)).block();
        ChatCompletion premium = adapter.chat(command(MockAdapter.PREMIUM_MODEL)).block();

        assertNotEquals(basic.content(), premium.content());
        assertTrue(premium.content().startsWith("This is a premium mock response"));
        assertEquals(MockAdapter.PREMIUM_MODEL, premium.model());
    }

    @Test
    void estimatesUnitsFromCharacters() {
        ChatCompletion completion = adapter.chat(command(MockAdapter.BASIC_MODEL)).block();

        // "hello world" is 11 characters
        assertEquals(3, completion.inputUnits());
        assertEquals(CohereAdapter.estimateTokens(completion.content()), completion.outputUnits());
    }

    @Test
    void unknownModelFallsBackToBasicResponse() {
        ChatCompletion completion = adapter.chat(command("mock-unknown")).block();

        assertTrue(completion.content().startsWith("This is a basic mock response"));
    }

    @Test
    void probeIsAlwaysHealthy() {
        assertTrue(adapter.probe("mock", null).block().healthy());
    }

    private static ChatCommand command(String model) {
        return new ChatCommand("mock", null, model, List.of(new ChatMessage("user", "hello world")), 0.7, 64);
    }
}
