/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.infrastructure.provider;

import com.conducto.config.AppProperties;
import com.conducto.domain.model.ChatMessage;
import com.conducto.domain.model.ProviderKind;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * Canned responses so the router can run end to end without provider credentials.
 */
@Service
public class MockAdapter implements ChatProviderAdapter {
    static final String BASIC_MODEL = "mock-basic";
    static final String PREMIUM_MODEL = "mock-premium";

    private static final Map<String, String> RESPONSES = Map.of(
            BASIC_MODEL, "This is a basic mock response for testing the multi-provider routing system. "
                    + "The request was routed to the mock provider because of your current trust level.",
            PREMIUM_MODEL, "This is a premium mock response demonstrating advanced capabilities. "
                    + "It stands in for the detailed analysis a premium model would return."
    );

    private final Duration latency;

    public MockAdapter(AppProperties properties) {
        this.latency = properties.providers().mock().latency();
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.MOCK;
    }

    @Override
    public Mono<ChatCompletion> chat(ChatCommand command) {
        String model = command.modelName() == null ? BASIC_MODEL : command.modelName();
        String content = RESPONSES.getOrDefault(model, RESPONSES.get(BASIC_MODEL));

        long inputUnits = command.messages().stream()
                .map(ChatMessage::content)
                .mapToLong(CohereAdapter::estimateTokens)
                .sum();
        long outputUnits = CohereAdapter.estimateTokens(content);

        Mono<ChatCompletion> completion = Mono.fromSupplier(() -> new ChatCompletion(content, model, inputUnits, outputUnits));
        if (latency.isZero() || latency.isNegative()) {
            return completion;
        }
        return Mono.delay(latency).then(completion);
    }

    @Override
    public Mono<ProbeResult> probe(String providerId, String baseUrl) {
        return Mono.just(ProbeResult.healthy(latency.toMillis()));
    }
}
