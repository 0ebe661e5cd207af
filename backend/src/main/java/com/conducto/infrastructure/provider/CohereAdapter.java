/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.infrastructure.provider;

import com.conducto.config.AppProperties;
import com.conducto.domain.model.ProviderKind;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Cohere only receives the last user message. When the response carries no billed units the
 * token counts are estimated at four characters per token.
 */
@Service
public class CohereAdapter implements ChatProviderAdapter {
    private static final Logger log = LoggerFactory.getLogger(CohereAdapter.class);
    private static final String LABEL = "Cohere";

    private final AppProperties properties;
    private final WebClient cohereWebClient;

    public CohereAdapter(AppProperties properties, @Qualifier("cohereWebClient") WebClient cohereWebClient) {
        this.properties = properties;
        this.cohereWebClient = cohereWebClient;
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.COHERE;
    }

    @Override
    public Mono<ChatCompletion> chat(ChatCommand command) {
        String apiKey = properties.providers().cohere().apiKey();
        if (WebClientErrors.isBlank(apiKey)) {
            return Mono.error(new ProviderException(command.providerId(), ProviderErrorType.UNAVAILABLE, "Cohere is not configured"));
        }

        String message = command.lastUserContent();
        Map<String, Object> body = new HashMap<>();
        body.put("model", command.modelName());
        body.put("message", message);
        body.put("max_tokens", command.maxTokens());
        body.put("temperature", command.temperature());

        return cohereWebClient.post()
                .uri(resolve(command.baseUrl(), "/v1/chat"))
                .contentType(MediaType.APPLICATION_JSON)
                .headers(h -> h.setBearerAuth(apiKey))
                .bodyValue(body)
                .retrieve()
                .bodyToMono(ChatResponse.class)
                .map(resp -> toCompletion(command, message, resp))
                .onErrorMap(e -> WebClientErrors.toProviderException(command.providerId(), LABEL, e));
    }

    @Override
    public Mono<ProbeResult> probe(String providerId, String baseUrl) {
        String apiKey = properties.providers().cohere().apiKey();
        if (WebClientErrors.isBlank(apiKey)) {
            return Mono.just(ProbeResult.unhealthy(0, "Cohere client not initialized"));
        }
        long startedAt = System.nanoTime();
        return cohereWebClient.get()
                .uri(resolve(baseUrl, "/v1/models"))
                .headers(h -> h.setBearerAuth(apiKey))
                .retrieve()
                .toBodilessEntity()
                .map(res -> ProbeResult.healthy(elapsedMs(startedAt)))
                .onErrorResume(e -> {
                    log.warn("Cohere probe failed provider={}", providerId);
                    return Mono.just(ProbeResult.unhealthy(elapsedMs(startedAt), WebClientErrors.probeError(LABEL, e)));
                });
    }

    private ChatCompletion toCompletion(ChatCommand command, String prompt, ChatResponse resp) {
        if (resp == null || resp.text == null) {
            throw new ProviderException(command.providerId(), ProviderErrorType.UNKNOWN, "Cohere response invalid");
        }
        long in;
        long out;
        if (resp.meta != null && resp.meta.billedUnits != null) {
            in = resp.meta.billedUnits.inputTokens;
            out = resp.meta.billedUnits.outputTokens;
        } else {
            in = estimateTokens(prompt);
            out = estimateTokens(resp.text);
        }
        return new ChatCompletion(resp.text, command.modelName(), in, out);
    }

    static long estimateTokens(String text) {
        if (text == null || text.isEmpty()) return 0;
        return (text.length() + 3) / 4;
    }

    private static String resolve(String baseUrl, String path) {
        if (WebClientErrors.isBlank(baseUrl)) return path;
        return baseUrl.replaceAll("/$", "") + path;
    }

    private static long elapsedMs(long startedAt) {
        return (System.nanoTime() - startedAt) / 1_000_000;
    }

    static final class ChatResponse {
        public String text;
        public Meta meta;
    }

    static final class Meta {
        @JsonProperty("billed_units")
        public BilledUnits billedUnits;
    }

    static final class BilledUnits {
        @JsonProperty("input_tokens")
        public long inputTokens;
        @JsonProperty("output_tokens")
        public long outputTokens;
    }
}
