/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.infrastructure.provider;

import com.conducto.config.AppProperties;
import com.conducto.domain.model.ChatMessage;
import com.conducto.domain.model.ProviderKind;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
public class AnthropicAdapter implements ChatProviderAdapter {
    private static final Logger log = LoggerFactory.getLogger(AnthropicAdapter.class);
    private static final String LABEL = "Anthropic";
    private static final String API_VERSION = "2023-06-01";

    private final AppProperties properties;
    private final WebClient anthropicWebClient;

    public AnthropicAdapter(AppProperties properties, @Qualifier("anthropicWebClient") WebClient anthropicWebClient) {
        this.properties = properties;
        this.anthropicWebClient = anthropicWebClient;
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.ANTHROPIC;
    }

    @Override
    public Mono<ChatCompletion> chat(ChatCommand command) {
        String apiKey = properties.providers().anthropic().apiKey();
        if (WebClientErrors.isBlank(apiKey)) {
            return Mono.error(new ProviderException(command.providerId(), ProviderErrorType.UNAVAILABLE, "Anthropic is not configured"));
        }

        Map<String, Object> body = new HashMap<>();
        body.put("model", command.modelName());
        body.put("max_tokens", command.maxTokens());
        body.put("temperature", command.temperature());
        // system prompts travel in a top-level field, not in the message list
        String system = systemPrompt(command.messages());
        if (system != null) body.put("system", system);
        body.put("messages", conversation(command.messages()));

        return anthropicWebClient.post()
                .uri(resolve(command.baseUrl(), "/v1/messages"))
                .contentType(MediaType.APPLICATION_JSON)
                .headers(h -> apply(h, apiKey))
                .bodyValue(body)
                .retrieve()
                .bodyToMono(MessageResponse.class)
                .map(resp -> toCompletion(command, resp))
                .onErrorMap(e -> WebClientErrors.toProviderException(command.providerId(), LABEL, e));
    }

    @Override
    public Mono<ProbeResult> probe(String providerId, String baseUrl) {
        String apiKey = properties.providers().anthropic().apiKey();
        if (WebClientErrors.isBlank(apiKey)) {
            return Mono.just(ProbeResult.unhealthy(0, "Anthropic client not initialized"));
        }
        long startedAt = System.nanoTime();
        return anthropicWebClient.get()
                .uri(resolve(baseUrl, "/v1/models"))
                .headers(h -> apply(h, apiKey))
                .retrieve()
                .toBodilessEntity()
                .map(res -> ProbeResult.healthy(elapsedMs(startedAt)))
                .onErrorResume(e -> {
                    log.warn("Anthropic probe failed provider={}", providerId);
                    return Mono.just(ProbeResult.unhealthy(elapsedMs(startedAt), WebClientErrors.probeError(LABEL, e)));
                });
    }

    private ChatCompletion toCompletion(ChatCommand command, MessageResponse resp) {
        if (resp == null || resp.content == null) {
            throw new ProviderException(command.providerId(), ProviderErrorType.UNKNOWN, "Anthropic response invalid");
        }
        String text = resp.content.stream()
                .filter(block -> "text".equals(block.type) && block.text != null)
                .map(block -> block.text)
                .findFirst()
                .orElse("No response generated");
        long in = resp.usage == null ? 0 : resp.usage.inputTokens;
        long out = resp.usage == null ? 0 : resp.usage.outputTokens;
        return new ChatCompletion(text, resp.model == null ? command.modelName() : resp.model, in, out);
    }

    private static void apply(HttpHeaders headers, String apiKey) {
        headers.set("x-api-key", apiKey);
        headers.set("anthropic-version", API_VERSION);
    }

    private static String systemPrompt(List<ChatMessage> messages) {
        return messages.stream()
                .filter(m -> "system".equalsIgnoreCase(m.role()))
                .map(ChatMessage::content)
                .reduce((a, b) -> a + "\n" + b)
                .orElse(null);
    }

    private static List<Map<String, String>> conversation(List<ChatMessage> messages) {
        return messages.stream()
                .filter(m -> !"system".equalsIgnoreCase(m.role()))
                .map(m -> Map.of("role", m.role(), "content", m.content()))
                .toList();
    }

    private static String resolve(String baseUrl, String path) {
        if (WebClientErrors.isBlank(baseUrl)) return path;
        return baseUrl.replaceAll("/$", "") + path;
    }

    private static long elapsedMs(long startedAt) {
        return (System.nanoTime() - startedAt) / 1_000_000;
    }

    static final class MessageResponse {
        public String model;
        public List<ContentBlock> content;
        public Usage usage;
    }

    static final class ContentBlock {
        public String type;
        public String text;
    }

    static final class Usage {
        @JsonProperty("input_tokens")
        public long inputTokens;
        @JsonProperty("output_tokens")
        public long outputTokens;
    }
}
