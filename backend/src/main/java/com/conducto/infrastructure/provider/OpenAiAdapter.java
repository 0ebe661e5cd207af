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
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
public class OpenAiAdapter implements ChatProviderAdapter {
    private static final Logger log = LoggerFactory.getLogger(OpenAiAdapter.class);
    private static final String LABEL = "OpenAI";

    private final AppProperties properties;
    private final WebClient openAiWebClient;

    public OpenAiAdapter(AppProperties properties, @Qualifier("openAiWebClient") WebClient openAiWebClient) {
        this.properties = properties;
        this.openAiWebClient = openAiWebClient;
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.OPENAI;
    }

    @Override
    public Mono<ChatCompletion> chat(ChatCommand command) {
        String apiKey = properties.providers().openai().apiKey();
        if (WebClientErrors.isBlank(apiKey)) {
            return Mono.error(new ProviderException(command.providerId(), ProviderErrorType.UNAVAILABLE, "OpenAI is not configured"));
        }

        Map<String, Object> body = new HashMap<>();
        body.put("model", command.modelName());
        body.put("messages", toWireMessages(command.messages()));
        body.put("temperature", command.temperature());
        body.put("max_tokens", command.maxTokens());

        return openAiWebClient.post()
                .uri(resolve(command.baseUrl(), "/v1/chat/completions"))
                .contentType(MediaType.APPLICATION_JSON)
                .headers(h -> h.setBearerAuth(apiKey))
                .bodyValue(body)
                .retrieve()
                .bodyToMono(CompletionResponse.class)
                .map(resp -> toCompletion(command, resp))
                .onErrorMap(e -> WebClientErrors.toProviderException(command.providerId(), LABEL, e));
    }

    @Override
    public Mono<ProbeResult> probe(String providerId, String baseUrl) {
        String apiKey = properties.providers().openai().apiKey();
        if (WebClientErrors.isBlank(apiKey)) {
            return Mono.just(ProbeResult.unhealthy(0, "OpenAI client not initialized"));
        }
        long startedAt = System.nanoTime();
        return openAiWebClient.get()
                .uri(resolve(baseUrl, "/v1/models"))
                .headers(h -> h.setBearerAuth(apiKey))
                .retrieve()
                .toBodilessEntity()
                .map(res -> ProbeResult.healthy(elapsedMs(startedAt)))
                .onErrorResume(e -> {
                    log.warn("OpenAI probe failed provider={}", providerId);
                    return Mono.just(ProbeResult.unhealthy(elapsedMs(startedAt), WebClientErrors.probeError(LABEL, e)));
                });
    }

    private ChatCompletion toCompletion(ChatCommand command, CompletionResponse resp) {
        if (resp == null || resp.choices == null || resp.choices.isEmpty()) {
            throw new ProviderException(command.providerId(), ProviderErrorType.UNKNOWN, "OpenAI response invalid");
        }
        Choice first = resp.choices.get(0);
        String content = first.message == null || first.message.content == null
                ? "No response generated"
                : first.message.content;
        long in = resp.usage == null ? 0 : resp.usage.promptTokens;
        long out = resp.usage == null ? 0 : resp.usage.completionTokens;
        return new ChatCompletion(content, resp.model == null ? command.modelName() : resp.model, in, out);
    }

    private static List<Map<String, String>> toWireMessages(List<ChatMessage> messages) {
        return messages.stream()
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

    static final class CompletionResponse {
        public String model;
        public List<Choice> choices;
        public Usage usage;
    }

    static final class Choice {
        public Message message;
    }

    static final class Message {
        public String content;
    }

    static final class Usage {
        @JsonProperty("prompt_tokens")
        public long promptTokens;
        @JsonProperty("completion_tokens")
        public long completionTokens;
    }
}
