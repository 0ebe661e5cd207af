/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * One WebClient per provider kind, all sharing the reactor-netty event loop. Response timeouts
 * are enforced per attempt by the Dispatcher, not here.
 */
@Configuration
public class WebClientConfig {
    @Bean
    public WebClient openAiWebClient(AppProperties properties) {
        return build(properties.providers().openai().baseUrl());
    }

    @Bean
    public WebClient anthropicWebClient(AppProperties properties) {
        return build(properties.providers().anthropic().baseUrl());
    }

    @Bean
    public WebClient cohereWebClient(AppProperties properties) {
        return build(properties.providers().cohere().baseUrl());
    }

    private WebClient build(String baseUrl) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000)
                .doOnConnected(conn -> conn.addHandlerLast(new WriteTimeoutHandler(15)));

        return WebClient.builder()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(cfg -> cfg.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
                        .build())
                .build();
    }
}
