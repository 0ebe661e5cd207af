/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Every nested section is optional; a missing value falls back to its default so tests can
 * build an instance with {@code new AppProperties(null, null, null, null)}.
 */
@ConfigurationProperties(prefix = "app")
public record AppProperties(
        Routing routing,
        Trust trust,
        Health health,
        Providers providers
) {
    public AppProperties {
        if (routing == null) routing = new Routing(null, null, null, null);
        if (trust == null) trust = new Trust(null);
        if (health == null) health = new Health(null, null, null);
        if (providers == null) providers = new Providers(null, null, null, null);
    }

    public record Routing(
            Duration perCallTimeout,
            Duration defaultDeadline,
            Double neutralHealthScore,
            Weights weights
    ) {
        public Routing {
            if (perCallTimeout == null) perCallTimeout = Duration.ofSeconds(30);
            if (defaultDeadline == null) defaultDeadline = Duration.ofSeconds(90);
            if (neutralHealthScore == null) neutralHealthScore = 100.0;
            if (weights == null) weights = new Weights(null, null, null, null);
        }
    }

    public record Weights(Double quality, Double cost, Double health, Double priority) {
        public Weights {
            if (quality == null) quality = 0.4;
            if (cost == null) cost = 0.3;
            if (health == null) health = 0.2;
            if (priority == null) priority = 0.1;
        }
    }

    public record Trust(Integer defaultScore) {
        public Trust {
            if (defaultScore == null) defaultScore = 50;
        }
    }

    public record Health(Boolean probeEnabled, Duration probeInterval, Duration probeTimeout) {
        public Health {
            if (probeEnabled == null) probeEnabled = true;
            if (probeInterval == null) probeInterval = Duration.ofSeconds(60);
            if (probeTimeout == null) probeTimeout = Duration.ofSeconds(10);
        }
    }

    public record Providers(Endpoint openai, Endpoint anthropic, Endpoint cohere, Mock mock) {
        public Providers {
            if (openai == null) openai = new Endpoint(null, "https://api.openai.com");
            if (anthropic == null) anthropic = new Endpoint(null, "https://api.anthropic.com");
            if (cohere == null) cohere = new Endpoint(null, "https://api.cohere.ai");
            if (mock == null) mock = new Mock(null);
        }
    }

    public record Endpoint(String apiKey, String baseUrl) {}

    public record Mock(Duration latency) {
        public Mock {
            if (latency == null) latency = Duration.ZERO;
        }
    }
}
