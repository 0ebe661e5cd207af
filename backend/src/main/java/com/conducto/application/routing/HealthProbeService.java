/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.application.routing;

import com.conducto.application.ProviderAdapterRegistry;
import com.conducto.application.ProviderCatalogService;
import com.conducto.config.AppProperties;
import com.conducto.infrastructure.provider.ChatProviderAdapter;
import com.conducto.infrastructure.provider.ProbeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * One probe cycle: every catalog provider with a registered adapter is probed concurrently,
 * then the results are recorded one by one. Failures are logged and left for the next cycle.
 */
@Service
public class HealthProbeService {
    private static final Logger log = LoggerFactory.getLogger(HealthProbeService.class);

    private final ProviderCatalogService catalogService;
    private final ProviderAdapterRegistry adapterRegistry;
    private final HealthTracker healthTracker;
    private final Duration probeTimeout;

    public HealthProbeService(
            ProviderCatalogService catalogService,
            ProviderAdapterRegistry adapterRegistry,
            HealthTracker healthTracker,
            AppProperties properties
    ) {
        this.catalogService = catalogService;
        this.adapterRegistry = adapterRegistry;
        this.healthTracker = healthTracker;
        this.probeTimeout = properties.health().probeTimeout();
    }

    public List<HealthSnapshot> runProbeCycle() {
        List<Mono<ProbeOutcome>> probes = new ArrayList<>();
        for (ProviderInfo provider : catalogService.providers()) {
            adapterRegistry.find(provider.kind()).ifPresent(adapter -> probes.add(probe(provider, adapter)));
        }

        List<ProbeOutcome> outcomes = Flux.mergeSequential(probes)
                .collectList()
                .block();

        if (outcomes != null) {
            for (ProbeOutcome outcome : outcomes) {
                healthTracker.recordProbe(outcome.providerId(), outcome.result().healthy(), outcome.result().error());
            }
            log.info("probe cycle done providers={} unhealthy={}",
                    outcomes.size(), outcomes.stream().filter(o -> !o.result().healthy()).count());
        }
        return healthTracker.snapshots();
    }

    private Mono<ProbeOutcome> probe(ProviderInfo provider, ChatProviderAdapter adapter) {
        return Mono.defer(() -> adapter.probe(provider.id(), provider.baseUrl()))
                .timeout(probeTimeout)
                .onErrorResume(e -> {
                    log.warn("probe failed provider={} error={}", provider.id(), e.toString());
                    return Mono.just(ProbeResult.unhealthy(probeTimeout.toMillis(), describe(e)));
                })
                .defaultIfEmpty(ProbeResult.unhealthy(0, "Probe returned no result"))
                .map(result -> new ProbeOutcome(provider.id(), result));
    }

    private static String describe(Throwable e) {
        if (e instanceof TimeoutException) return "Probe timed out";
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    private record ProbeOutcome(String providerId, ProbeResult result) {}
}
