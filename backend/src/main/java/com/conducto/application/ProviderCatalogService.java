/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.application;

import com.conducto.api.ApiException;
import com.conducto.application.routing.Candidate;
import com.conducto.application.routing.CatalogStore;
import com.conducto.application.routing.HealthSnapshot;
import com.conducto.application.routing.HealthTracker;
import com.conducto.application.routing.ModelInfo;
import com.conducto.application.routing.ProviderInfo;
import com.conducto.domain.model.ProviderKind;
import com.conducto.infrastructure.persistence.entity.ProviderEntity;
import com.conducto.infrastructure.persistence.entity.ProviderModelEntity;
import com.conducto.infrastructure.persistence.repository.ProviderModelRepository;
import com.conducto.infrastructure.persistence.repository.ProviderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Service
public class ProviderCatalogService implements CatalogStore {
    private static final Logger log = LoggerFactory.getLogger(ProviderCatalogService.class);

    private final ProviderRepository providerRepository;
    private final ProviderModelRepository modelRepository;
    private final HealthTracker healthTracker;
    private final ProviderAdapterRegistry adapterRegistry;

    public ProviderCatalogService(
            ProviderRepository providerRepository,
            ProviderModelRepository modelRepository,
            HealthTracker healthTracker,
            ProviderAdapterRegistry adapterRegistry
    ) {
        this.providerRepository = providerRepository;
        this.modelRepository = modelRepository;
        this.healthTracker = healthTracker;
        this.adapterRegistry = adapterRegistry;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Candidate> eligibleCandidates(int trustScore) {
        List<Candidate> candidates = new ArrayList<>();
        for (ProviderEntity provider : providerRepository.findByActiveTrueOrderByCreatedAtAscIdAsc()) {
            if (!adapterRegistry.supports(provider.getKind())) {
                log.debug("skipping provider without adapter provider={} kind={}", provider.getId(), provider.getKind());
                continue;
            }
            HealthSnapshot health = healthTracker.snapshot(provider.getId());
            if (!health.healthy()) {
                continue;
            }
            ProviderInfo info = toInfo(provider);
            modelRepository
                    .findByProviderIdAndMinTrustRequiredLessThanEqualOrderByQualityScoreDescModelNameAsc(provider.getId(), trustScore)
                    .forEach(model -> candidates.add(new Candidate(info, toInfo(model), health)));
        }
        return List.copyOf(candidates);
    }

    @Transactional(readOnly = true)
    public List<ProviderInfo> providers() {
        return providerRepository.findAllByOrderByCreatedAtAscIdAsc().stream()
                .map(ProviderCatalogService::toInfo)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<ProviderView> listProviders() {
        return providerRepository.findAllByOrderByCreatedAtAscIdAsc().stream()
                .map(p -> new ProviderView(
                        p.getId(),
                        p.getName(),
                        p.getKind(),
                        p.isActive(),
                        p.getPriority(),
                        adapterRegistry.supports(p.getKind()),
                        healthTracker.snapshot(p.getId()),
                        modelRepository.findByProviderIdOrderByQualityScoreDescModelNameAsc(p.getId()).stream()
                                .map(ProviderCatalogService::toInfo)
                                .toList()
                ))
                .toList();
    }

    @Transactional
    public ProviderInfo setActive(String providerId, boolean active) {
        ProviderEntity provider = requireProvider(providerId);
        provider.setActive(active);
        provider.setUpdatedAt(Instant.now());
        log.info("provider activation changed provider={} active={}", providerId, active);
        return toInfo(providerRepository.save(provider));
    }

    @Transactional
    public ProviderInfo setPriority(String providerId, int priority) {
        if (priority < 0 || priority > 100) {
            throw new IllegalArgumentException("priority must be between 0 and 100");
        }
        ProviderEntity provider = requireProvider(providerId);
        provider.setPriority(priority);
        provider.setUpdatedAt(Instant.now());
        log.info("provider priority changed provider={} priority={}", providerId, priority);
        return toInfo(providerRepository.save(provider));
    }

    private ProviderEntity requireProvider(String providerId) {
        return providerRepository.findById(providerId)
                .orElseThrow(() -> new ApiException(HttpStatus.NOT_FOUND, "Provider not found"));
    }

    static ProviderInfo toInfo(ProviderEntity e) {
        return new ProviderInfo(
                e.getId(),
                e.getName(),
                e.getKind(),
                e.getBaseUrl(),
                e.isActive(),
                e.getPriority(),
                e.getCreatedAt()
        );
    }

    static ModelInfo toInfo(ProviderModelEntity e) {
        return new ModelInfo(
                e.getModelName(),
                e.getCostPer1kInput(),
                e.getCostPer1kOutput(),
                e.getQualityScore(),
                e.getMinTrustRequired(),
                e.getContextWindow(),
                e.getMaxTokens()
        );
    }

    public record ProviderView(
            String id,
            String name,
            ProviderKind kind,
            boolean active,
            int priority,
            boolean adapterAvailable,
            HealthSnapshot health,
            List<ModelInfo> models
    ) {}
}
