/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.config;

import com.conducto.application.routing.CandidateScorer;
import com.conducto.application.routing.Dispatcher;
import com.conducto.application.routing.TrustGate;
import com.conducto.infrastructure.persistence.repository.ProviderModelRepository;
import com.conducto.infrastructure.persistence.repository.ProviderRepository;
import jakarta.persistence.EntityManagerFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
class JpaContextTest {
    @Autowired
    private EntityManagerFactory entityManagerFactory;

    @Autowired
    private ProviderRepository providerRepository;

    @Autowired
    private ProviderModelRepository providerModelRepository;

    @Autowired
    private AppProperties appProperties;

    @Autowired
    private TrustGate trustGate;

    @Autowired
    private CandidateScorer candidateScorer;

    @Autowired
    private Dispatcher dispatcher;

    @Test
    void contextLoadsWithSeededCatalog() {
        assertNotNull(entityManagerFactory);
        assertTrue(providerRepository.findById("mock").isPresent());
        assertEquals(2, providerModelRepository.findByProviderIdOrderByQualityScoreDescModelNameAsc("mock").size());
    }

    @Test
    void testProfileOverridesRoutingDefaults() {
        assertEquals(Duration.ofSeconds(2), appProperties.routing().perCallTimeout());
        assertEquals(0.4, appProperties.routing().weights().quality());
        assertEquals(50, appProperties.trust().defaultScore());
    }

    @Test
    void routingStagesAreWiredFromConfiguration() {
        assertNotNull(dispatcher);
        assertEquals(85, trustGate.score("demo-premium"));
        assertEquals(50, trustGate.score("caller-not-in-directory"));
        assertTrue(candidateScorer.rank(List.of()).isEmpty());
    }
}
