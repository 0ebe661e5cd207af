/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.application.routing;

import com.conducto.application.ProviderAdapterRegistry;
import com.conducto.config.AppProperties;
import com.conducto.domain.model.ChatMessage;
import com.conducto.domain.model.ProviderKind;
import com.conducto.infrastructure.provider.ChatCompletion;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.conducto.application.routing.RoutingFixtures.model;
import static com.conducto.application.routing.RoutingFixtures.provider;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InferenceRouterTest {
    private static final AppProperties PROPERTIES = new AppProperties(null, null, null, null);

    @Mock
    private HealthProbeService healthProbeService;

    private final DispatcherTest.RecordingHealth health = new DispatcherTest.RecordingHealth();
    private final DispatcherTest.RecordingLedger ledger = new DispatcherTest.RecordingLedger();

    /**
     * Applies the same trust gate as the JPA catalog over an in-memory list.
     */
    private static CatalogStore catalog(List<Candidate> all) {
        return trustScore -> all.stream()
                .filter(c -> c.model().minTrustRequired() <= trustScore)
                .toList();
    }

    private static final List<Candidate> PREMIUM_ONLY = List.of(
            new Candidate(provider("openai", ProviderKind.OPENAI, 100), model("gpt-4o", "0.005", 95, 70), HealthSnapshot.unknown("openai")),
            new Candidate(provider("mock", ProviderKind.MOCK, 100), model("mock-premium", "0", 85, 70), HealthSnapshot.unknown("mock"))
    );

    @Test
    void callerBelowEveryGateGetsNoEligibleProviderWithoutNetworkCalls() {
        DispatcherTest.FakeAdapter openai = new DispatcherTest.FakeAdapter(ProviderKind.OPENAI,
                cmd -> Mono.just(new ChatCompletion("x", cmd.modelName(), 1, 1)));
        DispatcherTest.FakeAdapter mock = new DispatcherTest.FakeAdapter(ProviderKind.MOCK,
                cmd -> Mono.just(new ChatCompletion("x", cmd.modelName(), 1, 1)));
        InferenceRouter router = router(callerId -> Optional.of(20), catalog(PREMIUM_ONLY), openai, mock);

        NoEligibleProviderException ex = assertThrows(NoEligibleProviderException.class, () ->
                router.route(request("hi"), "low-trust"));

        assertEquals(20, ex.getTrustScore());
        assertEquals(0, openai.calls);
        assertEquals(0, mock.calls);
        assertTrue(ledger.entries.isEmpty());
        assertTrue(health.outcomes.isEmpty());
    }

    @Test
    void routesToBestCandidateAndReportsTier() {
        DispatcherTest.FakeAdapter openai = new DispatcherTest.FakeAdapter(ProviderKind.OPENAI,
                cmd -> Mono.just(new ChatCompletion("from " + cmd.modelName(), cmd.modelName(), 2000, 1000)));
        DispatcherTest.FakeAdapter mock = new DispatcherTest.FakeAdapter(ProviderKind.MOCK,
                cmd -> Mono.just(new ChatCompletion("mock", cmd.modelName(), 1, 1)));
        InferenceRouter router = router(callerId -> Optional.of(80), catalog(PREMIUM_ONLY), openai, mock);

        RoutedResponse response = router.route(request("explain failover"), "trusted");

        assertEquals("from gpt-4o", response.content());
        assertEquals("openai", response.providerId());
        assertEquals("gpt-4o", response.model());
        assertEquals("premium", response.tier());
        assertEquals(80, response.trustScore());
        assertEquals(1, response.attempts());
        assertEquals(new BigDecimal("0.015000"), response.usage().cost());
        assertEquals(0, mock.calls);
        assertEquals("trusted", ledger.entries.get(0).callerId());
    }

    @Test
    void unknownCallerUsesDefaultTrust() {
        List<Candidate> mixed = new ArrayList<>(PREMIUM_ONLY);
        mixed.add(new Candidate(provider("mock", ProviderKind.MOCK, 100), model("mock-basic", "0", 40, 0), HealthSnapshot.unknown("mock")));
        DispatcherTest.FakeAdapter mock = new DispatcherTest.FakeAdapter(ProviderKind.MOCK,
                cmd -> Mono.just(new ChatCompletion("basic", cmd.modelName(), 1, 1)));
        InferenceRouter router = router(callerId -> Optional.empty(), catalog(mixed), mock);

        RoutedResponse response = router.route(request("hi"), null);

        assertEquals("mock-basic", response.model());
        assertEquals(50, response.trustScore());
        assertEquals("standard", response.tier());
        assertEquals(InferenceRouter.ANONYMOUS_CALLER, ledger.entries.get(0).callerId());
    }

    @Test
    void trustLookupFailureIsTrustUnavailable() {
        CatalogStore catalog = trustScore -> {
            throw new AssertionError("catalog must not be consulted");
        };
        InferenceRouter router = router(callerId -> {
            throw new IllegalStateException("identity service down");
        }, catalog);

        TrustUnavailableException ex = assertThrows(TrustUnavailableException.class, () ->
                router.route(request("hi"), "someone"));

        assertEquals(RoutingErrorCode.TRUST_UNAVAILABLE, ex.getCode());
        assertEquals("someone", ex.getCallerId());
    }

    @Test
    void emptyConversationIsRejected() {
        InferenceRouter router = router(callerId -> Optional.of(90), catalog(PREMIUM_ONLY));

        assertThrows(IllegalArgumentException.class, () ->
                router.route(new ChatRequest(List.of(), null, null, null), "c"));
    }

    @Test
    void checkAllHealthDelegatesToProbeCycle() {
        List<HealthSnapshot> snapshots = List.of(HealthSnapshot.unknown("mock"));
        when(healthProbeService.runProbeCycle()).thenReturn(snapshots);
        InferenceRouter router = router(callerId -> Optional.of(90), catalog(PREMIUM_ONLY));

        assertEquals(snapshots, router.checkAllHealth());
    }

    @Test
    void routeNeverTouchesTheProbeCycle() {
        DispatcherTest.FakeAdapter mock = new DispatcherTest.FakeAdapter(ProviderKind.MOCK,
                cmd -> Mono.just(new ChatCompletion("ok", cmd.modelName(), 1, 1)));
        InferenceRouter router = router(callerId -> Optional.of(90), catalog(PREMIUM_ONLY), mock);

        router.route(request("hi"), "c");

        verifyNoInteractions(healthProbeService);
    }

    private InferenceRouter router(TrustDirectory directory, CatalogStore catalog, DispatcherTest.FakeAdapter... adapters) {
        Dispatcher dispatcher = new Dispatcher(
                new ProviderAdapterRegistry(List.of(adapters)),
                health,
                ledger,
                Duration.ofSeconds(1)
        );
        return new InferenceRouter(
                new TrustGate(directory, PROPERTIES),
                catalog,
                new CandidateScorer(PROPERTIES),
                dispatcher,
                healthProbeService,
                PROPERTIES
        );
    }

    private static ChatRequest request(String content) {
        return ChatRequest.of(List.of(new ChatMessage("user", content)));
    }
}
