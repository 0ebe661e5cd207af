/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.application.routing;

import com.conducto.config.AppProperties;
import com.conducto.config.RequestContextFilter;
import com.conducto.domain.model.CallerTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Public entry point: trust, eligibility, ranking, then failover dispatch.
 * <p>
 * Not transactional on purpose: each health update and each usage row commits on its own, so
 * an exhausted request still leaves its attempts behind.
 */
@Service
public class InferenceRouter {
    private static final Logger log = LoggerFactory.getLogger(InferenceRouter.class);
    static final String ANONYMOUS_CALLER = "anonymous";

    private final TrustGate trustGate;
    private final CatalogStore catalogStore;
    private final CandidateScorer scorer;
    private final Dispatcher dispatcher;
    private final HealthProbeService healthProbeService;
    private final Duration defaultDeadline;

    public InferenceRouter(
            TrustGate trustGate,
            CatalogStore catalogStore,
            CandidateScorer scorer,
            Dispatcher dispatcher,
            HealthProbeService healthProbeService,
            AppProperties properties
    ) {
        this.trustGate = trustGate;
        this.catalogStore = catalogStore;
        this.scorer = scorer;
        this.dispatcher = dispatcher;
        this.healthProbeService = healthProbeService;
        this.defaultDeadline = properties.routing().defaultDeadline();
    }

    public RoutedResponse route(ChatRequest request, String callerId) {
        if (request == null || request.messages().isEmpty()) {
            throw new IllegalArgumentException("At least one message is required");
        }
        if (request.deadlineMs() != null && request.deadlineMs() <= 0) {
            throw new IllegalArgumentException("deadlineMs must be positive");
        }
        String caller = callerId == null || callerId.isBlank() ? ANONYMOUS_CALLER : callerId;
        String requestId = currentRequestId();
        Instant deadline = Instant.now().plus(request.deadlineMs() == null
                ? defaultDeadline
                : Duration.ofMillis(request.deadlineMs()));

        int trustScore = trustGate.score(caller);
        CallerTier tier = trustGate.tierOf(trustScore);

        List<Candidate> candidates = catalogStore.eligibleCandidates(trustScore);
        if (candidates.isEmpty()) {
            log.info("no eligible provider requestId={} callerId={} trustScore={} tier={}",
                    requestId, caller, trustScore, tier.label());
            throw new NoEligibleProviderException(trustScore);
        }

        List<ScoredCandidate> ranked = scorer.rank(candidates);
        log.debug("routing requestId={} callerId={} trustScore={} candidates={}",
                requestId, caller, trustScore, ranked.size());

        DispatchResult result = dispatcher.execute(
                new DispatchContext(requestId, caller, trustScore, request, deadline),
                ranked
        );

        Candidate chosen = result.chosen().candidate();
        return new RoutedResponse(
                result.completion().content(),
                chosen.providerId(),
                chosen.provider().name(),
                result.completion().model() == null ? chosen.modelName() : result.completion().model(),
                new RoutedResponse.Usage(
                        result.completion().inputUnits(),
                        result.completion().outputUnits(),
                        result.cost()
                ),
                result.latencyMs(),
                trustScore,
                tier.label(),
                result.attempts(),
                requestId
        );
    }

    /**
     * Runs a probe cycle now and returns the resulting snapshots.
     */
    public List<HealthSnapshot> checkAllHealth() {
        return healthProbeService.runProbeCycle();
    }

    private static String currentRequestId() {
        String rid = MDC.get(RequestContextFilter.REQUEST_ID_KEY);
        return rid == null || rid.isBlank() ? UUID.randomUUID().toString() : rid;
    }
}
