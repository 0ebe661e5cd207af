/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.application.routing;

import com.conducto.application.ProviderAdapterRegistry;
import com.conducto.config.AppProperties;
import com.conducto.infrastructure.provider.ChatCommand;
import com.conducto.infrastructure.provider.ChatCompletion;
import com.conducto.infrastructure.provider.ChatProviderAdapter;
import com.conducto.infrastructure.provider.ProviderErrorType;
import com.conducto.infrastructure.provider.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Walks the ranked candidates one at a time until one answers.
 * <p>
 * Every attempt, whatever its outcome, produces exactly one health update and one usage row,
 * in candidate order. Per-attempt errors never leave this class; callers only see a
 * {@link DispatchResult} or one of the terminal {@link RoutingException}s.
 */
@Service
public class Dispatcher {
    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);
    private static final int MAX_ERROR_LENGTH = 500;

    private final ProviderAdapterRegistry adapterRegistry;
    private final HealthTracker healthTracker;
    private final UsageLedger usageLedger;
    private final Duration perCallTimeout;

    @Autowired
    public Dispatcher(
            ProviderAdapterRegistry adapterRegistry,
            HealthTracker healthTracker,
            UsageLedger usageLedger,
            AppProperties properties
    ) {
        this(adapterRegistry, healthTracker, usageLedger, properties.routing().perCallTimeout());
    }

    Dispatcher(
            ProviderAdapterRegistry adapterRegistry,
            HealthTracker healthTracker,
            UsageLedger usageLedger,
            Duration perCallTimeout
    ) {
        this.adapterRegistry = adapterRegistry;
        this.healthTracker = healthTracker;
        this.usageLedger = usageLedger;
        this.perCallTimeout = perCallTimeout;
    }

    public DispatchResult execute(DispatchContext context, List<ScoredCandidate> ranked) {
        if (ranked == null || ranked.isEmpty()) {
            log.info("dispatch state={} requestId={} trustScore={}",
                    DispatchState.NO_CANDIDATES, context.requestId(), context.trustScore());
            throw new NoEligibleProviderException(context.trustScore());
        }

        ProviderException lastError = null;
        boolean lastCallCutByDeadline = false;
        int attempt = 0;

        for (ScoredCandidate scored : ranked) {
            Duration remaining = Duration.between(Instant.now(), context.deadline());
            if (remaining.isZero() || remaining.isNegative()) {
                log.warn("dispatch state={} requestId={} attempts={} remaining={}",
                        DispatchState.DEADLINE_EXCEEDED, context.requestId(), attempt, ranked.size() - attempt);
                throw new DeadlineExceededException(attempt, lastError);
            }

            attempt++;
            Candidate candidate = scored.candidate();
            boolean shortened = remaining.compareTo(perCallTimeout) < 0;
            Duration timeout = shortened ? remaining : perCallTimeout;
            log.debug("dispatch state={} requestId={} attempt={} provider={} model={} timeoutMs={}",
                    DispatchState.ATTEMPTING, context.requestId(), attempt, candidate.providerId(), candidate.modelName(), timeout.toMillis());

            long startedAt = System.nanoTime();
            try {
                ChatCompletion completion = call(candidate, context.request(), timeout);
                long latencyMs = elapsedMs(startedAt);
                BigDecimal cost = candidate.model().costFor(completion.inputUnits(), completion.outputUnits());

                healthTracker.recordOutcome(candidate.providerId(), true, null);
                usageLedger.record(new UsageEntry(
                        UUID.randomUUID(),
                        context.requestId(),
                        attempt,
                        context.callerId(),
                        candidate.providerId(),
                        candidate.modelName(),
                        completion.inputUnits(),
                        completion.outputUnits(),
                        cost,
                        latencyMs,
                        true,
                        null,
                        null,
                        Instant.now()
                ));

                log.info("dispatch state={} requestId={} attempt={} provider={} model={} latencyMs={}",
                        DispatchState.SUCCEEDED, context.requestId(), attempt, candidate.providerId(), candidate.modelName(), latencyMs);
                return new DispatchResult(DispatchState.SUCCEEDED, scored, completion, cost, latencyMs, attempt);
            } catch (ProviderException ex) {
                long latencyMs = elapsedMs(startedAt);
                lastError = ex;
                lastCallCutByDeadline = shortened && ex.getType() == ProviderErrorType.TIMEOUT;
                log.warn("dispatch attempt failed requestId={} attempt={} provider={} model={} kind={} latencyMs={}",
                        context.requestId(), attempt, candidate.providerId(), candidate.modelName(), ex.getType(), latencyMs);

                healthTracker.recordOutcome(candidate.providerId(), false, describe(ex));
                usageLedger.record(new UsageEntry(
                        UUID.randomUUID(),
                        context.requestId(),
                        attempt,
                        context.callerId(),
                        candidate.providerId(),
                        candidate.modelName(),
                        0,
                        0,
                        BigDecimal.ZERO.setScale(6),
                        latencyMs,
                        false,
                        ex.getType().name(),
                        truncate(ex.getSafeMessage()),
                        Instant.now()
                ));
            }
        }

        // the last candidate only counts as cut short if the deadline shrank its timeout
        if (lastCallCutByDeadline) {
            log.warn("dispatch state={} requestId={} attempts={}", DispatchState.DEADLINE_EXCEEDED, context.requestId(), attempt);
            throw new DeadlineExceededException(attempt, lastError);
        }
        log.warn("dispatch state={} requestId={} attempts={} lastKind={}",
                DispatchState.EXHAUSTED, context.requestId(), attempt, lastError == null ? null : lastError.getType());
        throw new AllProvidersExhaustedException(attempt, lastError);
    }

    private ChatCompletion call(Candidate candidate, ChatRequest request, Duration timeout) {
        String providerId = candidate.providerId();
        ChatProviderAdapter adapter = adapterRegistry.find(candidate.provider().kind())
                .orElseThrow(() -> new ProviderException(
                        providerId,
                        ProviderErrorType.UNAVAILABLE,
                        "No adapter for kind " + candidate.provider().kind()
                ));

        ChatCommand command = new ChatCommand(
                providerId,
                candidate.provider().baseUrl(),
                candidate.modelName(),
                request.messages(),
                request.temperature(),
                request.maxTokens()
        );

        ChatCompletion completion;
        try {
            completion = Mono.defer(() -> adapter.chat(command))
                    .timeout(timeout, Mono.error(() -> new ProviderException(
                            providerId,
                            ProviderErrorType.TIMEOUT,
                            "Provider call timed out after " + timeout.toMillis() + "ms"
                    )))
                    .onErrorMap(e -> !(e instanceof ProviderException), e -> new ProviderException(
                            providerId,
                            ProviderErrorType.UNKNOWN,
                            e.getClass().getSimpleName() + (e.getMessage() == null ? "" : ": " + e.getMessage()),
                            e
                    ))
                    .block();
        } catch (ProviderException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new ProviderException(providerId, ProviderErrorType.UNKNOWN, "Provider call failed", ex);
        }

        if (completion == null) {
            throw new ProviderException(providerId, ProviderErrorType.UNKNOWN, "Provider returned no completion");
        }
        return completion;
    }

    private static String describe(ProviderException ex) {
        return truncate(ex.getType() + ": " + ex.getSafeMessage());
    }

    private static String truncate(String message) {
        if (message == null) return null;
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }

    private static long elapsedMs(long startedAt) {
        return (System.nanoTime() - startedAt) / 1_000_000;
    }
}
