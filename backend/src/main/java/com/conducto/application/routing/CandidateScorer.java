/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.application.routing;

import com.conducto.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ranks eligible candidates by a weighted composite score, best first.
 * <p>
 * The cost term only looks at the input price. {@link List#sort} is stable, so candidates with
 * equal totals keep the order in which the catalog discovered them.
 */
@Service
public class CandidateScorer {
    private static final Logger log = LoggerFactory.getLogger(CandidateScorer.class);
    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

    private final ScoringWeights weights;
    private final double neutralHealthScore;

    @Autowired
    public CandidateScorer(AppProperties properties) {
        this(ScoringWeights.from(properties.routing().weights()), properties.routing().neutralHealthScore());
    }

    public CandidateScorer(ScoringWeights weights, double neutralHealthScore) {
        this.weights = weights == null ? ScoringWeights.defaults() : weights;
        this.neutralHealthScore = neutralHealthScore;
    }

    public List<ScoredCandidate> rank(List<Candidate> candidates) {
        if (candidates == null || candidates.isEmpty()) return List.of();

        List<ScoredCandidate> scored = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            scored.add(score(candidate));
        }
        scored.sort(Comparator.comparingDouble(ScoredCandidate::totalScore).reversed());

        if (log.isDebugEnabled()) {
            for (ScoredCandidate s : scored) {
                log.debug("candidate provider={} model={} total={} quality={} cost={} health={} priority={}",
                        s.candidate().providerId(), s.candidate().modelName(), s.totalScore(),
                        s.qualityScore(), s.costScore(), s.healthScore(), s.priorityScore());
            }
        }
        return List.copyOf(scored);
    }

    ScoredCandidate score(Candidate candidate) {
        double quality = candidate.model().qualityScore();
        double cost = costScore(candidate.model().costPer1kInput());
        double health = candidate.health() == null
                ? neutralHealthScore
                : candidate.health().successRateOr(neutralHealthScore);
        double priority = candidate.provider().priority();

        double total = quality * weights.quality()
                + cost * weights.cost()
                + health * weights.health()
                + priority * weights.priority();

        return new ScoredCandidate(candidate, total, quality, cost, health, priority);
    }

    static double costScore(BigDecimal costPer1kInput) {
        if (costPer1kInput == null) return 100;
        double raw = 100 - costPer1kInput.multiply(THOUSAND).doubleValue();
        return Math.max(0, raw);
    }
}
