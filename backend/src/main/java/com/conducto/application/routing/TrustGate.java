/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.application.routing;

import com.conducto.config.AppProperties;
import com.conducto.domain.model.CallerTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Turns a caller id into a trust score, read fresh on every request.
 */
@Service
public class TrustGate {
    private static final Logger log = LoggerFactory.getLogger(TrustGate.class);

    private final TrustDirectory trustDirectory;
    private final int defaultScore;

    @Autowired
    public TrustGate(TrustDirectory trustDirectory, AppProperties properties) {
        this(trustDirectory, properties.trust().defaultScore());
    }

    TrustGate(TrustDirectory trustDirectory, int defaultScore) {
        this.trustDirectory = trustDirectory;
        this.defaultScore = clamp(defaultScore);
    }

    public int score(String callerId) {
        Optional<Integer> found;
        try {
            found = trustDirectory.trustScore(callerId);
        } catch (RuntimeException ex) {
            log.warn("trust lookup failed callerId={}", callerId, ex);
            throw new TrustUnavailableException(callerId, ex);
        }
        if (found == null || found.isEmpty()) {
            log.debug("unknown caller callerId={} defaultScore={}", callerId, defaultScore);
            return defaultScore;
        }
        return clamp(found.get());
    }

    /**
     * Label for responses and logs. Never used for gating.
     */
    public CallerTier tierOf(int trustScore) {
        return CallerTier.fromTrustScore(trustScore);
    }

    static int clamp(int score) {
        if (score < 0) return 0;
        if (score > 100) return 100;
        return score;
    }
}
