/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.application;

import com.conducto.application.routing.HealthProbeService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "app.health", name = "probe-enabled", havingValue = "true", matchIfMissing = true)
public class HealthProbeScheduler {
    private static final Logger log = LoggerFactory.getLogger(HealthProbeScheduler.class);

    private final HealthProbeService healthProbeService;

    public HealthProbeScheduler(HealthProbeService healthProbeService) {
        this.healthProbeService = healthProbeService;
    }

    @Scheduled(
            initialDelayString = "${app.health.probe-interval:PT60S}",
            fixedDelayString = "${app.health.probe-interval:PT60S}"
    )
    public void probe() {
        try {
            healthProbeService.runProbeCycle();
        } catch (RuntimeException ex) {
            // a broken cycle must not cancel the schedule; the next run re-evaluates
            log.error("scheduled probe cycle failed", ex);
        }
    }
}
