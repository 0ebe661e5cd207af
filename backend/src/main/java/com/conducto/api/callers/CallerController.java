/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.api.callers;

import com.conducto.application.routing.TrustGate;
import com.conducto.domain.model.CallerTier;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/callers")
public class CallerController {
    private final TrustGate trustGate;

    public CallerController(TrustGate trustGate) {
        this.trustGate = trustGate;
    }

    @GetMapping("/{callerId}/tier")
    public CallerTierView tier(@PathVariable("callerId") String callerId) {
        int score = trustGate.score(callerId);
        CallerTier tier = trustGate.tierOf(score);
        return new CallerTierView(callerId, score, tier.label());
    }

    public record CallerTierView(String callerId, int trustScore, String tier) {}
}
