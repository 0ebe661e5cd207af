/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.api.analytics;

import com.conducto.application.ProviderUsageService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/analytics")
public class UsageAnalyticsController {
    private final ProviderUsageService usageService;

    public UsageAnalyticsController(ProviderUsageService usageService) {
        this.usageService = usageService;
    }

    @GetMapping("/usage")
    public List<ProviderUsageService.ProviderUsageSummary> usage(
            @RequestParam(value = "days", defaultValue = "7") int days
    ) {
        return usageService.summarize(days);
    }
}
