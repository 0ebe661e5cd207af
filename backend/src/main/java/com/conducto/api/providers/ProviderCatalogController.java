/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.api.providers;

import com.conducto.application.ProviderCatalogService;
import com.conducto.application.routing.HealthSnapshot;
import com.conducto.application.routing.InferenceRouter;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/providers")
public class ProviderCatalogController {
    private final ProviderCatalogService catalogService;
    private final InferenceRouter inferenceRouter;

    public ProviderCatalogController(ProviderCatalogService catalogService, InferenceRouter inferenceRouter) {
        this.catalogService = catalogService;
        this.inferenceRouter = inferenceRouter;
    }

    @GetMapping
    public List<ProviderCatalogService.ProviderView> list() {
        return catalogService.listProviders();
    }

    /**
     * Runs a probe cycle before answering.
     */
    @GetMapping("/health")
    public List<HealthSnapshot> health() {
        return inferenceRouter.checkAllHealth();
    }
}
