/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.api.admin;

import com.conducto.application.ProviderCatalogService;
import com.conducto.application.routing.HealthSnapshot;
import com.conducto.application.routing.HealthTracker;
import com.conducto.application.routing.ProviderInfo;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/admin")
public class AdminRoutingController {
    private final HealthTracker healthTracker;
    private final ProviderCatalogService catalogService;

    public AdminRoutingController(HealthTracker healthTracker, ProviderCatalogService catalogService) {
        this.healthTracker = healthTracker;
        this.catalogService = catalogService;
    }

    @GetMapping("/routing/health")
    public List<HealthSnapshot> health() {
        return healthTracker.snapshots();
    }

    @PutMapping("/providers/{id}/active")
    public ProviderInfo setActive(@PathVariable("id") String providerId, @Valid @RequestBody ActiveRequest req) {
        return catalogService.setActive(providerId, req.active());
    }

    @PutMapping("/providers/{id}/priority")
    public ProviderInfo setPriority(@PathVariable("id") String providerId, @Valid @RequestBody PriorityRequest req) {
        return catalogService.setPriority(providerId, req.priority());
    }

    public record ActiveRequest(@NotNull Boolean active) {}

    public record PriorityRequest(@NotNull @Min(0) @Max(100) Integer priority) {}
}
