/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.math.BigDecimal;

@Entity
@Table(
        name = "provider_models",
        uniqueConstraints = @UniqueConstraint(name = "uq_provider_model", columnNames = {"provider_id", "model_name"})
)
public class ProviderModelEntity {
    @Id
    @Column(name = "id", nullable = false, length = 96)
    private String id;

    @Column(name = "provider_id", nullable = false, length = 64)
    private String providerId;

    @Column(name = "model_name", nullable = false)
    private String modelName;

    @Column(name = "cost_per_1k_input", nullable = false, precision = 12, scale = 6)
    private BigDecimal costPer1kInput;

    @Column(name = "cost_per_1k_output", nullable = false, precision = 12, scale = 6)
    private BigDecimal costPer1kOutput;

    @Column(name = "quality_score", nullable = false)
    private int qualityScore;

    @Column(name = "min_trust_required", nullable = false)
    private int minTrustRequired;

    @Column(name = "context_window", nullable = false)
    private int contextWindow;

    @Column(name = "max_tokens", nullable = false)
    private int maxTokens;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getProviderId() {
        return providerId;
    }

    public void setProviderId(String providerId) {
        this.providerId = providerId;
    }

    public String getModelName() {
        return modelName;
    }

    public void setModelName(String modelName) {
        this.modelName = modelName;
    }

    public BigDecimal getCostPer1kInput() {
        return costPer1kInput;
    }

    public void setCostPer1kInput(BigDecimal costPer1kInput) {
        this.costPer1kInput = costPer1kInput;
    }

    public BigDecimal getCostPer1kOutput() {
        return costPer1kOutput;
    }

    public void setCostPer1kOutput(BigDecimal costPer1kOutput) {
        this.costPer1kOutput = costPer1kOutput;
    }

    public int getQualityScore() {
        return qualityScore;
    }

    public void setQualityScore(int qualityScore) {
        this.qualityScore = qualityScore;
    }

    public int getMinTrustRequired() {
        return minTrustRequired;
    }

    public void setMinTrustRequired(int minTrustRequired) {
        this.minTrustRequired = minTrustRequired;
    }

    public int getContextWindow() {
        return contextWindow;
    }

    public void setContextWindow(int contextWindow) {
        this.contextWindow = contextWindow;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(int maxTokens) {
        this.maxTokens = maxTokens;
    }
}
