/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.infrastructure.persistence.repository;

import com.conducto.infrastructure.persistence.entity.ProviderModelEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ProviderModelRepository extends JpaRepository<ProviderModelEntity, String> {
    List<ProviderModelEntity> findByProviderIdOrderByQualityScoreDescModelNameAsc(String providerId);

    List<ProviderModelEntity> findByProviderIdAndMinTrustRequiredLessThanEqualOrderByQualityScoreDescModelNameAsc(
            String providerId,
            int trustScore
    );
}
