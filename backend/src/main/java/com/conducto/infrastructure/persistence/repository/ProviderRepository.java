/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.infrastructure.persistence.repository;

import com.conducto.infrastructure.persistence.entity.ProviderEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ProviderRepository extends JpaRepository<ProviderEntity, String> {
    List<ProviderEntity> findAllByOrderByCreatedAtAscIdAsc();

    List<ProviderEntity> findByActiveTrueOrderByCreatedAtAscIdAsc();
}
