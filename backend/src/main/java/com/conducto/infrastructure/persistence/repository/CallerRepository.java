/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.infrastructure.persistence.repository;

import com.conducto.infrastructure.persistence.entity.CallerEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CallerRepository extends JpaRepository<CallerEntity, String> {
}
