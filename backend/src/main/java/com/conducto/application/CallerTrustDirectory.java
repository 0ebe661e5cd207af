/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.application;

import com.conducto.application.routing.TrustDirectory;
import com.conducto.infrastructure.persistence.entity.CallerEntity;
import com.conducto.infrastructure.persistence.repository.CallerRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Reads trust scores written by the identity subsystem. Nothing here changes them.
 */
@Service
public class CallerTrustDirectory implements TrustDirectory {
    private final CallerRepository callerRepository;

    public CallerTrustDirectory(CallerRepository callerRepository) {
        this.callerRepository = callerRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Integer> trustScore(String callerId) {
        if (callerId == null || callerId.isBlank()) return Optional.empty();
        return callerRepository.findById(callerId).map(CallerEntity::getTrustScore);
    }
}
