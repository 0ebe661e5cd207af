/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.application.routing;

import java.util.Optional;

public interface TrustDirectory {
    /**
     * Empty when the caller is unknown. Any exception means the lookup itself failed.
     */
    Optional<Integer> trustScore(String callerId);
}
