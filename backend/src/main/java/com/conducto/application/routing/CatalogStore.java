/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.application.routing;

import java.util.List;

/**
 * Provider/model catalog as seen by the router.
 */
public interface CatalogStore {
    /**
     * Active, healthy provider+model pairs whose trust gate the score passes, in discovery order.
     * Empty when nothing qualifies.
     */
    List<Candidate> eligibleCandidates(int trustScore);
}
