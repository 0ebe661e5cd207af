/*
 * Copyright (C) 2025 Conducto Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.conducto.application;

import com.conducto.domain.model.ProviderKind;
import com.conducto.infrastructure.provider.ChatProviderAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Chat adapters keyed by the wire protocol they speak. Catalog rows name a {@link ProviderKind};
 * a kind without an adapter is simply never routed to, while two adapters for the same kind is a
 * wiring error that fails startup.
 */
@Component
public class ProviderAdapterRegistry {
    private static final Logger log = LoggerFactory.getLogger(ProviderAdapterRegistry.class);

    private final Map<ProviderKind, ChatProviderAdapter> byKind;

    public ProviderAdapterRegistry(List<ChatProviderAdapter> adapters) {
        EnumMap<ProviderKind, ChatProviderAdapter> map = new EnumMap<>(ProviderKind.class);
        for (ChatProviderAdapter adapter : adapters == null ? List.<ChatProviderAdapter>of() : adapters) {
            ProviderKind kind = adapter.kind();
            if (kind == null) {
                throw new IllegalStateException(adapter.getClass().getSimpleName() + " does not declare a provider kind");
            }
            ChatProviderAdapter clash = map.putIfAbsent(kind, adapter);
            if (clash != null) {
                throw new IllegalStateException("Both " + clash.getClass().getSimpleName() + " and "
                        + adapter.getClass().getSimpleName() + " claim provider kind " + kind);
            }
        }
        this.byKind = map;
        log.info("chat adapters registered kinds={}", map.keySet());
    }

    public Optional<ChatProviderAdapter> find(ProviderKind kind) {
        return kind == null ? Optional.empty() : Optional.ofNullable(byKind.get(kind));
    }

    public boolean supports(ProviderKind kind) {
        return kind != null && byKind.containsKey(kind);
    }
}
