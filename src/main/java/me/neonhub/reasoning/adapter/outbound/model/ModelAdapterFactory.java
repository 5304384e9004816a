package me.neonhub.reasoning.adapter.outbound.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.neonhub.reasoning.domain.model.ModelChunk;
import me.neonhub.reasoning.domain.model.ModelRequest;
import me.neonhub.reasoning.domain.model.ModelResponse;
import me.neonhub.reasoning.infrastructure.config.ReasoningProperties;
import me.neonhub.reasoning.port.outbound.ModelPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Primary {@link ModelPort}: resolves the provider named by
 * {@code reasoning.model.provider} among the {@link ModelProviderAdapter} beans
 * and routes engine calls to it.
 *
 * <p>
 * Provider ids are matched case-insensitively. Candidates are tried in order
 * (the configured provider, then {@code none}, then the first registered
 * adapter) and the first one whose {@link ModelProviderAdapter#initialize()}
 * succeeds becomes active. Adapters without native streaming are streamed as a
 * single chunk built from their synchronous response.
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class ModelAdapterFactory implements ModelPort {

    private static final String LOG_PREFIX = "[Model]";
    private static final String PROVIDER_NONE = "none";

    private final ReasoningProperties properties;
    private final List<ModelProviderAdapter> adapters;

    private final Map<String, ModelProviderAdapter> adaptersByProvider = new LinkedHashMap<>();
    private volatile ModelProviderAdapter activeAdapter;

    @PostConstruct
    public void init() {
        for (ModelProviderAdapter adapter : adapters) {
            String id = normalize(adapter.getProviderId());
            ModelProviderAdapter previous = adaptersByProvider.putIfAbsent(id, adapter);
            if (previous != null) {
                throw new IllegalStateException("Duplicate model provider id: " + id);
            }
        }

        String requested = normalize(properties.getModel().getProvider());
        for (String candidate : candidateOrder(requested)) {
            ModelProviderAdapter adapter = adaptersByProvider.get(candidate);
            if (adapter == null) {
                continue;
            }
            try {
                adapter.initialize();
            } catch (RuntimeException e) {
                log.warn("{} Provider '{}' failed to initialize: {}", LOG_PREFIX, candidate, e.getMessage());
                continue;
            }
            activeAdapter = adapter;
            break;
        }

        if (activeAdapter == null) {
            log.warn("{} No usable model provider among {}; model calls will fail",
                    LOG_PREFIX, adaptersByProvider.keySet());
            return;
        }
        String active = normalize(activeAdapter.getProviderId());
        if (!active.equals(requested)) {
            log.warn("{} Model provider '{}' unavailable, using '{}'", LOG_PREFIX, requested, active);
        }
        log.info("{} Active model provider: {} (streaming: {})", LOG_PREFIX, active,
                activeAdapter.supportsStreaming() ? "native" : "single chunk");
    }

    private Set<String> candidateOrder(String requested) {
        Set<String> order = new LinkedHashSet<>();
        order.add(requested);
        order.add(PROVIDER_NONE);
        order.addAll(adaptersByProvider.keySet());
        return order;
    }

    static String normalize(String providerId) {
        if (providerId == null || providerId.isBlank()) {
            return PROVIDER_NONE;
        }
        return providerId.trim().toLowerCase(Locale.ROOT);
    }

    public ModelPort getActiveAdapter() {
        return activeAdapter;
    }

    public ModelPort getAdapter(String providerId) {
        return adaptersByProvider.get(normalize(providerId));
    }

    // ==================== ModelPort delegation ====================

    @Override
    public String getProviderId() {
        ModelProviderAdapter adapter = activeAdapter;
        return adapter != null ? adapter.getProviderId() : PROVIDER_NONE;
    }

    @Override
    public CompletableFuture<ModelResponse> generate(ModelRequest request) {
        return requireActive().generate(request);
    }

    @Override
    public Flux<ModelChunk> generateStream(ModelRequest request) {
        ModelProviderAdapter adapter = requireActive();
        if (adapter.supportsStreaming()) {
            return adapter.generateStream(request);
        }
        return ModelPort.super.generateStream(request);
    }

    @Override
    public boolean supportsStreaming() {
        ModelProviderAdapter adapter = activeAdapter;
        return adapter != null && adapter.supportsStreaming();
    }

    @Override
    public boolean isAvailable() {
        ModelProviderAdapter adapter = activeAdapter;
        return adapter != null && adapter.isAvailable();
    }

    private ModelProviderAdapter requireActive() {
        ModelProviderAdapter adapter = activeAdapter;
        if (adapter == null) {
            throw new IllegalStateException("No model adapter registered");
        }
        return adapter;
    }
}
