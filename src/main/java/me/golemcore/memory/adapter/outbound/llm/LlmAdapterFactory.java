package me.golemcore.memory.adapter.outbound.llm;

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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.LlmRequest;
import me.golemcore.memory.domain.model.LlmResponse;
import me.golemcore.memory.domain.model.ModelTier;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.LlmPort;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * The {@link LlmPort} the domain sees. Picks one {@link LlmProviderAdapter} at
 * startup from {@code memory.llm.provider} and forwards every call to it.
 *
 * <p>
 * An unknown provider id selects the fallback adapter (see
 * {@link LlmProviderAdapter#isFallback()}), so a typo in configuration leaves
 * the engine running with generation unavailable instead of failing to start.
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class LlmAdapterFactory implements LlmPort {

    private static final String NO_PROVIDER = "none";

    private final MemoryProperties properties;
    private final List<LlmProviderAdapter> adapters;

    private final Map<String, LlmProviderAdapter> adaptersByProvider = new LinkedHashMap<>();
    private LlmProviderAdapter activeAdapter;

    @PostConstruct
    public void init() {
        adapters.forEach(adapter -> adaptersByProvider.put(adapter.getProviderId(), adapter));
        log.debug("[LLM] Registered providers: {}", adaptersByProvider.keySet());

        String configured = properties.getLlm().getProvider();
        activeAdapter = adaptersByProvider.get(configured);
        if (activeAdapter != null) {
            log.info("[LLM] Active provider: {}", configured);
            return;
        }

        activeAdapter = adapters.stream()
                .filter(LlmProviderAdapter::isFallback)
                .findFirst()
                .orElse(null);
        log.warn("[LLM] Provider '{}' is not registered, using {}", configured, getProviderId());
    }

    public LlmPort getActiveAdapter() {
        return activeAdapter;
    }

    public boolean isProviderAvailable(String providerId) {
        LlmProviderAdapter adapter = adaptersByProvider.get(providerId);
        return adapter != null && adapter.isAvailable();
    }

    @Override
    public String getProviderId() {
        return activeAdapter != null ? activeAdapter.getProviderId() : NO_PROVIDER;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        if (activeAdapter == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("No LLM adapter registered"));
        }
        return activeAdapter.chat(request);
    }

    @Override
    public String getModel(ModelTier tier) {
        return activeAdapter != null ? activeAdapter.getModel(tier) : NO_PROVIDER;
    }

    @Override
    public boolean isAvailable() {
        return activeAdapter != null && activeAdapter.isAvailable();
    }
}
