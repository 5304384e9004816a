package me.neonhub.reasoning.port.outbound;

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
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound port to the language-model collaborator. Retries, timeouts and
 * fallbacks belong to the implementation, not to the engine.
 */
public interface ModelPort {

    /**
     * Returns the provider identifier (e.g., "langchain4j", "none").
     */
    String getProviderId();

    /**
     * Runs a completion and returns the full response.
     */
    CompletableFuture<ModelResponse> generate(ModelRequest request);

    /**
     * Runs a streaming completion. The returned flux is cold: nothing is
     * produced until it is subscribed, and cancelling the subscription stops
     * further production. Default implementation emits the synchronous result
     * as a single chunk.
     */
    default Flux<ModelChunk> generateStream(ModelRequest request) {
        return Flux.defer(() -> Mono.fromFuture(generate(request)).flux())
                .map(response -> ModelChunk.builder()
                        .text(response.getContent())
                        .usage(response.getUsage())
                        .done(true)
                        .build());
    }

    /**
     * Checks if this provider streams fragments natively.
     */
    default boolean supportsStreaming() {
        return false;
    }

    /**
     * Checks if the provider is configured and operational.
     */
    boolean isAvailable();
}
