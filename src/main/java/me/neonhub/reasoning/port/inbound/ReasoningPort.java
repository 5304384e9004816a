package me.neonhub.reasoning.port.inbound;

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

import me.neonhub.reasoning.domain.exception.ContextNotFoundException;
import me.neonhub.reasoning.domain.model.ContextEntry;
import me.neonhub.reasoning.domain.model.EngineMetrics;
import me.neonhub.reasoning.domain.model.InferenceOutcome;
import me.neonhub.reasoning.domain.model.InferenceRequest;
import me.neonhub.reasoning.domain.model.InferenceResult;
import me.neonhub.reasoning.domain.model.InferenceStream;
import me.neonhub.reasoning.domain.model.ReasoningContext;

import java.util.Collection;
import java.util.Optional;

/**
 * Caller-facing surface of the reasoning core, consumed by API and dashboard
 * layers.
 */
public interface ReasoningPort {

    ReasoningContext createContext(String sessionId, String userId, String campaignId);

    default ReasoningContext createContext(String sessionId) {
        return createContext(sessionId, null, null);
    }

    /**
     * Appends an entry to the context history, trimming the oldest entries past
     * the window size.
     */
    void addToContext(String contextId, ContextEntry entry) throws ContextNotFoundException;

    Optional<ReasoningContext> getContext(String contextId);

    void registerAgentType(String agentType, Collection<String> capabilities);

    /**
     * Unified entry point: a completed result, or a stream when
     * {@link InferenceRequest#isStream()} is set.
     */
    InferenceOutcome processInference(InferenceRequest request) throws ContextNotFoundException;

    InferenceResult infer(InferenceRequest request) throws ContextNotFoundException;

    InferenceStream stream(InferenceRequest request) throws ContextNotFoundException;

    EngineMetrics getMetrics();

    /**
     * Releases engine state on shutdown. Contexts are discarded, not drained.
     */
    void cleanup();
}
