package me.neonhub.reasoning.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * Input to {@code processInference}. Either {@code agentType} pins the agent
 * directly, or {@code capability} lets the router pick one.
 */
@Data
@Builder(toBuilder = true)
public class InferenceRequest {

    private String contextId;
    private String prompt;

    /**
     * Explicit agent; skips routing when set.
     */
    private String agentType;

    /**
     * Capability tag used for routing when no agent is pinned.
     */
    private String capability;

    @Builder.Default
    private boolean stream = false;

    private Double temperature;
    private Integer maxTokens;

    /**
     * Overrides the context priority for this request's routing decision.
     */
    private ContextPriority priority;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();
}
