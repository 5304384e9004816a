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
 * Outcome of a synchronous inference. The engine keeps nothing of it beyond
 * the history entry and the metrics it folds in.
 */
@Data
@Builder
public class InferenceResult {

    private String id;
    private String contextId;
    private String content;

    /**
     * Agent the request was executed against, or null for the generic path.
     */
    private String agentId;

    private int tokensUsed;
    private long responseTimeMs;

    /**
     * Always false: only contexts are cached, not inference outputs.
     */
    @Builder.Default
    private boolean cached = false;

    private Double confidence;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();
}
