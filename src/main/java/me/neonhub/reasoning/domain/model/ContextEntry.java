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

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * One turn or event within a {@link ReasoningContext}. The {@code type} is an
 * open tag; the constants below cover the values the engine itself writes.
 */
@Data
@Builder(toBuilder = true)
public class ContextEntry {

    public static final String TYPE_USER_INPUT = "user_input";
    public static final String TYPE_AGENT_OUTPUT = "agent_output";
    public static final String TYPE_SYSTEM_EVENT = "system_event";
    public static final String TYPE_SYSTEM_MESSAGE = "system_message";
    public static final String TYPE_TOOL_CALL = "tool_call";
    public static final String TYPE_TOOL_RESULT = "tool_result";

    private String id;
    private String type;
    private String content;

    /**
     * Agent that produced this entry, if any.
     */
    private String agentId;

    /**
     * Token cost estimate. Filled in by the engine when the caller leaves it
     * null.
     */
    private Integer tokens;

    private Instant timestamp;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    public static ContextEntry of(String type, String content) {
        return ContextEntry.builder()
                .type(type)
                .content(content)
                .build();
    }

    public int tokensOrZero() {
        return tokens != null ? tokens : 0;
    }
}
