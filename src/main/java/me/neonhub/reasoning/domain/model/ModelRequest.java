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

import java.util.ArrayList;
import java.util.List;

/**
 * Assembled prompt handed to the model collaborator: the context history as
 * role-tagged messages followed by the new user prompt.
 */
@Data
@Builder
public class ModelRequest {

    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    private String contextId;
    private String agentType;
    private String systemPrompt;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    private Double temperature;
    private Integer maxTokens;

    /**
     * The caller's prompt, always the last user message.
     */
    public String getPrompt() {
        if (messages == null || messages.isEmpty()) {
            return null;
        }
        return messages.get(messages.size() - 1).content();
    }

    public record Message(String role, String content) {
    }
}
