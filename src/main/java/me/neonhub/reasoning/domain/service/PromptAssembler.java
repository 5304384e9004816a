package me.neonhub.reasoning.domain.service;

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

import me.neonhub.reasoning.domain.model.ContextEntry;
import me.neonhub.reasoning.domain.model.InferenceRequest;
import me.neonhub.reasoning.domain.model.ModelRequest;
import me.neonhub.reasoning.domain.model.ReasoningContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a context's retained history plus the caller's prompt into a
 * {@link ModelRequest}.
 *
 * <p>
 * History entries become chat messages in history order, mapped by entry
 * type:
 * <ul>
 * <li>{@code agent_output}, {@code tool_call} - assistant
 * <li>{@code system_event}, {@code system_message} - system
 * <li>anything else - user
 * </ul>
 * Entries without content are skipped. The prompt is always the last message.
 */
public class PromptAssembler {

    public ModelRequest assemble(ReasoningContext context, InferenceRequest request, String agentType) {
        List<ModelRequest.Message> messages = new ArrayList<>();
        for (ContextEntry entry : context.historySnapshot()) {
            if (entry.getContent() == null || entry.getContent().isBlank()) {
                continue;
            }
            messages.add(new ModelRequest.Message(roleOf(entry.getType()), entry.getContent()));
        }
        messages.add(new ModelRequest.Message(ModelRequest.ROLE_USER,
                request.getPrompt() != null ? request.getPrompt() : ""));

        return ModelRequest.builder()
                .contextId(context.getId())
                .agentType(agentType)
                .systemPrompt(agentType != null ? "You are the " + agentType + " agent." : null)
                .messages(messages)
                .temperature(request.getTemperature())
                .maxTokens(request.getMaxTokens())
                .build();
    }

    static String roleOf(String entryType) {
        if (entryType == null) {
            return ModelRequest.ROLE_USER;
        }
        return switch (entryType) {
        case ContextEntry.TYPE_AGENT_OUTPUT, ContextEntry.TYPE_TOOL_CALL -> ModelRequest.ROLE_ASSISTANT;
        case ContextEntry.TYPE_SYSTEM_EVENT, ContextEntry.TYPE_SYSTEM_MESSAGE -> ModelRequest.ROLE_SYSTEM;
        default -> ModelRequest.ROLE_USER;
        };
    }
}
