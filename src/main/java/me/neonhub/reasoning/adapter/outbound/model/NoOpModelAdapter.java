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
import me.neonhub.reasoning.domain.model.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Placeholder model adapter used when no provider is configured.
 *
 * <p>
 * Answers every request with a deterministic echo of the prompt, without
 * calling any external API. The streaming variant emits the same text split on
 * word boundaries, so concatenating the stream yields exactly the synchronous
 * answer.
 *
 * <p>
 * Provider ID: {@code "none"}
 */
@Component
@Slf4j
public class NoOpModelAdapter implements ModelProviderAdapter {

    static final String RESPONSE_PREFIX = "AI response for: ";
    private static final int CHARS_PER_TOKEN = 4;

    @Override
    public String getProviderId() {
        return "none";
    }

    @Override
    public CompletableFuture<ModelResponse> generate(ModelRequest request) {
        log.debug("NoOpModelAdapter: generate() called - no model provider configured");
        String content = render(request);
        return CompletableFuture.completedFuture(ModelResponse.builder()
                .content(content)
                .model("none")
                .finishReason("stop")
                .usage(usageFor(request, content))
                .build());
    }

    @Override
    public Flux<ModelChunk> generateStream(ModelRequest request) {
        return Flux.defer(() -> {
            String content = render(request);
            List<ModelChunk> chunks = new ArrayList<>();
            for (String fragment : splitKeepingSpaces(content)) {
                chunks.add(ModelChunk.builder().text(fragment).build());
            }
            chunks.add(ModelChunk.builder()
                    .done(true)
                    .usage(usageFor(request, content))
                    .build());
            return Flux.fromIterable(chunks);
        });
    }

    @Override
    public boolean supportsStreaming() {
        return true;
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    private String render(ModelRequest request) {
        String prompt = request.getPrompt();
        return RESPONSE_PREFIX + (prompt != null ? prompt : "");
    }

    private TokenUsage usageFor(ModelRequest request, String content) {
        int input = 0;
        if (request.getMessages() != null) {
            for (ModelRequest.Message message : request.getMessages()) {
                input += message.content() != null ? message.content().length() / CHARS_PER_TOKEN : 0;
            }
        }
        return TokenUsage.of(input, content.length() / CHARS_PER_TOKEN);
    }

    private List<String> splitKeepingSpaces(String text) {
        List<String> parts = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == ' ') {
                parts.add(text.substring(start, i + 1));
                start = i + 1;
            }
        }
        if (start < text.length()) {
            parts.add(text.substring(start));
        }
        return parts;
    }
}
