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
import me.neonhub.reasoning.infrastructure.config.ReasoningProperties;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.anthropic.AnthropicStreamingChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiStreamingChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Model adapter using the langchain4j library.
 *
 * <p>
 * Supports:
 * <ul>
 * <li>OpenAI and any OpenAI-compatible endpoint (via {@code base-url})
 * <li>Anthropic (Claude models)
 * </ul>
 *
 * <p>
 * The configured model name carries its provider as a prefix, e.g.
 * {@code openai/gpt-4o-mini} or {@code anthropic/claude-3-5-haiku-latest}.
 * Names without a prefix are treated as OpenAI models.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 *
 * <p>
 * Configuration via {@code reasoning.model.langchain4j.*}.
 *
 * @see ModelProviderAdapter
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jModelAdapter implements ModelProviderAdapter {

    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String PROVIDER_OPENAI = "openai";

    private final ReasoningProperties properties;

    private ChatModel chatModel;
    private StreamingChatModel streamingChatModel;
    private String currentModel;
    private volatile boolean initialized = false;

    @Override
    public synchronized void initialize() {
        if (initialized)
            return;

        String model = settings().getModel();
        this.currentModel = model;

        try {
            this.chatModel = createChatModel(model);
            this.streamingChatModel = createStreamingChatModel(model);
            initialized = true;
            log.info("Langchain4j adapter initialized with model: {}", model);
        } catch (Exception e) {
            log.warn("Failed to initialize Langchain4j adapter: {}", e.getMessage());
        }
    }

    private void ensureInitialized() {
        if (!initialized) {
            initialize();
        }
    }

    private ReasoningProperties.Langchain4jProperties settings() {
        return properties.getModel().getLangchain4j();
    }

    private ReasoningProperties.ProviderProperties getProviderConfig(String providerName) {
        ReasoningProperties.ProviderProperties config = settings().getProviders().get(providerName);
        if (config == null) {
            throw new IllegalStateException("Provider not configured: " + providerName
                    + ". Add reasoning.model.langchain4j.providers." + providerName + ".api-key");
        }
        return config;
    }

    static String providerOf(String model) {
        return model.contains("/") ? model.substring(0, model.indexOf('/')) : PROVIDER_OPENAI;
    }

    static String stripProviderPrefix(String model) {
        return model.contains("/") ? model.substring(model.indexOf('/') + 1) : model;
    }

    /**
     * Create the blocking chat model for the configured provider.
     */
    protected ChatModel createChatModel(String model) {
        String provider = providerOf(model);
        ReasoningProperties.ProviderProperties config = getProviderConfig(provider);
        String modelName = stripProviderPrefix(model);
        Duration timeout = Duration.ofMillis(settings().getTimeoutMs());

        if (PROVIDER_ANTHROPIC.equals(provider)) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(modelName)
                    .maxRetries(0)
                    .maxTokens(settings().getMaxTokens())
                    .temperature(settings().getTemperature())
                    .timeout(timeout);
            if (config.getBaseUrl() != null) {
                builder.baseUrl(config.getBaseUrl());
            }
            return builder.build();
        }

        // Everything else speaks the OpenAI-compatible API
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .maxRetries(0)
                .temperature(settings().getTemperature())
                .timeout(timeout);
        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    /**
     * Create the streaming chat model for the configured provider.
     */
    protected StreamingChatModel createStreamingChatModel(String model) {
        String provider = providerOf(model);
        ReasoningProperties.ProviderProperties config = getProviderConfig(provider);
        String modelName = stripProviderPrefix(model);
        Duration timeout = Duration.ofMillis(settings().getTimeoutMs());

        if (PROVIDER_ANTHROPIC.equals(provider)) {
            var builder = AnthropicStreamingChatModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(modelName)
                    .maxTokens(settings().getMaxTokens())
                    .temperature(settings().getTemperature())
                    .timeout(timeout);
            if (config.getBaseUrl() != null) {
                builder.baseUrl(config.getBaseUrl());
            }
            return builder.build();
        }

        var builder = OpenAiStreamingChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(modelName)
                .temperature(settings().getTemperature())
                .timeout(timeout);
        if (config.getBaseUrl() != null) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public CompletableFuture<ModelResponse> generate(ModelRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();
            if (chatModel == null) {
                throw new IllegalStateException("Langchain4j adapter not available");
            }
            try {
                ChatResponse response = chatModel.chat(toChatRequest(request));
                return convertResponse(response);
            } catch (RuntimeException e) {
                log.error("Model call failed for context {}", request.getContextId(), e);
                throw e;
            }
        });
    }

    @Override
    public Flux<ModelChunk> generateStream(ModelRequest request) {
        return Flux.create(sink -> {
            ensureInitialized();
            if (streamingChatModel == null) {
                sink.error(new IllegalStateException("Langchain4j adapter not available"));
                return;
            }
            streamingChatModel.chat(toChatRequest(request), new StreamingChatResponseHandler() {
                @Override
                public void onPartialResponse(String partialResponse) {
                    if (partialResponse != null && !partialResponse.isEmpty()) {
                        sink.next(ModelChunk.builder().text(partialResponse).build());
                    }
                }

                @Override
                public void onCompleteResponse(ChatResponse completeResponse) {
                    sink.next(ModelChunk.builder()
                            .done(true)
                            .usage(convertUsage(completeResponse))
                            .build());
                    sink.complete();
                }

                @Override
                public void onError(Throwable error) {
                    log.error("Streaming model call failed for context {}", request.getContextId(), error);
                    sink.error(error);
                }
            });
        });
    }

    @Override
    public boolean supportsStreaming() {
        return true;
    }

    @Override
    public boolean isAvailable() {
        return settings().getProviders().values().stream()
                .anyMatch(p -> p.getApiKey() != null && !p.getApiKey().isBlank());
    }

    public String getCurrentModel() {
        return currentModel;
    }

    ChatRequest toChatRequest(ModelRequest request) {
        ChatRequest.Builder builder = ChatRequest.builder().messages(convertMessages(request));
        if (request.getTemperature() != null) {
            builder.temperature(request.getTemperature());
        }
        if (request.getMaxTokens() != null) {
            builder.maxOutputTokens(request.getMaxTokens());
        }
        return builder.build();
    }

    private List<ChatMessage> convertMessages(ModelRequest request) {
        List<ChatMessage> messages = new ArrayList<>();

        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }

        for (ModelRequest.Message msg : request.getMessages()) {
            String content = msg.content() != null ? msg.content() : "";
            switch (msg.role()) {
            case ModelRequest.ROLE_USER -> messages.add(UserMessage.from(content));
            case ModelRequest.ROLE_ASSISTANT -> messages.add(AiMessage.from(content));
            case ModelRequest.ROLE_SYSTEM -> messages.add(SystemMessage.from(content));
            default -> {
                log.warn("Unknown message role: {}, treating as user message", msg.role());
                messages.add(UserMessage.from(content));
            }
            }
        }

        return messages;
    }

    private ModelResponse convertResponse(ChatResponse response) {
        return ModelResponse.builder()
                .content(response.aiMessage().text())
                .usage(convertUsage(response))
                .model(currentModel)
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }

    private TokenUsage convertUsage(ChatResponse response) {
        if (response == null || response.tokenUsage() == null) {
            return null;
        }
        dev.langchain4j.model.output.TokenUsage usage = response.tokenUsage();
        int input = usage.inputTokenCount() != null ? usage.inputTokenCount() : 0;
        int output = usage.outputTokenCount() != null ? usage.outputTokenCount() : 0;
        return TokenUsage.of(input, output);
    }
}
