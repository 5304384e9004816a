package me.neonhub.reasoning.adapter.outbound.model;

import me.neonhub.reasoning.domain.model.ModelChunk;
import me.neonhub.reasoning.domain.model.ModelRequest;
import me.neonhub.reasoning.domain.model.ModelResponse;
import me.neonhub.reasoning.infrastructure.config.ReasoningProperties;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.output.FinishReason;
import dev.langchain4j.model.output.TokenUsage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class Langchain4jModelAdapterTest {

    private static final String OPENAI = "openai";
    private static final String ANTHROPIC = "anthropic";

    private ReasoningProperties properties;
    private ChatModel chatModel;
    private StreamingChatModel streamingChatModel;
    private Langchain4jModelAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new ReasoningProperties();
        chatModel = mock(ChatModel.class);
        streamingChatModel = mock(StreamingChatModel.class);

        adapter = new Langchain4jModelAdapter(properties) {
            @Override
            protected ChatModel createChatModel(String model) {
                return chatModel;
            }

            @Override
            protected StreamingChatModel createStreamingChatModel(String model) {
                return streamingChatModel;
            }
        };
    }

    private static ModelRequest request() {
        return ModelRequest.builder()
                .contextId("ctx_1")
                .systemPrompt("You are the content agent.")
                .messages(List.of(
                        new ModelRequest.Message(ModelRequest.ROLE_SYSTEM, "Campaign: spring"),
                        new ModelRequest.Message(ModelRequest.ROLE_USER, "Draft a tweet"),
                        new ModelRequest.Message(ModelRequest.ROLE_ASSISTANT, "Spring is here"),
                        new ModelRequest.Message(ModelRequest.ROLE_USER, "Shorter")))
                .temperature(0.3)
                .maxTokens(128)
                .build();
    }

    private static ChatResponse chatResponse(String text) {
        return ChatResponse.builder()
                .aiMessage(AiMessage.from(text))
                .tokenUsage(new TokenUsage(12, 4))
                .finishReason(FinishReason.STOP)
                .build();
    }

    private void configureProvider(String provider, String apiKey) {
        ReasoningProperties.ProviderProperties config = new ReasoningProperties.ProviderProperties();
        config.setApiKey(apiKey);
        properties.getModel().getLangchain4j().getProviders().put(provider, config);
    }

    // ===== Identity and availability =====

    @Test
    void shouldReturnLangchain4jProviderId() {
        assertEquals("langchain4j", adapter.getProviderId());
        assertTrue(adapter.supportsStreaming());
    }

    @Test
    void shouldBeAvailableOnlyWithApiKey() {
        assertFalse(adapter.isAvailable());

        configureProvider(OPENAI, " ");
        assertFalse(adapter.isAvailable());

        configureProvider(ANTHROPIC, "sk-ant-test");
        assertTrue(adapter.isAvailable());
    }

    @Test
    void shouldSplitProviderPrefix() {
        assertEquals(ANTHROPIC, Langchain4jModelAdapter.providerOf("anthropic/claude-3-5-haiku-latest"));
        assertEquals("claude-3-5-haiku-latest",
                Langchain4jModelAdapter.stripProviderPrefix("anthropic/claude-3-5-haiku-latest"));
        assertEquals(OPENAI, Langchain4jModelAdapter.providerOf("gpt-4o-mini"));
        assertEquals("gpt-4o-mini", Langchain4jModelAdapter.stripProviderPrefix("gpt-4o-mini"));
    }

    @Test
    void shouldTrackConfiguredModelAfterInit() {
        assertNull(adapter.getCurrentModel());

        adapter.initialize();

        assertEquals("openai/gpt-4o-mini", adapter.getCurrentModel());
    }

    // ===== generate =====

    @Test
    void shouldConvertMessagesAndResponse() {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(chatResponse("Spring!"));

        ModelResponse response = adapter.generate(request()).join();

        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(chatModel).chat(captor.capture());
        List<ChatMessage> messages = captor.getValue().messages();
        assertEquals(5, messages.size());
        assertInstanceOf(SystemMessage.class, messages.get(0));
        assertInstanceOf(SystemMessage.class, messages.get(1));
        assertInstanceOf(UserMessage.class, messages.get(2));
        assertInstanceOf(AiMessage.class, messages.get(3));
        assertEquals("Shorter", ((UserMessage) messages.get(4)).singleText());
        assertEquals(0.3, captor.getValue().temperature());
        assertEquals(128, captor.getValue().maxOutputTokens());

        assertEquals("Spring!", response.getContent());
        assertEquals("STOP", response.getFinishReason());
        assertEquals(12, response.getUsage().getInputTokens());
        assertEquals(4, response.getUsage().getOutputTokens());
        assertEquals(16, response.getUsage().getTotalTokens());
    }

    @Test
    void shouldPropagateModelFailure() {
        when(chatModel.chat(any(ChatRequest.class))).thenThrow(new IllegalStateException("rate limited"));

        CompletionException error = assertThrows(CompletionException.class,
                () -> adapter.generate(request()).join());

        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertEquals("rate limited", error.getCause().getMessage());
    }

    @Test
    void shouldFailWhenProviderNotConfigured() {
        Langchain4jModelAdapter unconfigured = new Langchain4jModelAdapter(properties);

        CompletionException error = assertThrows(CompletionException.class,
                () -> unconfigured.generate(request()).join());

        assertInstanceOf(IllegalStateException.class, error.getCause());
    }

    // ===== generateStream =====

    @Test
    void shouldStreamPartialResponsesThenUsage() {
        doAnswer(invocation -> {
            StreamingChatResponseHandler handler = invocation.getArgument(1);
            handler.onPartialResponse("Spr");
            handler.onPartialResponse("");
            handler.onPartialResponse("ing!");
            handler.onCompleteResponse(chatResponse("Spring!"));
            return null;
        }).when(streamingChatModel).chat(any(ChatRequest.class), any(StreamingChatResponseHandler.class));

        StepVerifier.create(adapter.generateStream(request()))
                .expectNextMatches(chunk -> "Spr".equals(chunk.getText()))
                .expectNextMatches(chunk -> "ing!".equals(chunk.getText()))
                .expectNextMatches(chunk -> chunk.isDone() && chunk.getUsage().getTotalTokens() == 16)
                .verifyComplete();
    }

    @Test
    void shouldSignalStreamingError() {
        doAnswer(invocation -> {
            StreamingChatResponseHandler handler = invocation.getArgument(1);
            handler.onPartialResponse("Spr");
            handler.onError(new IllegalStateException("connection reset"));
            return null;
        }).when(streamingChatModel).chat(any(ChatRequest.class), any(StreamingChatResponseHandler.class));

        StepVerifier.create(adapter.generateStream(request()))
                .expectNextMatches(ModelChunk::hasText)
                .expectErrorMatches(e -> e instanceof IllegalStateException
                        && "connection reset".equals(e.getMessage()))
                .verify();
    }

    // ===== model construction =====

    @Test
    void shouldBuildOpenAiModelForUnprefixedName() {
        configureProvider(OPENAI, "sk-test");
        Langchain4jModelAdapter real = new Langchain4jModelAdapter(properties);

        assertInstanceOf(OpenAiChatModel.class, real.createChatModel("gpt-4o-mini"));
    }

    @Test
    void shouldBuildAnthropicModelForAnthropicPrefix() {
        configureProvider(ANTHROPIC, "sk-ant-test");
        Langchain4jModelAdapter real = new Langchain4jModelAdapter(properties);

        assertInstanceOf(AnthropicChatModel.class, real.createChatModel("anthropic/claude-3-5-haiku-latest"));
    }

    @Test
    void shouldRejectUnconfiguredProvider() {
        Langchain4jModelAdapter real = new Langchain4jModelAdapter(properties);

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> real.createChatModel("anthropic/claude-3-5-haiku-latest"));
        assertTrue(error.getMessage().contains("reasoning.model.langchain4j.providers.anthropic"));
    }
}
