package me.neonhub.reasoning.adapter.outbound.model;

import me.neonhub.reasoning.domain.model.ModelChunk;
import me.neonhub.reasoning.domain.model.ModelRequest;
import me.neonhub.reasoning.domain.model.ModelResponse;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class NoOpModelAdapterTest {

    private final NoOpModelAdapter adapter = new NoOpModelAdapter();

    private static ModelRequest request(String prompt) {
        return ModelRequest.builder()
                .contextId("ctx_1")
                .messages(List.of(
                        new ModelRequest.Message(ModelRequest.ROLE_USER, "earlier question"),
                        new ModelRequest.Message(ModelRequest.ROLE_USER, prompt)))
                .build();
    }

    @Test
    void shouldReturnNoneProviderId() {
        assertEquals("none", adapter.getProviderId());
    }

    @Test
    void shouldNotBeAvailableButSupportStreaming() {
        assertFalse(adapter.isAvailable());
        assertTrue(adapter.supportsStreaming());
    }

    @Test
    void shouldEchoLastPrompt() {
        ModelResponse response = adapter.generate(request("plan a launch")).join();

        assertEquals("AI response for: plan a launch", response.getContent());
        assertEquals("none", response.getModel());
        assertEquals("stop", response.getFinishReason());
        assertNotNull(response.getUsage());
        assertEquals(response.getUsage().getInputTokens() + response.getUsage().getOutputTokens(),
                response.getUsage().getTotalTokens());
    }

    @Test
    void shouldHandleEmptyRequest() {
        ModelResponse response = adapter.generate(ModelRequest.builder().build()).join();

        assertEquals("AI response for: ", response.getContent());
    }

    @Test
    void streamShouldConcatenateToSynchronousContent() {
        ModelRequest request = request("write three taglines for a bakery");
        String expected = adapter.generate(request).join().getContent();

        List<ModelChunk> chunks = adapter.generateStream(request).collectList().block();

        assertNotNull(chunks);
        assertTrue(chunks.get(chunks.size() - 1).isDone());
        assertNotNull(chunks.get(chunks.size() - 1).getUsage());
        String streamed = chunks.stream()
                .filter(ModelChunk::hasText)
                .map(ModelChunk::getText)
                .collect(Collectors.joining());
        assertEquals(expected, streamed);
    }

    @Test
    void streamShouldEmitOneChunkPerWord() {
        StepVerifier.create(adapter.generateStream(request("hi there")))
                .expectNextMatches(chunk -> "AI ".equals(chunk.getText()))
                .expectNextMatches(chunk -> "response ".equals(chunk.getText()))
                .expectNextMatches(chunk -> "for: ".equals(chunk.getText()))
                .expectNextMatches(chunk -> "hi ".equals(chunk.getText()))
                .expectNextMatches(chunk -> "there".equals(chunk.getText()))
                .expectNextMatches(ModelChunk::isDone)
                .verifyComplete();
    }
}
