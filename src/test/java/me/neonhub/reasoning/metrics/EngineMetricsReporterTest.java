package me.neonhub.reasoning.metrics;

import me.neonhub.reasoning.domain.model.AgentRouteStats;
import me.neonhub.reasoning.domain.model.CacheMetrics;
import me.neonhub.reasoning.domain.model.EngineMetrics;
import me.neonhub.reasoning.infrastructure.config.ReasoningAutoConfiguration;
import me.neonhub.reasoning.infrastructure.config.ReasoningProperties;
import me.neonhub.reasoning.port.inbound.ReasoningPort;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class EngineMetricsReporterTest {

    private ReasoningPort reasoningPort;
    private ObjectMapper objectMapper;
    private ReasoningProperties properties;
    private EngineMetricsReporter reporter;

    @BeforeEach
    void setUp() {
        reasoningPort = mock(ReasoningPort.class);
        objectMapper = ReasoningAutoConfiguration.objectMapper();
        properties = new ReasoningProperties();
        reporter = new EngineMetricsReporter(reasoningPort, objectMapper, properties);
    }

    @AfterEach
    void tearDown() {
        reporter.stop();
    }

    private static EngineMetrics sampleMetrics() {
        return EngineMetrics.builder()
                .totalInferences(12)
                .failedInferences(2)
                .streamingRequests(3)
                .avgResponseTime(245.5)
                .activeInferences(1)
                .cache(CacheMetrics.builder().hits(8).misses(2).hitRate(0.8).size(4).capacity(1000).build())
                .agents(List.of(AgentRouteStats.builder()
                        .agentType("content")
                        .capabilities(Set.of("generate_content"))
                        .avgResponseTime(120.0)
                        .successRate(0.9)
                        .build()))
                .build();
    }

    @Test
    void shouldNotScheduleWhenIntervalIsZero() {
        reporter.start();

        assertFalse(reporter.isScheduled());
    }

    @Test
    void shouldScheduleWhenIntervalIsPositive() {
        properties.getMetrics().setReportInterval(Duration.ofMinutes(1));

        reporter.start();

        assertTrue(reporter.isScheduled());
        reporter.stop();
        assertFalse(reporter.isScheduled());
    }

    @Test
    void shouldRenderMetricsAsJson() throws Exception {
        JsonNode json = objectMapper.readTree(reporter.render(sampleMetrics()));

        assertEquals(12, json.get("totalInferences").asLong());
        assertEquals(2, json.get("failedInferences").asLong());
        assertEquals(0.8, json.get("cache").get("hitRate").asDouble(), 1e-9);
        assertEquals("content", json.get("agents").get(0).get("agentType").asText());
    }

    @Test
    void shouldReadMetricsOnReport() {
        when(reasoningPort.getMetrics()).thenReturn(sampleMetrics());

        reporter.report();

        verify(reasoningPort).getMetrics();
    }

    @Test
    void shouldSwallowReportFailures() {
        when(reasoningPort.getMetrics()).thenThrow(new IllegalStateException("engine stopped"));

        assertDoesNotThrow(reporter::report);
    }
}
