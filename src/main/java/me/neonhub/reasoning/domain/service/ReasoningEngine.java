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

import me.neonhub.reasoning.cache.ContextCache;
import me.neonhub.reasoning.domain.exception.ContextNotFoundException;
import me.neonhub.reasoning.domain.model.ContextEntry;
import me.neonhub.reasoning.domain.model.ContextPriority;
import me.neonhub.reasoning.domain.model.EngineMetrics;
import me.neonhub.reasoning.domain.model.InferenceOutcome;
import me.neonhub.reasoning.domain.model.InferenceRequest;
import me.neonhub.reasoning.domain.model.InferenceResult;
import me.neonhub.reasoning.domain.model.InferenceStream;
import me.neonhub.reasoning.domain.model.ModelChunk;
import me.neonhub.reasoning.domain.model.ModelRequest;
import me.neonhub.reasoning.domain.model.ModelResponse;
import me.neonhub.reasoning.domain.model.ReasoningContext;
import me.neonhub.reasoning.domain.model.TokenUsage;
import me.neonhub.reasoning.infrastructure.config.ReasoningProperties;
import me.neonhub.reasoning.port.inbound.ReasoningPort;
import me.neonhub.reasoning.port.outbound.ModelPort;
import me.neonhub.reasoning.routing.AgentRouter;
import me.neonhub.reasoning.routing.RoutingPolicy;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Orchestrates inference over cached reasoning contexts.
 *
 * <p>
 * Owns one {@link ContextCache} and one {@link AgentRouter}. An inference
 * resolves its context, picks an agent, assembles the prompt from the
 * context's retained history and calls the {@link ModelPort}, either
 * synchronously or as a pull-based stream. Every finished execution feeds its
 * latency and outcome into the router's agent profile and the engine metrics,
 * and a successful one appends its output to the context history.
 *
 * <p>
 * Agent resolution order:
 * <ol>
 * <li>the request's explicit {@code agentType}
 * <li>the best registered agent for the request's {@code capability}
 * <li>{@code reasoning.routing.default-agent}, when registered
 * <li>no agent (generic path)
 * </ol>
 */
@Service
@Slf4j
public class ReasoningEngine implements ReasoningPort {

    private static final String LOG_PREFIX = "[Engine]";
    private static final String CONTEXT_ID_PREFIX = "ctx_";
    private static final String ENTRY_ID_PREFIX = "entry_";
    private static final String INFERENCE_ID_PREFIX = "inf_";

    private final ReasoningProperties properties;
    private final ModelPort modelPort;
    private final Clock clock;
    private final ContextCache cache;
    private final AgentRouter router;
    private final PromptAssembler promptAssembler = new PromptAssembler();
    private final InferenceMetrics metrics = new InferenceMetrics();

    public ReasoningEngine(ReasoningProperties properties, ModelPort modelPort, Clock clock) {
        this.properties = properties;
        this.modelPort = modelPort;
        this.clock = clock;
        this.cache = new ContextCache(properties.getCache().getMaxSize(), clock);
        this.router = new AgentRouter(toPolicy(properties.getRouting()));
    }

    private static RoutingPolicy toPolicy(ReasoningProperties.RoutingProperties routing) {
        return RoutingPolicy.builder()
                .smoothingFactor(routing.getSmoothingFactor())
                .successWeight(routing.getSuccessWeight())
                .latencyWeight(routing.getLatencyWeight())
                .urgentSuccessWeight(routing.getUrgentSuccessWeight())
                .urgentLatencyWeight(routing.getUrgentLatencyWeight())
                .latencyScaleMs(routing.getLatencyScaleMs())
                .build();
    }

    @PostConstruct
    public void registerConfiguredAgents() {
        Map<String, ReasoningProperties.AgentProperties> agents = properties.getAgents();
        for (Map.Entry<String, ReasoningProperties.AgentProperties> entry : agents.entrySet()) {
            router.registerAgent(entry.getKey(), entry.getValue().getCapabilities());
        }
        if (!agents.isEmpty()) {
            log.info("{} Registered {} configured agents", LOG_PREFIX, agents.size());
        }
    }

    // ==================== Context lifecycle ====================

    @Override
    public ReasoningContext createContext(String sessionId, String userId, String campaignId) {
        Objects.requireNonNull(sessionId, "sessionId");
        Instant now = clock.instant();
        ReasoningContext context = ReasoningContext.builder()
                .id(CONTEXT_ID_PREFIX + UUID.randomUUID())
                .sessionId(sessionId)
                .userId(userId)
                .campaignId(campaignId)
                .createdAt(now)
                .lastAccessed(now)
                .build();
        cache.set(context);
        log.debug("{} Created context {} for session {}", LOG_PREFIX, context.getId(), sessionId);
        return context;
    }

    @Override
    public void addToContext(String contextId, ContextEntry entry) throws ContextNotFoundException {
        Objects.requireNonNull(entry, "entry");
        ReasoningContext context = requireContext(contextId);
        append(context, entry);
    }

    @Override
    public Optional<ReasoningContext> getContext(String contextId) {
        return cache.get(contextId);
    }

    @Override
    public void registerAgentType(String agentType, Collection<String> capabilities) {
        router.registerAgent(agentType, capabilities);
    }

    private ReasoningContext requireContext(String contextId) throws ContextNotFoundException {
        return cache.get(contextId).orElseThrow(() -> new ContextNotFoundException(contextId));
    }

    private void append(ReasoningContext context, ContextEntry entry) {
        ContextEntry stamped = entry.toBuilder()
                .id(entry.getId() != null ? entry.getId() : ENTRY_ID_PREFIX + UUID.randomUUID())
                .tokens(entry.getTokens() != null ? entry.getTokens() : TokenEstimator.estimate(entry.getContent()))
                .timestamp(clock.instant())
                .build();
        int trimmed = context.append(stamped, properties.getContext().getWindowSize());
        if (trimmed > 0) {
            log.trace("{} Trimmed {} entries from context {}", LOG_PREFIX, trimmed, context.getId());
        }
    }

    // ==================== Inference ====================

    @Override
    public InferenceOutcome processInference(InferenceRequest request) throws ContextNotFoundException {
        Objects.requireNonNull(request, "request");
        if (request.isStream()) {
            return InferenceOutcome.streaming(stream(request));
        }
        return InferenceOutcome.completed(infer(request));
    }

    @Override
    public InferenceResult infer(InferenceRequest request) throws ContextNotFoundException {
        Objects.requireNonNull(request, "request");
        ReasoningContext context = requireContext(request.getContextId());
        String agentType = resolveAgent(request, context);
        ModelRequest modelRequest = promptAssembler.assemble(context, request, agentType);

        metrics.begin();
        if (agentType != null) {
            router.acquire(agentType);
        }
        long startMillis = clock.millis();
        ModelResponse response;
        try {
            response = modelPort.generate(modelRequest).join();
        } catch (RuntimeException | Error e) {
            long elapsed = clock.millis() - startMillis;
            recordOutcome(agentType, elapsed, false);
            RuntimeException failure = ExecutionFailures.unwrap(e);
            log.warn("{} Inference failed for context {} (agent {}) after {}ms: {}",
                    LOG_PREFIX, context.getId(), agentType, elapsed, failure.getMessage());
            throw failure;
        } finally {
            metrics.end();
            if (agentType != null) {
                router.release(agentType);
            }
        }

        long elapsed = clock.millis() - startMillis;
        String content = response != null && response.getContent() != null ? response.getContent() : "";
        TokenUsage usage = response != null ? response.getUsage() : null;
        appendOutput(context, agentType, content, usage);
        recordOutcome(agentType, elapsed, true);

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("provider", modelPort.getProviderId());
        if (response != null && response.getModel() != null) {
            metadata.put("model", response.getModel());
        }
        if (response != null && response.getFinishReason() != null) {
            metadata.put("finishReason", response.getFinishReason());
        }

        log.debug("{} Inference for context {} via {} took {}ms", LOG_PREFIX, context.getId(),
                agentType != null ? agentType : "generic path", elapsed);
        return InferenceResult.builder()
                .id(INFERENCE_ID_PREFIX + UUID.randomUUID())
                .contextId(context.getId())
                .content(content)
                .agentId(agentType)
                .tokensUsed(tokensUsed(modelRequest, content, usage))
                .responseTimeMs(elapsed)
                .cached(false)
                .confidence(response != null ? response.getConfidence() : null)
                .metadata(metadata)
                .build();
    }

    @Override
    public InferenceStream stream(InferenceRequest request) throws ContextNotFoundException {
        Objects.requireNonNull(request, "request");
        ReasoningContext context = requireContext(request.getContextId());
        String agentType = resolveAgent(request, context);
        ModelRequest modelRequest = promptAssembler.assemble(context, request, agentType);

        metrics.recordStreamingRequest();
        log.debug("{} Streaming inference for context {} via {}", LOG_PREFIX, context.getId(),
                agentType != null ? agentType : "generic path");
        Flux<ModelChunk> chunks;
        try {
            chunks = modelPort.generateStream(modelRequest);
        } catch (RuntimeException | Error e) {
            recordOutcome(agentType, 0, false);
            RuntimeException failure = ExecutionFailures.unwrap(e);
            log.warn("{} Stream could not be opened for context {} (agent {}): {}",
                    LOG_PREFIX, context.getId(), agentType, failure.getMessage());
            throw failure;
        }
        return new FluxInferenceStream(context.getId(), agentType, chunks, new StreamAccounting(context, agentType));
    }

    String resolveAgent(InferenceRequest request, ReasoningContext context) {
        if (request.getAgentType() != null && !request.getAgentType().isBlank()) {
            return request.getAgentType();
        }

        ContextPriority priority = request.getPriority() != null ? request.getPriority() : context.getPriority();
        if (request.getCapability() != null) {
            Optional<String> best = router.findBestAgent(request.getCapability(), priority);
            if (best.isPresent()) {
                return best.get();
            }
        }

        String defaultAgent = properties.getRouting().getDefaultAgent();
        if (defaultAgent != null && router.isRegistered(defaultAgent)) {
            return defaultAgent;
        }
        return null;
    }

    private void appendOutput(ReasoningContext context, String agentType, String content, TokenUsage usage) {
        ContextEntry output = ContextEntry.builder()
                .type(ContextEntry.TYPE_AGENT_OUTPUT)
                .content(content)
                .agentId(agentType)
                .tokens(usage != null && usage.getOutputTokens() > 0
                        ? usage.getOutputTokens()
                        : TokenEstimator.estimate(content))
                .build();
        // Appended to the held instance: an evicted context is not put back.
        append(context, output);
    }

    private void recordOutcome(String agentType, long elapsedMs, boolean success) {
        if (agentType != null) {
            router.updateAgentMetrics(agentType, elapsedMs, success);
        }
        metrics.recordCompletion(elapsedMs, success);
    }

    private int tokensUsed(ModelRequest modelRequest, String content, TokenUsage usage) {
        if (usage != null && usage.getTotalTokens() > 0) {
            return usage.getTotalTokens();
        }
        int promptTokens = 0;
        for (ModelRequest.Message message : modelRequest.getMessages()) {
            promptTokens += TokenEstimator.estimate(message.content());
        }
        return promptTokens + TokenEstimator.estimate(content);
    }

    // ==================== Metrics & lifecycle ====================

    @Override
    public EngineMetrics getMetrics() {
        return EngineMetrics.builder()
                .totalInferences(metrics.totalInferences())
                .failedInferences(metrics.failedInferences())
                .streamingRequests(metrics.streamingRequests())
                .avgResponseTime(metrics.avgResponseTime())
                .activeInferences(metrics.activeInferences())
                .cache(cache.metrics())
                .agents(router.getRouteStats())
                .build();
    }

    @Override
    @PreDestroy
    public void cleanup() {
        int contexts = cache.size();
        cache.clear();
        router.clear();
        log.info("{} Cleaned up {} contexts and all agent registrations", LOG_PREFIX, contexts);
    }

    /**
     * Accounts for one streaming execution once its consumer starts pulling.
     */
    private final class StreamAccounting implements FluxInferenceStream.Lifecycle {

        private final ReasoningContext context;
        private final String agentType;
        private long startMillis;

        private StreamAccounting(ReasoningContext context, String agentType) {
            this.context = context;
            this.agentType = agentType;
        }

        @Override
        public void onStart() {
            metrics.begin();
            if (agentType != null) {
                router.acquire(agentType);
            }
            startMillis = clock.millis();
        }

        @Override
        public void onComplete(String content, TokenUsage usage) {
            long elapsed = clock.millis() - startMillis;
            finish();
            appendOutput(context, agentType, content, usage);
            recordOutcome(agentType, elapsed, true);
            log.debug("{} Stream for context {} completed in {}ms", LOG_PREFIX, context.getId(), elapsed);
        }

        @Override
        public void onFailure(Throwable error) {
            long elapsed = clock.millis() - startMillis;
            finish();
            recordOutcome(agentType, elapsed, false);
            log.warn("{} Stream failed for context {} (agent {}) after {}ms: {}",
                    LOG_PREFIX, context.getId(), agentType, elapsed, error.getMessage());
        }

        @Override
        public void onCancel() {
            finish();
        }

        private void finish() {
            metrics.end();
            if (agentType != null) {
                router.release(agentType);
            }
        }
    }
}
