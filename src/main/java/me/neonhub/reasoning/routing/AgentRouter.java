package me.neonhub.reasoning.routing;

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

import me.neonhub.reasoning.domain.model.AgentRouteStats;
import me.neonhub.reasoning.domain.model.ContextPriority;
import me.neonhub.reasoning.domain.model.ReasoningContext;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Capability registry and agent selector.
 *
 * <p>
 * Agents declare the capability tags they serve. The router keeps an index from
 * capability tag to the agents registered for it (in lexical order) and, for a
 * routing request, scores each candidate from its rolling profile:
 * <ul>
 * <li>EWMA success rate (higher is better)</li>
 * <li>EWMA response time (lower is better)</li>
 * <li>context priority, which shifts weight toward success rate</li>
 * </ul>
 * Ties go to the more specialized agent (fewer capabilities), then to the
 * lexically smaller agent type, so identical inputs always produce the same
 * decision.
 *
 * <p>
 * An unmatched capability is not an error: {@link #findBestAgent} returns
 * empty and the caller decides how to fall back.
 *
 * @since 1.0
 * @see RoutingPolicy
 */
@Slf4j
public class AgentRouter {

    private static final String LOG_PREFIX = "[Router]";

    private final RoutingPolicy policy;
    private final Map<String, AgentRoute> routes = new ConcurrentHashMap<>();
    private volatile Map<String, List<String>> capabilityIndex = Map.of();
    private final Object registrationLock = new Object();

    public AgentRouter(RoutingPolicy policy) {
        this.policy = policy;
    }

    /**
     * Registers an agent or replaces the capability set of an existing one.
     * Accumulated performance metrics survive re-registration.
     */
    public void registerAgent(String agentType, Collection<String> capabilities) {
        if (agentType == null || agentType.isBlank()) {
            throw new IllegalArgumentException("Agent type must not be blank");
        }
        Set<String> capabilitySet = normalize(capabilities);

        synchronized (registrationLock) {
            AgentRoute existing = routes.get(agentType);
            if (existing != null) {
                existing.replaceCapabilities(capabilitySet);
                log.debug("{} Updated capabilities for {}: {}", LOG_PREFIX, agentType, capabilitySet);
            } else {
                routes.put(agentType, new AgentRoute(agentType, capabilitySet));
                log.info("{} Registered agent {} with capabilities {}", LOG_PREFIX, agentType, capabilitySet);
            }
            rebuildIndex();
        }
    }

    /**
     * Selects the best registered agent for a capability.
     *
     * @param capability
     *            capability tag the request needs
     * @param context
     *            context whose priority biases the scoring; may be null
     * @return the chosen agent type, or empty when no registered agent declares
     *         the capability
     */
    public Optional<String> findBestAgent(String capability, ReasoningContext context) {
        ContextPriority priority = context != null ? context.getPriority() : ContextPriority.MEDIUM;
        return findBestAgent(capability, priority);
    }

    public Optional<String> findBestAgent(String capability, ContextPriority priority) {
        List<AgentCandidate> candidates = rankCandidates(capability, priority);
        if (candidates.isEmpty()) {
            log.debug("{} No agent registered for capability '{}'", LOG_PREFIX, capability);
            return Optional.empty();
        }

        AgentCandidate best = candidates.get(0);
        if (log.isTraceEnabled()) {
            for (AgentCandidate candidate : candidates) {
                log.trace("{}   - {}", LOG_PREFIX, candidate.toLogSummary());
            }
        }
        log.debug("{} Capability '{}' (priority {}) -> {} among {} candidates",
                LOG_PREFIX, capability, priority, best.getAgentType(), candidates.size());
        return Optional.of(best.getAgentType());
    }

    /**
     * Scores every agent that declares the capability, best first.
     */
    public List<AgentCandidate> rankCandidates(String capability, ContextPriority priority) {
        if (capability == null) {
            return List.of();
        }
        List<String> agentTypes = capabilityIndex.getOrDefault(capability, List.of());
        List<AgentCandidate> candidates = new ArrayList<>(agentTypes.size());
        for (String agentType : agentTypes) {
            AgentRoute route = routes.get(agentType);
            if (route == null) {
                continue;
            }
            AgentRouteStats stats = route.snapshot();
            candidates.add(AgentCandidate.builder()
                    .agentType(agentType)
                    .score(policy.score(stats.getSuccessRate(), stats.getAvgResponseTime(), priority))
                    .capabilityCount(stats.getCapabilities().size())
                    .successRate(stats.getSuccessRate())
                    .avgResponseTime(stats.getAvgResponseTime())
                    .build());
        }
        candidates.sort(AgentCandidate.RANKING);
        return candidates;
    }

    /**
     * Folds one observed call into the agent's rolling profile. Unknown agents
     * are ignored so stale identifiers never break a request.
     */
    public void updateAgentMetrics(String agentType, long responseTimeMs, boolean success) {
        AgentRoute route = agentType != null ? routes.get(agentType) : null;
        if (route == null) {
            log.debug("{} Ignoring metrics for unregistered agent {}", LOG_PREFIX, agentType);
            return;
        }
        route.recordOutcome(responseTimeMs, success, policy);
    }

    /**
     * Marks an invocation against the agent as in flight.
     */
    public void acquire(String agentType) {
        AgentRoute route = agentType != null ? routes.get(agentType) : null;
        if (route != null) {
            route.acquire();
        }
    }

    public void release(String agentType) {
        AgentRoute route = agentType != null ? routes.get(agentType) : null;
        if (route != null) {
            route.release();
        }
    }

    public boolean isRegistered(String agentType) {
        return agentType != null && routes.containsKey(agentType);
    }

    /**
     * Snapshot of every registered agent, ordered by agent type.
     */
    public List<AgentRouteStats> getRouteStats() {
        return routes.values().stream()
                .map(AgentRoute::snapshot)
                .sorted(Comparator.comparing(AgentRouteStats::getAgentType))
                .toList();
    }

    public void clear() {
        synchronized (registrationLock) {
            routes.clear();
            capabilityIndex = Map.of();
        }
    }

    // Caller holds registrationLock.
    private void rebuildIndex() {
        Map<String, List<String>> index = new HashMap<>();
        for (AgentRoute route : routes.values()) {
            for (String capability : route.getCapabilities()) {
                index.computeIfAbsent(capability, k -> new ArrayList<>()).add(route.getAgentType());
            }
        }
        Map<String, List<String>> frozen = new HashMap<>();
        for (Map.Entry<String, List<String>> entry : index.entrySet()) {
            List<String> agents = entry.getValue();
            agents.sort(Comparator.naturalOrder());
            frozen.put(entry.getKey(), List.copyOf(agents));
        }
        capabilityIndex = Map.copyOf(frozen);
    }

    private Set<String> normalize(Collection<String> capabilities) {
        Set<String> result = new LinkedHashSet<>();
        if (capabilities == null) {
            return result;
        }
        for (String capability : capabilities) {
            if (capability != null && !capability.isBlank()) {
                result.add(capability.trim());
            }
        }
        return result;
    }
}
