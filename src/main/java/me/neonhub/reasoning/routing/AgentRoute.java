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

import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mutable routing profile for one agent. Capability replacement and EWMA
 * updates synchronize on the route, so concurrent outcomes for the same agent
 * are never lost.
 */
class AgentRoute {

    private static final double PRIOR_RESPONSE_TIME = 0.0;
    private static final double PRIOR_SUCCESS_RATE = 1.0;

    private final String agentType;
    private final AtomicInteger load = new AtomicInteger();

    private Set<String> capabilities;
    private double avgResponseTime = PRIOR_RESPONSE_TIME;
    private double successRate = PRIOR_SUCCESS_RATE;
    private long totalCalls;
    private long failedCalls;

    AgentRoute(String agentType, Set<String> capabilities) {
        this.agentType = agentType;
        this.capabilities = Set.copyOf(capabilities);
    }

    String getAgentType() {
        return agentType;
    }

    synchronized Set<String> getCapabilities() {
        return capabilities;
    }

    synchronized void replaceCapabilities(Set<String> newCapabilities) {
        this.capabilities = Set.copyOf(newCapabilities);
    }

    synchronized void recordOutcome(long responseTimeMs, boolean success, RoutingPolicy policy) {
        avgResponseTime = policy.blend(avgResponseTime, responseTimeMs);
        successRate = policy.blend(successRate, success ? 1.0 : 0.0);
        totalCalls++;
        if (!success) {
            failedCalls++;
        }
    }

    void acquire() {
        load.incrementAndGet();
    }

    void release() {
        load.updateAndGet(current -> Math.max(0, current - 1));
    }

    synchronized AgentRouteStats snapshot() {
        return AgentRouteStats.builder()
                .agentType(agentType)
                .capabilities(capabilities)
                .avgResponseTime(avgResponseTime)
                .successRate(successRate)
                .load(load.get())
                .totalCalls(totalCalls)
                .failedCalls(failedCalls)
                .build();
    }
}
