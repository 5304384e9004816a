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

import lombok.Builder;
import lombok.Data;

import java.util.Comparator;

/**
 * A registered agent that can serve the requested capability, with the score
 * it received for the current routing decision.
 *
 * @since 1.0
 * @see AgentRouter
 */
@Data
@Builder
public class AgentCandidate {

    /**
     * Best first: higher score, then fewer capabilities (more specialized), then
     * lexical agent type.
     */
    public static final Comparator<AgentCandidate> RANKING = Comparator
            .comparingDouble(AgentCandidate::getScore).reversed()
            .thenComparingInt(AgentCandidate::getCapabilityCount)
            .thenComparing(AgentCandidate::getAgentType);

    private String agentType;
    private double score;
    private int capabilityCount;
    private double successRate;
    private double avgResponseTime;

    public String toLogSummary() {
        return String.format("%s(score=%.4f, success=%.3f, latency=%.1fms, caps=%d)",
                agentType, score, successRate, avgResponseTime, capabilityCount);
    }
}
