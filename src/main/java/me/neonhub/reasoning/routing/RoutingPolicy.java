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

import me.neonhub.reasoning.domain.model.ContextPriority;
import lombok.Builder;
import lombok.Data;

/**
 * Tunable constants for agent scoring and profile smoothing.
 *
 * <p>
 * Score for a candidate:
 *
 * <pre>
 *   latencyScore = 1 / (1 + avgResponseTime / latencyScaleMs)
 *   score        = successWeight * successRate + latencyWeight * latencyScore
 * </pre>
 *
 * HIGH and CRITICAL contexts use the urgent weight pair, which leans on success
 * rate. EWMA updates keep {@code 1 - smoothingFactor} of the old value.
 *
 * @since 1.0
 */
@Data
@Builder
public class RoutingPolicy {

    @Builder.Default
    private double smoothingFactor = 0.2;

    @Builder.Default
    private double successWeight = 0.6;

    @Builder.Default
    private double latencyWeight = 0.4;

    @Builder.Default
    private double urgentSuccessWeight = 0.85;

    @Builder.Default
    private double urgentLatencyWeight = 0.15;

    @Builder.Default
    private double latencyScaleMs = 1000.0;

    public static RoutingPolicy defaults() {
        return RoutingPolicy.builder().build();
    }

    public double score(double successRate, double avgResponseTime, ContextPriority priority) {
        boolean urgent = priority != null && priority.isUrgent();
        double ws = urgent ? urgentSuccessWeight : successWeight;
        double wl = urgent ? urgentLatencyWeight : latencyWeight;
        double latencyScore = 1.0 / (1.0 + Math.max(0.0, avgResponseTime) / latencyScaleMs);
        return ws * successRate + wl * latencyScore;
    }

    public double blend(double previous, double observed) {
        return previous * (1.0 - smoothingFactor) + observed * smoothingFactor;
    }
}
