package me.neonhub.reasoning.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration for the reasoning core, bound from
 * application.properties.
 *
 * <p>
 * All settings live under the {@code reasoning.*} prefix:
 * <ul>
 * <li>{@link CacheProperties} - context cache capacity</li>
 * <li>{@link ContextProperties} - history window size</li>
 * <li>{@link RoutingProperties} - scoring weights and EWMA smoothing</li>
 * <li>{@link ModelProperties} - model collaborator selection and
 * credentials</li>
 * <li>{@code agents} - agent types registered at startup</li>
 * <li>{@link MetricsProperties} - periodic metrics reporting</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "reasoning")
@Data
public class ReasoningProperties {

    private CacheProperties cache = new CacheProperties();
    private ContextProperties context = new ContextProperties();
    private RoutingProperties routing = new RoutingProperties();
    private ModelProperties model = new ModelProperties();
    private Map<String, AgentProperties> agents = new HashMap<>();
    private MetricsProperties metrics = new MetricsProperties();

    @Data
    public static class CacheProperties {
        private int maxSize = 1000;
    }

    @Data
    public static class ContextProperties {
        /** Max history entries kept per context; oldest entries are dropped first. */
        private int windowSize = 50;
    }

    // ==================== ROUTING ====================

    @Data
    public static class RoutingProperties {
        /** Weight of the newest observation in the EWMA blend. */
        private double smoothingFactor = 0.2;
        private double successWeight = 0.6;
        private double latencyWeight = 0.4;
        private double urgentSuccessWeight = 0.85;
        private double urgentLatencyWeight = 0.15;
        private double latencyScaleMs = 1000.0;

        /**
         * Agent used when neither an explicit agent nor a capability resolves.
         * Ignored unless the agent is registered.
         */
        private String defaultAgent;
    }

    // ==================== MODEL ====================

    @Data
    public static class ModelProperties {
        private String provider = "none";
        private Langchain4jProperties langchain4j = new Langchain4jProperties();
    }

    @Data
    public static class Langchain4jProperties {
        /** Model id, optionally prefixed with the provider: "openai/gpt-4o-mini". */
        private String model = "openai/gpt-4o-mini";
        private long timeoutMs = 60000;
        private double temperature = 0.7;
        private int maxTokens = 1024;
        private Map<String, ProviderProperties> providers = new HashMap<>();
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }

    // ==================== AGENTS ====================

    @Data
    public static class AgentProperties {
        private List<String> capabilities = new ArrayList<>();
    }

    @Data
    public static class MetricsProperties {
        /** Interval between metric snapshots in the log. Zero disables reporting. */
        private Duration reportInterval = Duration.ZERO;
    }
}
