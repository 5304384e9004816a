package me.neonhub.reasoning;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the reasoning engine.
 *
 * <p>
 * The engine keeps bounded, memory-resident reasoning contexts, routes each
 * inference to the best-scoring agent for a capability and calls the
 * configured language model synchronously or as a pull-based stream.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Inbound port       → ReasoningPort (ReasoningEngine)
 * Domain Layer       → ContextCache, AgentRouter, ReasoningEngine
 * Outbound port      → ModelPort (langchain4j / no-op adapters)
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code reasoning.*} prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ReasoningEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReasoningEngineApplication.class, args);
    }

}
