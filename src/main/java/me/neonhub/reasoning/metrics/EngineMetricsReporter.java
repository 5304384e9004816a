package me.neonhub.reasoning.metrics;

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

import me.neonhub.reasoning.domain.model.EngineMetrics;
import me.neonhub.reasoning.infrastructure.config.ReasoningProperties;
import me.neonhub.reasoning.port.inbound.ReasoningPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically logs an engine metrics snapshot as JSON.
 *
 * <p>
 * Enabled when {@code reasoning.metrics.report-interval} is positive; the
 * default of zero disables reporting.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EngineMetricsReporter {

    private static final String LOG_PREFIX = "[Metrics]";

    private final ReasoningPort reasoningPort;
    private final ObjectMapper objectMapper;
    private final ReasoningProperties properties;

    private ScheduledExecutorService reportExecutor;

    @PostConstruct
    public void start() {
        Duration interval = properties.getMetrics().getReportInterval();
        if (interval == null || interval.isZero() || interval.isNegative()) {
            log.debug("{} Periodic metrics reporting disabled", LOG_PREFIX);
            return;
        }

        reportExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "reasoning-metrics-reporter");
            t.setDaemon(true);
            return t;
        });
        long periodMs = interval.toMillis();
        reportExecutor.scheduleAtFixedRate(this::report, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("{} Reporting engine metrics every {}", LOG_PREFIX, interval);
    }

    /**
     * Logs one snapshot. Failures are logged and never escape, so the schedule
     * keeps running.
     */
    public void report() {
        try {
            log.info("{} {}", LOG_PREFIX, render(reasoningPort.getMetrics()));
        } catch (RuntimeException | JsonProcessingException e) {
            log.warn("{} Failed to report engine metrics: {}", LOG_PREFIX, e.getMessage());
        }
    }

    String render(EngineMetrics metrics) throws JsonProcessingException {
        return objectMapper.writeValueAsString(metrics);
    }

    boolean isScheduled() {
        return reportExecutor != null && !reportExecutor.isShutdown();
    }

    @PreDestroy
    public void stop() {
        if (reportExecutor != null) {
            reportExecutor.shutdownNow();
        }
    }
}
