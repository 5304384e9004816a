package me.neonhub.reasoning.domain.model;

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

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A logical session or task thread. Lives only in the context cache and ages
 * out under capacity pressure; there is no explicit close.
 *
 * <p>
 * History mutation and snapshots synchronize on the context instance. The
 * list itself is never handed out; read it through {@link #historySnapshot()}.
 */
@Data
@Builder
public class ReasoningContext {

    private String id;
    private String sessionId;
    private String userId;
    private String campaignId;

    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @Builder.Default
    private List<ContextEntry> history = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    private Instant createdAt;
    private volatile Instant lastAccessed;

    @Builder.Default
    private ContextPriority priority = ContextPriority.MEDIUM;

    /**
     * Appends an entry and drops the oldest entries until the history fits in
     * {@code windowSize}.
     *
     * @return number of entries trimmed from the head
     */
    public synchronized int append(ContextEntry entry, int windowSize) {
        if (history == null) {
            history = new ArrayList<>();
        }
        history.add(entry);
        int overflow = history.size() - windowSize;
        if (overflow <= 0) {
            return 0;
        }
        history.subList(0, overflow).clear();
        return overflow;
    }

    /**
     * Returns a copy of the current history, oldest first.
     */
    public synchronized List<ContextEntry> historySnapshot() {
        return history != null ? List.copyOf(history) : List.of();
    }

    public synchronized int totalTokens() {
        if (history == null) {
            return 0;
        }
        int sum = 0;
        for (ContextEntry entry : history) {
            sum += entry.tokensOrZero();
        }
        return sum;
    }
}
