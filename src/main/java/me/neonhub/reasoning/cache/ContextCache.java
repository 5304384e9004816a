package me.neonhub.reasoning.cache;

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

import me.neonhub.reasoning.domain.model.CacheMetrics;
import me.neonhub.reasoning.domain.model.ReasoningContext;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded in-memory store of {@link ReasoningContext} instances with
 * least-recently-used eviction.
 *
 * <p>
 * Recency is tracked by an access-ordered {@link LinkedHashMap}: every
 * {@link #get(String)} hit and every {@link #set(ReasoningContext)} moves the
 * entry to the most-recent end, so the head is always the entry that has gone
 * untouched the longest. All structural changes happen under a single lock that
 * is held only for the map operation itself.
 *
 * <p>
 * This is a cache, not a source of truth: evicted contexts are gone.
 *
 * @since 1.0
 */
@Slf4j
public class ContextCache {

    private static final String LOG_PREFIX = "[ContextCache]";

    private final int capacity;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<String, ReasoningContext> entries;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    public ContextCache(int capacity, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Cache capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.clock = clock;
        this.entries = new LinkedHashMap<>(16, 0.75f, true);
    }

    /**
     * Inserts or overwrites the context under its id. Inserting a new id into a
     * full cache evicts the least recently accessed entry first.
     */
    public void set(ReasoningContext context) {
        String id = context.getId();
        if (id == null) {
            throw new IllegalArgumentException("Context id must not be null");
        }

        String evictedId = null;
        lock.lock();
        try {
            if (!entries.containsKey(id) && entries.size() >= capacity) {
                evictedId = evictEldest();
            }
            entries.put(id, context);
        } finally {
            lock.unlock();
        }

        if (evictedId != null) {
            log.debug("{} Evicted least recently used context {} to make room for {}",
                    LOG_PREFIX, evictedId, id);
        }
    }

    /**
     * Looks up a context, refreshing its recency and {@code lastAccessed} on a
     * hit. A miss is counted and reported as empty, never as an error.
     */
    public Optional<ReasoningContext> get(String id) {
        if (id == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }

        ReasoningContext context;
        lock.lock();
        try {
            context = entries.get(id);
        } finally {
            lock.unlock();
        }

        if (context == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }

        context.setLastAccessed(clock.instant());
        hits.incrementAndGet();
        return Optional.of(context);
    }

    public boolean contains(String id) {
        lock.lock();
        try {
            return entries.containsKey(id);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int getCapacity() {
        return capacity;
    }

    public CacheMetrics metrics() {
        List<ReasoningContext> resident;
        lock.lock();
        try {
            resident = new ArrayList<>(entries.values());
        } finally {
            lock.unlock();
        }

        long totalTokens = 0;
        for (ReasoningContext context : resident) {
            totalTokens += context.totalTokens();
        }

        long hitCount = hits.get();
        long missCount = misses.get();
        long accesses = hitCount + missCount;

        return CacheMetrics.builder()
                .hits(hitCount)
                .misses(missCount)
                .evictions(evictions.get())
                .hitRate(accesses == 0 ? 0.0 : (double) hitCount / accesses)
                .size(resident.size())
                .capacity(capacity)
                .avgTokensPerContext((double) totalTokens / Math.max(resident.size(), 1))
                .build();
    }

    /**
     * Drops every entry. Counters are kept.
     */
    public void clear() {
        int dropped;
        lock.lock();
        try {
            dropped = entries.size();
            entries.clear();
        } finally {
            lock.unlock();
        }
        log.debug("{} Cleared {} contexts", LOG_PREFIX, dropped);
    }

    // Caller holds the lock.
    private String evictEldest() {
        Iterator<Map.Entry<String, ReasoningContext>> it = entries.entrySet().iterator();
        if (!it.hasNext()) {
            return null;
        }
        String eldest = it.next().getKey();
        it.remove();
        evictions.incrementAndGet();
        return eldest;
    }
}
