package me.neonhub.reasoning.cache;

import me.neonhub.reasoning.domain.model.CacheMetrics;
import me.neonhub.reasoning.domain.model.ContextEntry;
import me.neonhub.reasoning.domain.model.ReasoningContext;
import me.neonhub.reasoning.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class ContextCacheTest {

    private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

    private MutableClock clock;
    private ContextCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        cache = new ContextCache(3, clock);
    }

    private static ReasoningContext context(String id) {
        return ReasoningContext.builder().id(id).sessionId("s-" + id).createdAt(START).build();
    }

    // ===== Construction =====

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new ContextCache(0, clock));
        assertThrows(IllegalArgumentException.class, () -> new ContextCache(-5, clock));
    }

    @Test
    void rejectsContextWithoutId() {
        ReasoningContext anonymous = ReasoningContext.builder().sessionId("s").build();
        assertThrows(IllegalArgumentException.class, () -> cache.set(anonymous));
    }

    // ===== LRU eviction =====

    @Test
    void evictsLeastRecentlyInsertedWhenNothingWasRead() {
        cache.set(context("c0"));
        cache.set(context("c1"));
        cache.set(context("c2"));
        cache.set(context("c3"));

        assertFalse(cache.contains("c0"));
        assertTrue(cache.contains("c1"));
        assertTrue(cache.contains("c2"));
        assertTrue(cache.contains("c3"));
        assertEquals(3, cache.size());
        assertEquals(1, cache.metrics().getEvictions());
    }

    @Test
    void readRefreshesRecencySoAnotherEntryIsEvicted() {
        cache.set(context("c0"));
        cache.set(context("c1"));
        cache.set(context("c2"));

        assertTrue(cache.get("c0").isPresent());
        cache.set(context("c3"));

        assertTrue(cache.contains("c0"));
        assertFalse(cache.contains("c1"));
        assertTrue(cache.contains("c2"));
        assertTrue(cache.contains("c3"));
    }

    @Test
    void overwritingExistingKeyAtCapacityDoesNotEvict() {
        cache.set(context("c0"));
        cache.set(context("c1"));
        cache.set(context("c2"));

        ReasoningContext replacement = context("c1");
        cache.set(replacement);

        assertEquals(3, cache.size());
        assertEquals(0, cache.metrics().getEvictions());
        assertSame(replacement, cache.get("c1").orElseThrow());
    }

    @Test
    void sizeNeverExceedsCapacity() {
        for (int i = 0; i < 20; i++) {
            cache.set(context("c" + i));
            assertTrue(cache.size() <= cache.getCapacity());
        }
        assertEquals(17, cache.metrics().getEvictions());
    }

    // ===== Hits, misses, lastAccessed =====

    @Test
    void hitRateIsZeroBeforeAnyAccess() {
        CacheMetrics metrics = cache.metrics();

        assertEquals(0, metrics.getHits());
        assertEquals(0, metrics.getMisses());
        assertEquals(0.0, metrics.getHitRate());
        assertEquals(0, metrics.getSize());
        assertEquals(3, metrics.getCapacity());
    }

    @Test
    void countsHitsAndMisses() {
        cache.set(context("c0"));

        assertTrue(cache.get("c0").isPresent());
        assertTrue(cache.get("missing").isEmpty());
        assertTrue(cache.get(null).isEmpty());
        assertTrue(cache.get("c0").isPresent());

        CacheMetrics metrics = cache.metrics();
        assertEquals(2, metrics.getHits());
        assertEquals(2, metrics.getMisses());
        assertEquals(0.5, metrics.getHitRate(), 1e-9);
    }

    @Test
    void hitUpdatesLastAccessed() {
        ReasoningContext ctx = context("c0");
        ctx.setLastAccessed(START);
        cache.set(ctx);

        clock.advance(Duration.ofMinutes(5));
        ReasoningContext read = cache.get("c0").orElseThrow();

        assertEquals(START.plus(Duration.ofMinutes(5)), read.getLastAccessed());
    }

    @Test
    void containsDoesNotCountAsAccess() {
        cache.set(context("c0"));

        assertTrue(cache.contains("c0"));

        assertEquals(0, cache.metrics().getHits());
        assertEquals(0, cache.metrics().getMisses());
    }

    @Test
    void reportsAverageTokensPerResidentContext() {
        ReasoningContext first = context("c0");
        first.append(ContextEntry.builder().type(ContextEntry.TYPE_USER_INPUT).content("a").tokens(10).build(), 50);
        ReasoningContext second = context("c1");
        second.append(ContextEntry.builder().type(ContextEntry.TYPE_USER_INPUT).content("b").tokens(30).build(), 50);
        cache.set(first);
        cache.set(second);

        assertEquals(20.0, cache.metrics().getAvgTokensPerContext(), 1e-9);
    }

    @Test
    void clearDropsEntriesButKeepsCounters() {
        cache.set(context("c0"));
        cache.get("c0");

        cache.clear();

        assertEquals(0, cache.size());
        assertEquals(1, cache.metrics().getHits());
        assertTrue(cache.get("c0").isEmpty());
    }

    // ===== Concurrency =====

    @Test
    void concurrentWritersRespectCapacity() throws Exception {
        ContextCache shared = new ContextCache(50, clock);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                int thread = t;
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 200; i++) {
                        String id = "t" + thread + "-" + i;
                        shared.set(context(id));
                        shared.get(id);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        CacheMetrics metrics = shared.metrics();
        assertEquals(50, metrics.getSize());
        assertEquals(1600 - 50, metrics.getEvictions());
        assertEquals(1600, metrics.getHits() + metrics.getMisses());
    }
}
