package me.neonhub.reasoning.domain.service;

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

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Engine-wide inference counters. Counters are atomics; the running average
 * and the completed count it depends on move together under {@code avgLock}.
 */
class InferenceMetrics {

    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong streaming = new AtomicLong();
    private final AtomicInteger active = new AtomicInteger();

    private final ReentrantLock avgLock = new ReentrantLock();
    private long completed;
    private double avgResponseTime;

    void begin() {
        active.incrementAndGet();
    }

    void end() {
        active.updateAndGet(current -> Math.max(0, current - 1));
    }

    void recordStreamingRequest() {
        streaming.incrementAndGet();
    }

    void recordCompletion(long responseTimeMs, boolean success) {
        if (!success) {
            failed.incrementAndGet();
        }
        avgLock.lock();
        try {
            completed++;
            avgResponseTime += (responseTimeMs - avgResponseTime) / completed;
        } finally {
            avgLock.unlock();
        }
    }

    long totalInferences() {
        avgLock.lock();
        try {
            return completed;
        } finally {
            avgLock.unlock();
        }
    }

    double avgResponseTime() {
        avgLock.lock();
        try {
            return avgResponseTime;
        } finally {
            avgLock.unlock();
        }
    }

    long failedInferences() {
        return failed.get();
    }

    long streamingRequests() {
        return streaming.get();
    }

    int activeInferences() {
        return active.get();
    }
}
