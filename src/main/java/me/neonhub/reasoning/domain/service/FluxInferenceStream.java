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

import me.neonhub.reasoning.domain.model.InferenceStream;
import me.neonhub.reasoning.domain.model.ModelChunk;
import me.neonhub.reasoning.domain.model.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Signal;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * Pull-based {@link InferenceStream} over a model chunk {@link Flux}.
 *
 * <p>
 * Nothing is subscribed until the first {@link #hasNext()}. Chunks are then
 * requested one at a time, so the producer never runs ahead of the reader by
 * more than one chunk. Exactly one of the lifecycle callbacks
 * {@code onComplete}, {@code onFailure} or {@code onCancel} fires, and only if
 * the stream was started.
 */
@Slf4j
class FluxInferenceStream implements InferenceStream {

    /**
     * Hooks the engine uses to account for a stream's execution.
     */
    interface Lifecycle {

        void onStart();

        void onComplete(String content, TokenUsage usage);

        void onFailure(Throwable error);

        void onCancel();
    }

    private static final int PREFETCH = 1;

    private final String contextId;
    private final String agentId;
    private final Flux<ModelChunk> source;
    private final Lifecycle lifecycle;

    private final StringBuilder output = new StringBuilder();
    private final AtomicBoolean finished = new AtomicBoolean(false);
    private Stream<Signal<ModelChunk>> subscription;
    private Iterator<Signal<ModelChunk>> chunks;
    private String pending;
    private TokenUsage usage;

    FluxInferenceStream(String contextId, String agentId, Flux<ModelChunk> source, Lifecycle lifecycle) {
        this.contextId = contextId;
        this.agentId = agentId;
        this.source = source;
        this.lifecycle = lifecycle;
    }

    @Override
    public String getContextId() {
        return contextId;
    }

    @Override
    public String getAgentId() {
        return agentId;
    }

    @Override
    public boolean isFinished() {
        return finished.get();
    }

    @Override
    public boolean hasNext() {
        if (pending != null) {
            return true;
        }
        if (finished.get()) {
            return false;
        }
        if (chunks == null) {
            subscribe();
        }

        try {
            while (chunks.hasNext()) {
                Signal<ModelChunk> signal = chunks.next();
                if (signal.isOnError()) {
                    throw failWith(signal.getThrowable());
                }
                if (!signal.isOnNext()) {
                    break;
                }
                ModelChunk chunk = signal.get();
                if (chunk.getUsage() != null) {
                    usage = chunk.getUsage();
                }
                if (chunk.hasText()) {
                    pending = chunk.getText();
                    output.append(pending);
                    return true;
                }
            }
        } catch (RuntimeException e) {
            if (finished.get()) {
                throw e;
            }
            throw failWith(e);
        }

        complete();
        return false;
    }

    @Override
    public String next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Inference stream for context " + contextId + " is exhausted");
        }
        String fragment = pending;
        pending = null;
        return fragment;
    }

    /**
     * Abandons the stream. Cancels the upstream subscription if one exists; a
     * no-op once the stream has finished.
     */
    @Override
    public void close() {
        pending = null;
        if (!finished.compareAndSet(false, true)) {
            return;
        }
        if (subscription != null) {
            subscription.close();
            log.debug("Inference stream for context {} closed before completion", contextId);
            lifecycle.onCancel();
        }
    }

    private void subscribe() {
        lifecycle.onStart();
        subscription = source.materialize().toStream(PREFETCH);
        chunks = subscription.iterator();
    }

    private void complete() {
        if (finished.compareAndSet(false, true)) {
            subscription.close();
            lifecycle.onComplete(output.toString(), usage);
        }
    }

    /**
     * Records the failure and returns the exception to throw to the reader.
     * Upstream errors arrive in order as signals, so every fragment emitted
     * before the error has already been handed out.
     */
    private RuntimeException failWith(Throwable error) {
        Throwable cause = Exceptions.unwrap(error);
        fail(cause);
        return ExecutionFailures.unwrap(cause);
    }

    private void fail(Throwable error) {
        if (finished.compareAndSet(false, true)) {
            subscription.close();
            lifecycle.onFailure(error);
        }
    }
}
