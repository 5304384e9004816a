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

import java.util.Iterator;

/**
 * Single-use, forward-only sequence of text fragments produced by a streaming
 * inference.
 *
 * <p>
 * Each fragment is pulled from the model only when the caller asks for it.
 * Once {@link #hasNext()} returns false the full output has been appended to
 * the context history and the metrics are recorded. Calling {@link #close()}
 * before that abandons the upstream production; nothing is appended in that
 * case.
 */
public interface InferenceStream extends Iterator<String>, AutoCloseable {

    String getContextId();

    /**
     * Agent the stream is bound to, or null for the generic path.
     */
    String getAgentId();

    /**
     * True once the stream has been exhausted, failed, or closed.
     */
    boolean isFinished();

    @Override
    void close();
}
