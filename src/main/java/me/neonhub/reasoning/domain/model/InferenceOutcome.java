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

/**
 * Return value of the unified inference entry point: a complete result for
 * synchronous requests, or a pull-based stream when streaming was requested.
 */
public final class InferenceOutcome {

    private final InferenceResult result;
    private final InferenceStream stream;

    private InferenceOutcome(InferenceResult result, InferenceStream stream) {
        this.result = result;
        this.stream = stream;
    }

    public static InferenceOutcome completed(InferenceResult result) {
        return new InferenceOutcome(result, null);
    }

    public static InferenceOutcome streaming(InferenceStream stream) {
        return new InferenceOutcome(null, stream);
    }

    public boolean isStreaming() {
        return stream != null;
    }

    public InferenceResult getResult() {
        if (result == null) {
            throw new IllegalStateException("Outcome is a stream, not a completed result");
        }
        return result;
    }

    public InferenceStream getStream() {
        if (stream == null) {
            throw new IllegalStateException("Outcome is a completed result, not a stream");
        }
        return stream;
    }
}
