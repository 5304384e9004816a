package me.neonhub.reasoning.domain.exception;

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
 * Thrown when an operation names a context that was never created or has
 * already been evicted from the context cache. Never retried internally.
 */
public class ContextNotFoundException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String contextId;

    public ContextNotFoundException(String contextId) {
        super("Context not found: " + contextId);
        this.contextId = contextId;
    }

    public String getContextId() {
        return contextId;
    }
}
