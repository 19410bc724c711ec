package me.golemcore.memory.domain.exception;

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base class for typed memory engine failures. Carries an {@link ErrorKind}
 * and a details map that the API layer returns verbatim so callers can react
 * without a second round trip.
 */
public abstract class MemoryStoreException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final Map<String, Object> details;

    protected MemoryStoreException(ErrorKind kind, String message, Map<String, Object> details) {
        super(message);
        this.kind = kind;
        this.details = details != null ? new LinkedHashMap<>(details) : new LinkedHashMap<>();
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Map<String, Object> getDetails() {
        return Collections.unmodifiableMap(details);
    }
}
