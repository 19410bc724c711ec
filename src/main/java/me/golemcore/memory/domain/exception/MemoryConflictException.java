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

import java.util.Map;

/**
 * Raised when a precondition fails or a write collides with a newer change.
 * The details hold both sides of the collision.
 */
public class MemoryConflictException extends MemoryStoreException {

    private static final long serialVersionUID = 1L;

    public MemoryConflictException(String message, Map<String, Object> details) {
        super(ErrorKind.CONFLICT, message, details);
    }
}
