package me.golemcore.memory.domain.model;

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

import me.golemcore.memory.domain.exception.InvalidMemoryArgumentException;

/**
 * Organization and project identifiers resolved by the API layer before any
 * record store call.
 */
public record ProjectRef(String orgId, String projectId) {

    public ProjectRef {
        if (orgId == null || orgId.isBlank()) {
            throw new InvalidMemoryArgumentException("orgId is required");
        }
        if (projectId == null || projectId.isBlank()) {
            throw new InvalidMemoryArgumentException("projectId is required");
        }
    }
}
