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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Advisory, TTL-bounded write intent on a memory key.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MemoryLock {

    private String id;
    private String projectId;
    private String memoryKey;
    private String lockedBy;
    private Instant acquiredAt;
    private Instant expiresAt;

    @JsonIgnore
    public boolean isExpired(Instant now) {
        return expiresAt == null || expiresAt.isBefore(now);
    }
}
