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
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A named, versioned piece of project memory read and written by coding agents.
 *
 * <p>
 * At most one active (non-archived) memory exists per {@code (projectId, key)}.
 * Archiving is a soft delete; re-storing an archived key brings it back.
 * {@code revision} is bumped on every committed mutation and serves as the
 * optimistic-concurrency token for plain update/delete calls.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Memory {

    public static final int MIN_PRIORITY = 0;
    public static final int MAX_PRIORITY = 100;

    private String id;
    private String orgId;
    private String projectId;
    private String key;
    private String content;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Builder.Default
    private Set<String> tags = new LinkedHashSet<>();

    @Builder.Default
    private Set<String> relatedKeys = new LinkedHashSet<>();

    @Builder.Default
    private MemoryScope scope = MemoryScope.PROJECT;

    private int priority;
    private long accessCount;
    private Instant lastAccessedAt;
    private long helpfulCount;
    private long unhelpfulCount;

    private Instant pinnedAt;
    private Instant archivedAt;
    private Instant expiresAt;

    private String createdBy;
    private Instant createdAt;
    private Instant updatedAt;
    private long revision;

    @JsonIgnore
    public boolean isActive() {
        return archivedAt == null;
    }

    @JsonIgnore
    public boolean isPinned() {
        return pinnedAt != null;
    }

    @JsonIgnore
    public boolean isExpired(Instant now) {
        return expiresAt != null && expiresAt.isBefore(now);
    }
}
