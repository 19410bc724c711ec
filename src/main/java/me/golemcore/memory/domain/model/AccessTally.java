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

import java.time.Instant;

/**
 * Reads of one memory that have not been written back yet: how many, and the
 * latest read time.
 */
public record AccessTally(long count, Instant lastAccessedAt) {

    public static AccessTally single(Instant accessedAt) {
        return new AccessTally(1, accessedAt);
    }

    public AccessTally plus(AccessTally other) {
        Instant latest = other.lastAccessedAt.isAfter(lastAccessedAt) ? other.lastAccessedAt : lastAccessedAt;
        return new AccessTally(count + other.count, latest);
    }
}
