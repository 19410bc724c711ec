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

import java.util.Locale;

/**
 * Closed set of maintenance policies the lifecycle runner knows how to
 * execute. Names that do not map to a constant resolve to {@link #UNKNOWN}
 * and are reported as no-ops.
 */
public enum LifecyclePolicy {
    CLEANUP_EXPIRED,
    CLEANUP_EXPIRED_LOCKS,
    AUTO_PROMOTE,
    AUTO_DEMOTE,
    AUTO_PRUNE,
    AUTO_ARCHIVE_UNHEALTHY,
    CLEANUP_OLD_VERSIONS,
    PURGE_ARCHIVED,
    ARCHIVE_MERGED_BRANCHES,
    UNKNOWN;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static LifecyclePolicy fromName(String name) {
        if (name == null || name.isBlank()) {
            return UNKNOWN;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (LifecyclePolicy policy : values()) {
            if (policy != UNKNOWN && policy.name().equals(normalized)) {
                return policy;
            }
        }
        return UNKNOWN;
    }
}
