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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable snapshot of a memory's content and metadata, taken before a
 * mutation (or at creation for version 1).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MemoryVersion {

    public enum ChangeType {
        CREATED, UPDATED, RESTORED;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static ChangeType fromWireName(String value) {
            return ChangeType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    private String memoryId;
    private int version;
    private String content;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    private String changedBy;
    private ChangeType changeType;
    private Instant createdAt;
}
