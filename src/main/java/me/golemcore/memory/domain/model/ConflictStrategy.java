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
import me.golemcore.memory.domain.exception.InvalidMemoryArgumentException;

import java.util.Locale;

/**
 * How a safe store reacts when the memory changed after the caller read it.
 */
public enum ConflictStrategy {
    REJECT, LAST_WRITE_WINS, APPEND, RETURN_BOTH;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ConflictStrategy fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return REJECT;
        }
        try {
            return ConflictStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidMemoryArgumentException("Unknown conflict strategy: " + value);
        }
    }
}
