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

import com.fasterxml.jackson.annotation.JsonValue;
import me.golemcore.memory.domain.exception.InvalidMemoryArgumentException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Mutation applied to every key of a batch request.
 */
public enum BatchAction {
    ARCHIVE, UNARCHIVE, DELETE, PIN, UNPIN, SET_PRIORITY, ADD_TAGS, SET_SCOPE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static BatchAction fromWireName(String value) {
        if (value != null && !value.isBlank()) {
            String normalized = value.trim().toUpperCase(Locale.ROOT);
            for (BatchAction action : values()) {
                if (action.name().equals(normalized)) {
                    return action;
                }
            }
        }
        String valid = Arrays.stream(values()).map(BatchAction::wireName).collect(Collectors.joining(", "));
        throw new InvalidMemoryArgumentException("Unknown batch action \"" + value + "\". Valid: " + valid);
    }
}
