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

import java.util.Locale;

/**
 * One line of a line-based diff. {@code lineNumber} is 1-based in the second
 * text for {@code add} and {@code same}, and in the first text for
 * {@code remove}.
 */
public record DiffLine(Type type, String line, int lineNumber) {

    public enum Type {
        ADD, REMOVE, SAME;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static DiffLine add(String line, int lineNumber) {
        return new DiffLine(Type.ADD, line, lineNumber);
    }

    public static DiffLine remove(String line, int lineNumber) {
        return new DiffLine(Type.REMOVE, line, lineNumber);
    }

    public static DiffLine same(String line, int lineNumber) {
        return new DiffLine(Type.SAME, line, lineNumber);
    }
}
