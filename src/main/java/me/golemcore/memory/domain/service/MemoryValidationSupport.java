package me.golemcore.memory.domain.service;

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

import me.golemcore.memory.domain.exception.DeadlineExceededException;
import me.golemcore.memory.domain.exception.InvalidMemoryArgumentException;
import me.golemcore.memory.domain.model.Memory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;

/**
 * Argument checks shared by the memory services.
 */
public final class MemoryValidationSupport {

    public static final int MAX_KEY_LENGTH = 256;
    public static final int MAX_CONTENT_LENGTH = 65_536;
    public static final int MAX_TAGS = 20;
    public static final int MAX_TAG_LENGTH = 64;
    public static final long MAX_TIMEOUT_MS = 3_600_000L;

    private MemoryValidationSupport() {
    }

    public static String requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new InvalidMemoryArgumentException("key is required");
        }
        if (key.length() > MAX_KEY_LENGTH) {
            throw new InvalidMemoryArgumentException("key must be at most " + MAX_KEY_LENGTH + " characters");
        }
        return key;
    }

    public static String requireContent(String content) {
        if (content == null || content.isEmpty()) {
            throw new InvalidMemoryArgumentException("content is required");
        }
        validateContent(content);
        return content;
    }

    public static void validateContent(String content) {
        if (content != null && content.length() > MAX_CONTENT_LENGTH) {
            throw new InvalidMemoryArgumentException(
                    "content must be at most " + MAX_CONTENT_LENGTH + " characters");
        }
    }

    public static void validatePriority(Integer priority) {
        if (priority != null && (priority < Memory.MIN_PRIORITY || priority > Memory.MAX_PRIORITY)) {
            throw new InvalidMemoryArgumentException("priority must be between 0 and 100");
        }
    }

    public static void validateTags(Collection<String> tags) {
        if (tags == null) {
            return;
        }
        if (tags.size() > MAX_TAGS) {
            throw new InvalidMemoryArgumentException("at most " + MAX_TAGS + " tags are allowed");
        }
        for (String tag : tags) {
            if (tag == null || tag.isBlank() || tag.length() > MAX_TAG_LENGTH) {
                throw new InvalidMemoryArgumentException(
                        "tags must be non-blank and at most " + MAX_TAG_LENGTH + " characters");
            }
        }
    }

    public static void requireNonNegative(Number value, String name) {
        if (value != null && value.doubleValue() < 0) {
            throw new InvalidMemoryArgumentException(name + " must not be negative");
        }
    }

    /**
     * Deadline {@code timeoutMs} from now, or {@code null} without a timeout.
     * Timeouts are limited to one hour.
     */
    public static Instant deadlineAfter(Clock clock, Long timeoutMs) {
        if (timeoutMs == null) {
            return null;
        }
        if (timeoutMs <= 0 || timeoutMs > MAX_TIMEOUT_MS) {
            throw new InvalidMemoryArgumentException("timeoutMs must be between 1 and " + MAX_TIMEOUT_MS);
        }
        return clock.instant().plusMillis(timeoutMs);
    }

    public static void requireDeadlineNotPassed(Clock clock, Instant deadline, String operation) {
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            throw new DeadlineExceededException(operation, deadline);
        }
    }
}
