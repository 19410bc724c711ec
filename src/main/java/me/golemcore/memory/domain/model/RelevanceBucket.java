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

public enum RelevanceBucket {
    EXCELLENT(60), GOOD(30), FAIR(10), POOR(0);

    private final double minScore;

    RelevanceBucket(double minScore) {
        this.minScore = minScore;
    }

    public static RelevanceBucket of(double score) {
        for (RelevanceBucket bucket : values()) {
            if (score >= bucket.minScore) {
                return bucket;
            }
        }
        return POOR;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
