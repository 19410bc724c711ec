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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-run overrides for lifecycle policies. {@code null} values fall back to
 * the configured defaults.
 */
@Data
@Builder
public class LifecycleParams {

    private Integer accessThreshold;
    private Integer feedbackThreshold;
    private Double relevanceThreshold;
    private Double healthThreshold;
    private Integer maxVersionsPerMemory;
    private Integer archivePurgeDays;

    @Builder.Default
    private List<String> mergedBranches = new ArrayList<>();

    private Instant deadline;

    public static LifecycleParams defaults() {
        return LifecycleParams.builder().build();
    }
}
