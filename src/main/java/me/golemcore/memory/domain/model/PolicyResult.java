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

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of a single lifecycle policy within a run.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PolicyResult(int affected, String details, Boolean failed) {

    public static PolicyResult of(int affected) {
        return new PolicyResult(affected, null, null);
    }

    public static PolicyResult of(int affected, String details) {
        return new PolicyResult(affected, details, null);
    }

    public static PolicyResult failure(String details) {
        return new PolicyResult(0, details, Boolean.TRUE);
    }

    public boolean hasFailed() {
        return Boolean.TRUE.equals(failed);
    }
}
