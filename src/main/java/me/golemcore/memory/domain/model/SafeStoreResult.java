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

/**
 * Result of a conflict-aware store. When {@code stored} is false the caller
 * gets both sides so it can merge and resubmit.
 */
@Data
@Builder
public class SafeStoreResult {

    private String key;
    private boolean conflict;
    private boolean stored;
    private ConflictStrategy strategy;
    private String message;
    private StoreResult storeResult;
    private String proposedContent;
    private String currentContent;
    private Instant currentUpdatedAt;
    private Instant clientTimestamp;
}
