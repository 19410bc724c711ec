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

import java.util.List;
import java.util.Set;

/**
 * One action over a list of keys. Only the field matching the action is read:
 * {@code priority} for {@code set_priority}, {@code tags} for
 * {@code add_tags}, {@code scope} for {@code set_scope}.
 */
@Data
@Builder
public class BatchCommand {

    private List<String> keys;
    private BatchAction action;
    private Integer priority;
    private Set<String> tags;
    private MemoryScope scope;
    private String actorId;
}
