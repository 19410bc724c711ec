package me.golemcore.memory.adapter.outbound.persistence;

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

import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.memory.domain.model.MemoryLock;

import java.util.ArrayList;
import java.util.List;

/**
 * Stored form of one project's advisory locks.
 */
@Data
@NoArgsConstructor
public class ProjectLockDocument {

    private String projectId;
    private List<MemoryLock> locks = new ArrayList<>();

    public ProjectLockDocument(String projectId) {
        this.projectId = projectId;
    }
}
