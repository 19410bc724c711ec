package me.golemcore.memory.port.outbound;

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

import me.golemcore.memory.domain.model.Memory;
import me.golemcore.memory.domain.model.MemoryVersion;

import java.util.List;
import java.util.Optional;

/**
 * Read-modify-write view of a single project's memories, valid only inside
 * {@link MemoryRepositoryPort#inTransaction}.
 */
public interface MemoryTransaction {

    Optional<Memory> findByKey(String key);

    List<Memory> findAll();

    void save(Memory memory);

    /**
     * Hard-delete a memory together with its versions.
     */
    boolean delete(String memoryId);

    /**
     * Versions of a memory, newest first.
     */
    List<MemoryVersion> versions(String memoryId);

    Optional<MemoryVersion> version(String memoryId, int version);

    /**
     * Highest version number recorded for the memory, or 0 when none.
     */
    int latestVersion(String memoryId);

    void appendVersion(MemoryVersion version);

    /**
     * Keep only the {@code keep} newest versions. Returns how many were
     * removed.
     */
    int trimVersions(String memoryId, int keep);
}
