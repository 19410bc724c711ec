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

import me.golemcore.memory.domain.model.AccessTally;
import me.golemcore.memory.domain.model.Memory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Durable, transactional store of memories and their version snapshots.
 *
 * <p>
 * All writes go through {@link #inTransaction(String, Function)}: the work
 * sees a consistent view of one project and its changes are committed
 * atomically, or discarded if the work throws. Concurrent transactions on the
 * same project are serialized.
 */
public interface MemoryRepositoryPort {

    <T> T inTransaction(String projectId, Function<MemoryTransaction, T> work);

    Optional<Memory> findByKey(String projectId, String key);

    List<Memory> findAll(String projectId);

    long countActiveByProject(String projectId);

    long countActiveByOrg(String orgId);

    /**
     * Add pending reads to the access counters of a project in one write.
     * Keys that no longer exist are skipped. Returns how many memories were
     * updated.
     */
    int recordAccesses(String projectId, Map<String, AccessTally> tallies);

    /**
     * Drop any cached state for the project so the next read goes to storage.
     */
    void invalidate(String projectId);
}
