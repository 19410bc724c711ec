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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.adapter.outbound.persistence.ProjectDocumentStore.Outcome;
import me.golemcore.memory.domain.model.AccessTally;
import me.golemcore.memory.domain.model.Memory;
import me.golemcore.memory.infrastructure.config.MemoryStoreProperties;
import me.golemcore.memory.port.outbound.MemoryRepositoryPort;
import me.golemcore.memory.port.outbound.MemoryTransaction;
import me.golemcore.memory.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * {@link MemoryRepositoryPort} keeping each project's memories and versions in
 * one JSON document. A transaction is one serialized copy-on-write update of
 * that document, so a store that snapshots a version and rewrites the memory
 * either fully commits or leaves no trace.
 */
@Component
@Slf4j
public class JsonMemoryRepositoryAdapter implements MemoryRepositoryPort {

    private final ProjectDocumentStore<ProjectMemoryDocument> documents;

    public JsonMemoryRepositoryAdapter(StoragePort storage, ObjectMapper objectMapper,
            MemoryStoreProperties properties) {
        this.documents = new ProjectDocumentStore<>(storage, objectMapper,
                properties.getStorage().getDirectories().getMemories(),
                ProjectMemoryDocument.class, ProjectMemoryDocument::new);
    }

    @Override
    public <T> T inTransaction(String projectId, Function<MemoryTransaction, T> work) {
        return documents.update(projectId, document -> {
            JsonMemoryTransaction tx = new JsonMemoryTransaction(document);
            T result = work.apply(tx);
            return new Outcome<>(result, tx.isChanged());
        });
    }

    @Override
    public Optional<Memory> findByKey(String projectId, String key) {
        return documents.read(projectId, document -> document.getMemories().stream()
                .filter(memory -> memory.getKey().equals(key))
                .findFirst()
                .map(JsonMemoryTransaction::copy));
    }

    @Override
    public List<Memory> findAll(String projectId) {
        return documents.read(projectId, document -> document.getMemories().stream()
                .map(JsonMemoryTransaction::copy)
                .toList());
    }

    @Override
    public long countActiveByProject(String projectId) {
        return documents.read(projectId, document -> document.getMemories().stream()
                .filter(Memory::isActive)
                .count());
    }

    @Override
    public long countActiveByOrg(String orgId) {
        long total = 0;
        for (String projectId : documents.projectIds()) {
            total += documents.read(projectId, document -> document.getMemories().stream()
                    .filter(memory -> orgId.equals(memory.getOrgId()) && memory.isActive())
                    .count());
        }
        return total;
    }

    @Override
    public int recordAccesses(String projectId, Map<String, AccessTally> tallies) {
        if (tallies.isEmpty()) {
            return 0;
        }
        return documents.update(projectId, document -> {
            int updated = 0;
            for (Memory memory : document.getMemories()) {
                AccessTally tally = tallies.get(memory.getKey());
                if (tally == null) {
                    continue;
                }
                memory.setAccessCount(memory.getAccessCount() + tally.count());
                Instant accessedAt = tally.lastAccessedAt();
                if (memory.getLastAccessedAt() == null || accessedAt.isAfter(memory.getLastAccessedAt())) {
                    memory.setLastAccessedAt(accessedAt);
                }
                updated++;
            }
            return new Outcome<>(updated, updated > 0);
        });
    }

    @Override
    public void invalidate(String projectId) {
        documents.invalidate(projectId);
    }
}
