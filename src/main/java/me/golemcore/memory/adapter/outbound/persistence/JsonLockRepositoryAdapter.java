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
import me.golemcore.memory.adapter.outbound.persistence.ProjectDocumentStore.Outcome;
import me.golemcore.memory.domain.model.LockResult;
import me.golemcore.memory.domain.model.MemoryLock;
import me.golemcore.memory.infrastructure.config.MemoryStoreProperties;
import me.golemcore.memory.port.outbound.LockRepositoryPort;
import me.golemcore.memory.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link LockRepositoryPort} over one JSON document per project. Acquire runs
 * as a single serialized update of that document, which makes the
 * check-expired-then-insert sequence a compare-and-swap.
 */
@Component
public class JsonLockRepositoryAdapter implements LockRepositoryPort {

    private final ProjectDocumentStore<ProjectLockDocument> documents;

    public JsonLockRepositoryAdapter(StoragePort storage, ObjectMapper objectMapper,
            MemoryStoreProperties properties) {
        this.documents = new ProjectDocumentStore<>(storage, objectMapper,
                properties.getStorage().getDirectories().getLocks(),
                ProjectLockDocument.class, ProjectLockDocument::new);
    }

    @Override
    public LockResult tryAcquire(String projectId, String key, String holder, Instant now, Instant expiresAt) {
        return documents.update(projectId, document -> {
            List<MemoryLock> locks = document.getLocks();
            Iterator<MemoryLock> it = locks.iterator();
            while (it.hasNext()) {
                MemoryLock existing = it.next();
                if (existing.getMemoryKey().equals(key)) {
                    if (!existing.isExpired(now)) {
                        return new Outcome<>(LockResult.held(copy(existing)), false);
                    }
                    it.remove();
                }
            }
            MemoryLock lock = MemoryLock.builder()
                    .id(UUID.randomUUID().toString())
                    .projectId(projectId)
                    .memoryKey(key)
                    .lockedBy(holder)
                    .acquiredAt(now)
                    .expiresAt(expiresAt)
                    .build();
            locks.add(lock);
            return new Outcome<>(LockResult.acquired(copy(lock)), true);
        });
    }

    @Override
    public Optional<MemoryLock> find(String projectId, String key) {
        return documents.read(projectId, document -> document.getLocks().stream()
                .filter(lock -> lock.getMemoryKey().equals(key))
                .findFirst()
                .map(JsonLockRepositoryAdapter::copy));
    }

    @Override
    public boolean delete(String projectId, String key, String lockId) {
        return documents.update(projectId, document -> {
            boolean removed = document.getLocks()
                    .removeIf(lock -> lock.getMemoryKey().equals(key) && lock.getId().equals(lockId));
            return new Outcome<>(removed, removed);
        });
    }

    @Override
    public int deleteExpired(String projectId, Instant now) {
        return documents.update(projectId, document -> {
            int before = document.getLocks().size();
            document.getLocks().removeIf(lock -> lock.isExpired(now));
            int removed = before - document.getLocks().size();
            return new Outcome<>(removed, removed > 0);
        });
    }

    private static MemoryLock copy(MemoryLock lock) {
        return MemoryLock.builder()
                .id(lock.getId())
                .projectId(lock.getProjectId())
                .memoryKey(lock.getMemoryKey())
                .lockedBy(lock.getLockedBy())
                .acquiredAt(lock.getAcquiredAt())
                .expiresAt(lock.getExpiresAt())
                .build();
    }
}
