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

import me.golemcore.memory.domain.model.Memory;
import me.golemcore.memory.domain.model.MemoryVersion;
import me.golemcore.memory.port.outbound.MemoryTransaction;

import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Transaction over the working copy of a {@link ProjectMemoryDocument}.
 * Records cross the boundary as copies, so callers cannot change the document
 * except through {@link #save} and the version methods.
 */
class JsonMemoryTransaction implements MemoryTransaction {

    private static final Comparator<MemoryVersion> NEWEST_FIRST = Comparator
            .comparingInt(MemoryVersion::getVersion).reversed();

    private final ProjectMemoryDocument document;
    private boolean changed;

    JsonMemoryTransaction(ProjectMemoryDocument document) {
        this.document = document;
    }

    boolean isChanged() {
        return changed;
    }

    @Override
    public Optional<Memory> findByKey(String key) {
        return document.getMemories().stream()
                .filter(memory -> memory.getKey().equals(key))
                .findFirst()
                .map(JsonMemoryTransaction::copy);
    }

    @Override
    public List<Memory> findAll() {
        return document.getMemories().stream().map(JsonMemoryTransaction::copy).toList();
    }

    @Override
    public void save(Memory memory) {
        List<Memory> memories = document.getMemories();
        for (Memory other : memories) {
            if (other.getKey().equals(memory.getKey()) && !other.getId().equals(memory.getId())) {
                throw new IllegalStateException("Key already used by another memory: " + memory.getKey());
            }
        }
        for (int i = 0; i < memories.size(); i++) {
            if (memories.get(i).getId().equals(memory.getId())) {
                memories.set(i, copy(memory));
                changed = true;
                return;
            }
        }
        memories.add(copy(memory));
        changed = true;
    }

    @Override
    public boolean delete(String memoryId) {
        boolean removed = document.getMemories().removeIf(memory -> memory.getId().equals(memoryId));
        if (removed) {
            document.getVersions().removeIf(version -> version.getMemoryId().equals(memoryId));
            changed = true;
        }
        return removed;
    }

    @Override
    public List<MemoryVersion> versions(String memoryId) {
        return document.getVersions().stream()
                .filter(version -> version.getMemoryId().equals(memoryId))
                .sorted(NEWEST_FIRST)
                .map(JsonMemoryTransaction::copy)
                .toList();
    }

    @Override
    public Optional<MemoryVersion> version(String memoryId, int version) {
        return document.getVersions().stream()
                .filter(v -> v.getMemoryId().equals(memoryId) && v.getVersion() == version)
                .findFirst()
                .map(JsonMemoryTransaction::copy);
    }

    @Override
    public int latestVersion(String memoryId) {
        return document.getVersions().stream()
                .filter(version -> version.getMemoryId().equals(memoryId))
                .mapToInt(MemoryVersion::getVersion)
                .max()
                .orElse(0);
    }

    @Override
    public void appendVersion(MemoryVersion version) {
        if (version(version.getMemoryId(), version.getVersion()).isPresent()) {
            throw new IllegalStateException(
                    "Version " + version.getVersion() + " already exists for memory " + version.getMemoryId());
        }
        document.getVersions().add(copy(version));
        changed = true;
    }

    @Override
    public int trimVersions(String memoryId, int keep) {
        List<MemoryVersion> newest = versions(memoryId);
        if (newest.size() <= keep) {
            return 0;
        }
        int oldestKept = newest.get(keep - 1).getVersion();
        int removed = 0;
        Iterator<MemoryVersion> it = document.getVersions().iterator();
        while (it.hasNext()) {
            MemoryVersion version = it.next();
            if (version.getMemoryId().equals(memoryId) && version.getVersion() < oldestKept) {
                it.remove();
                removed++;
            }
        }
        changed = changed || removed > 0;
        return removed;
    }

    static Memory copy(Memory memory) {
        return memory.toBuilder()
                .metadata(memory.getMetadata() != null ? new LinkedHashMap<>(memory.getMetadata())
                        : new LinkedHashMap<>())
                .tags(memory.getTags() != null ? new LinkedHashSet<>(memory.getTags()) : new LinkedHashSet<>())
                .relatedKeys(memory.getRelatedKeys() != null ? new LinkedHashSet<>(memory.getRelatedKeys())
                        : new LinkedHashSet<>())
                .build();
    }

    private static MemoryVersion copy(MemoryVersion version) {
        return MemoryVersion.builder()
                .memoryId(version.getMemoryId())
                .version(version.getVersion())
                .content(version.getContent())
                .metadata(version.getMetadata() != null ? new LinkedHashMap<>(version.getMetadata())
                        : new LinkedHashMap<>())
                .changedBy(version.getChangedBy())
                .changeType(version.getChangeType())
                .createdAt(version.getCreatedAt())
                .build();
    }
}
