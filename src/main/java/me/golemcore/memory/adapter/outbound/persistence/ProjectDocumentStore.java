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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.port.outbound.StoragePort;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Per-project JSON documents on top of {@link StoragePort} with a write-through
 * cache.
 *
 * <p>
 * Updates are serialized per project and copy-on-write: the work runs on a
 * deep copy of the cached document, and only after the copy has been
 * persisted does it replace the cache entry. A failing update therefore leaves
 * both storage and cache untouched. Cached documents are never mutated after
 * publication, so reads need no lock.
 *
 * @param <D>
 *            document type
 */
@Slf4j
class ProjectDocumentStore<D> {

    private static final String EXTENSION = ".json";

    /**
     * Result of an update: the value handed back to the caller and whether the
     * document changed and must be written.
     */
    record Outcome<T>(T value, boolean changed) {
    }

    private final StoragePort storage;
    private final ObjectMapper objectMapper;
    private final String directory;
    private final Class<D> type;
    private final Function<String, D> emptyDocument;

    private final ConcurrentMap<String, D> cache = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    ProjectDocumentStore(StoragePort storage, ObjectMapper objectMapper, String directory, Class<D> type,
            Function<String, D> emptyDocument) {
        this.storage = storage;
        this.objectMapper = objectMapper;
        this.directory = directory;
        this.type = type;
        this.emptyDocument = emptyDocument;
    }

    <T> T read(String projectId, Function<D, T> reader) {
        D cached = cache.get(projectId);
        if (cached == null) {
            ReentrantLock lock = lockFor(projectId);
            lock.lock();
            try {
                cached = load(projectId);
            } finally {
                lock.unlock();
            }
        }
        return reader.apply(cached);
    }

    <T> T update(String projectId, Function<D, Outcome<T>> work) {
        ReentrantLock lock = lockFor(projectId);
        lock.lock();
        try {
            D working = objectMapper.convertValue(load(projectId), type);
            Outcome<T> outcome = work.apply(working);
            if (outcome.changed()) {
                persist(projectId, working);
                cache.put(projectId, working);
            }
            return outcome.value();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Projects with a stored or cached document.
     */
    Set<String> projectIds() {
        Set<String> ids = new LinkedHashSet<>(cache.keySet());
        List<String> files = join(storage.listObjects(directory, ""));
        for (String file : files) {
            if (file.endsWith(EXTENSION)) {
                ids.add(URLDecoder.decode(file.substring(0, file.length() - EXTENSION.length()),
                        StandardCharsets.UTF_8));
            }
        }
        return ids;
    }

    void invalidate(String projectId) {
        cache.remove(projectId);
        log.debug("[Storage] Invalidated cached {} document for project {}", directory, projectId);
    }

    private D load(String projectId) {
        D cached = cache.get(projectId);
        if (cached != null) {
            return cached;
        }
        String json = join(storage.getText(directory, fileName(projectId)));
        D document;
        if (json == null || json.isBlank()) {
            document = emptyDocument.apply(projectId);
        } else {
            try {
                document = objectMapper.readValue(json, type);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException(
                        "Corrupt " + directory + " document for project " + projectId, e);
            }
        }
        cache.put(projectId, document);
        return document;
    }

    private void persist(String projectId, D document) {
        String json;
        try {
            json = objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + directory + " document", e);
        }
        join(storage.putTextAtomic(directory, fileName(projectId), json, false));
    }

    private ReentrantLock lockFor(String projectId) {
        return locks.computeIfAbsent(projectId, id -> new ReentrantLock());
    }

    private static String fileName(String projectId) {
        return URLEncoder.encode(projectId, StandardCharsets.UTF_8) + EXTENSION;
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
