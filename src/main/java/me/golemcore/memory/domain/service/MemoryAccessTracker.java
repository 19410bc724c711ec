package me.golemcore.memory.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.AccessTally;
import me.golemcore.memory.port.outbound.MemoryRepositoryPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Records read access off the request path.
 *
 * <p>
 * Reads are tallied per project and written back in one document update. A
 * read that arrives while a project already has a pending batch joins that
 * batch instead of scheduling another write. Failures are logged and dropped;
 * a read never fails because its access counter could not be bumped.
 */
@Component
@Slf4j
public class MemoryAccessTracker {

    private final MemoryRepositoryPort memoryRepository;
    private final Clock clock;
    private final Executor flushExecutor;

    private final ConcurrentMap<String, PendingBatch> pending = new ConcurrentHashMap<>();

    @Autowired
    public MemoryAccessTracker(MemoryRepositoryPort memoryRepository, Clock clock) {
        this(memoryRepository, clock, ForkJoinPool.commonPool());
    }

    // Visible for testing
    MemoryAccessTracker(MemoryRepositoryPort memoryRepository, Clock clock, Executor flushExecutor) {
        this.memoryRepository = memoryRepository;
        this.clock = clock;
        this.flushExecutor = flushExecutor;
    }

    /**
     * Completes once the batch holding this read has been written back.
     */
    public CompletableFuture<Void> recordAccess(String projectId, String key) {
        AccessTally read = AccessTally.single(clock.instant());
        boolean[] opened = new boolean[1];
        PendingBatch batch = pending.compute(projectId, (id, current) -> {
            PendingBatch target = current;
            if (target == null) {
                target = new PendingBatch();
                opened[0] = true;
            }
            target.tallies.merge(key, read, AccessTally::plus);
            return target;
        });
        if (opened[0]) {
            CompletableFuture.runAsync(() -> flush(projectId), flushExecutor);
        }
        return batch.written;
    }

    private void flush(String projectId) {
        PendingBatch batch = pending.remove(projectId);
        if (batch == null) {
            return;
        }
        try {
            int updated = memoryRepository.recordAccesses(projectId, batch.tallies);
            if (updated < batch.tallies.size()) {
                log.debug("[MemoryStore] Access bump skipped {} deleted key(s) in {}",
                        batch.tallies.size() - updated, projectId);
            }
        } catch (RuntimeException e) {
            log.debug("[MemoryStore] Access bump failed for {} ({} keys): {}", projectId, batch.tallies.size(),
                    e.getMessage());
        } finally {
            batch.written.complete(null);
        }
    }

    /**
     * Tallies are only touched inside {@code pending.compute} or after the
     * batch has been removed from {@code pending}.
     */
    private static final class PendingBatch {
        private final Map<String, AccessTally> tallies = new HashMap<>();
        private final CompletableFuture<Void> written = new CompletableFuture<>();
    }
}
