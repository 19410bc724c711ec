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

import me.golemcore.memory.domain.model.LockResult;
import me.golemcore.memory.domain.model.MemoryLock;

import java.time.Instant;
import java.util.Optional;

/**
 * Storage for advisory memory locks, unique per {@code (projectId, key)}.
 */
public interface LockRepositoryPort {

    /**
     * Compare-and-swap acquire: if no lock exists, or the existing one expired
     * before {@code now}, store a new lock and report it as acquired; otherwise
     * return the current holder untouched.
     */
    LockResult tryAcquire(String projectId, String key, String holder, Instant now, Instant expiresAt);

    Optional<MemoryLock> find(String projectId, String key);

    /**
     * Delete the lock only if it is still the one identified by
     * {@code lockId}.
     */
    boolean delete(String projectId, String key, String lockId);

    int deleteExpired(String projectId, Instant now);
}
