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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.exception.ForbiddenOperationException;
import me.golemcore.memory.domain.exception.InvalidMemoryArgumentException;
import me.golemcore.memory.domain.exception.MemoryNotFoundException;
import me.golemcore.memory.domain.model.LockResult;
import me.golemcore.memory.domain.model.MemoryLock;
import me.golemcore.memory.infrastructure.config.MemoryStoreProperties;
import me.golemcore.memory.port.outbound.LockRepositoryPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Advisory, TTL-bounded locks on memory keys. The record store never consults
 * them; cooperating writers acquire before writing and release afterwards.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryLockService {

    private final LockRepositoryPort lockRepository;
    private final MemoryStoreProperties properties;
    private final Clock clock;

    public LockResult acquire(String projectId, String key, String holder, Integer ttlSeconds) {
        MemoryValidationSupport.requireKey(key);
        int ttl = resolveTtl(ttlSeconds);
        Instant now = clock.instant();

        LockResult result = lockRepository.tryAcquire(projectId, key, normalizeHolder(holder), now,
                now.plusSeconds(ttl));
        if (result.acquired()) {
            log.debug("[Lock] Acquired {}/{} by {} for {}s", projectId, key, result.lock().getLockedBy(), ttl);
        } else {
            log.debug("[Lock] {}/{} already held by {} until {}", projectId, key,
                    result.lock().getLockedBy(), result.lock().getExpiresAt());
        }
        return result;
    }

    public void release(String projectId, String key, String holder) {
        MemoryValidationSupport.requireKey(key);
        MemoryLock existing = lockRepository.find(projectId, key)
                .orElseThrow(() -> new MemoryNotFoundException("No lock found for key: " + key));

        String requestedBy = normalizeHolder(holder);
        if (requestedBy != null && !requestedBy.equals(existing.getLockedBy())) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("lockedBy", existing.getLockedBy());
            details.put("requestedBy", requestedBy);
            throw new ForbiddenOperationException(
                    "Lock is held by \"" + existing.getLockedBy() + "\", not \"" + requestedBy + "\"", details);
        }

        if (!lockRepository.delete(projectId, key, existing.getId())) {
            throw new MemoryNotFoundException("No lock found for key: " + key);
        }
        log.debug("[Lock] Released {}/{}", projectId, key);
    }

    /**
     * Currently effective lock, ignoring expired ones.
     */
    public Optional<MemoryLock> findActive(String projectId, String key) {
        Instant now = clock.instant();
        return lockRepository.find(projectId, key).filter(lock -> !lock.isExpired(now));
    }

    public int purgeExpired(String projectId) {
        return lockRepository.deleteExpired(projectId, clock.instant());
    }

    private int resolveTtl(Integer ttlSeconds) {
        if (ttlSeconds == null) {
            return properties.getLocks().getDefaultTtlSeconds();
        }
        int max = properties.getLocks().getMaxTtlSeconds();
        if (ttlSeconds < 1 || ttlSeconds > max) {
            throw new InvalidMemoryArgumentException("ttlSeconds must be between 1 and " + max);
        }
        return ttlSeconds;
    }

    private static String normalizeHolder(String holder) {
        return holder == null || holder.isBlank() ? null : holder;
    }
}
