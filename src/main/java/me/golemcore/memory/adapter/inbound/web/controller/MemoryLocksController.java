package me.golemcore.memory.adapter.inbound.web.controller;

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
import me.golemcore.memory.domain.model.LockResult;
import me.golemcore.memory.domain.model.MemoryLock;
import me.golemcore.memory.domain.service.MemoryLockService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;

/**
 * Advisory lock endpoints. A lock held by someone else is reported with 409
 * and the current holder, not as an error body.
 */
@RestController
@RequestMapping("/api/v1/memories/locks")
@RequiredArgsConstructor
public class MemoryLocksController {

    private final MemoryLockService lockService;

    @PostMapping
    public Mono<ResponseEntity<LockResponse>> acquire(
            @RequestHeader(MemoriesController.PROJECT_HEADER) String projectId,
            @RequestHeader(value = MemoriesController.ACTOR_HEADER, required = false) String actorId,
            @RequestBody AcquireLockRequest request) {
        return Mono.fromCallable(() -> {
            String holder = request.holder() != null ? request.holder() : actorId;
            LockResult result = lockService.acquire(projectId, request.key(), holder, request.ttlSeconds());
            HttpStatus status = result.acquired() ? HttpStatus.OK : HttpStatus.CONFLICT;
            return ResponseEntity.status(status).body(LockResponse.of(result.acquired(), result.lock()));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping
    public Mono<ResponseEntity<LockResponse>> get(
            @RequestHeader(MemoriesController.PROJECT_HEADER) String projectId,
            @RequestParam String key) {
        return Mono.fromCallable(() -> lockService.findActive(projectId, key)
                .map(lock -> ResponseEntity.ok(LockResponse.of(true, lock)))
                .orElseGet(() -> ResponseEntity.notFound().build()))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @DeleteMapping
    public Mono<ResponseEntity<Void>> release(
            @RequestHeader(MemoriesController.PROJECT_HEADER) String projectId,
            @RequestHeader(value = MemoriesController.ACTOR_HEADER, required = false) String actorId,
            @RequestParam String key,
            @RequestParam(required = false) String holder) {
        return Mono.fromCallable(() -> {
            lockService.release(projectId, key, holder != null ? holder : actorId);
            return ResponseEntity.noContent().<Void>build();
        }).subscribeOn(Schedulers.boundedElastic());
    }

    public record AcquireLockRequest(String key, String holder, Integer ttlSeconds) {
    }

    public record LockResponse(boolean acquired, String key, String lockedBy, Instant acquiredAt,
            Instant expiresAt) {

        static LockResponse of(boolean acquired, MemoryLock lock) {
            return new LockResponse(acquired, lock.getMemoryKey(), lock.getLockedBy(), lock.getAcquiredAt(),
                    lock.getExpiresAt());
        }
    }
}
