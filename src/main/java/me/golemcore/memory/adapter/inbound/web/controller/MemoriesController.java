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
import me.golemcore.memory.domain.exception.InvalidMemoryArgumentException;
import me.golemcore.memory.domain.model.BatchAction;
import me.golemcore.memory.domain.model.BatchCommand;
import me.golemcore.memory.domain.model.BatchResult;
import me.golemcore.memory.domain.model.ConflictStrategy;
import me.golemcore.memory.domain.model.DiffResult;
import me.golemcore.memory.domain.model.DuplicateWarning;
import me.golemcore.memory.domain.model.Memory;
import me.golemcore.memory.domain.model.MemoryHealth;
import me.golemcore.memory.domain.model.MemoryScope;
import me.golemcore.memory.domain.model.MemoryVersion;
import me.golemcore.memory.domain.model.ProjectRef;
import me.golemcore.memory.domain.model.QuotaSnapshot;
import me.golemcore.memory.domain.model.RollbackResult;
import me.golemcore.memory.domain.model.SafeStoreResult;
import me.golemcore.memory.domain.model.StoreCommand;
import me.golemcore.memory.domain.model.StoreResult;
import me.golemcore.memory.domain.service.ConflictResolutionService;
import me.golemcore.memory.domain.service.DuplicateDetectionService;
import me.golemcore.memory.domain.service.MemoryQuotaService;
import me.golemcore.memory.domain.service.MemoryRecordService;
import me.golemcore.memory.domain.service.MemoryScoringService;
import me.golemcore.memory.domain.service.MemoryValidationSupport;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Memory record endpoints. The caller's org, project and actor arrive as
 * headers set by the authenticating gateway in front of this service. Keys
 * may contain slashes, so they are passed as the {@code key} query parameter
 * or in the request body rather than as path segments.
 */
@RestController
@RequestMapping("/api/v1/memories")
@RequiredArgsConstructor
public class MemoriesController {

    static final String ORG_HEADER = "X-Org-Id";
    static final String PROJECT_HEADER = "X-Project-Id";
    static final String ACTOR_HEADER = "X-Actor-Id";

    private final MemoryRecordService recordService;
    private final ConflictResolutionService conflictResolutionService;
    private final DuplicateDetectionService duplicateDetectionService;
    private final MemoryQuotaService quotaService;
    private final MemoryScoringService scoringService;
    private final Clock clock;

    // ==================== STORE ====================

    @PostMapping
    public Mono<ResponseEntity<StoreMemoryResponse>> store(
            @RequestHeader(ORG_HEADER) String orgId,
            @RequestHeader(PROJECT_HEADER) String projectId,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
            @RequestBody StoreMemoryRequest request) {
        return blocking(() -> {
            ProjectRef project = new ProjectRef(orgId, projectId);
            StoreCommand command = toCommand(request.key(), request.content(), request.metadata(),
                    request.priority(), request.tags(), request.expiresAt(), request.scope(), actorId);

            DuplicateWarning warning = null;
            if (command.getKey() != null && recordService.find(project, command.getKey()).isEmpty()) {
                warning = duplicateDetectionService.findSimilar(project, command.getKey(), command.getContent())
                        .orElse(null);
            }

            StoreResult result = recordService.store(project, command);
            StoreMemoryResponse body = new StoreMemoryResponse(result.getMemory(), result.isCreated(),
                    result.getVersion(), result.getQuota(), warning);
            return ResponseEntity.status(result.isCreated() ? HttpStatus.CREATED : HttpStatus.OK)
                    .eTag(etag(result.getMemory()))
                    .body(body);
        });
    }

    @PostMapping("/safe")
    public Mono<ResponseEntity<SafeStoreResult>> storeSafe(
            @RequestHeader(ORG_HEADER) String orgId,
            @RequestHeader(PROJECT_HEADER) String projectId,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
            @RequestBody SafeStoreRequest request) {
        return blocking(() -> {
            StoreCommand command = toCommand(request.key(), request.content(), request.metadata(),
                    request.priority(), request.tags(), request.expiresAt(), request.scope(), actorId);
            SafeStoreResult result = conflictResolutionService.storeSafe(new ProjectRef(orgId, projectId),
                    command, request.ifUnmodifiedSince(), ConflictStrategy.fromWireName(request.strategy()));
            HttpStatus status = result.isStored() ? HttpStatus.OK : HttpStatus.CONFLICT;
            return ResponseEntity.status(status).body(result);
        });
    }

    // ==================== READ ====================

    @GetMapping
    public Mono<ResponseEntity<List<Memory>>> list(
            @RequestHeader(ORG_HEADER) String orgId,
            @RequestHeader(PROJECT_HEADER) String projectId,
            @RequestParam(defaultValue = "false") boolean includeArchived,
            @RequestParam(required = false) String tag) {
        return blocking(() -> ResponseEntity.ok(
                recordService.list(new ProjectRef(orgId, projectId), includeArchived, tag)));
    }

    @GetMapping("/entry")
    public Mono<ResponseEntity<Memory>> get(
            @RequestHeader(ORG_HEADER) String orgId,
            @RequestHeader(PROJECT_HEADER) String projectId,
            @RequestParam String key,
            @RequestParam(defaultValue = "false") boolean includeArchived) {
        return blocking(() -> {
            Memory memory = recordService.get(new ProjectRef(orgId, projectId), key, includeArchived);
            return ResponseEntity.ok().eTag(etag(memory)).body(memory);
        });
    }

    @GetMapping("/versions")
    public Mono<ResponseEntity<List<MemoryVersion>>> versions(
            @RequestHeader(ORG_HEADER) String orgId,
            @RequestHeader(PROJECT_HEADER) String projectId,
            @RequestParam String key) {
        return blocking(() -> ResponseEntity.ok(recordService.listVersions(new ProjectRef(orgId, projectId), key)));
    }

    @GetMapping("/diff")
    public Mono<ResponseEntity<DiffResult>> diff(
            @RequestHeader(ORG_HEADER) String orgId,
            @RequestHeader(PROJECT_HEADER) String projectId,
            @RequestParam String key,
            @RequestParam int from,
            @RequestParam(required = false) Integer to,
            @RequestParam(required = false) Long timeoutMs) {
        return blocking(() -> ResponseEntity.ok(recordService.diff(new ProjectRef(orgId, projectId), key, from, to,
                deadline(timeoutMs))));
    }

    // ==================== UPDATE / DELETE ====================

    /**
     * Conditional update. {@code If-Match} carries the revision from the
     * memory's ETag.
     */
    @PatchMapping("/entry")
    public Mono<ResponseEntity<StoreResult>> update(
            @RequestHeader(ORG_HEADER) String orgId,
            @RequestHeader(PROJECT_HEADER) String projectId,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
            @RequestHeader(HttpHeaders.IF_MATCH) String ifMatch,
            @RequestParam String key,
            @RequestBody UpdateMemoryRequest request) {
        return blocking(() -> {
            StoreCommand command = toCommand(key, request.content(), request.metadata(), request.priority(),
                    request.tags(), request.expiresAt(), request.scope(), actorId);
            StoreResult result = recordService.updateIfMatch(new ProjectRef(orgId, projectId),
                    parseRevision(ifMatch), command);
            return ResponseEntity.ok().eTag(etag(result.getMemory())).body(result);
        });
    }

    @DeleteMapping("/entry")
    public Mono<ResponseEntity<Void>> delete(
            @RequestHeader(ORG_HEADER) String orgId,
            @RequestHeader(PROJECT_HEADER) String projectId,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
            @RequestHeader(value = HttpHeaders.IF_MATCH, required = false) String ifMatch,
            @RequestParam String key) {
        return blocking(() -> {
            ProjectRef project = new ProjectRef(orgId, projectId);
            if (ifMatch != null && !ifMatch.isBlank()) {
                recordService.deleteIfMatch(project, key, parseRevision(ifMatch), actorId);
            } else {
                recordService.delete(project, key, actorId);
            }
            return ResponseEntity.noContent().build();
        });
    }

    @PostMapping("/rollback")
    public Mono<ResponseEntity<RollbackResult>> rollback(
            @RequestHeader(ORG_HEADER) String orgId,
            @RequestHeader(PROJECT_HEADER) String projectId,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
            @RequestBody RollbackRequest request) {
        return blocking(() -> {
            int steps = request.steps() != null ? request.steps() : 1;
            return ResponseEntity.ok(recordService.rollback(new ProjectRef(orgId, projectId), request.key(), steps,
                    actorId, deadline(request.timeoutMs())));
        });
    }

    // ==================== FLAGS, FEEDBACK, LINKS ====================

    @PostMapping("/pin")
    public Mono<ResponseEntity<Memory>> pin(
            @RequestHeader(ORG_HEADER) String orgId,
            @RequestHeader(PROJECT_HEADER) String projectId,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
            @RequestParam String key,
            @RequestParam(defaultValue = "true") boolean pinned) {
        return blocking(() -> ResponseEntity.ok(
                recordService.pin(new ProjectRef(orgId, projectId), key, pinned, actorId)));
    }

    @PostMapping("/archive")
    public Mono<ResponseEntity<Memory>> archive(
            @RequestHeader(ORG_HEADER) String orgId,
            @RequestHeader(PROJECT_HEADER) String projectId,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
            @RequestParam String key,
            @RequestParam(defaultValue = "true") boolean archived) {
        return blocking(() -> ResponseEntity.ok(
                recordService.archive(new ProjectRef(orgId, projectId), key, archived, actorId)));
    }

    @PostMapping("/feedback")
    public Mono<ResponseEntity<Memory>> feedback(
            @RequestHeader(ORG_HEADER) String orgId,
            @RequestHeader(PROJECT_HEADER) String projectId,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
            @RequestBody FeedbackRequest request) {
        return blocking(() -> ResponseEntity.ok(recordService.recordFeedback(new ProjectRef(orgId, projectId),
                request.key(), request.helpful(), actorId)));
    }

    @PostMapping("/links")
    public Mono<ResponseEntity<Memory>> link(
            @RequestHeader(ORG_HEADER) String orgId,
            @RequestHeader(PROJECT_HEADER) String projectId,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
            @RequestBody LinkRequest request) {
        return blocking(() -> ResponseEntity.ok(recordService.link(new ProjectRef(orgId, projectId),
                request.key(), request.relatedKey(), actorId)));
    }

    @DeleteMapping("/links")
    public Mono<ResponseEntity<Memory>> unlink(
            @RequestHeader(ORG_HEADER) String orgId,
            @RequestHeader(PROJECT_HEADER) String projectId,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
            @RequestParam String key,
            @RequestParam String relatedKey) {
        return blocking(() -> ResponseEntity.ok(recordService.unlink(new ProjectRef(orgId, projectId), key,
                relatedKey, actorId)));
    }

    // ==================== BATCH ====================

    @PostMapping("/batch")
    public Mono<ResponseEntity<BatchResult>> batch(
            @RequestHeader(ORG_HEADER) String orgId,
            @RequestHeader(PROJECT_HEADER) String projectId,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actorId,
            @RequestBody BatchRequest request) {
        return blocking(() -> ResponseEntity.ok(
                recordService.batch(new ProjectRef(orgId, projectId), toBatchCommand(request, actorId))));
    }

    // ==================== CAPACITY & HEALTH ====================

    @GetMapping("/capacity")
    public Mono<ResponseEntity<QuotaSnapshot>> capacity(
            @RequestHeader(ORG_HEADER) String orgId,
            @RequestHeader(PROJECT_HEADER) String projectId) {
        return blocking(() -> ResponseEntity.ok(quotaService.snapshot(new ProjectRef(orgId, projectId))));
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<List<MemoryHealth>>> health(
            @RequestHeader(ORG_HEADER) String orgId,
            @RequestHeader(PROJECT_HEADER) String projectId,
            @RequestParam(defaultValue = "50") int limit) {
        return blocking(() -> {
            List<Memory> active = recordService.list(new ProjectRef(orgId, projectId), false, null);
            return ResponseEntity.ok(scoringService.report(active, clock.instant(), limit));
        });
    }

    // ==================== HELPERS ====================

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }

    private static StoreCommand toCommand(String key, String content, Map<String, Object> metadata,
            Integer priority, Set<String> tags, Instant expiresAt, String scope, String actorId) {
        return StoreCommand.builder()
                .key(key)
                .content(content)
                .metadata(metadata)
                .priority(priority)
                .tags(tags)
                .expiresAt(expiresAt)
                .scope(scope != null ? MemoryScope.fromWireName(scope) : null)
                .actorId(actorId)
                .build();
    }

    /**
     * {@code value} is untyped on the wire; its expected shape depends on the
     * action.
     */
    static BatchCommand toBatchCommand(BatchRequest request, String actorId) {
        BatchAction action = BatchAction.fromWireName(request.action());
        BatchCommand.BatchCommandBuilder command = BatchCommand.builder()
                .keys(request.keys())
                .action(action)
                .actorId(actorId);
        Object value = request.value();
        switch (action) {
        case SET_PRIORITY -> {
            if (!(value instanceof Integer priority)) {
                throw new InvalidMemoryArgumentException("value must be an integer 0-100 for set_priority");
            }
            command.priority(priority);
        }
        case ADD_TAGS -> {
            if (!(value instanceof List<?> list) || !list.stream().allMatch(String.class::isInstance)) {
                throw new InvalidMemoryArgumentException("value must be a string[] for add_tags");
            }
            Set<String> tags = new LinkedHashSet<>();
            list.forEach(tag -> tags.add((String) tag));
            command.tags(tags);
        }
        case SET_SCOPE -> {
            if (!"project".equals(value) && !"shared".equals(value)) {
                throw new InvalidMemoryArgumentException("value must be 'project' or 'shared' for set_scope");
            }
            command.scope(MemoryScope.fromWireName((String) value));
        }
        default -> {
            // archive, unarchive, delete, pin and unpin take no value
        }
        }
        return command.build();
    }

    private Instant deadline(Long timeoutMs) {
        return MemoryValidationSupport.deadlineAfter(clock, timeoutMs);
    }

    static String etag(Memory memory) {
        return "\"" + memory.getRevision() + "\"";
    }

    static long parseRevision(String ifMatch) {
        String value = ifMatch.trim();
        if (value.startsWith("W/")) {
            value = value.substring(2);
        }
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            value = value.substring(1, value.length() - 1);
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new InvalidMemoryArgumentException("If-Match must carry a memory revision, got: " + ifMatch);
        }
    }

    public record StoreMemoryRequest(String key, String content, Map<String, Object> metadata, Integer priority,
            Set<String> tags, Instant expiresAt, String scope) {
    }

    public record UpdateMemoryRequest(String content, Map<String, Object> metadata, Integer priority,
            Set<String> tags, Instant expiresAt, String scope) {
    }

    public record SafeStoreRequest(String key, String content, Map<String, Object> metadata, Integer priority,
            Set<String> tags, Instant expiresAt, String scope, Instant ifUnmodifiedSince, String strategy) {
    }

    public record RollbackRequest(String key, Integer steps, Long timeoutMs) {
    }

    public record BatchRequest(List<String> keys, String action, Object value) {
    }

    public record FeedbackRequest(String key, boolean helpful) {
    }

    public record LinkRequest(String key, String relatedKey) {
    }

    public record StoreMemoryResponse(Memory memory, boolean created, int version, QuotaSnapshot quota,
            DuplicateWarning duplicateWarning) {
    }
}
