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
import me.golemcore.memory.domain.exception.InsufficientHistoryException;
import me.golemcore.memory.domain.exception.InvalidMemoryArgumentException;
import me.golemcore.memory.domain.exception.MemoryConflictException;
import me.golemcore.memory.domain.exception.MemoryNotFoundException;
import me.golemcore.memory.domain.model.BatchAction;
import me.golemcore.memory.domain.model.BatchCommand;
import me.golemcore.memory.domain.model.BatchResult;
import me.golemcore.memory.domain.model.DiffLine;
import me.golemcore.memory.domain.model.DiffResult;
import me.golemcore.memory.domain.model.Memory;
import me.golemcore.memory.domain.model.MemoryChangedEvent;
import me.golemcore.memory.domain.model.MemoryChangedEvent.ChangeKind;
import me.golemcore.memory.domain.model.MemoryScope;
import me.golemcore.memory.domain.model.MemoryVersion;
import me.golemcore.memory.domain.model.MemoryVersion.ChangeType;
import me.golemcore.memory.domain.model.ProjectRef;
import me.golemcore.memory.domain.model.QuotaSnapshot;
import me.golemcore.memory.domain.model.RollbackResult;
import me.golemcore.memory.domain.model.StoreCommand;
import me.golemcore.memory.domain.model.StoreResult;
import me.golemcore.memory.infrastructure.config.MemoryStoreProperties;
import me.golemcore.memory.port.outbound.MemoryEventPort;
import me.golemcore.memory.port.outbound.MemoryRepositoryPort;
import me.golemcore.memory.port.outbound.MemoryTransaction;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Versioned key/value store of project memories.
 *
 * <p>
 * Every mutation runs inside a per-project transaction of the
 * {@link MemoryRepositoryPort}: the existing record is read, its pre-mutation
 * state is snapshotted as a new {@link MemoryVersion}, and the new state is
 * written as one unit. Change notifications are published only after the
 * transaction has committed and never fail the operation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryRecordService {

    public static final int MAX_BATCH_KEYS = 100;

    private final MemoryRepositoryPort memoryRepository;
    private final MemoryQuotaService quotaService;
    private final MemoryAccessTracker accessTracker;
    private final MemoryEventPort eventPort;
    private final MemoryStoreProperties properties;
    private final Clock clock;

    // ==================== STORE ====================

    /**
     * Create or update the memory with the command's key. Omitted fields of
     * an update keep their current values. Re-storing an archived key
     * unarchives it.
     */
    public StoreResult store(ProjectRef project, StoreCommand command) {
        validate(command);
        return storeDecided(project, command.getKey(), current -> command)
                .orElseThrow(() -> new IllegalStateException("Unconditional store wrote nothing"));
    }

    /**
     * Store whose command is chosen inside the write transaction, from the
     * record as it stands there. No other write to the project can land
     * between the decision and the write. The decider returns {@code null} to
     * leave the memory untouched, in which case the result is empty.
     */
    public Optional<StoreResult> storeDecided(ProjectRef project, String key,
            Function<Optional<Memory>, StoreCommand> decider) {
        MemoryValidationSupport.requireKey(key);

        QuotaSnapshot quota = null;
        if (memoryRepository.findByKey(project.projectId(), key).isEmpty()) {
            quota = quotaService.checkCreate(project);
        }

        AppliedStore applied = memoryRepository.inTransaction(project.projectId(), tx -> {
            Optional<Memory> existing = tx.findByKey(key);
            StoreCommand command = decider.apply(existing);
            if (command == null) {
                return null;
            }
            validate(command);
            if (!key.equals(command.getKey())) {
                throw new InvalidMemoryArgumentException("Decided command targets key " + command.getKey()
                        + " instead of " + key);
            }
            StoreResult result = existing.isPresent() ? applyUpdate(tx, existing.get(), command)
                    : create(tx, project, command);
            return new AppliedStore(command, result);
        });
        if (applied == null) {
            return Optional.empty();
        }
        StoreResult result = applied.result();
        result.setQuota(quota);

        log.info("[MemoryStore] {} {}/{} (v{})", result.isCreated() ? "Created" : "Updated",
                project.projectId(), key, result.getVersion());
        publishQuietly(result.isCreated() ? ChangeKind.CREATED : ChangeKind.UPDATED, project, key,
                applied.command().getActorId(), result.getVersion());
        return Optional.of(result);
    }

    private record AppliedStore(StoreCommand command, StoreResult result) {
    }

    /**
     * Update an existing memory only if its revision still equals
     * {@code expectedRevision}.
     */
    public StoreResult updateIfMatch(ProjectRef project, long expectedRevision, StoreCommand command) {
        validate(command);
        String key = command.getKey();
        StoreResult result = memoryRepository.inTransaction(project.projectId(), tx -> {
            Memory existing = tx.findByKey(key).orElseThrow(() -> MemoryNotFoundException.forKey(key));
            requireRevision(existing, expectedRevision);
            return applyUpdate(tx, existing, command);
        });
        log.info("[MemoryStore] Updated {}/{} at revision {}", project.projectId(), key, expectedRevision);
        publishQuietly(ChangeKind.UPDATED, project, key, command.getActorId(), result.getVersion());
        return result;
    }

    private StoreResult create(MemoryTransaction tx, ProjectRef project, StoreCommand command) {
        MemoryValidationSupport.requireContent(command.getContent());
        Instant now = clock.instant();
        Memory memory = Memory.builder()
                .id(UUID.randomUUID().toString())
                .orgId(project.orgId())
                .projectId(project.projectId())
                .key(command.getKey())
                .content(command.getContent())
                .metadata(command.getMetadata() != null ? new LinkedHashMap<>(command.getMetadata())
                        : new LinkedHashMap<>())
                .tags(command.getTags() != null ? new LinkedHashSet<>(command.getTags()) : new LinkedHashSet<>())
                .scope(command.getScope() != null ? command.getScope() : MemoryScope.PROJECT)
                .priority(command.getPriority() != null ? command.getPriority() : Memory.MIN_PRIORITY)
                .expiresAt(command.getExpiresAt())
                .createdBy(command.getActorId())
                .createdAt(now)
                .updatedAt(now)
                .revision(1)
                .build();
        tx.save(memory);
        tx.appendVersion(snapshot(memory, 1, ChangeType.CREATED, command.getActorId(), now));
        return StoreResult.builder().memory(memory).created(true).version(1).build();
    }

    private StoreResult applyUpdate(MemoryTransaction tx, Memory existing, StoreCommand command) {
        Instant now = clock.instant();
        int version = tx.latestVersion(existing.getId()) + 1;
        tx.appendVersion(snapshot(existing, version, ChangeType.UPDATED, command.getActorId(), now));

        Memory updated = existing.toBuilder().build();
        if (command.getContent() != null) {
            updated.setContent(command.getContent());
        }
        if (command.getMetadata() != null) {
            updated.setMetadata(new LinkedHashMap<>(command.getMetadata()));
        }
        if (command.getPriority() != null) {
            updated.setPriority(command.getPriority());
        }
        if (command.getTags() != null) {
            updated.setTags(new LinkedHashSet<>(command.getTags()));
        }
        if (command.getExpiresAt() != null) {
            updated.setExpiresAt(command.getExpiresAt());
        }
        if (command.getScope() != null) {
            updated.setScope(command.getScope());
        }
        if (updated.getArchivedAt() != null) {
            log.debug("[MemoryStore] Unarchiving {}/{} on re-store", existing.getProjectId(), existing.getKey());
            updated.setArchivedAt(null);
        }
        touch(updated, now);
        tx.save(updated);
        return StoreResult.builder().memory(updated).created(false).version(version).build();
    }

    // ==================== READ ====================

    /**
     * Read a memory and record the access in the background.
     */
    public Memory get(ProjectRef project, String key, boolean includeArchived) {
        MemoryValidationSupport.requireKey(key);
        Memory memory = memoryRepository.findByKey(project.projectId(), key)
                .filter(found -> includeArchived || found.isActive())
                .orElseThrow(() -> MemoryNotFoundException.forKey(key));
        accessTracker.recordAccess(project.projectId(), key);
        return memory;
    }

    /**
     * Look up a memory without counting it as an access.
     */
    public Optional<Memory> find(ProjectRef project, String key) {
        return memoryRepository.findByKey(project.projectId(), key);
    }

    public List<Memory> list(ProjectRef project, boolean includeArchived, String tag) {
        List<Memory> result = new ArrayList<>();
        for (Memory memory : memoryRepository.findAll(project.projectId())) {
            if (!includeArchived && !memory.isActive()) {
                continue;
            }
            if (tag != null && !memory.getTags().contains(tag)) {
                continue;
            }
            result.add(memory);
        }
        return result;
    }

    public List<MemoryVersion> listVersions(ProjectRef project, String key) {
        MemoryValidationSupport.requireKey(key);
        return memoryRepository.inTransaction(project.projectId(), tx -> {
            Memory memory = tx.findByKey(key).orElseThrow(() -> MemoryNotFoundException.forKey(key));
            return tx.versions(memory.getId());
        });
    }

    // ==================== DELETE ====================

    /**
     * Hard-delete a memory with its versions. Links pointing at it are
     * removed from the partner memories.
     */
    public void delete(ProjectRef project, String key, String actorId) {
        MemoryValidationSupport.requireKey(key);
        memoryRepository.inTransaction(project.projectId(), tx -> {
            Memory existing = tx.findByKey(key).orElseThrow(() -> MemoryNotFoundException.forKey(key));
            deleteWithLinks(tx, existing);
            return null;
        });
        log.info("[MemoryStore] Deleted {}/{}", project.projectId(), key);
        publishQuietly(ChangeKind.DELETED, project, key, actorId, null);
    }

    public void deleteIfMatch(ProjectRef project, String key, long expectedRevision, String actorId) {
        MemoryValidationSupport.requireKey(key);
        memoryRepository.inTransaction(project.projectId(), tx -> {
            Memory existing = tx.findByKey(key).orElseThrow(() -> MemoryNotFoundException.forKey(key));
            requireRevision(existing, expectedRevision);
            deleteWithLinks(tx, existing);
            return null;
        });
        log.info("[MemoryStore] Deleted {}/{} at revision {}", project.projectId(), key, expectedRevision);
        publishQuietly(ChangeKind.DELETED, project, key, actorId, null);
    }

    /**
     * Delete inside an open transaction, detaching the memory from its link
     * partners. Shared with the lifecycle policies.
     */
    static void deleteWithLinks(MemoryTransaction tx, Memory memory) {
        for (String partnerKey : memory.getRelatedKeys()) {
            tx.findByKey(partnerKey).ifPresent(partner -> {
                Memory copy = partner.toBuilder().relatedKeys(new LinkedHashSet<>(partner.getRelatedKeys())).build();
                if (copy.getRelatedKeys().remove(memory.getKey())) {
                    copy.setRevision(copy.getRevision() + 1);
                    tx.save(copy);
                }
            });
        }
        tx.delete(memory.getId());
    }

    // ==================== HISTORY ====================

    /**
     * Undo the last {@code steps} edits. The current state is snapshotted as a
     * {@code restored} version first, so the rollback can itself be undone.
     */
    public RollbackResult rollback(ProjectRef project, String key, int steps, String actorId, Instant deadline) {
        MemoryValidationSupport.requireKey(key);
        int maxSteps = properties.getLifecycle().getMaxRollbackSteps();
        if (steps < 1 || steps > maxSteps) {
            throw new InvalidMemoryArgumentException("steps must be between 1 and " + maxSteps);
        }
        MemoryValidationSupport.requireDeadlineNotPassed(clock, deadline, "rollback");

        RollbackResult result = memoryRepository.inTransaction(project.projectId(), tx -> {
            Memory existing = tx.findByKey(key).orElseThrow(() -> MemoryNotFoundException.forKey(key));
            List<MemoryVersion> versions = tx.versions(existing.getId());
            if (versions.size() < steps + 1) {
                throw new InsufficientHistoryException(key, versions.size(), steps);
            }
            // Version n holds the state that edit n replaced.
            MemoryVersion target = versions.get(steps - 1);
            MemoryValidationSupport.requireDeadlineNotPassed(clock, deadline, "rollback");

            Instant now = clock.instant();
            int newVersion = versions.get(0).getVersion() + 1;
            tx.appendVersion(snapshot(existing, newVersion, ChangeType.RESTORED, actorId, now));

            Memory restored = existing.toBuilder()
                    .content(target.getContent())
                    .metadata(target.getMetadata() != null ? new LinkedHashMap<>(target.getMetadata())
                            : new LinkedHashMap<>())
                    .build();
            touch(restored, now);
            tx.save(restored);

            return RollbackResult.builder()
                    .key(key)
                    .rolledBackTo(target.getVersion())
                    .stepsBack(steps)
                    .newVersion(newVersion)
                    .previousContent(existing.getContent())
                    .restoredContent(target.getContent())
                    .memory(restored)
                    .build();
        });

        log.info("[MemoryStore] Rolled back {}/{} {} step(s) to v{}", project.projectId(), key, steps,
                result.getRolledBackTo());
        publishQuietly(ChangeKind.RESTORED, project, key, actorId, result.getNewVersion());
        return result;
    }

    /**
     * Line diff of version {@code fromVersion} against version
     * {@code toVersion}, or against the current content when it is null.
     */
    public DiffResult diff(ProjectRef project, String key, int fromVersion, Integer toVersion, Instant deadline) {
        MemoryValidationSupport.requireKey(key);
        MemoryValidationSupport.requireDeadlineNotPassed(clock, deadline, "diff");

        String[] contents = memoryRepository.inTransaction(project.projectId(), tx -> {
            Memory memory = tx.findByKey(key).orElseThrow(() -> MemoryNotFoundException.forKey(key));
            String before = versionContent(tx, memory, fromVersion);
            String after = toVersion != null ? versionContent(tx, memory, toVersion) : memory.getContent();
            return new String[] { before, after };
        });

        List<DiffLine> lines = LineDiffSupport.computeLineDiff(contents[0], contents[1],
                () -> MemoryValidationSupport.requireDeadlineNotPassed(clock, deadline, "diff"));

        int added = 0;
        int removed = 0;
        int unchanged = 0;
        for (DiffLine line : lines) {
            switch (line.type()) {
            case ADD -> added++;
            case REMOVE -> removed++;
            case SAME -> unchanged++;
            }
        }
        return DiffResult.builder()
                .key(key)
                .from("v" + fromVersion)
                .to(toVersion != null ? "v" + toVersion : "current")
                .lines(lines)
                .added(added)
                .removed(removed)
                .unchanged(unchanged)
                .build();
    }

    private static String versionContent(MemoryTransaction tx, Memory memory, int version) {
        return tx.version(memory.getId(), version)
                .map(MemoryVersion::getContent)
                .orElseThrow(() -> new MemoryNotFoundException("Version " + version + " not found"));
    }

    // ==================== FLAGS, FEEDBACK, LINKS ====================

    public Memory pin(ProjectRef project, String key, boolean pinned, String actorId) {
        Memory memory = mutate(project, key, true, (existing, now) -> {
            if (existing.isPinned() == pinned) {
                return false;
            }
            existing.setPinnedAt(pinned ? now : null);
            return true;
        });
        publishQuietly(pinned ? ChangeKind.PINNED : ChangeKind.UNPINNED, project, key, actorId, null);
        return memory;
    }

    /**
     * Archive or unarchive explicitly. Unarchiving brings back an existing
     * key and is not gated by the quota.
     */
    public Memory archive(ProjectRef project, String key, boolean archived, String actorId) {
        Memory memory = mutate(project, key, true, (existing, now) -> {
            if (existing.isActive() != archived) {
                return false;
            }
            existing.setArchivedAt(archived ? now : null);
            return true;
        });
        publishQuietly(archived ? ChangeKind.ARCHIVED : ChangeKind.UNARCHIVED, project, key, actorId, null);
        return memory;
    }

    public Memory recordFeedback(ProjectRef project, String key, boolean helpful, String actorId) {
        Memory memory = mutate(project, key, false, (existing, now) -> {
            if (helpful) {
                existing.setHelpfulCount(existing.getHelpfulCount() + 1);
            } else {
                existing.setUnhelpfulCount(existing.getUnhelpfulCount() + 1);
            }
            return true;
        });
        publishQuietly(ChangeKind.FEEDBACK, project, key, actorId, null);
        return memory;
    }

    /**
     * Link two memories in both directions.
     */
    public Memory link(ProjectRef project, String key, String relatedKey, String actorId) {
        return updateLink(project, key, relatedKey, true, actorId);
    }

    public Memory unlink(ProjectRef project, String key, String relatedKey, String actorId) {
        return updateLink(project, key, relatedKey, false, actorId);
    }

    private Memory updateLink(ProjectRef project, String key, String relatedKey, boolean linked, String actorId) {
        MemoryValidationSupport.requireKey(key);
        MemoryValidationSupport.requireKey(relatedKey);
        if (key.equals(relatedKey)) {
            throw new InvalidMemoryArgumentException("A memory cannot be linked to itself");
        }
        Memory result = memoryRepository.inTransaction(project.projectId(), tx -> {
            Memory source = tx.findByKey(key).orElseThrow(() -> MemoryNotFoundException.forKey(key));
            Memory target = tx.findByKey(relatedKey).orElseThrow(() -> MemoryNotFoundException.forKey(relatedKey));
            Instant now = clock.instant();
            Memory updatedSource = withLink(source, relatedKey, linked, now);
            Memory updatedTarget = withLink(target, key, linked, now);
            if (updatedSource != source) {
                tx.save(updatedSource);
            }
            if (updatedTarget != target) {
                tx.save(updatedTarget);
            }
            return updatedSource;
        });
        publishQuietly(ChangeKind.LINKED, project, key, actorId, null);
        return result;
    }

    private static Memory withLink(Memory memory, String otherKey, boolean linked, Instant now) {
        Memory copy = memory.toBuilder().relatedKeys(new LinkedHashSet<>(memory.getRelatedKeys())).build();
        boolean changed = linked ? copy.getRelatedKeys().add(otherKey) : copy.getRelatedKeys().remove(otherKey);
        if (!changed) {
            return memory;
        }
        touch(copy, now);
        return copy;
    }

    // ==================== BATCH ====================

    /**
     * Apply one action to up to {@value #MAX_BATCH_KEYS} keys in a single
     * transaction. Missing keys are skipped; when none exists the batch fails
     * with not found. Memories already in the requested state are matched but
     * not counted as affected.
     */
    public BatchResult batch(ProjectRef project, BatchCommand command) {
        List<String> keys = validateBatch(command);
        BatchAction action = command.getAction();

        BatchOutcome outcome = memoryRepository.inTransaction(project.projectId(), tx -> {
            Instant now = clock.instant();
            int matched = 0;
            List<String> changed = new ArrayList<>();
            for (String key : keys) {
                Optional<Memory> existing = tx.findByKey(key);
                if (existing.isEmpty()) {
                    continue;
                }
                matched++;
                if (applyBatchAction(tx, existing.get(), command, now)) {
                    changed.add(key);
                }
            }
            if (matched == 0) {
                throw new MemoryNotFoundException("No matching memories found");
            }
            return new BatchOutcome(matched, changed);
        });

        log.info("[MemoryStore] Batch {} on {}: {} requested, {} matched, {} changed", action.wireName(),
                project.projectId(), keys.size(), outcome.matched(), outcome.changed().size());
        ChangeKind kind = changeKindOf(action);
        for (String key : outcome.changed()) {
            publishQuietly(kind, project, key, command.getActorId(), null);
        }
        return new BatchResult(action, keys.size(), outcome.matched(), outcome.changed().size());
    }

    private static boolean applyBatchAction(MemoryTransaction tx, Memory memory, BatchCommand command,
            Instant now) {
        if (command.getAction() == BatchAction.DELETE) {
            deleteWithLinks(tx, memory);
            return true;
        }
        Memory copy = memory.toBuilder().tags(new LinkedHashSet<>(memory.getTags())).build();
        BatchAction action = command.getAction();
        boolean changed = switch (action) {
        case ARCHIVE, UNARCHIVE -> {
            boolean archive = action == BatchAction.ARCHIVE;
            if (memory.isActive() != archive) {
                yield false;
            }
            copy.setArchivedAt(archive ? now : null);
            yield true;
        }
        case PIN, UNPIN -> {
            boolean pin = action == BatchAction.PIN;
            if (memory.isPinned() == pin) {
                yield false;
            }
            copy.setPinnedAt(pin ? now : null);
            yield true;
        }
        case SET_PRIORITY -> {
            boolean differs = memory.getPriority() != command.getPriority();
            copy.setPriority(command.getPriority());
            yield differs;
        }
        case ADD_TAGS -> {
            boolean added = copy.getTags().addAll(command.getTags());
            MemoryValidationSupport.validateTags(copy.getTags());
            yield added;
        }
        case SET_SCOPE -> {
            boolean differs = memory.getScope() != command.getScope();
            copy.setScope(command.getScope());
            yield differs;
        }
        case DELETE -> throw new IllegalStateException("delete is handled before copying");
        };
        if (!changed) {
            return false;
        }
        touch(copy, now);
        tx.save(copy);
        return true;
    }

    private static ChangeKind changeKindOf(BatchAction action) {
        return switch (action) {
        case ARCHIVE -> ChangeKind.ARCHIVED;
        case UNARCHIVE -> ChangeKind.UNARCHIVED;
        case DELETE -> ChangeKind.DELETED;
        case PIN -> ChangeKind.PINNED;
        case UNPIN -> ChangeKind.UNPINNED;
        case SET_PRIORITY, ADD_TAGS, SET_SCOPE -> ChangeKind.UPDATED;
        };
    }

    private static List<String> validateBatch(BatchCommand command) {
        if (command == null || command.getAction() == null) {
            throw new InvalidMemoryArgumentException("batch action is required");
        }
        List<String> keys = command.getKeys();
        if (keys == null || keys.isEmpty() || keys.size() > MAX_BATCH_KEYS) {
            throw new InvalidMemoryArgumentException("keys must have 1-" + MAX_BATCH_KEYS + " entries");
        }
        keys.forEach(MemoryValidationSupport::requireKey);
        switch (command.getAction()) {
        case SET_PRIORITY -> {
            if (command.getPriority() == null) {
                throw new InvalidMemoryArgumentException("priority is required for set_priority");
            }
            MemoryValidationSupport.validatePriority(command.getPriority());
        }
        case ADD_TAGS -> {
            if (command.getTags() == null || command.getTags().isEmpty()) {
                throw new InvalidMemoryArgumentException("tags are required for add_tags");
            }
            MemoryValidationSupport.validateTags(command.getTags());
        }
        case SET_SCOPE -> {
            if (command.getScope() == null) {
                throw new InvalidMemoryArgumentException("scope is required for set_scope");
            }
        }
        default -> {
            // no value to check
        }
        }
        return List.copyOf(new LinkedHashSet<>(keys));
    }

    private record BatchOutcome(int matched, List<String> changed) {
    }

    @FunctionalInterface
    private interface MemoryMutation {
        boolean apply(Memory memory, Instant now);
    }

    private Memory mutate(ProjectRef project, String key, boolean bumpRevision, MemoryMutation mutation) {
        MemoryValidationSupport.requireKey(key);
        return memoryRepository.inTransaction(project.projectId(), tx -> {
            Memory existing = tx.findByKey(key).orElseThrow(() -> MemoryNotFoundException.forKey(key));
            Memory copy = existing.toBuilder().build();
            Instant now = clock.instant();
            if (!mutation.apply(copy, now)) {
                return existing;
            }
            if (bumpRevision) {
                touch(copy, now);
            }
            tx.save(copy);
            return copy;
        });
    }

    // ==================== HELPERS ====================

    private static void validate(StoreCommand command) {
        if (command == null) {
            throw new InvalidMemoryArgumentException("store command is required");
        }
        MemoryValidationSupport.requireKey(command.getKey());
        MemoryValidationSupport.validateContent(command.getContent());
        MemoryValidationSupport.validatePriority(command.getPriority());
        MemoryValidationSupport.validateTags(command.getTags());
    }

    private static void requireRevision(Memory existing, long expectedRevision) {
        if (existing.getRevision() != expectedRevision) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("key", existing.getKey());
            details.put("expectedRevision", expectedRevision);
            details.put("currentRevision", existing.getRevision());
            details.put("currentUpdatedAt", String.valueOf(existing.getUpdatedAt()));
            details.put("currentContent", existing.getContent());
            throw new MemoryConflictException(
                    "Memory '" + existing.getKey() + "' was modified (revision " + existing.getRevision()
                            + ", expected " + expectedRevision + ")",
                    details);
        }
    }

    static void touch(Memory memory, Instant now) {
        memory.setUpdatedAt(now);
        bumpRevision(memory);
    }

    /**
     * Marks a maintenance change. {@code updatedAt} stays put so timestamp
     * checks and recency scoring only see client edits.
     */
    static void bumpRevision(Memory memory) {
        memory.setRevision(memory.getRevision() + 1);
    }

    private static MemoryVersion snapshot(Memory memory, int version, ChangeType type, String actorId,
            Instant now) {
        return MemoryVersion.builder()
                .memoryId(memory.getId())
                .version(version)
                .content(memory.getContent())
                .metadata(memory.getMetadata() != null ? new LinkedHashMap<>(memory.getMetadata())
                        : new LinkedHashMap<>())
                .changedBy(actorId)
                .changeType(type)
                .createdAt(now)
                .build();
    }

    private void publishQuietly(ChangeKind kind, ProjectRef project, String key, String actorId, Integer version) {
        try {
            eventPort.publish(new MemoryChangedEvent(kind, project.orgId(), project.projectId(), key, actorId,
                    version, clock.instant()));
        } catch (RuntimeException e) {
            log.warn("[MemoryStore] Change notification {} for {}/{} failed: {}", kind, project.projectId(), key,
                    e.getMessage());
        }
    }
}
