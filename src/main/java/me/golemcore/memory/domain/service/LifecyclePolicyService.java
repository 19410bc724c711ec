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
import me.golemcore.memory.domain.exception.InvalidMemoryArgumentException;
import me.golemcore.memory.domain.model.LifecycleParams;
import me.golemcore.memory.domain.model.LifecyclePolicy;
import me.golemcore.memory.domain.model.LifecycleRunResult;
import me.golemcore.memory.domain.model.Memory;
import me.golemcore.memory.domain.model.PolicyResult;
import me.golemcore.memory.domain.model.ProjectRef;
import me.golemcore.memory.infrastructure.config.MemoryStoreProperties;
import me.golemcore.memory.port.outbound.LockRepositoryPort;
import me.golemcore.memory.port.outbound.MemoryRepositoryPort;
import org.springframework.stereotype.Service;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Runs named maintenance policies over one project.
 *
 * <p>
 * Policies are independent: each runs in its own transaction, and a failure
 * is reported in that policy's result without stopping the rest of the batch.
 * Unknown names produce {@code affected = 0} with an explanation.
 *
 * <p>
 * Cleanup, prune, archive and purge policies settle after one run: a second
 * run over unchanged data affects nothing. {@code auto_promote} and
 * {@code auto_demote} move priority by one step per run, so repeated runs keep
 * stepping until the memory stops qualifying (promotion stops once priority
 * reaches 50, demotion at 0). Policy changes bump {@code revision} but leave
 * {@code updatedAt} alone.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LifecyclePolicyService {

    static final String TAG_PRUNED = "auto:pruned";
    static final String TAG_DECAYED = "auto:decayed";
    static final String TAG_MERGED = "auto:merged";
    static final String BRANCH_PLAN_PREFIX = "agent/context/branch_plan/";

    /**
     * Policies that only delete expired data or step priorities, so they can
     * run from a timer without review.
     */
    public static final List<String> SCHEDULED_POLICIES = List.of(
            LifecyclePolicy.CLEANUP_EXPIRED.wireName(),
            LifecyclePolicy.CLEANUP_EXPIRED_LOCKS.wireName(),
            LifecyclePolicy.AUTO_PROMOTE.wireName(),
            LifecyclePolicy.AUTO_DEMOTE.wireName());

    private static final int PROMOTE_CEILING = 50;

    private final MemoryRepositoryPort memoryRepository;
    private final LockRepositoryPort lockRepository;
    private final MemoryScoringService scoringService;
    private final MemoryStoreProperties properties;
    private final Clock clock;

    public LifecycleRunResult run(ProjectRef project, List<String> policies, LifecycleParams params) {
        if (policies == null || policies.isEmpty()) {
            throw new InvalidMemoryArgumentException("at least one policy is required");
        }
        LifecycleParams effective = params != null ? params : LifecycleParams.defaults();
        validate(effective);

        Map<String, PolicyResult> results = new LinkedHashMap<>();
        for (String name : policies) {
            if (effective.getDeadline() != null && !clock.instant().isBefore(effective.getDeadline())) {
                results.put(name, PolicyResult.failure("Skipped: deadline exceeded"));
                continue;
            }
            LifecyclePolicy policy = LifecyclePolicy.fromName(name);
            try {
                PolicyResult result = runPolicy(project, policy, name, effective);
                results.put(name, result);
                if (result.affected() > 0) {
                    log.info("[Lifecycle] {} affected {} memories in project {}", name, result.affected(),
                            project.projectId());
                }
            } catch (RuntimeException e) {
                log.warn("[Lifecycle] Policy {} failed for project {}: {}", name, project.projectId(),
                        e.getMessage());
                results.put(name, PolicyResult.failure(e.getMessage() != null ? e.getMessage()
                        : e.getClass().getSimpleName()));
            }
        }
        return new LifecycleRunResult(results);
    }

    public LifecycleRunResult runScheduled(ProjectRef project, LifecycleParams params) {
        log.debug("[Lifecycle] Scheduled run for project {}", project.projectId());
        return run(project, SCHEDULED_POLICIES, params);
    }

    private PolicyResult runPolicy(ProjectRef project, LifecyclePolicy policy, String name,
            LifecycleParams params) {
        String projectId = project.projectId();
        Instant now = clock.instant();
        return switch (policy) {
        case CLEANUP_EXPIRED -> cleanupExpired(projectId, now);
        case CLEANUP_EXPIRED_LOCKS -> PolicyResult.of(lockRepository.deleteExpired(projectId, now));
        case AUTO_PROMOTE -> autoPromote(projectId, params);
        case AUTO_DEMOTE -> autoDemote(projectId, params);
        case AUTO_PRUNE -> {
            double threshold = orDefault(params.getRelevanceThreshold(),
                    properties.getLifecycle().getRelevanceThreshold());
            yield archiveWhere(projectId, now, TAG_PRUNED,
                    memory -> !memory.isPinned() && scoringService.isLowRelevance(memory, now, threshold));
        }
        case AUTO_ARCHIVE_UNHEALTHY -> {
            double threshold = orDefault(params.getHealthThreshold(),
                    properties.getLifecycle().getHealthThreshold());
            yield archiveWhere(projectId, now, TAG_DECAYED,
                    memory -> !memory.isPinned() && scoringService.health(memory, now).score() < threshold);
        }
        case CLEANUP_OLD_VERSIONS -> cleanupOldVersions(projectId, params);
        case PURGE_ARCHIVED -> purgeArchived(projectId, now, params);
        case ARCHIVE_MERGED_BRANCHES -> archiveMergedBranches(projectId, now, params);
        case UNKNOWN -> PolicyResult.of(0, "Unknown policy: " + name);
        };
    }

    private PolicyResult cleanupExpired(String projectId, Instant now) {
        int deleted = memoryRepository.inTransaction(projectId, tx -> {
            int count = 0;
            for (Memory memory : tx.findAll()) {
                if (memory.isExpired(now)) {
                    MemoryRecordService.deleteWithLinks(tx, memory);
                    count++;
                }
            }
            return count;
        });
        return PolicyResult.of(deleted);
    }

    private PolicyResult autoPromote(String projectId, LifecycleParams params) {
        int threshold = orDefault(params.getAccessThreshold(), properties.getLifecycle().getAccessThreshold());
        int increment = properties.getLifecycle().getPromoteIncrement();
        int promoted = updateWhere(projectId,
                memory -> memory.isActive() && memory.getAccessCount() >= threshold
                        && memory.getPriority() < PROMOTE_CEILING,
                memory -> {
                    memory.setPriority(Math.min(memory.getPriority() + increment, Memory.MAX_PRIORITY));
                    MemoryRecordService.bumpRevision(memory);
                });
        return PolicyResult.of(promoted, "accessCount >= " + threshold);
    }

    private PolicyResult autoDemote(String projectId, LifecycleParams params) {
        int threshold = orDefault(params.getFeedbackThreshold(), properties.getLifecycle().getFeedbackThreshold());
        int decrement = properties.getLifecycle().getDemoteDecrement();
        int demoted = updateWhere(projectId,
                memory -> memory.isActive() && memory.getPriority() > Memory.MIN_PRIORITY
                        && memory.getUnhelpfulCount() >= threshold
                        && memory.getUnhelpfulCount() > memory.getHelpfulCount(),
                memory -> {
                    memory.setPriority(Math.max(memory.getPriority() - decrement, Memory.MIN_PRIORITY));
                    MemoryRecordService.bumpRevision(memory);
                });
        return PolicyResult.of(demoted, "unhelpfulCount >= " + threshold);
    }

    private PolicyResult archiveWhere(String projectId, Instant now, String tag, Predicate<Memory> eligible) {
        int archived = updateWhere(projectId, memory -> memory.isActive() && eligible.test(memory),
                memory -> archive(memory, now, tag));
        return PolicyResult.of(archived, "tagged " + tag);
    }

    private PolicyResult cleanupOldVersions(String projectId, LifecycleParams params) {
        int keep = orDefault(params.getMaxVersionsPerMemory(), properties.getLifecycle().getMaxVersionsPerMemory());
        int removed = memoryRepository.inTransaction(projectId, tx -> {
            int count = 0;
            for (Memory memory : tx.findAll()) {
                count += tx.trimVersions(memory.getId(), keep);
            }
            return count;
        });
        return PolicyResult.of(removed, "kept newest " + keep + " versions per memory");
    }

    private PolicyResult purgeArchived(String projectId, Instant now, LifecycleParams params) {
        int days = orDefault(params.getArchivePurgeDays(), properties.getLifecycle().getArchivePurgeDays());
        Instant cutoff = now.minus(Duration.ofDays(days));
        int purged = memoryRepository.inTransaction(projectId, tx -> {
            int count = 0;
            for (Memory memory : tx.findAll()) {
                if (!memory.isActive() && !memory.isPinned() && memory.getArchivedAt().isBefore(cutoff)) {
                    MemoryRecordService.deleteWithLinks(tx, memory);
                    count++;
                }
            }
            return count;
        });
        return PolicyResult.of(purged, "archived more than " + days + " days ago");
    }

    private PolicyResult archiveMergedBranches(String projectId, Instant now, LifecycleParams params) {
        List<String> branches = params.getMergedBranches() != null ? params.getMergedBranches() : List.of();
        List<String> prefixes = new ArrayList<>();
        for (String branch : branches) {
            if (branch != null && !branch.isBlank()) {
                prefixes.add(BRANCH_PLAN_PREFIX + encodeBranch(branch.trim()));
            }
        }
        if (prefixes.isEmpty()) {
            return PolicyResult.of(0, "No merged branches provided");
        }
        int archived = updateWhere(projectId,
                memory -> memory.isActive() && matchesAny(memory.getKey(), prefixes),
                memory -> archive(memory, now, TAG_MERGED));
        return PolicyResult.of(archived, "branches: " + String.join(", ", branches));
    }

    private int updateWhere(String projectId, Predicate<Memory> eligible, Consumer<Memory> change) {
        return memoryRepository.inTransaction(projectId, tx -> {
            int count = 0;
            for (Memory memory : tx.findAll()) {
                if (eligible.test(memory)) {
                    Memory copy = memory.toBuilder().tags(new LinkedHashSet<>(memory.getTags())).build();
                    change.accept(copy);
                    tx.save(copy);
                    count++;
                }
            }
            return count;
        });
    }

    private static void archive(Memory memory, Instant now, String tag) {
        memory.setArchivedAt(now);
        memory.getTags().add(tag);
        MemoryRecordService.bumpRevision(memory);
    }

    private static boolean matchesAny(String key, List<String> prefixes) {
        for (String prefix : prefixes) {
            if (key.equals(prefix) || key.startsWith(prefix + "/")) {
                return true;
            }
        }
        return false;
    }

    /**
     * Percent-encodes a branch name the way branch-plan keys are built by
     * agents, leaving {@code ! ' ( ) ~} unescaped.
     */
    static String encodeBranch(String branch) {
        return URLEncoder.encode(branch, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("%21", "!")
                .replace("%27", "'")
                .replace("%28", "(")
                .replace("%29", ")")
                .replace("%7E", "~");
    }

    private static void validate(LifecycleParams params) {
        MemoryValidationSupport.requireNonNegative(params.getAccessThreshold(), "accessThreshold");
        MemoryValidationSupport.requireNonNegative(params.getFeedbackThreshold(), "feedbackThreshold");
        MemoryValidationSupport.requireNonNegative(params.getRelevanceThreshold(), "relevanceThreshold");
        MemoryValidationSupport.requireNonNegative(params.getHealthThreshold(), "healthThreshold");
        MemoryValidationSupport.requireNonNegative(params.getArchivePurgeDays(), "archivePurgeDays");
        if (params.getMaxVersionsPerMemory() != null && params.getMaxVersionsPerMemory() < 1) {
            throw new InvalidMemoryArgumentException("maxVersionsPerMemory must be at least 1");
        }
    }

    private static int orDefault(Integer value, int fallback) {
        return value != null ? value : fallback;
    }

    private static double orDefault(Double value, double fallback) {
        return value != null ? value : fallback;
    }
}
