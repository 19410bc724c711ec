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
import me.golemcore.memory.domain.model.ConflictStrategy;
import me.golemcore.memory.domain.model.Memory;
import me.golemcore.memory.domain.model.ProjectRef;
import me.golemcore.memory.domain.model.SafeStoreResult;
import me.golemcore.memory.domain.model.StoreCommand;
import me.golemcore.memory.domain.model.StoreResult;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Timestamp-based optimistic concurrency on top of
 * {@link MemoryRecordService#storeDecided}. A conflict exists when the memory
 * was updated after the client's {@code ifUnmodifiedSince}; the strategy
 * decides whether to write anyway, merge by appending, or hand both sides
 * back. The check and the write share one project transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConflictResolutionService {

    static final String APPEND_SEPARATOR = "\n---\n";

    private final MemoryRecordService recordService;

    public SafeStoreResult storeSafe(ProjectRef project, StoreCommand command, Instant ifUnmodifiedSince,
            ConflictStrategy strategy) {
        MemoryValidationSupport.requireKey(command.getKey());
        MemoryValidationSupport.requireContent(command.getContent());
        ConflictStrategy effective = strategy != null ? strategy : ConflictStrategy.REJECT;

        AtomicReference<Memory> observed = new AtomicReference<>();
        Optional<StoreResult> written = recordService.storeDecided(project, command.getKey(), current -> {
            observed.set(current.orElse(null));
            if (!isConflict(current.orElse(null), ifUnmodifiedSince)) {
                return command;
            }
            return switch (effective) {
            case LAST_WRITE_WINS -> command;
            case APPEND -> command.toBuilder()
                    .content(current.get().getContent() + APPEND_SEPARATOR + command.getContent())
                    .build();
            case RETURN_BOTH, REJECT -> null;
            };
        });

        Memory server = observed.get();
        if (!isConflict(server, ifUnmodifiedSince)) {
            return stored(command, written.orElseThrow(), effective, false, "Stored without conflict",
                    ifUnmodifiedSince);
        }
        log.info("[Conflict] {}/{} modified at {} after client timestamp {}, strategy {}",
                project.projectId(), command.getKey(), server.getUpdatedAt(), ifUnmodifiedSince,
                effective.wireName());

        return switch (effective) {
        case LAST_WRITE_WINS -> stored(command, written.orElseThrow(), effective, true,
                "Conflict resolved by last write wins; the intervening change was overwritten",
                ifUnmodifiedSince);
        case APPEND -> stored(command, written.orElseThrow(), effective, true,
                "Conflict resolved by appending to the current content", ifUnmodifiedSince);
        case RETURN_BOTH -> notStored(command, server, effective,
                "Both versions returned. Merge them manually and resubmit with a fresh timestamp.",
                ifUnmodifiedSince);
        case REJECT -> notStored(command, server, effective,
                "Memory was modified after " + ifUnmodifiedSince + "; write rejected", ifUnmodifiedSince);
        };
    }

    private static boolean isConflict(Memory current, Instant ifUnmodifiedSince) {
        return ifUnmodifiedSince != null
                && current != null
                && current.getUpdatedAt() != null
                && current.getUpdatedAt().isAfter(ifUnmodifiedSince);
    }

    private static SafeStoreResult stored(StoreCommand command, StoreResult result, ConflictStrategy strategy,
            boolean conflict, String message, Instant clientTimestamp) {
        return SafeStoreResult.builder()
                .key(command.getKey())
                .conflict(conflict)
                .stored(true)
                .strategy(strategy)
                .message(message)
                .storeResult(result)
                .clientTimestamp(clientTimestamp)
                .build();
    }

    private static SafeStoreResult notStored(StoreCommand command, Memory server, ConflictStrategy strategy,
            String message, Instant clientTimestamp) {
        return SafeStoreResult.builder()
                .key(command.getKey())
                .conflict(true)
                .stored(false)
                .strategy(strategy)
                .message(message)
                .proposedContent(command.getContent())
                .currentContent(server.getContent())
                .currentUpdatedAt(server.getUpdatedAt())
                .clientTimestamp(clientTimestamp)
                .build();
    }
}
