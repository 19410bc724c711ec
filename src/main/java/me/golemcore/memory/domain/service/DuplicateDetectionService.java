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
import me.golemcore.memory.domain.model.DuplicateWarning;
import me.golemcore.memory.domain.model.Memory;
import me.golemcore.memory.domain.model.ProjectRef;
import me.golemcore.memory.infrastructure.config.MemoryStoreProperties;
import me.golemcore.memory.port.outbound.EmbeddingPort;
import me.golemcore.memory.port.outbound.MemoryRepositoryPort;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Advisory near-duplicate check run before a new key is stored.
 *
 * <p>
 * Compares the embedding of the candidate content with the most recently
 * updated active memories of the project. Any problem with the embedding
 * service (not configured, slow, failing) yields no warning and never blocks
 * the store.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DuplicateDetectionService {

    private final EmbeddingPort embeddingPort;
    private final MemoryRepositoryPort memoryRepository;
    private final MemoryStoreProperties properties;

    public Optional<DuplicateWarning> findSimilar(ProjectRef project, String key, String content) {
        MemoryStoreProperties.DedupProperties dedup = properties.getDedup();
        if (!dedup.isEnabled() || content == null || content.isBlank()) {
            return Optional.empty();
        }
        try {
            if (!embeddingPort.isAvailable()) {
                return Optional.empty();
            }
            List<Memory> candidates = candidates(project, key, dedup.getMaxCandidates());
            if (candidates.isEmpty()) {
                return Optional.empty();
            }

            List<String> texts = new ArrayList<>(candidates.size() + 1);
            texts.add(content);
            candidates.forEach(memory -> texts.add(memory.getContent()));
            List<float[]> vectors = embeddingPort.embedBatch(texts)
                    .get(dedup.getTimeoutMs(), TimeUnit.MILLISECONDS);

            return closest(candidates, vectors, dedup.getSimilarityThreshold());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("[Dedup] Interrupted while checking {}", key);
        } catch (TimeoutException e) {
            log.debug("[Dedup] Embedding timed out after {}ms for {}", dedup.getTimeoutMs(), key);
        } catch (ExecutionException | RuntimeException e) {
            log.debug("[Dedup] Similarity check failed for {}: {}", key, e.getMessage());
        }
        return Optional.empty();
    }

    private List<Memory> candidates(ProjectRef project, String key, int limit) {
        return memoryRepository.findAll(project.projectId()).stream()
                .filter(Memory::isActive)
                .filter(memory -> !memory.getKey().equals(key))
                .sorted(Comparator.comparing(Memory::getUpdatedAt,
                        Comparator.nullsLast(Comparator.<Instant>reverseOrder())))
                .limit(Math.max(0, limit))
                .toList();
    }

    private Optional<DuplicateWarning> closest(List<Memory> candidates, List<float[]> vectors, double threshold) {
        if (vectors == null || vectors.size() != candidates.size() + 1) {
            log.debug("[Dedup] Unexpected embedding count, skipping");
            return Optional.empty();
        }
        float[] candidateVector = vectors.get(0);
        DuplicateWarning best = null;
        for (int i = 0; i < candidates.size(); i++) {
            double similarity = embeddingPort.cosineSimilarity(candidateVector, vectors.get(i + 1));
            if (similarity >= threshold && (best == null || similarity > best.similarity())) {
                best = new DuplicateWarning(candidates.get(i).getKey(), Math.round(similarity * 1000.0) / 1000.0);
            }
        }
        return Optional.ofNullable(best);
    }
}
