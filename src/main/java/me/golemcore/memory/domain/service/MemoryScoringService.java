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
import me.golemcore.memory.domain.model.HealthScore;
import me.golemcore.memory.domain.model.Memory;
import me.golemcore.memory.domain.model.MemoryHealth;
import me.golemcore.memory.domain.model.RelevanceBucket;
import me.golemcore.memory.infrastructure.config.MemoryStoreProperties;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Side-effect-free health and relevance scoring of memories at a given
 * instant.
 *
 * <p>
 * Health is the sum of four 0-25 factors (age, access, feedback, freshness).
 * Relevance multiplies priority, a logarithmic usage factor, exponential decay
 * since the last access, a feedback ratio and a pin boost, capped at 100.
 */
@Service
@RequiredArgsConstructor
public class MemoryScoringService {

    private static final double FACTOR_MAX = 25.0;
    private static final double FEEDBACK_BASELINE = 12.5;
    private static final double FEEDBACK_STEP = 2.5;
    private static final double ACCESS_STEP = 2.5;
    private static final double AGE_DAYS_PER_POINT = 14.0;
    private static final double FRESHNESS_DAYS_PER_POINT = 7.0;
    private static final double MAX_SCORE = 100.0;
    private static final double MILLIS_PER_DAY = 86_400_000.0;

    private final MemoryStoreProperties properties;

    public HealthScore health(Memory memory, Instant now) {
        double ageDays = daysBetween(memory.getCreatedAt(), now);
        double ageFactor = Math.max(0, FACTOR_MAX - ageDays / AGE_DAYS_PER_POINT);

        double accessFactor = Math.min(FACTOR_MAX, Math.max(0, memory.getAccessCount()) * ACCESS_STEP);

        double netFeedback = (double) memory.getHelpfulCount() - memory.getUnhelpfulCount();
        double feedbackFactor = FEEDBACK_BASELINE
                + clamp(netFeedback * FEEDBACK_STEP, -FEEDBACK_BASELINE, FEEDBACK_BASELINE);

        double freshnessFactor = 0;
        if (memory.getLastAccessedAt() != null) {
            double daysSinceAccess = daysBetween(memory.getLastAccessedAt(), now);
            freshnessFactor = Math.max(0, FACTOR_MAX - daysSinceAccess / FRESHNESS_DAYS_PER_POINT);
        }

        double total = clamp(ageFactor + accessFactor + feedbackFactor + freshnessFactor, 0, MAX_SCORE);
        return new HealthScore(round2(total), round2(ageFactor), round2(accessFactor),
                round2(feedbackFactor), round2(freshnessFactor));
    }

    public double relevance(Memory memory, Instant now) {
        double basePriority = Math.max(memory.getPriority(), 1) / MAX_SCORE;
        double usageFactor = 1 + Math.log1p(Math.max(0, memory.getAccessCount()));

        // Never-accessed memories decay from their creation time.
        Instant reference = memory.getLastAccessedAt() != null ? memory.getLastAccessedAt() : memory.getCreatedAt();
        double timeFactor = 1;
        if (reference != null) {
            timeFactor = Math.exp(-properties.getScoring().getRelevanceDecayRate() * daysBetween(reference, now));
        }

        long totalFeedback = memory.getHelpfulCount() + memory.getUnhelpfulCount();
        double feedbackFactor = 1;
        if (totalFeedback > 0) {
            feedbackFactor = 0.5 + (double) memory.getHelpfulCount() / totalFeedback;
        }

        double pinBoost = memory.isPinned() ? properties.getScoring().getPinBoost() : 1;

        double raw = basePriority * usageFactor * timeFactor * feedbackFactor * pinBoost * MAX_SCORE;
        return clamp(round2(raw), 0, MAX_SCORE);
    }

    /**
     * Pinned memories never count as low relevance, whatever their score.
     */
    public boolean isLowRelevance(Memory memory, Instant now, double threshold) {
        if (memory.isPinned()) {
            return false;
        }
        return relevance(memory, now) < threshold;
    }

    /**
     * Score the given memories, worst health first.
     */
    public List<MemoryHealth> report(Collection<Memory> memories, Instant now, int limit) {
        List<MemoryHealth> rows = new ArrayList<>();
        for (Memory memory : memories) {
            double relevance = relevance(memory, now);
            rows.add(MemoryHealth.builder()
                    .key(memory.getKey())
                    .priority(memory.getPriority())
                    .accessCount(memory.getAccessCount())
                    .pinned(memory.isPinned())
                    .health(health(memory, now))
                    .relevance(relevance)
                    .bucket(RelevanceBucket.of(relevance))
                    .build());
        }
        rows.sort(Comparator.comparingDouble((MemoryHealth row) -> row.getHealth().score())
                .thenComparing(MemoryHealth::getKey));
        return limit > 0 && rows.size() > limit ? new ArrayList<>(rows.subList(0, limit)) : rows;
    }

    private static double daysBetween(Instant from, Instant to) {
        if (from == null || to == null) {
            return 0;
        }
        return Math.max(0, Duration.between(from, to).toMillis() / MILLIS_PER_DAY);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
