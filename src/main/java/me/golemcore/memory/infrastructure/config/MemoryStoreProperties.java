package me.golemcore.memory.infrastructure.config;

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

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Centralized configuration properties for the memory store, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code memstore.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - where memory and lock documents live</li>
 * <li>{@link QuotaProperties} - plan catalog and org plan assignments</li>
 * <li>{@link LockProperties} - advisory lock TTL bounds</li>
 * <li>{@link ScoringProperties} - relevance score weights</li>
 * <li>{@link LifecycleProperties} - default lifecycle policy parameters</li>
 * <li>{@link DedupProperties} and {@link EmbeddingProperties} - duplicate
 * warnings</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "memstore")
@Data
public class MemoryStoreProperties {

    private StorageProperties storage = new StorageProperties();
    private QuotaProperties quota = new QuotaProperties();
    private LockProperties locks = new LockProperties();
    private ScoringProperties scoring = new ScoringProperties();
    private LifecycleProperties lifecycle = new LifecycleProperties();
    private DedupProperties dedup = new DedupProperties();
    private EmbeddingProperties embedding = new EmbeddingProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private DirectoriesProperties directories = new DirectoriesProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/memory-store";
    }

    @Data
    public static class DirectoriesProperties {
        private String memories = "memories";
        private String locks = "locks";
    }

    // ==================== QUOTA ====================

    @Data
    public static class QuotaProperties {
        private String defaultPlan = "free";
        private double approachingRatio = 0.8;
        private Map<String, PlanProperties> plans = defaultPlans();
        private Map<String, String> orgPlans = new HashMap<>();
    }

    /**
     * Memory limits of one plan. Negative values mean unlimited.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PlanProperties {
        private long softLimitPerProject;
        private long hardLimitOrg;
    }

    private static Map<String, PlanProperties> defaultPlans() {
        Map<String, PlanProperties> plans = new LinkedHashMap<>();
        plans.put("free", new PlanProperties(200, 500));
        plans.put("lite", new PlanProperties(1_000, 10_000));
        plans.put("pro", new PlanProperties(5_000, 100_000));
        plans.put("business", new PlanProperties(10_000, 500_000));
        plans.put("scale", new PlanProperties(25_000, 2_000_000));
        plans.put("enterprise", new PlanProperties(-1, -1));
        return plans;
    }

    // ==================== LOCKS & SCORING ====================

    @Data
    public static class LockProperties {
        private int defaultTtlSeconds = 60;
        private int maxTtlSeconds = 3600;
    }

    @Data
    public static class ScoringProperties {
        private double relevanceDecayRate = 0.03;
        private double pinBoost = 1.5;
    }

    // ==================== LIFECYCLE ====================

    @Data
    public static class LifecycleProperties {
        private int accessThreshold = 10;
        private int feedbackThreshold = 3;
        private double relevanceThreshold = 5.0;
        private double healthThreshold = 15.0;
        private int maxVersionsPerMemory = 50;
        private int archivePurgeDays = 90;
        private int promoteIncrement = 10;
        private int demoteDecrement = 10;
        private int maxRollbackSteps = 50;
    }

    // ==================== DEDUP ====================

    @Data
    public static class DedupProperties {
        private boolean enabled = true;
        private double similarityThreshold = 0.92;
        private int maxCandidates = 50;
        private long timeoutMs = 2000;
    }

    @Data
    public static class EmbeddingProperties {
        private String apiKey;
        private String baseUrl;
        private String model = "text-embedding-3-small";
        private long timeoutSeconds = 10;
    }
}
