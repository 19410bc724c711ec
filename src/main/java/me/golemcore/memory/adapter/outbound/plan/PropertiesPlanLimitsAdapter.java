package me.golemcore.memory.adapter.outbound.plan;

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
import me.golemcore.memory.domain.model.QuotaLimits;
import me.golemcore.memory.infrastructure.config.MemoryStoreProperties;
import me.golemcore.memory.port.outbound.PlanLimitsPort;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Resolves an org's memory limits from the configured plan catalog
 * ({@code memstore.quota.plans}) and org-to-plan assignments
 * ({@code memstore.quota.org-plans}). Orgs without an assignment, or assigned
 * to an unknown plan, get the default plan.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PropertiesPlanLimitsAdapter implements PlanLimitsPort {

    private final MemoryStoreProperties properties;

    @Override
    public QuotaLimits resolveLimits(String orgId) {
        MemoryStoreProperties.QuotaProperties quota = properties.getQuota();
        String planId = quota.getOrgPlans().getOrDefault(orgId, quota.getDefaultPlan());
        MemoryStoreProperties.PlanProperties plan = findPlan(planId);
        if (plan == null) {
            log.warn("[Quota] Unknown plan '{}' for org {}, using '{}'", planId, orgId, quota.getDefaultPlan());
            plan = findPlan(quota.getDefaultPlan());
        }
        if (plan == null) {
            log.warn("[Quota] Default plan '{}' is not configured, treating org {} as unlimited",
                    quota.getDefaultPlan(), orgId);
            return QuotaLimits.unlimited();
        }
        return new QuotaLimits(limit(plan.getSoftLimitPerProject()), limit(plan.getHardLimitOrg()));
    }

    private MemoryStoreProperties.PlanProperties findPlan(String planId) {
        if (planId == null) {
            return null;
        }
        return properties.getQuota().getPlans().get(planId.trim().toLowerCase(Locale.ROOT));
    }

    private static long limit(long configured) {
        return configured < 0 ? QuotaLimits.UNLIMITED : configured;
    }
}
