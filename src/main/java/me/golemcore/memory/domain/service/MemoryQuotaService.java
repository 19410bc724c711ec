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
import me.golemcore.memory.domain.exception.QuotaExceededException;
import me.golemcore.memory.domain.model.ProjectRef;
import me.golemcore.memory.domain.model.QuotaLimits;
import me.golemcore.memory.domain.model.QuotaSnapshot;
import me.golemcore.memory.infrastructure.config.MemoryStoreProperties;
import me.golemcore.memory.port.outbound.MemoryRepositoryPort;
import me.golemcore.memory.port.outbound.PlanLimitsPort;
import org.springframework.stereotype.Service;

/**
 * Two-tier capacity model: a soft per-project limit that only warns and a
 * hard org-wide limit that blocks creation of new keys.
 *
 * <p>
 * Counting and the subsequent create are not serialized, so concurrent
 * creates near the hard limit can overshoot it by a few records. That margin
 * is accepted in exchange for lock-free writes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryQuotaService {

    private final MemoryRepositoryPort memoryRepository;
    private final PlanLimitsPort planLimitsPort;
    private final MemoryStoreProperties properties;

    public QuotaSnapshot snapshot(ProjectRef project) {
        QuotaLimits limits = planLimitsPort.resolveLimits(project.orgId());
        long projectUsed = memoryRepository.countActiveByProject(project.projectId());
        long orgUsed = memoryRepository.countActiveByOrg(project.orgId());

        boolean softFull = !limits.isSoftUnlimited() && projectUsed >= limits.softLimitPerProject();
        boolean approaching = !limits.isSoftUnlimited()
                && projectUsed >= properties.getQuota().getApproachingRatio() * limits.softLimitPerProject();
        boolean hardFull = !limits.isHardUnlimited() && orgUsed >= limits.hardLimitOrg();

        return QuotaSnapshot.builder()
                .projectUsed(projectUsed)
                .projectSoftLimit(limits.softLimitPerProject())
                .orgUsed(orgUsed)
                .orgHardLimit(limits.hardLimitOrg())
                .softFull(softFull)
                .approaching(approaching)
                .hardFull(hardFull)
                .build();
    }

    /**
     * Gate applied before a new key is created. Throws when the org is at its
     * hard limit; soft signals are returned for the caller to surface.
     */
    public QuotaSnapshot checkCreate(ProjectRef project) {
        QuotaSnapshot snapshot = snapshot(project);
        if (snapshot.isHardFull()) {
            log.warn("[Quota] Org {} at hard limit ({}/{}), rejecting new key in project {}",
                    project.orgId(), snapshot.getOrgUsed(), snapshot.getOrgHardLimit(), project.projectId());
            throw new QuotaExceededException(snapshot.getOrgUsed(), snapshot.getOrgHardLimit());
        }
        if (snapshot.isSoftFull()) {
            log.info("[Quota] Project {} over soft limit ({}/{})",
                    project.projectId(), snapshot.getProjectUsed(), snapshot.getProjectSoftLimit());
        } else if (snapshot.isApproaching()) {
            log.debug("[Quota] Project {} approaching soft limit ({}/{})",
                    project.projectId(), snapshot.getProjectUsed(), snapshot.getProjectSoftLimit());
        }
        return snapshot;
    }
}
