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
import me.golemcore.memory.domain.model.LifecycleParams;
import me.golemcore.memory.domain.model.LifecyclePolicy;
import me.golemcore.memory.domain.model.LifecycleRunResult;
import me.golemcore.memory.domain.model.PolicyResult;
import me.golemcore.memory.domain.model.ProjectRef;
import me.golemcore.memory.domain.service.LifecyclePolicyService;
import me.golemcore.memory.domain.service.MemoryValidationSupport;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Lifecycle policy runs, triggered by an external scheduler or an operator.
 */
@RestController
@RequestMapping("/api/v1/memories/lifecycle")
@RequiredArgsConstructor
public class LifecycleController {

    private final LifecyclePolicyService lifecyclePolicyService;
    private final Clock clock;

    @GetMapping("/policies")
    public Mono<ResponseEntity<List<String>>> policies() {
        List<String> names = Arrays.stream(LifecyclePolicy.values())
                .filter(policy -> policy != LifecyclePolicy.UNKNOWN)
                .map(LifecyclePolicy::wireName)
                .toList();
        return Mono.just(ResponseEntity.ok(names));
    }

    @PostMapping("/run")
    public Mono<ResponseEntity<LifecycleRunResponse>> run(
            @RequestHeader(MemoriesController.ORG_HEADER) String orgId,
            @RequestHeader(MemoriesController.PROJECT_HEADER) String projectId,
            @RequestBody LifecycleRunRequest request) {
        return Mono.fromCallable(() -> {
            LifecycleParams.LifecycleParamsBuilder params = LifecycleParams.builder()
                    .accessThreshold(request.accessThreshold())
                    .feedbackThreshold(request.feedbackThreshold())
                    .relevanceThreshold(request.relevanceThreshold())
                    .healthThreshold(request.healthThreshold())
                    .maxVersionsPerMemory(request.maxVersionsPerMemory())
                    .archivePurgeDays(request.archivePurgeDays());
            if (request.mergedBranches() != null) {
                params.mergedBranches(request.mergedBranches());
            }
            params.deadline(MemoryValidationSupport.deadlineAfter(clock, request.timeoutMs()));
            LifecycleRunResult result = lifecyclePolicyService.run(new ProjectRef(orgId, projectId),
                    request.policies(), params.build());
            return ResponseEntity.ok(new LifecycleRunResponse(result.results(), result.totalAffected()));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Runs {@link LifecyclePolicyService#SCHEDULED_POLICIES}. Meant for cron
     * callers; the body is optional.
     */
    @PostMapping("/schedule")
    public Mono<ResponseEntity<ScheduledRunResponse>> schedule(
            @RequestHeader(MemoriesController.ORG_HEADER) String orgId,
            @RequestHeader(MemoriesController.PROJECT_HEADER) String projectId,
            @RequestBody(required = false) ScheduledRunRequest request) {
        return Mono.fromCallable(() -> {
            ScheduledRunRequest effective = request != null ? request : new ScheduledRunRequest(null, null, null);
            Instant ranAt = clock.instant();
            LifecycleParams params = LifecycleParams.builder()
                    .accessThreshold(effective.accessThreshold())
                    .feedbackThreshold(effective.feedbackThreshold())
                    .deadline(MemoryValidationSupport.deadlineAfter(clock, effective.timeoutMs()))
                    .build();
            LifecycleRunResult result = lifecyclePolicyService.runScheduled(new ProjectRef(orgId, projectId),
                    params);
            return ResponseEntity.ok(new ScheduledRunResponse(true, ranAt, result.results(),
                    result.totalAffected()));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    public record LifecycleRunRequest(List<String> policies, Integer accessThreshold, Integer feedbackThreshold,
            Double relevanceThreshold, Double healthThreshold, Integer maxVersionsPerMemory,
            Integer archivePurgeDays, List<String> mergedBranches, Long timeoutMs) {
    }

    public record LifecycleRunResponse(Map<String, PolicyResult> results, int totalAffected) {
    }

    public record ScheduledRunRequest(Integer accessThreshold, Integer feedbackThreshold, Long timeoutMs) {
    }

    public record ScheduledRunResponse(boolean scheduled, Instant ranAt, Map<String, PolicyResult> results,
            int totalAffected) {
    }
}
