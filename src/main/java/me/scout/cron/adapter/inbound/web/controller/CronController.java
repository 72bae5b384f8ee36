package me.scout.cron.adapter.inbound.web.controller;

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

import me.scout.cron.domain.model.AdmissionDecision;
import me.scout.cron.domain.model.JobDefinition;
import me.scout.cron.domain.model.ReconciliationReport;
import me.scout.cron.domain.model.RunEvent;
import me.scout.cron.domain.model.RunRecord;
import me.scout.cron.domain.model.TransitionOutcome;
import me.scout.cron.domain.service.ConcurrencyAdmissionService;
import me.scout.cron.domain.service.JobRunService;
import me.scout.cron.domain.service.JobService;
import me.scout.cron.domain.service.RunLifecycleService;
import me.scout.cron.domain.service.SchedulingService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Job, run and schedule management endpoints.
 */
@RestController
@RequestMapping("/api/cron")
@RequiredArgsConstructor
public class CronController {

    private static final int MAX_PAGE_SIZE = 500;

    private final JobService jobService;
    private final SchedulingService schedulingService;
    private final RunLifecycleService lifecycleService;
    private final ConcurrencyAdmissionService admissionService;
    private final JobRunService jobRunService;
    private final Clock clock;

    @GetMapping("/jobs")
    public Mono<ResponseEntity<List<JobDefinition>>> listJobs(
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(defaultValue = "100") int limit) {
        if (offset < 0 || limit <= 0 || limit > MAX_PAGE_SIZE) {
            throw badRequest("offset must be >= 0 and limit between 1 and " + MAX_PAGE_SIZE);
        }
        return Mono.just(ResponseEntity.ok(jobService.listJobs(offset, limit)));
    }

    @GetMapping("/jobs/due")
    public Mono<ResponseEntity<List<JobDefinition>>> getDueJobs() {
        return Mono.just(ResponseEntity.ok(schedulingService.getDueJobs()));
    }

    @GetMapping("/jobs/{jobId}")
    public Mono<ResponseEntity<JobDefinition>> getJob(@PathVariable String jobId) {
        return Mono.just(ResponseEntity.ok(requireJob(jobId)));
    }

    @PostMapping("/jobs")
    public Mono<ResponseEntity<JobDefinition>> createJob(@RequestBody JobDefinition request) {
        if (request == null) {
            throw badRequest("Request body is required");
        }
        try {
            JobDefinition created = jobService.addJob(request);
            return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(created));
        } catch (IllegalArgumentException e) {
            throw badRequest(e.getMessage());
        }
    }

    @PutMapping("/jobs/{jobId}")
    public Mono<ResponseEntity<JobDefinition>> updateJob(@PathVariable String jobId,
            @RequestBody JobDefinition request) {
        if (request == null) {
            throw badRequest("Request body is required");
        }
        if (request.getId() != null && !request.getId().equals(jobId)) {
            throw badRequest("Job id in body does not match path: " + request.getId());
        }
        requireJob(jobId);
        request.setId(jobId);
        try {
            return Mono.just(ResponseEntity.ok(jobService.updateJob(request)));
        } catch (IllegalArgumentException e) {
            throw badRequest(e.getMessage());
        }
    }

    @DeleteMapping("/jobs/{jobId}")
    public Mono<ResponseEntity<DeleteJobResponse>> deleteJob(@PathVariable String jobId) {
        requireJob(jobId);
        jobService.deleteJob(jobId);
        return Mono.just(ResponseEntity.ok(new DeleteJobResponse(jobId)));
    }

    @PostMapping("/jobs/{jobId}/pause")
    public Mono<ResponseEntity<JobDefinition>> pauseJob(@PathVariable String jobId) {
        requireJob(jobId);
        return Mono.just(ResponseEntity.ok(jobService.pauseJob(jobId)));
    }

    @PostMapping("/jobs/{jobId}/resume")
    public Mono<ResponseEntity<JobDefinition>> resumeJob(@PathVariable String jobId) {
        requireJob(jobId);
        return Mono.just(ResponseEntity.ok(jobService.resumeJob(jobId)));
    }

    @PostMapping("/jobs/{jobId}/run")
    public Mono<ResponseEntity<RunRecord>> runJobNow(@PathVariable String jobId,
            @RequestBody(required = false) RunNowRequest request) {
        requireJob(jobId);
        boolean dryRun = request != null && request.dryRun();
        Map<String, Object> inputs = request != null ? request.inputs() : null;
        RunRecord run = dryRun ? jobRunService.dryRun(jobId) : jobRunService.runJobNow(jobId, inputs);
        return Mono.just(ResponseEntity.ok(run));
    }

    @GetMapping("/jobs/{jobId}/admission")
    public Mono<ResponseEntity<AdmissionDecision>> checkAdmission(@PathVariable String jobId) {
        JobDefinition job = requireJob(jobId);
        return Mono.just(ResponseEntity.ok(admissionService.canRunJob(job)));
    }

    @GetMapping("/runs")
    public Mono<ResponseEntity<List<RunRecord>>> listRuns(
            @RequestParam(required = false) String jobId,
            @RequestParam(defaultValue = "50") int limit) {
        if (limit <= 0 || limit > MAX_PAGE_SIZE) {
            throw badRequest("limit must be between 1 and " + MAX_PAGE_SIZE);
        }
        return Mono.just(ResponseEntity.ok(jobRunService.listRuns(jobId, limit)));
    }

    @GetMapping("/runs/pending")
    public Mono<ResponseEntity<List<RunRecord>>> getPendingRuns() {
        return Mono.just(ResponseEntity.ok(lifecycleService.getPendingRuns()));
    }

    @GetMapping("/runs/{runId}")
    public Mono<ResponseEntity<RunRecord>> getRun(@PathVariable String runId) {
        RunRecord run = jobRunService.getRun(runId)
                .orElseThrow(() -> notFound("Run not found: " + runId));
        return Mono.just(ResponseEntity.ok(run));
    }

    @GetMapping("/runs/{runId}/events")
    public Mono<ResponseEntity<List<RunEvent>>> getRunEvents(@PathVariable String runId,
            @RequestParam(defaultValue = "100") int limit) {
        if (limit <= 0 || limit > MAX_PAGE_SIZE) {
            throw badRequest("limit must be between 1 and " + MAX_PAGE_SIZE);
        }
        if (jobRunService.getRun(runId).isEmpty()) {
            throw notFound("Run not found: " + runId);
        }
        return Mono.just(ResponseEntity.ok(jobRunService.listRunEvents(runId, limit)));
    }

    @PostMapping("/runs/{runId}/cancel")
    public Mono<ResponseEntity<TransitionResponse>> cancelRun(@PathVariable String runId) {
        TransitionOutcome outcome = lifecycleService.cancelRun(runId);
        if (outcome == TransitionOutcome.NOT_FOUND) {
            throw notFound("Run not found: " + runId);
        }
        return Mono.just(ResponseEntity.ok(new TransitionResponse(runId, outcome.name())));
    }

    @PostMapping("/runs/process")
    public Mono<ResponseEntity<ProcessPendingResponse>> processPendingRuns() {
        return Mono.just(ResponseEntity.ok(new ProcessPendingResponse(jobRunService.processPendingRuns())));
    }

    @PostMapping("/schedules/update")
    public Mono<ResponseEntity<ReconciliationReport>> updateSchedules() {
        return Mono.just(ResponseEntity.ok(schedulingService.updateAllSchedules()));
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<HealthResponse>> health() {
        HealthResponse response = new HealthResponse("UP", clock.instant(),
                lifecycleService.getPendingRuns().size(), schedulingService.getDueJobs().size());
        return Mono.just(ResponseEntity.ok(response));
    }

    private JobDefinition requireJob(String jobId) {
        if (jobId == null || jobId.isBlank()) {
            throw badRequest("jobId is required");
        }
        return jobService.getJob(jobId)
                .orElseThrow(() -> notFound("Job not found: " + jobId));
    }

    private ResponseStatusException badRequest(String message) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, message);
    }

    private ResponseStatusException notFound(String message) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, message);
    }

    public record RunNowRequest(Map<String, Object> inputs, boolean dryRun) {
    }

    public record DeleteJobResponse(String jobId) {
    }

    public record TransitionResponse(String runId, String outcome) {
    }

    public record ProcessPendingResponse(int processed) {
    }

    public record HealthResponse(String status, Instant time, int pendingRuns, int dueJobs) {
    }
}
