package com.whereq.roundhouse.controller;

import com.whereq.roundhouse.dto.EnqueueBuildRequest;
import com.whereq.roundhouse.dto.EnqueueBuildResponse;
import com.whereq.roundhouse.dto.JobActionResponse;
import com.whereq.roundhouse.dto.JobDetailsResponse;
import com.whereq.roundhouse.exception.InvalidStatusTransitionException;
import com.whereq.roundhouse.exception.JobNotFoundException;
import com.whereq.roundhouse.exception.JobValidationException;
import com.whereq.roundhouse.exception.StoreUnavailableException;
import com.whereq.roundhouse.model.JobStatus;
import com.whereq.roundhouse.model.LogLine;
import com.whereq.roundhouse.model.QueueStats;
import com.whereq.roundhouse.monitor.QueueMonitor;
import com.whereq.roundhouse.service.BuildLogStream;
import com.whereq.roundhouse.service.JobAdmissionService;
import com.whereq.roundhouse.service.JobStatusTracker;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.UUID;

/**
 * Controller for build job admission and management
 *
 * @author WhereQ Inc.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/jobs")
@RequiredArgsConstructor
@Tag(name = "Build Jobs", description = "Admit, inspect, cancel and retry build jobs")
public class BuildJobController {

    private final JobAdmissionService admissionService;
    private final JobStatusTracker statusTracker;
    private final BuildLogStream logStream;
    private final QueueMonitor queueMonitor;

    /**
     * Admit a build job
     *
     * @param request build request
     * @return Mono with 202 Accepted response
     */
    @PostMapping
    @Operation(summary = "Enqueue build", description = "Admit a build job and return its id and queue position")
    public Mono<ResponseEntity<EnqueueBuildResponse>> enqueue(@Valid @RequestBody EnqueueBuildRequest request) {
        log.info("Received build request: service={}, sha={}, priority={}",
            request.getServiceId(), request.getGitSha(), request.getPriority());

        return admissionService.enqueue(request.toJob())
            .flatMap(job -> queueMonitor.stats()
                .map(QueueStats::getTotalDepth)
                // Position is informational only
                .onErrorResume(e -> Mono.just(-1L))
                .map(position -> ResponseEntity
                    .status(HttpStatus.ACCEPTED)
                    .location(URI.create("/api/v1/jobs/" + job.getId()))
                    .body(EnqueueBuildResponse.builder()
                        .jobId(job.getId())
                        .status(JobStatus.QUEUED)
                        .position(position)
                        .build())))
            .onErrorResume(JobValidationException.class, e -> {
                log.warn("Validation error: {}", e.getMessage());
                return Mono.just(ResponseEntity
                    .badRequest()
                    .body(EnqueueBuildResponse.error(e.getMessage())));
            })
            .onErrorResume(StoreUnavailableException.class, e -> Mono.just(ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(EnqueueBuildResponse.error(e.getMessage()))))
            .onErrorResume(Exception.class, e -> {
                log.error("Unexpected error during job admission", e);
                return Mono.just(ResponseEntity
                    .status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(EnqueueBuildResponse.error("Failed to enqueue build")));
            });
    }

    /**
     * Get job, status and result
     *
     * @param jobId job identifier
     * @return Mono with job details
     */
    @GetMapping("/{jobId}")
    @Operation(summary = "Get job", description = "Get a job with its status and result")
    public Mono<ResponseEntity<JobDetailsResponse>> getJob(@PathVariable UUID jobId) {
        return statusTracker.getJob(jobId)
            .flatMap(record -> statusTracker.getResult(jobId)
                .map(result -> JobDetailsResponse.of(record, result))
                .defaultIfEmpty(JobDetailsResponse.of(record, null)))
            .map(ResponseEntity::ok)
            .onErrorResume(JobNotFoundException.class, e -> Mono.just(ResponseEntity.notFound().<JobDetailsResponse>build()))
            .onErrorResume(StoreUnavailableException.class,
                e -> Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).<JobDetailsResponse>build()));
    }

    /**
     * Stream build logs as server-sent events. Each event id is the line's cursor, so a
     * client reconnecting with {@code Last-Event-ID} resumes where it left off.
     *
     * @param jobId job identifier
     * @param from cursor of the last line already seen
     * @param lastEventId cursor sent by a reconnecting EventSource
     * @return endless stream of log events; 400 if the cursor is malformed
     */
    @GetMapping(value = "/{jobId}/logs", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "Stream logs", description = "Tail build logs from a cursor as server-sent events")
    public Flux<ServerSentEvent<LogLine>> streamLogs(
            @PathVariable UUID jobId,
            @RequestParam(value = "from", required = false) String from,
            @RequestHeader(value = "Last-Event-ID", required = false) String lastEventId) {

        String cursor = from != null && !from.isBlank() ? from : lastEventId;
        if (!BuildLogStream.isValidCursor(cursor)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid log cursor: " + cursor);
        }
        log.debug("Streaming logs for job {} from {}", jobId, cursor);

        return logStream.stream(jobId, cursor)
            .map(line -> ServerSentEvent.<LogLine>builder()
                .id(line.getCursor())
                .event("log")
                .data(line)
                .build());
    }

    /**
     * Cancel a queued or building job
     *
     * @param jobId job identifier
     * @return Mono with cancellation response
     */
    @PostMapping("/{jobId}/cancel")
    @Operation(summary = "Cancel job", description = "Cancel a queued or building job")
    public Mono<ResponseEntity<JobActionResponse>> cancel(@PathVariable UUID jobId) {
        return admissionService.cancel(jobId)
            .thenReturn(ResponseEntity.ok(JobActionResponse.builder()
                .jobId(jobId)
                .status(JobStatus.CANCELLED)
                .message("Job cancelled")
                .build()))
            .onErrorResume(JobNotFoundException.class, e -> Mono.just(ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(JobActionResponse.error(jobId, "Job not found"))))
            .onErrorResume(InvalidStatusTransitionException.class, e -> Mono.just(ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(JobActionResponse.error(jobId, "Job cannot be cancelled in status " + e.getFrom().value()))))
            .onErrorResume(StoreUnavailableException.class, e -> Mono.just(ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(JobActionResponse.error(jobId, e.getMessage()))));
    }

    /**
     * Retry a failed or cancelled job as a new job
     *
     * @param jobId job identifier
     * @return Mono with 202 Accepted response naming the new job
     */
    @PostMapping("/{jobId}/retry")
    @Operation(summary = "Retry job", description = "Re-admit a failed or cancelled job with raised priority")
    public Mono<ResponseEntity<JobActionResponse>> retry(@PathVariable UUID jobId) {
        return admissionService.retry(jobId)
            .map(job -> ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .location(URI.create("/api/v1/jobs/" + job.getId()))
                .body(JobActionResponse.builder()
                    .jobId(jobId)
                    .newJobId(job.getId())
                    .status(JobStatus.QUEUED)
                    .message("Job retry queued")
                    .build()))
            .onErrorResume(JobNotFoundException.class, e -> Mono.just(ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(JobActionResponse.error(jobId, "Job not found"))))
            .onErrorResume(InvalidStatusTransitionException.class, e -> Mono.just(ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(JobActionResponse.error(jobId, "Only failed or cancelled jobs can be retried"))))
            .onErrorResume(StoreUnavailableException.class, e -> Mono.just(ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(JobActionResponse.error(jobId, e.getMessage()))));
    }
}
