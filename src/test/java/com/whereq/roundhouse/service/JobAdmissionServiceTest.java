package com.whereq.roundhouse.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.roundhouse.exception.InvalidStatusTransitionException;
import com.whereq.roundhouse.exception.JobNotFoundException;
import com.whereq.roundhouse.exception.JobSerializationException;
import com.whereq.roundhouse.exception.JobValidationException;
import com.whereq.roundhouse.exception.StoreUnavailableException;
import com.whereq.roundhouse.model.BuildJob;
import com.whereq.roundhouse.model.JobStatus;
import com.whereq.roundhouse.queue.FifoJobQueue;
import com.whereq.roundhouse.queue.JsonCodec;
import com.whereq.roundhouse.queue.PriorityJobQueue;
import com.whereq.roundhouse.queue.QueueKeys;
import com.whereq.roundhouse.support.InterceptingCoordinationStore;
import com.whereq.roundhouse.support.MutableClock;
import com.whereq.roundhouse.support.TestJobs;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobAdmissionServiceTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    private MutableClock clock;
    private InterceptingCoordinationStore store;
    private QueueKeys keys;
    private JobStatusTracker tracker;
    private PriorityJobQueue priorityQueue;
    private FifoJobQueue fifoQueue;
    private JobAdmissionService admission;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START, Duration.ofMillis(1));
        store = new InterceptingCoordinationStore(clock);
        keys = new QueueKeys("test");
        tracker = new JobStatusTracker(store, keys, TestJobs.codec(), clock, Duration.ofDays(7));
        priorityQueue = new PriorityJobQueue(store, keys, 1_000_000_000L);
        fifoQueue = new FifoJobQueue(store, keys);
        admission = new JobAdmissionService(tracker, priorityQueue, fifoQueue, clock, new SimpleMeterRegistry());
    }

    @Test
    void assignsIdentityAndAdmissionTime() {
        UUID callerId = UUID.randomUUID();
        BuildJob draft = TestJobs.draft(0).toBuilder().id(callerId).createdAt(Instant.EPOCH).build();

        BuildJob admitted = admission.enqueue(draft).block();

        assertThat(admitted.getId()).isNotNull().isNotEqualTo(callerId);
        assertThat(admitted.getCreatedAt()).isAfterOrEqualTo(START);
        assertThat(tracker.getJob(admitted.getId()).block().getStatus()).isEqualTo(JobStatus.QUEUED);
    }

    @Test
    void routesByPriority() {
        admission.enqueue(TestJobs.draft(0)).block();
        admission.enqueue(TestJobs.draft(0)).block();
        admission.enqueue(TestJobs.draft(4)).block();

        assertThat(fifoQueue.size().block()).isEqualTo(2L);
        assertThat(priorityQueue.size().block()).isEqualTo(1L);
    }

    @Test
    void rejectsInvalidJobBeforeWritingAnything() {
        BuildJob missingSha = TestJobs.draft(0).toBuilder().gitSha(" ").build();
        BuildJob negativePriority = TestJobs.draft(-1);
        BuildJob missingService = TestJobs.draft(0).toBuilder().serviceId(null).build();

        assertThatThrownBy(() -> admission.enqueue(missingSha).block()).isInstanceOf(JobValidationException.class);
        assertThatThrownBy(() -> admission.enqueue(negativePriority).block()).isInstanceOf(JobValidationException.class);
        assertThatThrownBy(() -> admission.enqueue(missingService).block()).isInstanceOf(JobValidationException.class);
        assertThat(fifoQueue.size().block()).isZero();
        assertThat(priorityQueue.size().block()).isZero();
    }

    @Test
    void rejectsJobWithoutProjectOrBuildConfig() {
        BuildJob missingProject = TestJobs.draft(0).toBuilder().projectId(null).build();
        BuildJob missingConfig = TestJobs.draft(3).toBuilder().buildConfig(null).build();

        assertThatThrownBy(() -> admission.enqueue(missingProject).block())
            .isInstanceOf(JobValidationException.class)
            .hasMessageContaining("project_id");
        assertThatThrownBy(() -> admission.enqueue(missingConfig).block())
            .isInstanceOf(JobValidationException.class)
            .hasMessageContaining("build_config");
        assertThat(fifoQueue.size().block()).isZero();
        assertThat(priorityQueue.size().block()).isZero();
    }

    @Test
    void removesRecordWhenSettingItsExpiryFails() {
        store.failExpireAt(new StoreUnavailableException("connection reset"));

        assertThatThrownBy(() -> admission.enqueue(TestJobs.draft(0)).block())
            .isInstanceOf(StoreUnavailableException.class);

        assertThat(store.getFailedExpireKeys()).hasSize(1);
        assertThat(store.hashGetAll(store.getFailedExpireKeys().get(0)).block()).isEmpty();
        assertThat(fifoQueue.size().block()).isZero();
    }

    @Test
    void removesRecordWhenQueueInsertFails() {
        FifoJobQueue failingQueue = mock(FifoJobQueue.class);
        when(failingQueue.offer(any())).thenReturn(Mono.error(new StoreUnavailableException("connection reset")));
        JobAdmissionService failing =
            new JobAdmissionService(tracker, priorityQueue, failingQueue, clock, new SimpleMeterRegistry());

        assertThatThrownBy(() -> failing.enqueue(TestJobs.draft(0)).block())
            .isInstanceOf(StoreUnavailableException.class);

        ArgumentCaptor<BuildJob> offered = ArgumentCaptor.forClass(BuildJob.class);
        verify(failingQueue).offer(offered.capture());
        UUID jobId = offered.getValue().getId();
        assertThatThrownBy(() -> tracker.getJob(jobId).block()).isInstanceOf(JobNotFoundException.class);
    }

    @Test
    void serializationFailureLeavesNoState() throws Exception {
        ObjectMapper brokenMapper = mock(ObjectMapper.class);
        when(brokenMapper.writeValueAsString(any())).thenThrow(new JsonProcessingException("cannot write") { });
        JobStatusTracker brokenTracker =
            new JobStatusTracker(store, keys, new JsonCodec(brokenMapper), clock, Duration.ofDays(7));
        JobAdmissionService broken =
            new JobAdmissionService(brokenTracker, priorityQueue, fifoQueue, clock, new SimpleMeterRegistry());

        assertThatThrownBy(() -> broken.enqueue(TestJobs.draft(2)).block())
            .isInstanceOf(JobSerializationException.class);
        assertThat(priorityQueue.size().block()).isZero();
        assertThat(fifoQueue.size().block()).isZero();
    }

    @Test
    void cancelsQueuedJob() {
        BuildJob job = admission.enqueue(TestJobs.draft(0)).block();

        admission.cancel(job.getId()).block();

        assertThat(tracker.getJob(job.getId()).block().getStatus()).isEqualTo(JobStatus.CANCELLED);
    }

    @Test
    void cannotCancelFinishedJob() {
        BuildJob job = admission.enqueue(TestJobs.draft(0)).block();
        tracker.updateStatus(job.getId(), JobStatus.BUILDING, "worker-1").block();
        tracker.updateStatus(job.getId(), JobStatus.COMPLETED, "worker-1").block();

        assertThatThrownBy(() -> admission.cancel(job.getId()).block())
            .isInstanceOf(InvalidStatusTransitionException.class);
    }

    @Test
    void retryReadmitsFailedJobWithHigherPriority() {
        BuildJob job = admission.enqueue(TestJobs.draft(0)).block();
        tracker.updateStatus(job.getId(), JobStatus.BUILDING, "worker-1").block();
        tracker.updateStatus(job.getId(), JobStatus.FAILED, "worker-1").block();
        fifoQueue.poll(Duration.ZERO).block();

        BuildJob retried = admission.retry(job.getId()).block();

        assertThat(retried.getId()).isNotEqualTo(job.getId());
        assertThat(retried.getPriority()).isEqualTo(1);
        assertThat(retried.getGitSha()).isEqualTo(job.getGitSha());
        assertThat(retried.getBuildConfig()).isEqualTo(job.getBuildConfig());
        assertThat(priorityQueue.size().block()).isEqualTo(1L);
        assertThat(tracker.getJob(job.getId()).block().getStatus()).isEqualTo(JobStatus.FAILED);
    }

    @Test
    void retryRejectsJobThatHasNotFailed() {
        BuildJob job = admission.enqueue(TestJobs.draft(0)).block();

        assertThatThrownBy(() -> admission.retry(job.getId()).block())
            .isInstanceOf(InvalidStatusTransitionException.class);
    }
}
