package com.whereq.roundhouse.worker;

import com.whereq.roundhouse.config.RoundhouseProperties;
import com.whereq.roundhouse.executor.BuildExecutor;
import com.whereq.roundhouse.model.BuildJob;
import com.whereq.roundhouse.model.BuildResult;
import com.whereq.roundhouse.model.JobStatus;
import com.whereq.roundhouse.service.BuildLogStream;
import com.whereq.roundhouse.service.CallbackNotifier;
import com.whereq.roundhouse.service.DispatchService;
import com.whereq.roundhouse.service.JobStatusTracker;
import com.whereq.roundhouse.service.WorkerRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background worker that claims jobs and runs them through the {@link BuildExecutor}.
 *
 * The worker keeps one claim loop per build slot, so at most {@code maxConcurrentBuilds}
 * builds run at once and a slot only asks for work when it is free. On shutdown it stops
 * claiming, waits for running builds up to the grace period and unregisters.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "roundhouse.worker", name = "enabled", havingValue = "true")
public class BuildWorker {

    private static final Duration ERROR_BACKOFF = Duration.ofSeconds(1);
    private static final Duration UNREGISTER_TIMEOUT = Duration.ofSeconds(5);

    private final DispatchService dispatchService;
    private final JobStatusTracker statusTracker;
    private final BuildLogStream logStream;
    private final WorkerRegistry workerRegistry;
    private final CallbackNotifier callbackNotifier;
    private final BuildExecutor executor;
    private final Clock clock;

    private final String workerId;
    private final int maxConcurrentBuilds;
    private final Duration pollInterval;
    private final Duration buildTimeout;
    private final Duration shutdownGracePeriod;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger activeBuilds = new AtomicInteger();
    private volatile Disposable loop;

    private final Counter successCounter;
    private final Counter failureCounter;
    private final Timer executionTimer;

    @Autowired
    public BuildWorker(DispatchService dispatchService, JobStatusTracker statusTracker, BuildLogStream logStream,
                       WorkerRegistry workerRegistry, CallbackNotifier callbackNotifier,
                       ObjectProvider<BuildExecutor> executor, Clock clock, RoundhouseProperties properties,
                       MeterRegistry meterRegistry) {
        this(dispatchService, statusTracker, logStream, workerRegistry, callbackNotifier,
            executor.getIfAvailable(), clock, properties.getWorker(), meterRegistry);
    }

    public BuildWorker(DispatchService dispatchService, JobStatusTracker statusTracker, BuildLogStream logStream,
                       WorkerRegistry workerRegistry, CallbackNotifier callbackNotifier, BuildExecutor executor,
                       Clock clock, RoundhouseProperties.WorkerConfig config, MeterRegistry meterRegistry) {
        this.dispatchService = dispatchService;
        this.statusTracker = statusTracker;
        this.logStream = logStream;
        this.workerRegistry = workerRegistry;
        this.callbackNotifier = callbackNotifier;
        this.executor = executor;
        this.clock = clock;

        this.workerId = config.getId() == null || config.getId().isBlank() ? defaultWorkerId() : config.getId();
        this.maxConcurrentBuilds = Math.max(1, config.getMaxConcurrentBuilds());
        this.pollInterval = config.getPollInterval();
        this.buildTimeout = config.getBuildTimeout();
        this.shutdownGracePeriod = config.getShutdownGracePeriod();

        this.successCounter = Counter.builder("roundhouse.builds.succeeded")
            .description("Number of successful builds")
            .register(meterRegistry);
        this.failureCounter = Counter.builder("roundhouse.builds.failed")
            .description("Number of failed builds")
            .register(meterRegistry);
        this.executionTimer = Timer.builder("roundhouse.builds.execution.time")
            .description("Build execution time")
            .register(meterRegistry);
    }

    @PostConstruct
    public void start() {
        if (executor == null) {
            log.warn("Build worker enabled but no BuildExecutor is available, not starting");
            return;
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }

        log.info("Starting build worker {}: max concurrent builds={}", workerId, maxConcurrentBuilds);

        loop = workerRegistry.register(workerId)
            .onErrorResume(e -> {
                log.warn("Failed to register worker {}: {}", workerId, e.getMessage());
                return Mono.empty();
            })
            .thenMany(Flux.range(0, maxConcurrentBuilds)
                .flatMap(slot -> claimAndBuild().repeat(running::get), maxConcurrentBuilds))
            .subscribe(
                v -> { },
                e -> log.error("Build worker {} stopped unexpectedly", workerId, e));
    }

    @PreDestroy
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }

        log.info("Stopping build worker {}, waiting for {} active builds", workerId, activeBuilds.get());

        long deadline = System.nanoTime() + shutdownGracePeriod.toNanos();
        try {
            while (activeBuilds.get() > 0 && System.nanoTime() < deadline) {
                Thread.sleep(100);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        if (activeBuilds.get() > 0) {
            log.warn("Shutdown grace period elapsed, interrupting {} builds", activeBuilds.get());
        } else {
            log.info("All builds completed");
        }

        if (loop != null) {
            loop.dispose();
        }

        try {
            workerRegistry.unregister(workerId).block(UNREGISTER_TIMEOUT);
        } catch (Exception e) {
            log.warn("Failed to unregister worker {}: {}", workerId, e.getMessage());
        }
    }

    public String getWorkerId() {
        return workerId;
    }

    public int getActiveBuilds() {
        return activeBuilds.get();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Claim one job and run it. Completes empty when no work arrived within the poll interval.
     */
    private Mono<Void> claimAndBuild() {
        return Mono.defer(() -> dispatchService.claim(workerId, pollInterval))
            .flatMap(this::build)
            .onErrorResume(e -> {
                log.error("Failed to claim job: {}", e.getMessage());
                return Mono.delay(ERROR_BACKOFF).then();
            });
    }

    /**
     * Execute a claimed job and record its outcome
     */
    private Mono<Void> build(BuildJob job) {
        long startMillis = clock.millis();
        activeBuilds.incrementAndGet();
        log.info("Processing job {}: service={}, sha={}", job.getId(), job.getServiceId(), job.shortSha());

        return Mono.defer(() -> executor.execute(job, line -> logStream.append(job.getId(), line).then()))
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(buildTimeout)
            .switchIfEmpty(Mono.fromSupplier(() -> BuildResult.failure(job, "Executor returned no result",
                elapsedSecs(startMillis))))
            .onErrorResume(e -> Mono.just(BuildResult.failure(job, failureMessage(e), elapsedSecs(startMillis))))
            .flatMap(result -> complete(job, result, startMillis))
            .doFinally(signal -> activeBuilds.decrementAndGet());
    }

    private Mono<Void> complete(BuildJob job, BuildResult result, long startMillis) {
        executionTimer.record(Duration.ofMillis(clock.millis() - startMillis));

        JobStatus finalStatus;
        if (result.isSuccess()) {
            finalStatus = JobStatus.COMPLETED;
            successCounter.increment();
            log.info("Job {} completed: image={}, duration={}s", job.getId(), result.getImageUri(),
                result.getDurationSecs());
        } else {
            finalStatus = JobStatus.FAILED;
            failureCounter.increment();
            log.warn("Job {} failed: {}, duration={}s", job.getId(), result.getErrorMessage(),
                result.getDurationSecs());
        }

        return statusTracker.setResult(job.getId(), result)
            .onErrorResume(e -> {
                log.error("Failed to store result for job {}: {}", job.getId(), e.getMessage());
                return Mono.empty();
            })
            .then(statusTracker.updateStatus(job.getId(), finalStatus, workerId)
                .onErrorResume(e -> {
                    log.error("Failed to update final status for job {}: {}", job.getId(), e.getMessage());
                    return Mono.empty();
                }))
            .then(callbackNotifier.notifyCompletion(job, result));
    }

    private String failureMessage(Throwable e) {
        if (e instanceof TimeoutException) {
            return "Build timed out after " + buildTimeout;
        }
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    private double elapsedSecs(long startMillis) {
        return (clock.millis() - startMillis) / 1000.0;
    }

    private static String defaultWorkerId() {
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            host = "worker";
        }
        return host + "-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
