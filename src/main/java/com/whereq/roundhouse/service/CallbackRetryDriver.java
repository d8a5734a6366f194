package com.whereq.roundhouse.service;

import com.whereq.roundhouse.config.RoundhouseProperties;
import com.whereq.roundhouse.model.FailedCallback;
import com.whereq.roundhouse.model.RetryPolicy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

/**
 * Periodically redelivers failed callbacks.
 *
 * Each pass claims the attempts that are due, so several instances can run the driver
 * against the same store without delivering an attempt twice.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "roundhouse.callback.driver", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CallbackRetryDriver {

    private final CallbackRetryQueue retryQueue;
    private final CallbackNotifier notifier;
    private final RetryPolicy retryPolicy;
    private final Clock clock;
    private final int batchSize;

    private final Counter retriedCounter;
    private final Counter abandonedCounter;

    @Autowired
    public CallbackRetryDriver(CallbackRetryQueue retryQueue, CallbackNotifier notifier,
                               RetryPolicy callbackRetryPolicy, Clock clock, RoundhouseProperties properties,
                               MeterRegistry meterRegistry) {
        this(retryQueue, notifier, callbackRetryPolicy, clock,
            properties.getCallback().getDriver().getBatchSize(), meterRegistry);
    }

    public CallbackRetryDriver(CallbackRetryQueue retryQueue, CallbackNotifier notifier,
                               RetryPolicy retryPolicy, Clock clock, int batchSize, MeterRegistry meterRegistry) {
        this.retryQueue = retryQueue;
        this.notifier = notifier;
        this.retryPolicy = retryPolicy;
        this.clock = clock;
        this.batchSize = batchSize;

        this.retriedCounter = Counter.builder("roundhouse.callbacks.retried")
            .description("Number of callback redeliveries attempted")
            .register(meterRegistry);
        this.abandonedCounter = Counter.builder("roundhouse.callbacks.abandoned")
            .description("Number of callbacks dropped after exhausting retries")
            .register(meterRegistry);
    }

    @Scheduled(fixedDelayString = "${roundhouse.callback.driver.interval:PT5S}")
    public void retryDueCallbacks() {
        try {
            Long processed = runOnce().block();
            if (processed != null && processed > 0) {
                log.info("Processed {} callback retries", processed);
            }
        } catch (Exception e) {
            log.warn("Callback retry pass failed: {}", e.getMessage());
        }
    }

    /**
     * Claim due attempts and redeliver them one by one
     *
     * @return Mono with the number of attempts processed
     */
    public Mono<Long> runOnce() {
        return retryQueue.claimReady(batchSize)
            .concatMap(this::redeliver)
            .count();
    }

    private Mono<Void> redeliver(FailedCallback attempt) {
        retriedCounter.increment();

        return notifier.deliver(attempt.getCallbackUrl(), attempt.getPayload())
            .then(Mono.defer(() -> {
                log.info("Callback for job {} delivered on attempt {}", attempt.getJobId(), attempt.getAttempts() + 1);
                return retryQueue.abandon(attempt.getId());
            }))
            .onErrorResume(error -> handleFailure(attempt, error))
            .onErrorResume(error -> {
                // Claimed but not put back; the attempt expires with its retention
                log.error("Failed to update callback attempt {} for job {}: {}",
                    attempt.getId(), attempt.getJobId(), error.getMessage());
                return Mono.empty();
            });
    }

    private Mono<Void> handleFailure(FailedCallback attempt, Throwable error) {
        int attemptsSoFar = attempt.getAttempts() + 1;

        if (retryPolicy.isExhausted(attemptsSoFar)) {
            abandonedCounter.increment();
            log.warn("Callback for job {} abandoned after {} attempts: {}",
                attempt.getJobId(), attemptsSoFar, error.getMessage());
            return retryQueue.abandon(attempt.getId());
        }

        Instant now = clock.instant();
        Instant next = now.plus(retryPolicy.backoffFor(attemptsSoFar));
        if (attempt.getNextRetry() != null && !next.isAfter(attempt.getNextRetry())) {
            next = attempt.getNextRetry().plusMillis(1);
        }

        return retryQueue.reschedule(attempt, next, error.getMessage()).then();
    }
}
