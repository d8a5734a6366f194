package com.whereq.roundhouse.service;

import com.whereq.roundhouse.model.BuildResult;
import com.whereq.roundhouse.model.FailedCallback;
import com.whereq.roundhouse.model.RetryPolicy;
import com.whereq.roundhouse.queue.QueueKeys;
import com.whereq.roundhouse.store.InMemoryCoordinationStore;
import com.whereq.roundhouse.support.MutableClock;
import com.whereq.roundhouse.support.TestJobs;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class CallbackRetryDriverTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    private final AtomicInteger deliveries = new AtomicInteger();
    private volatile HttpStatus responseStatus;

    private MutableClock clock;
    private CallbackRetryQueue retryQueue;
    private RetryPolicy policy;
    private CallbackRetryDriver driver;

    @BeforeEach
    void setUp() {
        responseStatus = HttpStatus.OK;
        clock = new MutableClock(START);
        retryQueue = new CallbackRetryQueue(new InMemoryCoordinationStore(clock), new QueueKeys("test"),
            TestJobs.codec(), clock, Duration.ofHours(24));
        policy = RetryPolicy.builder()
            .maxAttempts(3)
            .initialInterval(Duration.ofSeconds(1))
            .multiplier(2.0)
            .maxInterval(Duration.ofMinutes(1))
            .build();

        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            deliveries.incrementAndGet();
            return Mono.just(ClientResponse.create(responseStatus).build());
        });
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        CallbackNotifier notifier =
            new CallbackNotifier(builder, retryQueue, policy, clock, null, Duration.ofSeconds(5), meterRegistry);
        driver = new CallbackRetryDriver(retryQueue, notifier, policy, clock, 10, meterRegistry);
    }

    @Test
    void deliveredAttemptIsRemoved() {
        schedule(1);

        assertThat(driver.runOnce().block()).isEqualTo(1L);

        assertThat(deliveries.get()).isEqualTo(1);
        assertThat(retryQueue.pendingCount().block()).isZero();
    }

    @Test
    void failedRedeliveryIsRescheduledWithBackoff() {
        responseStatus = HttpStatus.INTERNAL_SERVER_ERROR;
        schedule(1);

        driver.runOnce().block();

        assertThat(retryQueue.pendingCount().block()).isEqualTo(1L);
        assertThat(retryQueue.claimReady(10).collectList().block()).isEmpty();

        // Second delivery failed: next delay is initial * multiplier
        clock.advance(Duration.ofSeconds(2));
        FailedCallback attempt = retryQueue.claimReady(10).blockFirst();
        assertThat(attempt.getAttempts()).isEqualTo(2);
        assertThat(attempt.getNextRetry()).isEqualTo(START.plusSeconds(2));
        assertThat(attempt.getLastError()).contains("500");
    }

    @Test
    void attemptIsAbandonedWhenRetriesRunOut() {
        responseStatus = HttpStatus.SERVICE_UNAVAILABLE;
        schedule(2);

        driver.runOnce().block();

        assertThat(deliveries.get()).isEqualTo(1);
        assertThat(retryQueue.pendingCount().block()).isZero();
    }

    @Test
    void nothingDueMeansNoDeliveries() {
        retryQueue.scheduleRetry(UUID.randomUUID(), START.plusSeconds(60)).block();

        assertThat(driver.runOnce().block()).isZero();
        assertThat(deliveries.get()).isZero();
    }

    @Test
    void scheduledPassSurvivesDeliveryFailures() {
        responseStatus = HttpStatus.BAD_GATEWAY;
        schedule(1);

        driver.retryDueCallbacks();

        assertThat(retryQueue.pendingCount().block()).isEqualTo(1L);
    }

    private void schedule(int attempts) {
        UUID jobId = UUID.randomUUID();
        retryQueue.scheduleRetry(FailedCallback.builder()
                .jobId(jobId)
                .callbackUrl("http://orchestrator.local/callback")
                .payload(BuildResult.builder().jobId(jobId).success(true).build())
                .attempts(attempts)
                .nextRetry(START)
                .build())
            .block();
    }
}
