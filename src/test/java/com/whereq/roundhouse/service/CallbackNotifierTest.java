package com.whereq.roundhouse.service;

import com.whereq.roundhouse.model.BuildJob;
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
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CallbackNotifierTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");
    private static final String CALLBACK_URL = "http://orchestrator.local/internal/builds/callback";

    private final List<ClientRequest> requests = new CopyOnWriteArrayList<>();
    private HttpStatus responseStatus;

    private MutableClock clock;
    private CallbackRetryQueue retryQueue;
    private CallbackNotifier notifier;
    private BuildJob job;
    private BuildResult result;

    @BeforeEach
    void setUp() {
        responseStatus = HttpStatus.OK;
        clock = new MutableClock(START);
        retryQueue = new CallbackRetryQueue(new InMemoryCoordinationStore(clock), new QueueKeys("test"),
            TestJobs.codec(), clock, Duration.ofHours(24));

        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            return Mono.just(ClientResponse.create(responseStatus).build());
        });
        RetryPolicy policy = RetryPolicy.builder().initialInterval(Duration.ofSeconds(5)).build();
        notifier = new CallbackNotifier(builder, retryQueue, policy, clock, "secret-key", Duration.ofSeconds(5),
            new SimpleMeterRegistry());

        job = TestJobs.draft(0).toBuilder()
            .id(UUID.randomUUID())
            .createdAt(START)
            .callbackUrl(CALLBACK_URL)
            .build();
        result = BuildResult.builder().jobId(job.getId()).releaseId(job.getReleaseId()).success(true).build();
    }

    @Test
    void postsResultWithBearerToken() {
        notifier.deliver(CALLBACK_URL, result).block();

        assertThat(requests).hasSize(1);
        ClientRequest request = requests.get(0);
        assertThat(request.method()).isEqualTo(HttpMethod.POST);
        assertThat(request.url().toString()).isEqualTo(CALLBACK_URL);
        assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer secret-key");
    }

    @Test
    void errorStatusIsADeliveryFailure() {
        responseStatus = HttpStatus.BAD_GATEWAY;

        assertThatThrownBy(() -> notifier.deliver(CALLBACK_URL, result).block())
            .isInstanceOf(WebClientResponseException.class);
    }

    @Test
    void successfulNotificationSchedulesNothing() {
        notifier.notifyCompletion(job, result).block();

        assertThat(requests).hasSize(1);
        assertThat(retryQueue.pendingCount().block()).isZero();
    }

    @Test
    void failedNotificationIsQueuedForRetry() {
        responseStatus = HttpStatus.SERVICE_UNAVAILABLE;

        notifier.notifyCompletion(job, result).block();

        assertThat(retryQueue.pendingCount().block()).isEqualTo(1L);
        clock.advance(Duration.ofSeconds(5));
        FailedCallback attempt = retryQueue.claimReady(1).blockFirst();
        assertThat(attempt.getJobId()).isEqualTo(job.getId());
        assertThat(attempt.getCallbackUrl()).isEqualTo(CALLBACK_URL);
        assertThat(attempt.getPayload()).isEqualTo(result);
        assertThat(attempt.getAttempts()).isEqualTo(1);
        assertThat(attempt.getNextRetry()).isEqualTo(START.plusSeconds(5));
    }

    @Test
    void transportErrorIsQueuedForRetry() {
        WebClient.Builder unreachable = WebClient.builder()
            .exchangeFunction(request -> Mono.error(new ConnectException("Connection refused")));
        CallbackNotifier offline = new CallbackNotifier(unreachable, retryQueue, RetryPolicy.defaultPolicy(), clock,
            null, Duration.ofSeconds(5), new SimpleMeterRegistry());

        offline.notifyCompletion(job, result).block();

        assertThat(retryQueue.pendingCount().block()).isEqualTo(1L);
    }

    @Test
    void jobWithoutCallbackIsNotNotified() {
        notifier.notifyCompletion(job.toBuilder().callbackUrl(null).build(), result).block();

        assertThat(requests).isEmpty();
        assertThat(retryQueue.pendingCount().block()).isZero();
    }
}
