package com.whereq.roundhouse.service;

import com.whereq.roundhouse.config.RoundhouseProperties;
import com.whereq.roundhouse.model.BuildJob;
import com.whereq.roundhouse.model.BuildResult;
import com.whereq.roundhouse.model.FailedCallback;
import com.whereq.roundhouse.model.RetryPolicy;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;

/**
 * Service for delivering build results to the job's callback URL
 */
@Slf4j
@Service
public class CallbackNotifier {

    private final WebClient webClient;
    private final CallbackRetryQueue retryQueue;
    private final RetryPolicy retryPolicy;
    private final Clock clock;
    private final String apiKey;
    private final Duration timeout;

    private final Counter deliveredCounter;
    private final Counter failedCounter;

    @Autowired
    public CallbackNotifier(WebClient.Builder webClientBuilder, CallbackRetryQueue retryQueue,
                            RetryPolicy callbackRetryPolicy, Clock clock, RoundhouseProperties properties,
                            MeterRegistry meterRegistry) {
        this(webClientBuilder, retryQueue, callbackRetryPolicy, clock, properties.getCallback().getApiKey(),
            properties.getCallback().getTimeout(), meterRegistry);
    }

    public CallbackNotifier(WebClient.Builder webClientBuilder, CallbackRetryQueue retryQueue,
                            RetryPolicy retryPolicy, Clock clock, String apiKey, Duration timeout,
                            MeterRegistry meterRegistry) {
        this.webClient = webClientBuilder.build();
        this.retryQueue = retryQueue;
        this.retryPolicy = retryPolicy;
        this.clock = clock;
        this.apiKey = apiKey;
        this.timeout = timeout;

        this.deliveredCounter = Counter.builder("roundhouse.callbacks.delivered")
            .description("Number of build results delivered to callback URLs")
            .register(meterRegistry);
        this.failedCounter = Counter.builder("roundhouse.callbacks.failed")
            .description("Number of failed callback deliveries")
            .register(meterRegistry);
    }

    /**
     * Deliver a build result and schedule a retry if delivery fails. Completes normally
     * either way; a job's outcome never depends on its callback.
     *
     * @param job finished job
     * @param result build outcome
     * @return Mono that completes when delivered or queued for retry
     */
    public Mono<Void> notifyCompletion(BuildJob job, BuildResult result) {
        if (!job.hasCallback()) {
            return Mono.empty();
        }

        return deliver(job.getCallbackUrl(), result)
            .onErrorResume(error -> {
                log.warn("Callback for job {} failed, scheduling retry: {}", job.getId(), error.getMessage());
                return retryQueue.scheduleRetry(FailedCallback.builder()
                        .jobId(job.getId())
                        .callbackUrl(job.getCallbackUrl())
                        .payload(result)
                        .attempts(1)
                        .nextRetry(clock.instant().plus(retryPolicy.backoffFor(1)))
                        .lastError(error.getMessage())
                        .build())
                    .then()
                    .onErrorResume(scheduleError -> {
                        log.error("Failed to schedule callback retry for job {}: {}",
                            job.getId(), scheduleError.getMessage());
                        return Mono.empty();
                    });
            });
    }

    /**
     * POST a build result as JSON
     *
     * @param url callback URL
     * @param result build outcome
     * @return Mono that completes when the receiver accepted it; errors on transport
     *     failure or any status of 400 and above
     */
    public Mono<Void> deliver(String url, BuildResult result) {
        return webClient.post()
            .uri(url)
            .contentType(MediaType.APPLICATION_JSON)
            .headers(headers -> {
                if (apiKey != null && !apiKey.isEmpty()) {
                    headers.set(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
                }
            })
            .bodyValue(result)
            .retrieve()
            .toBodilessEntity()
            .timeout(timeout)
            .doOnSuccess(response -> {
                deliveredCounter.increment();
                log.info("Callback sent for job {}: {} - {}", result.getJobId(), url, response.getStatusCode());
            })
            .doOnError(error -> {
                failedCounter.increment();
                log.warn("Callback to {} for job {} failed: {}", url, result.getJobId(), error.getMessage());
            })
            .then();
    }
}
