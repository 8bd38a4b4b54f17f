package org.assetsync.changes.polling;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

import org.assetsync.client.common.ApiException;
import org.assetsync.client.common.DamApiClient;
import org.assetsync.client.common.http.HttpResponse;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

/**
 * Repeats a read until it reports ready or the attempt budget is exhausted, waiting a fixed
 * delay between attempts. Disposing the returned Mono cancels any pending wait.
 */
@Slf4j
public class PollingRetrier {
    private static final int STATUS_READY = 200;
    private static final int STATUS_ACCEPTED = 202;

    private final DamApiClient client;
    private final PollingSettings defaults;
    private final Scheduler delayScheduler;

    public PollingRetrier(DamApiClient client, PollingSettings defaults) {
        this(client, defaults, Schedulers.parallel());
    }

    public PollingRetrier(DamApiClient client, PollingSettings defaults, Scheduler delayScheduler) {
        this.client = client;
        this.defaults = defaults;
        this.delayScheduler = delayScheduler;
    }

    public Mono<HttpResponse> pollUntilReady(String location) {
        return pollUntilReady(location, defaults.getMaxAttempts(), defaults.getDelay());
    }

    /**
     * GETs {@code location} until it answers 200. A 202 consumes one attempt and waits {@code delay};
     * any other status fails immediately.
     *
     * @throws PollingTimeoutException (as an error signal) after {@code maxAttempts} 202 responses
     */
    public Mono<HttpResponse> pollUntilReady(String location, int maxAttempts, Duration delay) {
        var attempt = Mono.defer(() -> client.get(location))
            .flatMap(response -> {
                if (response.getStatusCode() == STATUS_READY) {
                    return Mono.just(response);
                }
                if (response.getStatusCode() == STATUS_ACCEPTED) {
                    log.debug("{} still processing", location);
                    return Mono.error(new NotReadyException(location));
                }
                return Mono.error(new ApiException("Unexpected status " + response.getStatusCode()
                    + " while polling " + location));
            });
        return retryWhileNotReady(location, attempt, maxAttempts, delay);
    }

    /**
     * As {@link #pollUntilReady(String, int, Duration)}, but also gives up once {@code deadline} has passed.
     */
    public Mono<HttpResponse> pollUntilReady(String location, int maxAttempts, Duration delay, Duration deadline) {
        return withDeadline(location, pollUntilReady(location, maxAttempts, delay), deadline);
    }

    /**
     * Resubscribes to {@code attempt} for as long as it fails with {@link NotReadyException}, up to
     * {@code maxAttempts} subscriptions in total. Any other error ends the poll at once.
     */
    public <T> Mono<T> retryWhileNotReady(String target, Mono<T> attempt, int maxAttempts, Duration delay) {
        if (maxAttempts < 1) {
            return Mono.error(new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts));
        }
        return attempt.retryWhen(Retry.fixedDelay(maxAttempts - 1L, delay)
            .scheduler(delayScheduler)
            .filter(NotReadyException.class::isInstance)
            .doBeforeRetry(signal -> log.atDebug().setMessage("Polling {}: attempt {} of {}")
                .addArgument(target)
                .addArgument(signal.totalRetries() + 2)
                .addArgument(maxAttempts)
                .log())
            .onRetryExhaustedThrow((spec, signal) -> {
                log.warn("Giving up on {} after {} attempts", target, maxAttempts);
                return new PollingTimeoutException(target, maxAttempts);
            }));
    }

    public <T> Mono<T> retryWhileNotReady(String target, Mono<T> attempt, PollingSettings settings) {
        return retryWhileNotReady(target, attempt, settings.getMaxAttempts(), settings.getDelay());
    }

    private <T> Mono<T> withDeadline(String target, Mono<T> poll, Duration deadline) {
        return poll.timeout(deadline, delayScheduler)
            .onErrorMap(TimeoutException.class, e -> new PollingTimeoutException(target, e));
    }
}
