package com.mailsync.provider;

import com.mailsync.config.SyncProperties;
import com.mailsync.exception.ProviderException;
import com.mailsync.exception.TransientProviderException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;

/**
 * Runs blocking provider calls with a bounded timeout and exponential-backoff retry
 * - Timeout counts as a transient failure
 * - Only TransientProviderException is retried
 * - After the retry budget the last transient failure is rethrown
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProviderCallPolicy {

    private final SyncProperties properties;

    /**
     * Execute a provider call and return its result
     */
    public <T> T call(String operation, Callable<T> call) {
        SyncProperties.Retry retry = properties.getRetry();
        Duration timeout = Duration.ofMillis(properties.getProvider().getTimeoutMs());

        try {
            return Mono.fromCallable(call)
                    .subscribeOn(Schedulers.boundedElastic())
                    .timeout(timeout)
                    .onErrorMap(TimeoutException.class,
                            e -> new TransientProviderException(operation + " timed out after " + timeout.toMillis() + "ms", e))
                    .retryWhen(Retry.backoff(retry.getMaxAttempts(), Duration.ofMillis(retry.getInitialDelayMs()))
                            .maxBackoff(Duration.ofMillis(retry.getMaxDelayMs()))
                            .filter(TransientProviderException.class::isInstance)
                            .doBeforeRetry(signal -> log.warn("{} failed (attempt {}): {}, retrying",
                                    operation, signal.totalRetries() + 1, signal.failure().getMessage()))
                            .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()))
                    .block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new ProviderException(operation + " failed", cause);
        }
    }

    /**
     * Execute a provider call without a result
     */
    public void run(String operation, Runnable call) {
        call(operation, () -> {
            call.run();
            return Boolean.TRUE;
        });
    }
}
