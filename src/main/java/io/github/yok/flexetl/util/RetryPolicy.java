package io.github.yok.flexetl.util;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import io.github.yok.flexetl.config.PipelineConfig;
import java.time.Duration;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounded retry with a fixed delay around any fallible operation.
 *
 * <p>
 * <strong>Behavior:</strong>
 * </p>
 * <ul>
 * <li>The operation is attempted at most {@code maxAttempts} times.</li>
 * <li>Every failure is logged with the attempt count.</li>
 * <li>While attempts remain, the calling thread pauses for {@code retryDelay} (no backoff).</li>
 * <li>When all attempts fail, a critical line is logged and {@link RetryExhaustedException} is
 * thrown.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Getter
public class RetryPolicy {

    /**
     * A zero-argument operation that may fail with any exception.
     *
     * @param <T> result type
     */
    @FunctionalInterface
    public interface Attempt<T> {

        /**
         * Runs the operation once.
         *
         * @return operation result
         * @throws Exception on failure
         */
        T run() throws Exception;
    }

    /**
     * Blocks the calling thread between two attempts.
     */
    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration delay) throws InterruptedException;
    }

    private final int maxAttempts;
    private final Duration retryDelay;
    private final Sleeper sleeper;

    /**
     * Creates a policy.
     *
     * @param maxAttempts maximum number of attempts (at least 1)
     * @param retryDelay fixed pause between attempts
     */
    public RetryPolicy(int maxAttempts, Duration retryDelay) {
        this(maxAttempts, retryDelay, delay -> Thread.sleep(delay.toMillis()));
    }

    @VisibleForTesting
    RetryPolicy(int maxAttempts, Duration retryDelay, Sleeper sleeper) {
        Preconditions.checkArgument(maxAttempts >= 1, "maxAttempts must be >= 1: %s", maxAttempts);
        Preconditions.checkNotNull(retryDelay, "retryDelay must not be null");
        Preconditions.checkArgument(!retryDelay.isNegative(), "retryDelay must not be negative");
        this.maxAttempts = maxAttempts;
        this.retryDelay = retryDelay;
        this.sleeper = Preconditions.checkNotNull(sleeper, "sleeper must not be null");
    }

    /**
     * Creates a policy from {@code pipeline.maxRetries} and {@code pipeline.retryDelay}.
     *
     * @param config pipeline settings
     * @return retry policy
     */
    public static RetryPolicy from(PipelineConfig config) {
        return new RetryPolicy(config.getMaxRetries(), config.getRetryDelay());
    }

    /**
     * Runs the operation until it succeeds or the attempts are exhausted.
     *
     * @param operation operation name used in log lines and in the fatal error
     * @param attempt the operation
     * @param <T> result type
     * @return result of the first successful attempt
     * @throws RetryExhaustedException if every attempt failed
     */
    public <T> T execute(String operation, Attempt<T> attempt) {
        for (int count = 1; count <= maxAttempts; count++) {
            try {
                return attempt.run();
            } catch (Exception e) {
                log.error("Error in {}: {}. Attempt {}/{}", operation, e.getMessage(), count,
                        maxAttempts);
                log.debug("Failure detail of {} (attempt {})", operation, count, e);
                if (count < maxAttempts) {
                    pause(operation, count);
                }
            }
        }
        log.error("CRITICAL: operation {} failed after {} attempts.", operation, maxAttempts);
        throw new RetryExhaustedException(operation, maxAttempts);
    }

    private void pause(String operation, int count) {
        log.info("Retrying {} in {} ms", operation, retryDelay.toMillis());
        try {
            sleeper.sleep(retryDelay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while waiting to retry {}", operation);
            throw new RetryExhaustedException(operation, count);
        }
    }
}
