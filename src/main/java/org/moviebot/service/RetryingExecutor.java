package org.moviebot.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.backoff.FixedBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.RestClientException;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Runs a single call with a fixed number of attempts and a fixed pause between them.
 * <p>
 * Every failed attempt is logged at WARN. Once the attempts are used up the last exception is logged
 * and rethrown, so callers decide what "no response" means for them.
 */
@Slf4j
public class RetryingExecutor {

    private final RetryTemplate retryTemplate;
    private final int maxAttempts;

    public RetryingExecutor(int maxAttempts, Duration delay) {
        this(maxAttempts, delay, List.of(RestClientException.class));
    }

    public RetryingExecutor(int maxAttempts, Duration delay, Collection<Class<? extends Throwable>> retryOn) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;

        Map<Class<? extends Throwable>, Boolean> retryable = retryOn.stream()
                .collect(Collectors.toMap(Function.identity(), type -> true));

        FixedBackOffPolicy backOffPolicy = new FixedBackOffPolicy();
        backOffPolicy.setBackOffPeriod(Math.max(1, delay.toMillis()));

        this.retryTemplate = new RetryTemplate();
        this.retryTemplate.setRetryPolicy(new SimpleRetryPolicy(maxAttempts, retryable));
        this.retryTemplate.setBackOffPolicy(backOffPolicy);
    }

    public <T> T execute(String operation, Supplier<T> call) {
        try {
            return retryTemplate.execute(context -> {
                try {
                    return call.get();
                } catch (RuntimeException e) {
                    log.warn("Attempt {}/{} failed for {}: {}",
                            context.getRetryCount() + 1, maxAttempts, operation, e.getMessage());
                    throw e;
                }
            });
        } catch (RuntimeException e) {
            log.error("Giving up on {}: {}", operation, e.getMessage());
            throw e;
        }
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
