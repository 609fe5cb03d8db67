package com.flagship.budget_reconciliation.config;

import com.flagship.budget_reconciliation.sync.DownstreamSyncException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.classify.Classifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.RetryPolicy;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.policy.ExceptionClassifierRetryPolicy;
import org.springframework.retry.policy.NeverRetryPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

/**
 * Retry policy for calls to downstream synchronization collaborators.
 *
 * Only a {@link DownstreamSyncException} flagged retryable (rate limit,
 * connection failure, timeout) is retried, with exponential backoff capped at
 * {@code sync.retry.max-interval-ms}, up to {@code sync.retry.max-attempts}
 * attempts in total. Everything else fails on the first attempt.
 */
@Configuration
@Slf4j
public class RetryConfig {

    @Bean
    public RetryTemplate downstreamSyncRetryTemplate(
            @Value("${sync.retry.max-attempts:5}") int maxAttempts,
            @Value("${sync.retry.initial-interval-ms:1000}") long initialIntervalMs,
            @Value("${sync.retry.multiplier:2.0}") double multiplier,
            @Value("${sync.retry.max-interval-ms:65000}") long maxIntervalMs) {

        SimpleRetryPolicy retryable = new SimpleRetryPolicy(maxAttempts);
        NeverRetryPolicy never = new NeverRetryPolicy();
        ExceptionClassifierRetryPolicy policy = new ExceptionClassifierRetryPolicy();
        policy.setExceptionClassifier((Classifier<Throwable, RetryPolicy>) throwable ->
            throwable instanceof DownstreamSyncException e && e.isRetryable() ? retryable : never);

        ExponentialBackOffPolicy backOff = new ExponentialBackOffPolicy();
        backOff.setInitialInterval(initialIntervalMs);
        backOff.setMultiplier(multiplier);
        backOff.setMaxInterval(maxIntervalMs);

        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(policy);
        template.setBackOffPolicy(backOff);

        log.info("Downstream sync retry: maxAttempts={}, initialInterval={}ms, multiplier={}, maxInterval={}ms",
            maxAttempts, initialIntervalMs, multiplier, maxIntervalMs);
        return template;
    }
}
