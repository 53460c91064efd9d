package com.crosspost.platform.scheduler.service;

import com.crosspost.platform.connector.model.PostVariant;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * When a demoted variant is committed again after a failed attempt.
 *
 * <p>With the defaults ({@code max-attempts: 0}, {@code backoff: 0s}) every transient failure is
 * retried on the next tick without limit. Failures recorded as not retryable (validation errors,
 * rejections, missed windows) wait for the user to request the schedule again.
 */
@Component
@Getter
public class RetryPolicy {

    static final String MISSED_WINDOW = "MISSED_WINDOW";

    private final int maxAttempts;
    private final Duration backoff;

    public RetryPolicy(@Value("${scheduler.retry.max-attempts:0}") int maxAttempts,
                       @Value("${scheduler.retry.backoff:0s}") Duration backoff) {
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
    }

    /**
     * Next attempt time for a variant demoted after a failure, empty when it must stay demoted.
     */
    public Optional<Instant> nextAttemptAt(PostVariant variant, Instant now) {
        if (!variant.isScheduleDesired() || variant.getNotScheduledReason() == null) {
            return Optional.empty();
        }
        if (!variant.isRetryable()) {
            return Optional.empty();
        }
        if (maxAttempts > 0 && variant.getAttemptCount() >= maxAttempts) {
            return Optional.empty();
        }
        return Optional.of(now.plus(backoff.multipliedBy(variant.getAttemptCount())));
    }
}
