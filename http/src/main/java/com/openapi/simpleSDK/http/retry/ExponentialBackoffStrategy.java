package com.openapi.simpleSDK.http.retry;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Random;

/**
 * Computes the pause before a retry: a server supplied {@code Retry-After} wins,
 * otherwise the base delay doubles per attempt with up to 50% random jitter, capped at
 * the policy maximum.
 */
public class ExponentialBackoffStrategy {
    private final Random random;
    private final Clock clock;

    public ExponentialBackoffStrategy() {
        this(new Random(), Clock.systemUTC());
    }

    ExponentialBackoffStrategy(Random random, Clock clock) {
        this.random = random;
        this.clock = clock;
    }

    public Duration delayAfter(int failedAttempt, RetryPolicy policy, String retryAfterHeader) {
        Duration serverDelay = parseRetryAfter(retryAfterHeader);
        if (serverDelay != null) {
            return serverDelay.compareTo(policy.getMaxDelay()) > 0 ? policy.getMaxDelay() : serverDelay;
        }

        int exponent = Math.min(Math.max(failedAttempt - 1, 0), 20);
        long exponentialMs = policy.getBaseDelay().toMillis() << exponent;
        long jitterMs = (long) (exponentialMs * 0.5 * random.nextDouble());
        return Duration.ofMillis(Math.min(exponentialMs + jitterMs, policy.getMaxDelay().toMillis()));
    }

    Duration parseRetryAfter(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.chars().allMatch(Character::isDigit)) {
            return Duration.ofSeconds(Long.parseLong(trimmed));
        }
        try {
            ZonedDateTime at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
            Duration delay = Duration.between(ZonedDateTime.now(clock), at);
            return delay.isNegative() ? Duration.ZERO : delay;
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
