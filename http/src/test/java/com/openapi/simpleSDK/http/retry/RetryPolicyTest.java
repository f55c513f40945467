package com.openapi.simpleSDK.http.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void testSingleAttemptNeverAllowsAnotherAttempt() {
        assertEquals(1, RetryPolicy.SINGLE_ATTEMPT.getMaxAttempts());
        assertFalse(RetryPolicy.SINGLE_ATTEMPT.allowsAttemptAfter(1));
    }

    @Test
    void testOfAttempts() {
        assertSame(RetryPolicy.SINGLE_ATTEMPT, RetryPolicy.ofAttempts(1));
        RetryPolicy three = RetryPolicy.ofAttempts(3);
        assertTrue(three.allowsAttemptAfter(2));
        assertFalse(three.allowsAttemptAfter(3));
    }

    @Test
    void testDefaultRetryableStatuses() {
        RetryPolicy policy = RetryPolicy.ofAttempts(3);
        assertTrue(policy.isRetryableStatus(429));
        assertTrue(policy.isRetryableStatus(503));
        assertFalse(policy.isRetryableStatus(500));
        assertFalse(policy.isRetryableStatus(404));
    }

    @Test
    void testBuilderRejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy.Builder().maxAttempts(0));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy.Builder().baseDelay(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new RetryPolicy.Builder()
            .baseDelay(Duration.ofSeconds(2))
            .maxDelay(Duration.ofSeconds(1))
            .build());
    }
}
