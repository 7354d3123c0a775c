package io.optionsnap.infrastructure.stream;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ReconnectionPolicy.
 *
 * Tests:
 * - Fixed delay without attempt limit
 * - Exponential backoff and max delay
 * - Attempt limit
 * - Reset on success
 */
class ReconnectionPolicyTest {

    @Test
    void testInitialState() {
        ReconnectionPolicy policy = ReconnectionPolicy.fixedDelay(Duration.ofSeconds(60));

        assertTrue(policy.shouldRetry());
        assertEquals(0, policy.getAttemptCount());
        assertEquals(0, policy.getTotalFailures());
        assertFalse(policy.isCircuitOpen());
        assertNull(policy.getLastAttemptTime());
        assertEquals(Duration.ofSeconds(60), policy.getNextDelay());
    }

    @Test
    void testFixedDelayNeverGivesUp() {
        ReconnectionPolicy policy = ReconnectionPolicy.fixedDelay(Duration.ofSeconds(60));

        for (int i = 0; i < 1000; i++) {
            policy.recordFailure();
            assertTrue(policy.shouldRetry(), "Fixed delay policy should always retry");
            assertEquals(Duration.ofSeconds(60), policy.getNextDelay(), "Delay should stay fixed");
        }
        assertEquals(1000, policy.getAttemptCount());
        assertFalse(policy.isCircuitOpen());
    }

    @Test
    void testExponentialBackoff() {
        ReconnectionPolicy policy = ReconnectionPolicy.builder()
            .initialDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofMinutes(5))
            .multiplier(2.0)
            .maxAttempts(10)
            .build();

        // First failure waits the initial delay
        policy.recordFailure();
        assertEquals(Duration.ofSeconds(1), policy.getNextDelay());

        policy.recordFailure();
        assertEquals(Duration.ofSeconds(2), policy.getNextDelay());

        policy.recordFailure();
        assertEquals(Duration.ofSeconds(4), policy.getNextDelay());
    }

    @Test
    void testMaxDelayRespected() {
        ReconnectionPolicy policy = ReconnectionPolicy.builder()
            .initialDelay(Duration.ofSeconds(10))
            .maxDelay(Duration.ofSeconds(30))
            .multiplier(3.0)
            .unlimitedAttempts()
            .build();

        policy.recordFailure();
        assertEquals(Duration.ofSeconds(10), policy.getNextDelay());

        policy.recordFailure();
        assertEquals(Duration.ofSeconds(30), policy.getNextDelay());

        policy.recordFailure();
        assertEquals(Duration.ofSeconds(30), policy.getNextDelay(), "Delay should be capped");
    }

    @Test
    void testCircuitOpensAfterMaxAttempts() {
        ReconnectionPolicy policy = ReconnectionPolicy.builder()
            .initialDelay(Duration.ofMillis(100))
            .maxDelay(Duration.ofSeconds(5))
            .maxAttempts(3)
            .build();

        policy.recordFailure();
        assertTrue(policy.shouldRetry(), "Should still retry (1/3)");
        policy.recordFailure();
        assertTrue(policy.shouldRetry(), "Should still retry (2/3)");
        policy.recordFailure();
        assertFalse(policy.shouldRetry(), "Should not retry after max attempts");
        assertTrue(policy.isCircuitOpen());
    }

    @Test
    void testSuccessResetsAttemptsButKeepsTotal() {
        ReconnectionPolicy policy = ReconnectionPolicy.builder()
            .initialDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofMinutes(5))
            .multiplier(2.0)
            .maxAttempts(5)
            .build();

        policy.recordFailure();
        policy.recordFailure();
        policy.recordFailure();
        assertNotNull(policy.getLastAttemptTime());

        policy.recordSuccess();

        assertEquals(0, policy.getAttemptCount());
        assertEquals(3, policy.getTotalFailures());
        assertEquals(Duration.ofSeconds(1), policy.getNextDelay());
        assertNull(policy.getLastAttemptTime());
        assertTrue(policy.shouldRetry());
    }

    @Test
    void testInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class,
            () -> ReconnectionPolicy.builder().initialDelay(Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
            () -> ReconnectionPolicy.builder().multiplier(0.5));
        assertThrows(IllegalArgumentException.class,
            () -> ReconnectionPolicy.builder().maxAttempts(0));
        assertThrows(IllegalArgumentException.class,
            () -> ReconnectionPolicy.builder()
                .initialDelay(Duration.ofMinutes(10))
                .maxDelay(Duration.ofMinutes(1))
                .build());
    }
}
