package opsqueue.jobs.service;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class BackoffPolicyTest {

    private static final Duration BASE = Duration.ofSeconds(30);
    private static final Duration MAX = Duration.ofHours(1);

    @Test
    void doublesPerAttemptWithoutJitter() {
        BackoffPolicy policy = new BackoffPolicy(BASE, MAX, () -> 0.0);

        assertEquals(Duration.ofSeconds(30), policy.delay(1));
        assertEquals(Duration.ofSeconds(60), policy.delay(2));
        assertEquals(Duration.ofSeconds(120), policy.delay(3));
        assertEquals(Duration.ofSeconds(240), policy.delay(4));
    }

    @Test
    void jitterStretchesByAtMostAQuarter() {
        BackoffPolicy policy = new BackoffPolicy(BASE, MAX, () -> 0.999);

        Duration d = policy.delay(1);
        assertTrue(d.compareTo(BASE) > 0);
        assertTrue(d.compareTo(Duration.ofMillis(37_500)) < 0);
    }

    @Test
    void cappedAtMax() {
        BackoffPolicy policy = new BackoffPolicy(BASE, MAX, () -> 0.5);

        assertEquals(MAX, policy.delay(12));
        assertEquals(MAX, policy.delay(60));
    }

    @Test
    void attemptsBelowOneUseFirstStep() {
        BackoffPolicy policy = new BackoffPolicy(BASE, MAX, () -> 0.0);

        assertEquals(BASE, policy.delay(0));
        assertEquals(BASE, policy.delay(-3));
    }

    @Test
    void delaysNeverDecreaseWithRandomJitter() {
        Random random = new Random(42);
        BackoffPolicy policy = new BackoffPolicy(BASE, MAX, random::nextDouble);

        Duration previous = Duration.ZERO;
        for (int attempt = 1; attempt <= 20; attempt++) {
            Duration d = policy.delay(attempt);
            assertTrue(d.compareTo(previous) >= 0, "delay shrank at attempt " + attempt);
            assertTrue(d.compareTo(BASE) >= 0);
            assertTrue(d.compareTo(MAX) <= 0);
            previous = d;
        }
    }

    @Test
    void outOfRangeRandomIsClamped() {
        BackoffPolicy policy = new BackoffPolicy(BASE, MAX, () -> 7.0);

        assertTrue(policy.delay(1).compareTo(Duration.ofMillis(37_500)) < 0);
    }

    @Test
    void rejectsBadBounds() {
        assertThrows(IllegalArgumentException.class, () -> new BackoffPolicy(Duration.ZERO, MAX, () -> 0.0));
        assertThrows(IllegalArgumentException.class,
                () -> new BackoffPolicy(Duration.ofMinutes(5), Duration.ofMinutes(1), () -> 0.0));
    }

    @Test
    void defaultsUseThirtySecondsToOneHour() {
        BackoffPolicy policy = BackoffPolicy.defaults();

        assertEquals(BASE, policy.base());
        assertEquals(MAX, policy.max());
    }
}
