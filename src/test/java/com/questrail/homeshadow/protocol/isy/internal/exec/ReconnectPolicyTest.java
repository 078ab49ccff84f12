package com.questrail.homeshadow.protocol.isy.internal.exec;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ReconnectPolicyTest {

    @Test
    void backoffGrowsGeometricallyUpToTheCap() {
        ReconnectPolicy policy = ReconnectPolicy.defaults();

        assertEquals(Duration.ofSeconds(1), policy.backoffFor(1));
        assertEquals(Duration.ofSeconds(2), policy.backoffFor(2));
        assertEquals(Duration.ofSeconds(32), policy.backoffFor(6));
        assertEquals(Duration.ofSeconds(60), policy.backoffFor(7));
        assertEquals(Duration.ofSeconds(60), policy.backoffFor(500));
        assertThrows(IllegalArgumentException.class, () -> policy.backoffFor(0));
    }

    @Test
    void advertisedHeartbeatWidensTheWatchdogWindow() {
        ReconnectPolicy policy = ReconnectPolicy.defaults();

        assertEquals(Duration.ofSeconds(35), policy.effectiveWatchdogWindow(Duration.ZERO));
        assertEquals(Duration.ofSeconds(35), policy.effectiveWatchdogWindow(Duration.ofSeconds(10)));
        assertEquals(Duration.ofSeconds(125), policy.effectiveWatchdogWindow(Duration.ofSeconds(120)));
    }

    @Test
    void adaptedWindowIsCapped() {
        ReconnectPolicy policy = ReconnectPolicy.defaults().withMaxWatchdogWindow(Duration.ofMinutes(2));

        assertEquals(Duration.ofMinutes(2), policy.effectiveWatchdogWindow(Duration.ofSeconds(118)));
        assertEquals(Duration.ofMinutes(2), policy.effectiveWatchdogWindow(Duration.ofSeconds(100_000_000)));
        assertEquals(Duration.ofMinutes(2), policy.effectiveWatchdogWindow(Duration.ofSeconds(Long.MAX_VALUE)));
        assertThrows(IllegalArgumentException.class,
                () -> policy.withMaxWatchdogWindow(Duration.ofSeconds(10)));
    }

    @Test
    void retryCeiling() {
        assertFalse(ReconnectPolicy.defaults().retryCeilingReached(10_000));

        ReconnectPolicy limited = ReconnectPolicy.defaults().withMaxAttempts(3);
        assertFalse(limited.retryCeilingReached(3));
        assertTrue(limited.retryCeilingReached(4));
    }

    @Test
    void invalidSettingsAreRejected() {
        ReconnectPolicy policy = ReconnectPolicy.defaults();

        assertThrows(IllegalArgumentException.class,
                () -> policy.withWatchdog(Duration.ZERO, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class,
                () -> policy.withBackoff(Duration.ofSeconds(10), Duration.ofSeconds(1), 2.0));
        assertThrows(IllegalArgumentException.class,
                () -> policy.withBackoff(Duration.ofSeconds(1), Duration.ofSeconds(10), 0.5));
        assertThrows(IllegalArgumentException.class, () -> policy.withMaxAttempts(-1));
    }
}
