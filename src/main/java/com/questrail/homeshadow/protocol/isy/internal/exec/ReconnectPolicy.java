package com.questrail.homeshadow.protocol.isy.internal.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * ReconnectPolicy
 * -----------------------------------------------------------------------------
 * Operational timing for the reconnection supervisor.
 *
 * <p>This is deliberately <em>operational only</em>. The supervisor reducer
 * decides <em>whether</em> to reconnect; this policy controls <em>when</em>.</p>
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>watchdogWindow</b>: maximum silence (no frame of any kind) tolerated
 *       from a session before it is force-closed. Also bounds how long a
 *       session may take to become live.</li>
 *   <li><b>heartbeatGrace</b>: slack added to the controller's advertised
 *       heartbeat interval. The effective window is never below
 *       {@code watchdogWindow} and never above {@code maxWatchdogWindow}.</li>
 *   <li><b>maxWatchdogWindow</b>: upper bound on the adapted window, whatever
 *       interval the controller advertises.</li>
 *   <li><b>watchdogCheckPeriod</b>: how often the watchdog samples session
 *       activity.</li>
 *   <li><b>initialBackoff</b>, <b>maxBackoff</b>, <b>backoffMultiplier</b>:
 *       the reconnect delay for attempt {@code n} is
 *       {@code min(maxBackoff, initialBackoff * multiplier^(n-1))}.</li>
 *   <li><b>maxAttempts</b>: consecutive failed attempts tolerated before the
 *       supervisor gives up and reports {@code FAILED}; {@code 0} retries
 *       forever.</li>
 * </ul>
 */
public record ReconnectPolicy(
        Duration watchdogWindow,
        Duration heartbeatGrace,
        Duration maxWatchdogWindow,
        Duration watchdogCheckPeriod,
        Duration initialBackoff,
        Duration maxBackoff,
        double backoffMultiplier,
        int maxAttempts
) {
    public ReconnectPolicy {
        Objects.requireNonNull(watchdogWindow, "watchdogWindow");
        Objects.requireNonNull(heartbeatGrace, "heartbeatGrace");
        Objects.requireNonNull(maxWatchdogWindow, "maxWatchdogWindow");
        Objects.requireNonNull(watchdogCheckPeriod, "watchdogCheckPeriod");
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");

        if (watchdogWindow.isNegative() || watchdogWindow.isZero()) {
            throw new IllegalArgumentException("watchdogWindow must be positive");
        }
        if (heartbeatGrace.isNegative()) {
            throw new IllegalArgumentException("heartbeatGrace must be non-negative");
        }
        if (maxWatchdogWindow.compareTo(watchdogWindow) < 0) {
            throw new IllegalArgumentException("maxWatchdogWindow must be >= watchdogWindow");
        }
        if (watchdogCheckPeriod.isNegative() || watchdogCheckPeriod.isZero()) {
            throw new IllegalArgumentException("watchdogCheckPeriod must be positive");
        }
        if (initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must be non-negative");
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0");
        }
    }

    /**
     * Defaults matched to the controller's 30 second websocket heartbeat:
     * <ul>
     *   <li>watchdogWindow: 35s</li>
     *   <li>heartbeatGrace: 5s</li>
 *   <li>maxWatchdogWindow: 5min</li>
     *   <li>watchdogCheckPeriod: 5s</li>
     *   <li>backoff: 1s doubling up to 60s</li>
     *   <li>maxAttempts: unlimited</li>
     * </ul>
     */
    public static ReconnectPolicy defaults() {
        return new ReconnectPolicy(
                Duration.ofSeconds(35),
                Duration.ofSeconds(5),
                Duration.ofMinutes(5),
                Duration.ofSeconds(5),
                Duration.ofSeconds(1),
                Duration.ofSeconds(60),
                2.0,
                0
        );
    }

    /** Raises {@code maxWatchdogWindow} to {@code window} when it would fall below it. */
    public ReconnectPolicy withWatchdog(Duration window, Duration checkPeriod) {
        Objects.requireNonNull(window, "window");
        Duration max = maxWatchdogWindow.compareTo(window) < 0 ? window : maxWatchdogWindow;
        return new ReconnectPolicy(window, heartbeatGrace, max, checkPeriod,
                initialBackoff, maxBackoff, backoffMultiplier, maxAttempts);
    }

    public ReconnectPolicy withBackoff(Duration initial, Duration max, double multiplier) {
        return new ReconnectPolicy(watchdogWindow, heartbeatGrace, maxWatchdogWindow, watchdogCheckPeriod,
                initial, max, multiplier, maxAttempts);
    }

    public ReconnectPolicy withMaxAttempts(int attempts) {
        return new ReconnectPolicy(watchdogWindow, heartbeatGrace, maxWatchdogWindow, watchdogCheckPeriod,
                initialBackoff, maxBackoff, backoffMultiplier, attempts);
    }

    public ReconnectPolicy withMaxWatchdogWindow(Duration max) {
        return new ReconnectPolicy(watchdogWindow, heartbeatGrace, max, watchdogCheckPeriod,
                initialBackoff, maxBackoff, backoffMultiplier, maxAttempts);
    }

    /**
     * @param attempt 1-based retry attempt
     */
    public Duration backoffFor(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        double nanos = initialBackoff.toNanos() * Math.pow(backoffMultiplier, attempt - 1);
        if (nanos >= maxBackoff.toNanos()) {
            return maxBackoff;
        }
        return Duration.ofNanos((long) nanos);
    }

    /**
     * @param advertisedInterval heartbeat interval announced by the controller,
     *                           {@link Duration#ZERO} when none was seen
     */
    public Duration effectiveWatchdogWindow(Duration advertisedInterval) {
        if (advertisedInterval.isZero() || advertisedInterval.isNegative()) {
            return watchdogWindow;
        }
        // compared before adding so an absurd interval cannot overflow
        if (advertisedInterval.compareTo(maxWatchdogWindow.minus(heartbeatGrace)) >= 0) {
            return maxWatchdogWindow;
        }
        Duration adapted = advertisedInterval.plus(heartbeatGrace);
        return adapted.compareTo(watchdogWindow) < 0 ? watchdogWindow : adapted;
    }

    public boolean retryCeilingReached(int attempt) {
        return maxAttempts > 0 && attempt > maxAttempts;
    }
}
