package com.questrail.homeshadow.protocol.isy.internal.state;

import com.questrail.homeshadow.api.ConnectionStatus;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * SupervisorIntents
 * -----------------------------------------------------------------------------
 * Immutable set of actions emitted by the {@link SupervisorReducer}.
 *
 * <h2>Role in the architecture</h2>
 * The reducer decides <b>what should happen next</b>; the intent executor
 * decides <b>how</b>: it owns the session, the timers and the
 * connection-status feed.
 *
 * <h2>Execution order</h2>
 * Kinds are declared in the order the executor realizes them. Tearing down
 * always precedes opening, so the previous session is closed before its
 * replacement opens.
 */
public final class SupervisorIntents
{
    public enum Kind {
        /** Cancel a pending reconnect delay. */
        CANCEL_RETRY,

        /** Stop checking session activity. */
        DISARM_WATCHDOG,

        /** Close the current session, if any. */
        CLOSE_SESSION,

        /** Open a new session with {@link #sessionId()}. */
        OPEN_SESSION,

        /** Start (or restart) activity checks for {@link #sessionId()}. */
        ARM_WATCHDOG,

        /** Schedule reconnect attempt {@link #retryAttempt()} after its backoff. */
        SCHEDULE_RETRY,

        /** Fetch and merge a fresh snapshot. */
        RESEED,

        /** Publish {@link #status()} on the connection-status feed. */
        PUBLISH_STATUS
    }

    private static final SupervisorIntents NONE =
            new SupervisorIntents(EnumSet.noneOf(Kind.class), 0, 0, null);

    private final Set<Kind> kinds;
    private final long sessionId;
    private final int retryAttempt;
    private final ConnectionStatus status;

    private SupervisorIntents(Set<Kind> kinds, long sessionId, int retryAttempt, ConnectionStatus status) {
        this.kinds = Collections.unmodifiableSet(kinds.isEmpty() ? EnumSet.noneOf(Kind.class) : EnumSet.copyOf(kinds));
        this.sessionId = sessionId;
        this.retryAttempt = retryAttempt;
        this.status = status;
    }

    public static SupervisorIntents none() {
        return NONE;
    }

    public Set<Kind> kinds() {
        return kinds;
    }

    public boolean isEmpty() {
        return kinds.isEmpty();
    }

    public boolean contains(Kind kind) {
        return kinds.contains(kind);
    }

    /** Session targeted by {@code OPEN_SESSION} and {@code ARM_WATCHDOG}. */
    public long sessionId() {
        return sessionId;
    }

    public int retryAttempt() {
        return retryAttempt;
    }

    public Optional<ConnectionStatus> status() {
        return Optional.ofNullable(status);
    }

    @Override
    public String toString() {
        return "SupervisorIntents" + kinds
                + (status != null ? " status=" + status : "")
                + (retryAttempt > 0 ? " attempt=" + retryAttempt : "");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final EnumSet<Kind> kinds = EnumSet.noneOf(Kind.class);
        private long sessionId;
        private int retryAttempt;
        private ConnectionStatus status;

        private Builder() {}

        public Builder add(Kind kind) {
            kinds.add(Objects.requireNonNull(kind, "kind"));
            return this;
        }

        public Builder openSession(long id) {
            kinds.add(Kind.OPEN_SESSION);
            kinds.add(Kind.ARM_WATCHDOG);
            this.sessionId = id;
            return this;
        }

        public Builder armWatchdog(long id) {
            kinds.add(Kind.ARM_WATCHDOG);
            this.sessionId = id;
            return this;
        }

        public Builder scheduleRetry(int attempt) {
            kinds.add(Kind.SCHEDULE_RETRY);
            this.retryAttempt = attempt;
            return this;
        }

        public Builder publish(ConnectionStatus newStatus) {
            kinds.add(Kind.PUBLISH_STATUS);
            this.status = Objects.requireNonNull(newStatus, "status");
            return this;
        }

        public SupervisorIntents build() {
            if (kinds.isEmpty()) {
                return NONE;
            }
            return new SupervisorIntents(kinds, sessionId, retryAttempt, status);
        }
    }
}
