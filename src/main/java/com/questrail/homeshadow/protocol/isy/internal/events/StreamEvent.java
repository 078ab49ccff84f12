package com.questrail.homeshadow.protocol.isy.internal.events;

import com.questrail.homeshadow.api.EntityAddress;
import com.questrail.homeshadow.api.NodeChangeAction;
import com.questrail.homeshadow.api.PropertyValue;
import com.questrail.homeshadow.api.SystemStatus;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * StreamEvent
 * -----------------------------------------------------------------------------
 * One decoded event-stream frame.
 *
 * <p>
 * Stream events are produced by the frame decoder on the transport thread and
 * are immutable. {@link Heartbeat} and {@link SubscriptionAck} are consumed by
 * the stream session itself; every other variant is applied to the shadow by
 * the dispatch loop.
 * </p>
 */
public sealed interface StreamEvent
        permits StreamEvent.PropertyUpdate, StreamEvent.ControlMessage, StreamEvent.NodeListChanged,
                StreamEvent.SystemStatusChanged, StreamEvent.Heartbeat, StreamEvent.ProgramUpdate,
                StreamEvent.SubscriptionAck
{
    /** A reported property value ({@code ST} for the status). */
    record PropertyUpdate(EntityAddress address, String key, PropertyValue value) implements StreamEvent {
        public PropertyUpdate {
            Objects.requireNonNull(address, "address");
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        }
    }

    /** A control code reported for a node, with or without a value. */
    record ControlMessage(EntityAddress address, String control, Optional<PropertyValue> value)
            implements StreamEvent {
        public ControlMessage {
            Objects.requireNonNull(address, "address");
            Objects.requireNonNull(control, "control");
            Objects.requireNonNull(value, "value");
        }
    }

    record NodeListChanged(EntityAddress address, NodeChangeAction action, Map<String, String> info)
            implements StreamEvent {
        public NodeListChanged {
            Objects.requireNonNull(address, "address");
            Objects.requireNonNull(action, "action");
            info = Map.copyOf(Objects.requireNonNull(info, "info"));
        }
    }

    record SystemStatusChanged(SystemStatus status) implements StreamEvent {
        public SystemStatusChanged {
            Objects.requireNonNull(status, "status");
        }
    }

    /**
     * Periodic keep-alive. {@code interval} is the controller's advertised
     * heartbeat period; sequence gaps are tolerated.
     */
    record Heartbeat(long sequence, Duration interval) implements StreamEvent {
        public Heartbeat {
            Objects.requireNonNull(interval, "interval");
        }
    }

    /**
     * Program status report. Absent fields were not part of the frame and leave
     * the stored values untouched.
     */
    record ProgramUpdate(
            EntityAddress address,
            Optional<Boolean> enabled,
            Optional<Boolean> runAtStartup,
            Optional<ProgramCondition> condition,
            Optional<ProgramRunState> runState,
            Optional<LocalDateTime> lastRun,
            Optional<LocalDateTime> lastFinish) implements StreamEvent {
        public ProgramUpdate {
            Objects.requireNonNull(address, "address");
            Objects.requireNonNull(enabled, "enabled");
            Objects.requireNonNull(runAtStartup, "runAtStartup");
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(runState, "runState");
            Objects.requireNonNull(lastRun, "lastRun");
            Objects.requireNonNull(lastFinish, "lastFinish");
        }
    }

    /** The controller accepted the subscription and assigned a stream id. */
    record SubscriptionAck(String streamId) implements StreamEvent {
        public SubscriptionAck {
            Objects.requireNonNull(streamId, "streamId");
        }
    }

    /** Program condition, high nibble of the program status code. */
    enum ProgramCondition
    {
        UNKNOWN(0x1), TRUE(0x2), FALSE(0x3), NOT_LOADED(0xF);

        private final int code;

        ProgramCondition(int code) {
            this.code = code;
        }

        public static Optional<ProgramCondition> fromCode(int code) {
            for (ProgramCondition c : values()) {
                if (c.code == code) {
                    return Optional.of(c);
                }
            }
            return Optional.empty();
        }
    }

    /** Program run state, low nibble of the program status code. */
    enum ProgramRunState
    {
        IDLE(0x1), RUNNING_THEN(0x2), RUNNING_ELSE(0x3);

        private final int code;

        ProgramRunState(int code) {
            this.code = code;
        }

        public int code() {
            return code;
        }

        public static Optional<ProgramRunState> fromCode(int code) {
            for (ProgramRunState s : values()) {
                if (s.code == code) {
                    return Optional.of(s);
                }
            }
            return Optional.empty();
        }
    }
}
