package com.questrail.homeshadow.protocol.isy.internal.exec;

import com.questrail.homeshadow.api.EntityAddress;
import com.questrail.homeshadow.api.EntityChange;
import com.questrail.homeshadow.api.PropertyValue;
import com.questrail.homeshadow.api.StatusChange;
import com.questrail.homeshadow.api.SystemStatus;
import com.questrail.homeshadow.core.ApplyResult;
import com.questrail.homeshadow.core.ShadowTree;
import com.questrail.homeshadow.notify.NotificationFeed;
import com.questrail.homeshadow.protocol.isy.internal.events.StreamEvent;
import com.questrail.homeshadow.protocol.isy.internal.events.StreamEvent.ProgramCondition;
import com.questrail.homeshadow.protocol.isy.internal.events.StreamEvent.ProgramRunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Routes decoded stream events to the shadow tree and the system-status feed.
 *
 * <p>Program reports are flattened into ordinary property updates on the
 * program's address: status {@code ST} (1 true, 0 false) and the auxiliary
 * properties {@code running}, {@code runAtStartup}, {@code lastRun} and
 * {@code lastFinish} (epoch seconds). The controller reports program times in
 * its local time, interpreted in {@code controllerZone}.</p>
 */
public final class StreamEventDispatcher
{
    private static final Logger log = LoggerFactory.getLogger(StreamEventDispatcher.class);

    public static final String PROGRAM_RUNNING = "running";
    public static final String PROGRAM_RUN_AT_STARTUP = "runAtStartup";
    public static final String PROGRAM_LAST_RUN = "lastRun";
    public static final String PROGRAM_LAST_FINISH = "lastFinish";

    private final ShadowTree tree;
    private final NotificationFeed<SystemStatus> systemFeed;
    private final ZoneId controllerZone;

    public StreamEventDispatcher(ShadowTree tree, NotificationFeed<SystemStatus> systemFeed, ZoneId controllerZone) {
        this.tree = Objects.requireNonNull(tree, "tree");
        this.systemFeed = Objects.requireNonNull(systemFeed, "systemFeed");
        this.controllerZone = Objects.requireNonNull(controllerZone, "controllerZone");
    }

    public void dispatch(StreamEvent event, Instant now) {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(now, "now");

        if (event instanceof StreamEvent.PropertyUpdate e) {
            tree.applyPropertyUpdate(e.address(), e.key(), e.value(), now);
        } else if (event instanceof StreamEvent.ControlMessage e) {
            tree.applyControlMessage(e.address(), e.control(), e.value(), now);
        } else if (event instanceof StreamEvent.NodeListChanged e) {
            tree.applyEntityChange(new EntityChange(e.address(), e.action(), e.info(), now));
        } else if (event instanceof StreamEvent.SystemStatusChanged e) {
            log.debug("System status {}", e.status());
            systemFeed.publish(e.status());
        } else if (event instanceof StreamEvent.ProgramUpdate e) {
            applyProgram(e, now);
        } else {
            log.debug("No dispatch for {}", event);
        }
    }

    private void applyProgram(StreamEvent.ProgramUpdate e, Instant now) {
        EntityAddress address = e.address();
        if (tree.lookup(address).isEmpty()) {
            log.debug("Ignoring program update for unknown program {}", address);
            return;
        }

        e.enabled().ifPresent(enabled -> tree.setEnabled(address, enabled, now));

        e.condition().ifPresent(condition -> {
            if (condition == ProgramCondition.TRUE || condition == ProgramCondition.FALSE) {
                apply(address, StatusChange.STATUS, flag(condition == ProgramCondition.TRUE), now);
            }
        });
        e.runState().ifPresent(state ->
                apply(address, PROGRAM_RUNNING, flag(state != ProgramRunState.IDLE), now));
        e.runAtStartup().ifPresent(startup ->
                apply(address, PROGRAM_RUN_AT_STARTUP, flag(startup), now));
        e.lastRun().ifPresent(time ->
                apply(address, PROGRAM_LAST_RUN, epochSeconds(time), now));
        e.lastFinish().ifPresent(time ->
                apply(address, PROGRAM_LAST_FINISH, epochSeconds(time), now));
    }

    private void apply(EntityAddress address, String key, PropertyValue value, Instant now) {
        ApplyResult result = tree.applyPropertyUpdate(address, key, value, now);
        if (log.isTraceEnabled()) {
            log.trace("Program {} {} -> {}", address, key, result);
        }
    }

    private static PropertyValue flag(boolean value) {
        return PropertyValue.of(value ? 1 : 0);
    }

    private PropertyValue epochSeconds(LocalDateTime time) {
        return PropertyValue.of(time.atZone(controllerZone).toEpochSecond());
    }
}
