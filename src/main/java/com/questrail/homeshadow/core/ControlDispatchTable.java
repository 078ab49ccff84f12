package com.questrail.homeshadow.core;

import com.questrail.homeshadow.api.EntityKind;
import com.questrail.homeshadow.api.EntityKind.Capability;
import com.questrail.homeshadow.api.PropertyValue;
import com.questrail.homeshadow.api.UnitOfMeasure;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * ControlDispatchTable
 * =============================================================================
 * Fixed mapping from an inbound control code to what it does to an entity.
 *
 * <p>
 * The table is resolved at apply time against the entity kind's static
 * {@link Capability} set:
 * </p>
 * <ul>
 *   <li>transient commands (on, off, dim, fade, beep, program run, ...) only
 *       raise a control-received notification;</li>
 *   <li>any other code on a kind with {@link Capability#AUX_PROPERTIES} is a
 *       reported property and is also stored;</li>
 *   <li>{@value #BATTERY_LEVEL} on an entity that has never reported a status
 *       is that entity's status (battery powered sensors report no
 *       {@code ST}).</li>
 * </ul>
 */
public final class ControlDispatchTable
{
    public static final String BATTERY_LEVEL = "BATLVL";
    public static final String RAMP_RATE = "RR";

    /**
     * Effect of a control code on an entity.
     */
    public enum ControlEffect
    {
        /** The entity kind takes no control messages. */
        UNSUPPORTED,
        /** Notify control listeners only. */
        NOTIFY_ONLY,
        /** Notify, and store the value as an auxiliary property. */
        AUX_PROPERTY,
        /** Notify, and store the value as the entity status. */
        STATUS
    }

    private static final Set<String> TRANSIENT_COMMANDS = Set.of(
            "BEEP", "BRT", "DIM", "BMAN", "SMAN", "FDUP", "FDDOWN", "FDSTOP",
            "DON", "DOF", "DFON", "DFOF", "RESET", "X10", "BUSY", "ST",
            "RUN", "RUNTHEN", "RUNELSE", "STOP");

    // Insteon ramp rate index -> tenths of a second.
    private static final Map<Integer, Long> INSTEON_RAMP_RATES = Map.ofEntries(
            Map.entry(0, 5400L), Map.entry(1, 4800L), Map.entry(2, 4200L), Map.entry(3, 3600L),
            Map.entry(4, 3000L), Map.entry(5, 2700L), Map.entry(6, 2400L), Map.entry(7, 2100L),
            Map.entry(8, 1800L), Map.entry(9, 1500L), Map.entry(10, 1200L), Map.entry(11, 900L),
            Map.entry(12, 600L), Map.entry(13, 470L), Map.entry(14, 430L), Map.entry(15, 385L),
            Map.entry(16, 340L), Map.entry(17, 320L), Map.entry(18, 300L), Map.entry(19, 280L),
            Map.entry(20, 260L), Map.entry(21, 235L), Map.entry(22, 215L), Map.entry(23, 190L),
            Map.entry(24, 85L), Map.entry(25, 65L), Map.entry(26, 45L), Map.entry(27, 20L),
            Map.entry(28, 5L), Map.entry(29, 3L), Map.entry(30, 2L), Map.entry(31, 1L));

    private static final ControlDispatchTable STANDARD = new ControlDispatchTable(TRANSIENT_COMMANDS);

    private final Set<String> transientCommands;

    public ControlDispatchTable(Set<String> transientCommands) {
        this.transientCommands = Set.copyOf(Objects.requireNonNull(transientCommands, "transientCommands"));
    }

    public static ControlDispatchTable standard() {
        return STANDARD;
    }

    /**
     * @param kind          entity kind receiving the message
     * @param control       control code
     * @param statusKnown   whether the entity has a known status value
     */
    public ControlEffect resolve(EntityKind kind, String control, boolean statusKnown) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(control, "control");

        if (!kind.has(Capability.CONTROL_EVENTS)) {
            return ControlEffect.UNSUPPORTED;
        }
        if (transientCommands.contains(control)) {
            return ControlEffect.NOTIFY_ONLY;
        }
        if (BATTERY_LEVEL.equals(control) && !statusKnown && kind.has(Capability.STATUS)) {
            return ControlEffect.STATUS;
        }
        return kind.has(Capability.AUX_PROPERTIES) ? ControlEffect.AUX_PROPERTY : ControlEffect.NOTIFY_ONLY;
    }

    /**
     * Translates device-specific encodings into their physical reading. Only
     * the Insteon ramp rate index is translated, to seconds.
     */
    public PropertyValue normalize(String control, PropertyValue value) {
        if (!RAMP_RATE.equals(control) || !value.isKnown() || UnitOfMeasure.SECONDS.equals(value.unit())) {
            return value;
        }
        long index = value.value().getAsLong();
        // only a plain integer can be a table index
        if (value.precision() != 0 || index < 0 || index > Integer.MAX_VALUE) {
            return value;
        }
        Long tenths = INSTEON_RAMP_RATES.get((int) index);
        if (tenths == null) {
            return value;
        }
        return PropertyValue.of(tenths, 1, UnitOfMeasure.SECONDS, value.formatted());
    }
}
