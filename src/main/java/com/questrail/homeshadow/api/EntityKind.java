package com.questrail.homeshadow.api;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * EntityKind
 * -----------------------------------------------------------------------------
 * The kind of a shadowed controller entity. Addresses are unique within a kind,
 * so the kind is part of every {@link EntityAddress}.
 *
 * <h2>Static capabilities</h2>
 * Each kind carries a fixed {@link Capability} set. The shadow tree consults it
 * when it resolves what an inbound control code does to an entity; nothing is
 * attached to entities at runtime.
 */
public enum EntityKind
{
    /** A physical or virtual device node. */
    NODE(EnumSet.of(Capability.STATUS, Capability.CONTROL_EVENTS, Capability.AUX_PROPERTIES)),

    /** A scene. Scenes report control events and a derived on/off status. */
    GROUP(EnumSet.of(Capability.STATUS, Capability.CONTROL_EVENTS)),

    /** A program or program folder. */
    PROGRAM(EnumSet.of(Capability.STATUS, Capability.CONTROL_EVENTS, Capability.AUX_PROPERTIES)),

    /** An integer or state variable, addressed as {@code type.id}. */
    VARIABLE(EnumSet.of(Capability.STATUS, Capability.AUX_PROPERTIES));

    private final Set<Capability> capabilities;

    EntityKind(Set<Capability> capabilities) {
        this.capabilities = Collections.unmodifiableSet(capabilities);
    }

    public Set<Capability> capabilities() {
        return capabilities;
    }

    public boolean has(Capability capability) {
        return capabilities.contains(capability);
    }

    /**
     * Capabilities an entity kind may carry.
     */
    public enum Capability
    {
        /** Has a primary status value. */
        STATUS,
        /** Receives control-received notifications. */
        CONTROL_EVENTS,
        /** Keeps auxiliary properties reported by control codes. */
        AUX_PROPERTIES
    }
}
