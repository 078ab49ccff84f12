package com.questrail.homeshadow.api;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable point-in-time view of one shadowed entity.
 *
 * <p>{@code lastUpdate} moves on every applied report; {@code lastChanged} only
 * when a value actually changed. {@code properties} holds the auxiliary
 * properties keyed by control code (e.g. {@code OL}, {@code RR}).</p>
 */
public record EntitySnapshot(
        EntityAddress address,
        String name,
        PropertyValue status,
        Instant lastChanged,
        Instant lastUpdate,
        boolean enabled,
        Map<String, PropertyValue> properties)
{
    public EntitySnapshot {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(lastChanged, "lastChanged");
        Objects.requireNonNull(lastUpdate, "lastUpdate");
        properties = Map.copyOf(Objects.requireNonNull(properties, "properties"));
    }

    /**
     * A freshly seeded entity: enabled, no auxiliary properties, both
     * timestamps set to {@code asOf}.
     */
    public static EntitySnapshot of(EntityAddress address, String name, PropertyValue status, Instant asOf) {
        return new EntitySnapshot(address, name, status, asOf, asOf, true, Map.of());
    }

    public Optional<PropertyValue> property(String key) {
        return Optional.ofNullable(properties.get(key));
    }
}
