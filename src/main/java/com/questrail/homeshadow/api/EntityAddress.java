package com.questrail.homeshadow.api;

import java.util.Locale;
import java.util.Objects;

/**
 * EntityAddress
 * -----------------------------------------------------------------------------
 * Stable identifier of a shadowed entity, scoped by {@link EntityKind}.
 *
 * <p>
 * Identifiers are opaque strings as reported by the controller:
 * <ul>
 *   <li>nodes: the device address, e.g. {@code "1A 2B 3C 1"}</li>
 *   <li>groups: the scene address, e.g. {@code "12345"}</li>
 *   <li>programs: four upper-case hex digits, e.g. {@code "00A1"}</li>
 *   <li>variables: {@code type.id}, e.g. {@code "1.5"}</li>
 * </ul>
 * Two addresses are equal when kind and id are equal.
 */
public record EntityAddress(EntityKind kind, String id)
{
    public EntityAddress {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
    }

    public static EntityAddress node(String address) {
        return new EntityAddress(EntityKind.NODE, address);
    }

    public static EntityAddress group(String address) {
        return new EntityAddress(EntityKind.GROUP, address);
    }

    /**
     * Program ids are normalized to four upper-case hex digits, since event
     * frames report them without leading zeros.
     */
    public static EntityAddress program(String id) {
        Objects.requireNonNull(id, "id");
        String trimmed = id.trim().toUpperCase(Locale.ROOT);
        StringBuilder padded = new StringBuilder();
        for (int i = trimmed.length(); i < 4; i++) {
            padded.append('0');
        }
        return new EntityAddress(EntityKind.PROGRAM, padded.append(trimmed).toString());
    }

    public static EntityAddress variable(int type, int id) {
        return new EntityAddress(EntityKind.VARIABLE, type + "." + id);
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase(Locale.ROOT) + ":" + id;
    }
}
