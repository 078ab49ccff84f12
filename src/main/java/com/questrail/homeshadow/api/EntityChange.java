package com.questrail.homeshadow.api;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Payload of the platform-wide entity-changed feed: an entity was added,
 * removed, renamed, moved, enabled, or is being reprogrammed.
 *
 * <p>{@code info} carries the action-specific detail fields reported by the
 * controller (e.g. {@code newName}, {@code enabled}, {@code memory}).</p>
 */
public record EntityChange(
        EntityAddress address,
        NodeChangeAction action,
        Map<String, String> info,
        Instant timestamp)
{
    public EntityChange {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(action, "action");
        info = Map.copyOf(Objects.requireNonNull(info, "info"));
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
