package com.questrail.homeshadow.core;

import com.questrail.homeshadow.api.ControlReceived;
import com.questrail.homeshadow.api.EntityAddress;
import com.questrail.homeshadow.api.EntityChange;
import com.questrail.homeshadow.api.EntityKind;
import com.questrail.homeshadow.api.EntityKind.Capability;
import com.questrail.homeshadow.api.EntitySnapshot;
import com.questrail.homeshadow.api.FeedListener;
import com.questrail.homeshadow.api.NodeChangeAction;
import com.questrail.homeshadow.api.PropertyValue;
import com.questrail.homeshadow.api.StatusChange;
import com.questrail.homeshadow.api.Subscription;
import com.questrail.homeshadow.core.ControlDispatchTable.ControlEffect;
import com.questrail.homeshadow.notify.NotificationFeed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * ShadowTree
 * =============================================================================
 * The in-memory mirror of every controller entity, keyed by
 * {@link EntityAddress}.
 *
 * <h2>Ownership and threading</h2>
 * <ul>
 *   <li>All mutating methods ({@code seed}, {@code apply*}) are called from one
 *       serialized context, the client's dispatch loop. The tree takes no
 *       locks.</li>
 *   <li>Entity state is held as immutable {@link EntitySnapshot}s, replaced
 *       whole on each mutation, so readers on other threads always observe a
 *       consistent entity.</li>
 *   <li>Subscribing is safe from any thread. Per-entity feeds are created on
 *       first use and outlive the entity itself: removing and re-adding an
 *       address keeps its listeners.</li>
 * </ul>
 *
 * <h2>Change semantics</h2>
 * <ul>
 *   <li>An update for an address that is not in the tree is ignored and
 *       nothing is mutated.</li>
 *   <li>{@code lastUpdate} moves on every applied report; {@code lastChanged}
 *       and the status feed only when the value differs from the stored
 *       one.</li>
 *   <li>Control messages always notify the control feed; the
 *       {@link ControlDispatchTable} decides whether they also store a
 *       value.</li>
 * </ul>
 */
public final class ShadowTree
{
    private static final Logger log = LoggerFactory.getLogger(ShadowTree.class);

    private final ControlDispatchTable dispatchTable;
    private final Map<EntityAddress, EntitySnapshot> entities = new ConcurrentHashMap<>();
    private final Map<EntityAddress, EntityFeeds> feeds = new ConcurrentHashMap<>();
    private final NotificationFeed<EntityChange> entityChanges = new NotificationFeed<>("entity-changed");

    private boolean seeded;

    public ShadowTree() {
        this(ControlDispatchTable.standard());
    }

    public ShadowTree(ControlDispatchTable dispatchTable) {
        this.dispatchTable = Objects.requireNonNull(dispatchTable, "dispatchTable");
    }

    // -------------------------------------------------------------------------
    // Reads
    // -------------------------------------------------------------------------

    public Optional<EntitySnapshot> lookup(EntityAddress address) {
        Objects.requireNonNull(address, "address");
        return Optional.ofNullable(entities.get(address));
    }

    public Collection<EntitySnapshot> snapshots() {
        return List.copyOf(entities.values());
    }

    public int size() {
        return entities.size();
    }

    // -------------------------------------------------------------------------
    // Subscriptions
    // -------------------------------------------------------------------------

    public Subscription subscribeStatus(EntityAddress address, FeedListener<? super StatusChange> listener) {
        return feedsFor(address).status.subscribe(listener);
    }

    public Subscription subscribeControl(EntityAddress address, FeedListener<? super ControlReceived> listener) {
        return feedsFor(address).control.subscribe(listener);
    }

    public Subscription subscribeEntityChanges(FeedListener<? super EntityChange> listener) {
        return entityChanges.subscribe(listener);
    }

    // -------------------------------------------------------------------------
    // Mutations (dispatch loop only)
    // -------------------------------------------------------------------------

    /**
     * Loads a snapshot. The first call populates the tree silently. Later calls
     * merge: changed values notify like ordinary updates, new addresses publish
     * {@link NodeChangeAction#NODE_ADDED} and addresses missing from the new
     * snapshot are removed with {@link NodeChangeAction#NODE_REMOVED}. A changed
     * name publishes a rename and a changed enabled flag publishes
     * {@link NodeChangeAction#NODE_ENABLED}, with the same info keys the event
     * stream uses.
     *
     * @return number of entries loaded
     */
    public int seed(Collection<? extends EntitySnapshot> entries, Instant now) {
        Objects.requireNonNull(entries, "entries");
        Objects.requireNonNull(now, "now");

        if (!seeded) {
            for (EntitySnapshot entry : entries) {
                entities.put(entry.address(), entry);
            }
            seeded = true;
            log.info("Seeded shadow with {} entities", entries.size());
            return entries.size();
        }

        Set<EntityAddress> present = new HashSet<>();
        for (EntitySnapshot entry : entries) {
            present.add(entry.address());
            EntitySnapshot current = entities.get(entry.address());
            if (current == null) {
                entities.put(entry.address(), entry);
                entityChanges.publish(new EntityChange(entry.address(), NodeChangeAction.NODE_ADDED, Map.of(), now));
                continue;
            }
            entities.put(entry.address(), new EntitySnapshot(entry.address(), entry.name(), current.status(),
                    current.lastChanged(), current.lastUpdate(), entry.enabled(), current.properties()));
            if (!entry.name().equals(current.name())) {
                NodeChangeAction rename = entry.address().kind() == EntityKind.GROUP
                        ? NodeChangeAction.GROUP_RENAMED : NodeChangeAction.NODE_RENAMED;
                entityChanges.publish(new EntityChange(entry.address(), rename,
                        Map.of("newName", entry.name()), now));
            }
            if (entry.enabled() != current.enabled()) {
                entityChanges.publish(new EntityChange(entry.address(), NodeChangeAction.NODE_ENABLED,
                        Map.of("enabled", String.valueOf(entry.enabled())), now));
            }
            applyPropertyUpdate(entry.address(), StatusChange.STATUS, entry.status(), now);
            for (Map.Entry<String, PropertyValue> property : entry.properties().entrySet()) {
                applyPropertyUpdate(entry.address(), property.getKey(), property.getValue(), now);
            }
        }

        for (EntityAddress address : List.copyOf(entities.keySet())) {
            if (!present.contains(address)) {
                entities.remove(address);
                entityChanges.publish(new EntityChange(address, NodeChangeAction.NODE_REMOVED, Map.of(), now));
            }
        }
        log.info("Re-seeded shadow with {} entities", entries.size());
        return entries.size();
    }

    /**
     * Applies a reported property value. {@link StatusChange#STATUS} updates the
     * entity status; any other key updates an auxiliary property.
     */
    public ApplyResult applyPropertyUpdate(EntityAddress address, String key, PropertyValue value, Instant now) {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(now, "now");

        EntitySnapshot current = entities.get(address);
        if (current == null) {
            log.debug("Ignoring {} update for unknown entity {}", key, address);
            return ApplyResult.IGNORED;
        }

        if (StatusChange.STATUS.equals(key)) {
            if (!address.kind().has(Capability.STATUS)) {
                log.debug("Ignoring status update for {}: kind has no status", address);
                return ApplyResult.IGNORED;
            }
            return applyStatus(current, value, now);
        }

        if (!address.kind().has(Capability.AUX_PROPERTIES)) {
            log.debug("Ignoring property {} for {}: kind has no auxiliary properties", key, address);
            return ApplyResult.IGNORED;
        }
        return applyAuxProperty(current, key, value, now);
    }

    /**
     * Applies a control message. Every accepted message raises a
     * control-received notification, repeated codes included.
     */
    public ApplyResult applyControlMessage(EntityAddress address, String control, Optional<PropertyValue> value,
                                           Instant now) {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(control, "control");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(now, "now");

        EntitySnapshot current = entities.get(address);
        if (current == null) {
            log.debug("Ignoring control {} for unknown entity {}", control, address);
            return ApplyResult.IGNORED;
        }

        ControlEffect effect = dispatchTable.resolve(address.kind(), control, current.status().isKnown());
        if (effect == ControlEffect.UNSUPPORTED) {
            log.debug("Ignoring control {} for {}: kind takes no control messages", control, address);
            return ApplyResult.IGNORED;
        }

        Optional<PropertyValue> normalized = value.map(v -> dispatchTable.normalize(control, v));

        ApplyResult result = ApplyResult.UNCHANGED;
        if (normalized.isPresent()) {
            if (effect == ControlEffect.STATUS) {
                result = applyStatus(current, normalized.get(), now);
            } else if (effect == ControlEffect.AUX_PROPERTY) {
                result = applyAuxProperty(current, control, normalized.get(), now);
            }
        }

        EntityFeeds entityFeeds = feeds.get(address);
        if (entityFeeds != null) {
            entityFeeds.control.publish(new ControlReceived(address, control, normalized, now));
        }
        return result;
    }

    /**
     * Applies a node-list change and publishes it on the entity-changed feed.
     * Changes for addresses not in the tree are published too (a node may have
     * just been added on the controller).
     */
    public ApplyResult applyEntityChange(EntityChange change) {
        Objects.requireNonNull(change, "change");

        EntityAddress address = change.address();
        EntitySnapshot current = entities.get(address);
        ApplyResult result = current == null ? ApplyResult.IGNORED : ApplyResult.UNCHANGED;

        if (current != null) {
            switch (change.action()) {
                case NODE_ENABLED:
                    String enabled = change.info().get("enabled");
                    if (enabled != null) {
                        result = setEnabled(address, parseFlag(enabled), change.timestamp());
                    }
                    break;
                case NODE_RENAMED:
                case GROUP_RENAMED:
                    String newName = change.info().get("newName");
                    if (newName != null && !newName.equals(current.name())) {
                        entities.put(address, new EntitySnapshot(address, newName, current.status(),
                                current.lastChanged(), change.timestamp(), current.enabled(), current.properties()));
                        result = ApplyResult.CHANGED;
                    }
                    break;
                case NODE_REMOVED:
                case GROUP_REMOVED:
                    entities.remove(address);
                    result = ApplyResult.CHANGED;
                    break;
                default:
                    break;
            }
        }

        log.debug("Entity change {} for {} {}", change.action(), address, change.info());
        entityChanges.publish(change);
        return result;
    }

    /**
     * Sets the enabled flag of an entity. Does not notify the status feed.
     */
    public ApplyResult setEnabled(EntityAddress address, boolean enabled, Instant now) {
        EntitySnapshot current = entities.get(address);
        if (current == null) {
            log.debug("Ignoring enabled flag for unknown entity {}", address);
            return ApplyResult.IGNORED;
        }
        if (current.enabled() == enabled) {
            return ApplyResult.UNCHANGED;
        }
        entities.put(address, new EntitySnapshot(address, current.name(), current.status(),
                now, now, enabled, current.properties()));
        return ApplyResult.CHANGED;
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private ApplyResult applyStatus(EntitySnapshot current, PropertyValue reported, Instant now) {
        EntityAddress address = current.address();
        PropertyValue previous = current.status();
        PropertyValue value = prepare(previous, reported);

        if (value.sameValueAs(previous)) {
            entities.put(address, new EntitySnapshot(address, current.name(), value,
                    current.lastChanged(), now, current.enabled(), current.properties()));
            return ApplyResult.UNCHANGED;
        }

        entities.put(address, new EntitySnapshot(address, current.name(), value,
                now, now, current.enabled(), current.properties()));
        publishStatus(new StatusChange(address, StatusChange.STATUS, previous, value, now));
        return ApplyResult.CHANGED;
    }

    private ApplyResult applyAuxProperty(EntitySnapshot current, String key, PropertyValue reported, Instant now) {
        EntityAddress address = current.address();
        PropertyValue previous = current.properties().get(key);
        PropertyValue value = prepare(previous, reported);

        Map<String, PropertyValue> properties = new HashMap<>(current.properties());
        properties.put(key, value);

        if (value.sameValueAs(previous)) {
            entities.put(address, new EntitySnapshot(address, current.name(), current.status(),
                    current.lastChanged(), now, current.enabled(), properties));
            return ApplyResult.UNCHANGED;
        }

        entities.put(address, new EntitySnapshot(address, current.name(), current.status(),
                now, now, current.enabled(), properties));
        publishStatus(new StatusChange(address, key,
                previous == null ? PropertyValue.unknown() : previous, value, now));
        return ApplyResult.CHANGED;
    }

    /**
     * Keeps a known unit when the report carries none (older firmware omits
     * it) and fills in the formatted text from the decimal reading.
     */
    private static PropertyValue prepare(PropertyValue previous, PropertyValue reported) {
        PropertyValue value = reported;
        if (!value.unit().isSet() && previous != null && previous.unit().isSet()) {
            value = value.withUnit(previous.unit());
        }
        if (value.formatted().isEmpty() && value.isKnown()) {
            value = value.withFormatted(value.decimalText());
        }
        return value;
    }

    private void publishStatus(StatusChange change) {
        EntityFeeds entityFeeds = feeds.get(change.address());
        if (entityFeeds != null) {
            entityFeeds.status.publish(change);
        }
    }

    private EntityFeeds feedsFor(EntityAddress address) {
        Objects.requireNonNull(address, "address");
        return feeds.computeIfAbsent(address, EntityFeeds::new);
    }

    private static boolean parseFlag(String text) {
        String t = text.trim();
        return t.equalsIgnoreCase("true") || t.equals("1") || t.equalsIgnoreCase("on");
    }

    private static final class EntityFeeds
    {
        final NotificationFeed<StatusChange> status;
        final NotificationFeed<ControlReceived> control;

        EntityFeeds(EntityAddress address) {
            this.status = new NotificationFeed<>("status:" + address);
            this.control = new NotificationFeed<>("control:" + address);
        }
    }
}
