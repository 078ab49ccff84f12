package com.questrail.homeshadow.api;

import java.util.Collection;

/**
 * Supplies a full snapshot of the controller's entities, typically fetched
 * from its REST interface. Used to re-seed the shadow after a reconnect.
 *
 * <p>Called off the dispatch loop; it may block.</p>
 */
@FunctionalInterface
public interface SnapshotSource
{
    /**
     * @throws RuntimeException when the snapshot cannot be fetched; the shadow
     *         keeps its current contents
     */
    Collection<EntitySnapshot> fetch();
}
