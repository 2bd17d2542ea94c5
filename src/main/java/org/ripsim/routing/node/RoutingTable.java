package org.ripsim.routing.node;

import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2ObjectMap;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.ripsim.core.cost.RouteCost;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * Destination-keyed route table owned by one node.
 * <p>
 * Contract:
 * </p>
 * <ul>
 * <li>The owner id always maps to {@code {cost: 0, nextHop: owner}}; writes targeting the owner
 *     are rejected.</li>
 * <li>Entries are overwritten, never removed. Unreachable destinations stay at
 *     {@link RouteCost#INFINITY}.</li>
 * <li>Iteration follows insertion order. Order only affects reports, never relaxation results.</li>
 * <li>Tables returned by {@link #copy()} are frozen and reject every write.</li>
 * </ul>
 */
public final class RoutingTable {

    @Getter
    @Accessors(fluent = true)
    private final String ownerId;
    private final Object2ObjectLinkedOpenHashMap<String, RouteEntry> entries;
    private final boolean frozen;

    /**
     * Creates a table holding only the owner's self-entry.
     *
     * @param ownerId id of the owning node.
     */
    RoutingTable(String ownerId) {
        this.ownerId = Objects.requireNonNull(ownerId, "ownerId");
        this.entries = new Object2ObjectLinkedOpenHashMap<>();
        this.entries.put(ownerId, RouteEntry.self(ownerId));
        this.frozen = false;
    }

    private RoutingTable(RoutingTable source) {
        this.ownerId = source.ownerId;
        this.entries = new Object2ObjectLinkedOpenHashMap<>(source.entries);
        this.frozen = true;
    }

    /**
     * Returns the entry for one destination.
     *
     * @param destination destination node id.
     * @return current entry, or null when the destination was never learned.
     */
    public RouteEntry get(String destination) {
        return entries.get(destination);
    }

    /**
     * Returns the known cost to a destination, {@link RouteCost#INFINITY} when unknown.
     */
    public long costTo(String destination) {
        RouteEntry entry = entries.get(destination);
        return entry == null ? RouteCost.INFINITY : entry.cost();
    }

    /**
     * Returns whether the destination has an entry (reachable or not).
     */
    public boolean contains(String destination) {
        return entries.containsKey(destination);
    }

    /**
     * Returns number of destinations, self included.
     */
    public int size() {
        return entries.size();
    }

    /**
     * Returns destinations in insertion order.
     */
    public List<String> destinations() {
        return Collections.unmodifiableList(new ArrayList<>(entries.keySet()));
    }

    /**
     * Visits every entry in insertion order.
     */
    public void forEach(BiConsumer<String, RouteEntry> visitor) {
        Objects.requireNonNull(visitor, "visitor");
        for (Object2ObjectMap.Entry<String, RouteEntry> entry : entries.object2ObjectEntrySet()) {
            visitor.accept(entry.getKey(), entry.getValue());
        }
    }

    /**
     * Returns a frozen copy of the table as it stands now.
     */
    public RoutingTable copy() {
        return new RoutingTable(this);
    }

    /**
     * Returns whether this instance rejects writes.
     */
    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Writes a route for a destination other than the owner.
     */
    void put(String destination, RouteEntry entry) {
        if (frozen) {
            throw new UnsupportedOperationException("routing table snapshot is read-only");
        }
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(entry, "entry");
        if (destination.equals(ownerId)) {
            throw new IllegalArgumentException("self-entry of " + ownerId + " cannot be overwritten");
        }
        entries.put(destination, entry);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        forEach((destination, entry) -> {
            if (builder.length() > 0) {
                builder.append('\n');
            }
            builder.append(destination).append(": ").append(entry);
        });
        return builder.toString();
    }
}
