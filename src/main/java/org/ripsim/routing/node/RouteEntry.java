package org.ripsim.routing.node;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.ripsim.core.cost.RouteCost;

import java.util.Objects;

/**
 * Best known path from a table owner to one destination.
 * <p>
 * Immutable. An entry is either reachable ({@code cost < INFINITY}, non-null next hop) or the
 * canonical unreachable entry ({@code cost == INFINITY}, {@code nextHop == null}) written when a
 * direct link goes down.
 * </p>
 */
@Getter
@EqualsAndHashCode
@Accessors(fluent = true)
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class RouteEntry {
    private static final RouteEntry UNREACHABLE = new RouteEntry(RouteCost.INFINITY, null);

    /** Total path cost, or {@link RouteCost#INFINITY}. */
    private final long cost;
    /** First hop on the path; null when the destination is unreachable. */
    private final String nextHop;

    /**
     * Creates a route through {@code nextHop}.
     *
     * @param cost non-negative path cost.
     * @param nextHop first hop node id.
     * @return immutable route entry.
     */
    public static RouteEntry of(long cost, String nextHop) {
        if (cost < 0) {
            throw new IllegalArgumentException("cost must be >= 0");
        }
        return new RouteEntry(cost, Objects.requireNonNull(nextHop, "nextHop"));
    }

    /**
     * Creates the zero-cost entry a node keeps for itself.
     */
    public static RouteEntry self(String nodeId) {
        return new RouteEntry(0L, Objects.requireNonNull(nodeId, "nodeId"));
    }

    /**
     * Returns the canonical unreachable entry.
     */
    public static RouteEntry unreachable() {
        return UNREACHABLE;
    }

    /**
     * Returns whether this entry describes a usable path.
     */
    public boolean isReachable() {
        return RouteCost.isFinite(cost);
    }

    @Override
    public String toString() {
        return "cost " + RouteCost.format(cost) + ", next hop " + (nextHop == null ? "N/A" : nextHop);
    }
}
