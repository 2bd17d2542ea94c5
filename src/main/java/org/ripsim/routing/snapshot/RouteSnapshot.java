package org.ripsim.routing.snapshot;

import lombok.Builder;
import lombok.Value;
import org.ripsim.core.cost.RouteCost;

/**
 * Immutable view of one routing-table row.
 */
@Value
@Builder
public class RouteSnapshot {
    /** Destination node id. */
    String destination;
    /** Path cost, {@link RouteCost#INFINITY} when unreachable. */
    long cost;
    /** First hop, or null when unreachable. */
    String nextHop;

    /**
     * Returns whether the row describes a usable path.
     */
    public boolean isReachable() {
        return RouteCost.isFinite(cost);
    }
}
