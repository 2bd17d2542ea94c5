package org.ripsim.routing.snapshot;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Immutable copy of one node's routing table, rows in table insertion order.
 */
@Value
@Builder
public class NodeSnapshot {
    /** Owning node id. */
    String nodeId;
    /** Table rows. */
    @Singular
    List<RouteSnapshot> routes;

    /**
     * Returns the row for a destination, or null when the node never learned it.
     */
    public RouteSnapshot route(String destination) {
        for (RouteSnapshot route : routes) {
            if (route.getDestination().equals(destination)) {
                return route;
            }
        }
        return null;
    }
}
