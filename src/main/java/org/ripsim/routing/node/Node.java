package org.ripsim.routing.node;

import it.unimi.dsi.fastutil.objects.Object2LongLinkedOpenHashMap;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.ripsim.core.cost.RouteCost;
import org.ripsim.core.error.RoutingException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One distance-vector router: a routing table plus the direct cost to each neighbor.
 * <p>
 * Table updates follow plain Bellman-Ford relaxation with strict improvement only. There is no
 * split horizon or poisoned reverse, so stale routes through a lost neighbor survive a link
 * failure until a strictly cheaper path replaces them.
 * </p>
 */
public final class Node {
    @Getter
    @Accessors(fluent = true)
    private final String id;
    private final RoutingTable routingTable;
    private final Object2LongLinkedOpenHashMap<String> neighborCosts;

    /**
     * Creates a node with no neighbors and only its self-entry.
     *
     * @param id node id.
     */
    public Node(String id) {
        this.id = Objects.requireNonNull(id, "id");
        this.routingTable = new RoutingTable(id);
        this.neighborCosts = new Object2LongLinkedOpenHashMap<>();
        this.neighborCosts.defaultReturnValue(RouteCost.INFINITY);
    }

    /**
     * Records a direct link and seeds the direct route to that neighbor.
     * <p>
     * An existing link or route to the neighbor is overwritten.
     * </p>
     *
     * @param neighborId neighbor id, distinct from this node.
     * @param cost finite non-negative link cost.
     */
    public void connectNeighbor(String neighborId, long cost) {
        Objects.requireNonNull(neighborId, "neighborId");
        if (neighborId.equals(id)) {
            throw new IllegalArgumentException("node " + id + " cannot link to itself");
        }
        if (cost < 0 || !RouteCost.isFinite(cost)) {
            throw new IllegalArgumentException("link cost must be finite and >= 0, got " + cost);
        }
        neighborCosts.put(neighborId, cost);
        routingTable.put(neighborId, RouteEntry.of(cost, neighborId));
    }

    /**
     * Relaxes this node's table against one neighbor's advertised table.
     *
     * @param neighborId advertising neighbor; must be a known neighbor.
     * @param neighborTable table advertised by the neighbor.
     * @return true when at least one entry strictly improved.
     * @throws RoutingException with {@link RoutingException.Reason#NOT_A_NEIGHBOR} for unknown neighbors.
     */
    public boolean updateRoutingTable(String neighborId, RoutingTable neighborTable) {
        Objects.requireNonNull(neighborTable, "neighborTable");
        if (!isNeighbor(neighborId)) {
            throw new RoutingException(
                    RoutingException.Reason.NOT_A_NEIGHBOR,
                    "node " + id + " has no neighbor " + neighborId
            );
        }
        long linkCost = neighborCosts.getLong(neighborId);
        boolean[] changed = {false};
        neighborTable.forEach((destination, advertised) -> {
            if (destination.equals(id)) {
                return;
            }
            long candidateCost = RouteCost.add(linkCost, advertised.cost());
            if (candidateCost < routingTable.costTo(destination)) {
                routingTable.put(destination, RouteEntry.of(candidateCost, neighborId));
                changed[0] = true;
            }
        });
        return changed[0];
    }

    /**
     * Returns a read-only snapshot of the table as of this call.
     */
    public RoutingTable shareTable() {
        return routingTable.copy();
    }

    /**
     * Marks the link to a neighbor as down.
     * <p>
     * The neighbor stays known with cost {@link RouteCost#INFINITY} and its direct route is reset
     * to unreachable. Routes to other destinations that use it as next hop are left untouched.
     * Unknown neighbors are ignored.
     * </p>
     *
     * @param neighborId neighbor to disconnect.
     */
    public void disconnectNeighbor(String neighborId) {
        if (!isNeighbor(neighborId)) {
            return;
        }
        neighborCosts.put(neighborId, RouteCost.INFINITY);
        routingTable.put(neighborId, RouteEntry.unreachable());
    }

    /**
     * Returns the current route to a destination, or null when unknown.
     */
    public RouteEntry route(String destination) {
        return routingTable.get(destination);
    }

    /**
     * Returns the direct link cost, {@link RouteCost#INFINITY} for down or unknown links.
     */
    public long neighborCost(String neighborId) {
        return neighborCosts.getLong(neighborId);
    }

    /**
     * Returns whether {@code nodeId} was ever connected to this node.
     */
    public boolean isNeighbor(String nodeId) {
        return nodeId != null && neighborCosts.containsKey(nodeId);
    }

    /**
     * Returns neighbor ids in connection order, including neighbors whose link is down.
     */
    public List<String> neighborIds() {
        return Collections.unmodifiableList(new ArrayList<>(neighborCosts.keySet()));
    }

    @Override
    public String toString() {
        return "Node " + id + " Routing Table:\n" + routingTable;
    }
}
