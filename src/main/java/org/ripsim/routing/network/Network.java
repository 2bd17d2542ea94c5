package org.ripsim.routing.network;

import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2ObjectMap;
import org.ripsim.core.cost.RouteCost;
import org.ripsim.core.error.RoutingException;
import org.ripsim.core.error.RoutingException.Reason;
import org.ripsim.routing.node.Node;
import org.ripsim.routing.node.RoutingTable;
import org.ripsim.routing.snapshot.NetworkSnapshot;
import org.ripsim.routing.snapshot.NodeSnapshot;
import org.ripsim.routing.snapshot.RouteSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Owns all nodes of a simulated distance-vector network and drives synchronous rounds.
 *
 * <p>Round semantics:</p>
 * <ul>
 * <li>Every node's table is copied before any update of the round is applied.</li>
 * <li>Each node then relaxes against the pre-round copy of each known neighbor, so node
 *     iteration order never changes which tables are read.</li>
 * <li>Writes of round {@code k} become visible to neighbors in round {@code k + 1}.</li>
 * </ul>
 *
 * <p>Construction errors are raised as {@link RoutingException} with stable reason codes instead
 * of being ignored. Not thread-safe.</p>
 */
public final class Network {

    private static final Logger log = LoggerFactory.getLogger(Network.class);

    private final Object2ObjectLinkedOpenHashMap<String, Node> nodes = new Object2ObjectLinkedOpenHashMap<>();
    private NetworkState state = NetworkState.UNINITIALIZED;

    /**
     * Adds a node holding only its self-entry.
     *
     * @param id non-blank node id.
     * @return the created node.
     * @throws RoutingException when the id is blank or already present.
     */
    public Node addNode(String id) {
        requireNodeId(id);
        if (nodes.containsKey(id)) {
            throw new RoutingException(Reason.DUPLICATE_NODE_ID, "node already exists: " + id);
        }
        Node node = new Node(id);
        nodes.put(id, node);
        state = NetworkState.BUILT;
        log.debug("Added node {}", id);
        return node;
    }

    /**
     * Establishes a bidirectional link and seeds the direct route in both tables.
     * <p>
     * Reconnecting an existing pair overwrites the link cost and both direct routes.
     * </p>
     *
     * @param a first endpoint.
     * @param b second endpoint.
     * @param cost finite non-negative link cost.
     * @throws RoutingException for unknown ids, self links, negative or infinite costs.
     */
    public void connectNodes(String a, String b, long cost) {
        Node first = requireNode(a);
        Node second = requireNode(b);
        if (a.equals(b)) {
            throw new RoutingException(Reason.SELF_LINK, "cannot link node " + a + " to itself");
        }
        if (cost < 0) {
            throw new RoutingException(Reason.NEGATIVE_COST, "link cost must be >= 0, got " + cost);
        }
        if (!RouteCost.isFinite(cost)) {
            throw new RoutingException(Reason.INFINITE_COST, "link cost must be finite: " + a + "-" + b);
        }
        first.connectNeighbor(b, cost);
        second.connectNeighbor(a, cost);
        state = NetworkState.BUILT;
        log.debug("Connected {} <-> {} with cost {}", a, b, cost);
    }

    /**
     * Runs one synchronous round over the whole network.
     *
     * @return true when at least one routing table changed.
     */
    public boolean runIteration() {
        Object2ObjectLinkedOpenHashMap<String, RoutingTable> advertised =
                new Object2ObjectLinkedOpenHashMap<>(nodes.size());
        for (Object2ObjectMap.Entry<String, Node> entry : nodes.object2ObjectEntrySet()) {
            advertised.put(entry.getKey(), entry.getValue().shareTable());
        }

        boolean updated = false;
        for (Node node : nodes.values()) {
            for (String neighborId : node.neighborIds()) {
                RoutingTable neighborTable = advertised.get(neighborId);
                if (neighborTable == null) {
                    continue;
                }
                if (node.updateRoutingTable(neighborId, neighborTable)) {
                    updated = true;
                }
            }
        }
        state = updated ? NetworkState.CONVERGING : NetworkState.CONVERGED;
        return updated;
    }

    /**
     * Runs rounds until a quiet round or the round cap.
     *
     * @param maxRounds maximum number of rounds; must be {@code > 0}.
     * @return rounds used and whether the network converged.
     */
    public ConvergenceResult converge(int maxRounds) {
        return converge(maxRounds, RoundObserver.NONE);
    }

    /**
     * Runs rounds until a quiet round or the round cap, notifying an observer after each round.
     *
     * @param maxRounds maximum number of rounds; must be {@code > 0}.
     * @param observer callback receiving every round outcome.
     * @return rounds used and whether the network converged.
     */
    public ConvergenceResult converge(int maxRounds, RoundObserver observer) {
        if (maxRounds <= 0) {
            throw new IllegalArgumentException("maxRounds must be > 0");
        }
        Objects.requireNonNull(observer, "observer");
        state = NetworkState.CONVERGING;
        for (int round = 1; round <= maxRounds; round++) {
            boolean changed = runIteration();
            log.debug("Round {} finished, changed={}", round, changed);
            observer.onRound(round, changed);
            if (!changed) {
                return ConvergenceResult.of(round, true);
            }
        }
        state = NetworkState.ROUND_CAP_REACHED;
        return ConvergenceResult.of(maxRounds, false);
    }

    /**
     * Takes the link between two nodes down in both directions.
     * <p>
     * Does not reconverge; callers run {@link #converge(int)} afterwards. Two existing nodes that
     * were never linked are left untouched.
     * </p>
     *
     * @param a first endpoint.
     * @param b second endpoint.
     * @throws RoutingException when either id is unknown.
     */
    public void simulateFailure(String a, String b) {
        Node first = requireNode(a);
        Node second = requireNode(b);
        if (!first.isNeighbor(b)) {
            log.debug("No link between {} and {}, nothing to take down", a, b);
            return;
        }
        first.disconnectNeighbor(b);
        second.disconnectNeighbor(a);
        state = NetworkState.CONVERGING;
        log.debug("Link {} <-> {} is down", a, b);
    }

    /**
     * Copies every routing table into an immutable snapshot.
     */
    public NetworkSnapshot snapshot() {
        NetworkSnapshot.NetworkSnapshotBuilder builder = NetworkSnapshot.builder();
        for (Node node : nodes.values()) {
            NodeSnapshot.NodeSnapshotBuilder nodeBuilder = NodeSnapshot.builder().nodeId(node.id());
            node.shareTable().forEach((destination, entry) -> nodeBuilder.route(RouteSnapshot.builder()
                    .destination(destination)
                    .cost(entry.cost())
                    .nextHop(entry.nextHop())
                    .build()));
            builder.node(nodeBuilder.build());
        }
        return builder.build();
    }

    /**
     * Returns the node with the given id.
     *
     * @throws RoutingException when the id is unknown.
     */
    public Node node(String id) {
        return requireNode(id);
    }

    /**
     * Returns whether a node id is present.
     */
    public boolean containsNode(String id) {
        return id != null && nodes.containsKey(id);
    }

    /**
     * Returns node ids in insertion order.
     */
    public List<String> nodeIds() {
        return Collections.unmodifiableList(new ArrayList<>(nodes.keySet()));
    }

    /**
     * Returns number of nodes.
     */
    public int size() {
        return nodes.size();
    }

    /**
     * Returns the current lifecycle state.
     */
    public NetworkState state() {
        return state;
    }

    private Node requireNode(String id) {
        requireNodeId(id);
        Node node = nodes.get(id);
        if (node == null) {
            throw new RoutingException(Reason.UNKNOWN_NODE_ID, "unknown node: " + id);
        }
        return node;
    }

    private static void requireNodeId(String id) {
        if (id == null || id.isBlank()) {
            throw new RoutingException(Reason.NODE_ID_REQUIRED, "node id must be non-blank");
        }
    }
}
