package org.ripsim.routing.snapshot;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Immutable copy of every routing table in a network, nodes in insertion order.
 *
 * <p>Handed to reporters; later rounds never alter a snapshot already taken.</p>
 */
@Value
@Builder
public class NetworkSnapshot {
    @Singular
    List<NodeSnapshot> nodes;

    /**
     * Returns the snapshot of one node, or null when absent.
     */
    public NodeSnapshot node(String nodeId) {
        for (NodeSnapshot node : nodes) {
            if (node.getNodeId().equals(nodeId)) {
                return node;
            }
        }
        return null;
    }

    /**
     * Returns one table row, or null when the node or destination is absent.
     */
    public RouteSnapshot route(String nodeId, String destination) {
        NodeSnapshot node = node(nodeId);
        return node == null ? null : node.route(destination);
    }
}
