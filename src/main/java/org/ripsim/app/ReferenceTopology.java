package org.ripsim.app;

import lombok.experimental.UtilityClass;
import org.ripsim.routing.network.Network;
import org.ripsim.routing.simulation.LinkFailure;

/**
 * Fully meshed three-node network used by the demo run.
 *
 * <pre>
 *   A --1-- B --1-- C
 *    \_______4_____/
 * </pre>
 */
@UtilityClass
public class ReferenceTopology {
    public static final String NODE_A = "A";
    public static final String NODE_B = "B";
    public static final String NODE_C = "C";

    /** Failure injected by the demo run. */
    public static final LinkFailure FAILURE_A_B = LinkFailure.between(NODE_A, NODE_B);

    /**
     * Builds a fresh triangle network.
     */
    public static Network triangle() {
        Network network = new Network();
        network.addNode(NODE_A);
        network.addNode(NODE_B);
        network.addNode(NODE_C);
        network.connectNodes(NODE_A, NODE_B, 1);
        network.connectNodes(NODE_B, NODE_C, 1);
        network.connectNodes(NODE_A, NODE_C, 4);
        return network;
    }
}
