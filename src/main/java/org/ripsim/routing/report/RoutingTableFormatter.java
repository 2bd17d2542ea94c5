package org.ripsim.routing.report;

import lombok.experimental.UtilityClass;
import org.ripsim.core.cost.RouteCost;
import org.ripsim.routing.snapshot.NetworkSnapshot;
import org.ripsim.routing.snapshot.NodeSnapshot;
import org.ripsim.routing.snapshot.RouteSnapshot;

/**
 * Plain-text rendering of routing tables shared by console and log-file reporters.
 */
@UtilityClass
public class RoutingTableFormatter {
    static final String TABLE_RULE = "-".repeat(34);
    static final String SECTION_RULE = "-".repeat(40);
    static final String MISSING_HOP = "N/A";

    private static final String ROW_FORMAT = "%-12s %-10s %-10s%n";

    /**
     * Renders every table of a snapshot, one block per node.
     */
    public static String format(NetworkSnapshot snapshot) {
        StringBuilder out = new StringBuilder();
        for (NodeSnapshot node : snapshot.getNodes()) {
            out.append(format(node));
        }
        return out.toString();
    }

    /**
     * Renders one node's table followed by a section rule.
     */
    public static String format(NodeSnapshot node) {
        StringBuilder out = new StringBuilder();
        out.append("Routing Table for Node ").append(node.getNodeId()).append(':').append(System.lineSeparator());
        out.append(String.format(ROW_FORMAT, "Destination", "Cost", "Next Hop"));
        out.append(TABLE_RULE).append(System.lineSeparator());
        for (RouteSnapshot route : node.getRoutes()) {
            out.append(String.format(
                    ROW_FORMAT,
                    route.getDestination(),
                    RouteCost.format(route.getCost()),
                    route.getNextHop() == null ? MISSING_HOP : route.getNextHop()
            ));
        }
        out.append(SECTION_RULE).append(System.lineSeparator());
        return out.toString();
    }
}
