package org.ripsim.routing.simulation;

import lombok.Value;

/**
 * A link to take down between two nodes.
 */
@Value(staticConstructor = "between")
public class LinkFailure {
    String first;
    String second;

    @Override
    public String toString() {
        return first + "-" + second;
    }
}
