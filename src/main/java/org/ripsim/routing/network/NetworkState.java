package org.ripsim.routing.network;

/**
 * Lifecycle of a {@link Network}.
 */
public enum NetworkState {
    /** No node has been added yet. */
    UNINITIALIZED,
    /** Nodes or links were added since the last round. */
    BUILT,
    /** Rounds are running, or the last round or failure changed routing state. */
    CONVERGING,
    /** The last round changed nothing. */
    CONVERGED,
    /** The round cap was hit while tables were still changing. */
    ROUND_CAP_REACHED
}
