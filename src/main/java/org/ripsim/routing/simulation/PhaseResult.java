package org.ripsim.routing.simulation;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one convergence phase.
 */
@Value
@Builder
public class PhaseResult {
    /** Phase label used in reported events. */
    String phase;
    /** Rounds executed, the final quiet round included. */
    int roundsUsed;
    /** False when the round cap was hit. */
    boolean converged;
    /** Wall time spent in the phase. */
    long elapsedNanos;
}
