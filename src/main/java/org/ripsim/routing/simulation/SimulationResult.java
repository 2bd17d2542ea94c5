package org.ripsim.routing.simulation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Structured result of {@link Simulation#run(List)}.
 */
@Value
@Builder
public class SimulationResult {
    @Singular
    List<PhaseResult> phases;
    /** Sum of the elapsed time of every phase. */
    long totalElapsedNanos;

    /**
     * Returns true when every phase converged within the round cap.
     */
    public boolean allConverged() {
        for (PhaseResult phase : phases) {
            if (!phase.isConverged()) {
                return false;
            }
        }
        return true;
    }
}
