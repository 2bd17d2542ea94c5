package org.ripsim.routing.network;

import lombok.Value;

/**
 * Outcome of one {@link Network#converge(int)} call.
 *
 * <p>{@code roundsUsed} counts the final quiet round when {@code converged=true}. When the cap is
 * hit, {@code converged=false} and {@code roundsUsed} equals the cap.</p>
 */
@Value(staticConstructor = "of")
public class ConvergenceResult {
    /** Number of rounds executed. */
    int roundsUsed;
    /** True when the last executed round changed no table. */
    boolean converged;
}
