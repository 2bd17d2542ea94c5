package org.ripsim.routing.network;

/**
 * Callback invoked after every round of {@link Network#converge(int, RoundObserver)}.
 */
@FunctionalInterface
public interface RoundObserver {

    /**
     * Observer that ignores every round.
     */
    RoundObserver NONE = (round, changed) -> {
    };

    /**
     * Receives the outcome of one finished round.
     *
     * @param round 1-based round number within the current convergence run.
     * @param changed whether any routing table changed in that round.
     */
    void onRound(int round, boolean changed);
}
