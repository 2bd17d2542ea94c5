package org.ripsim.routing.report;

import org.ripsim.routing.snapshot.NetworkSnapshot;

import java.util.List;

/**
 * Receives routing-state snapshots tagged with an event description.
 *
 * <p>Reporters own all presentation; the routing core never formats or writes output itself.</p>
 */
@FunctionalInterface
public interface Reporter {

    /**
     * Publishes one snapshot.
     *
     * @param event human-readable event description.
     * @param snapshot immutable routing state at the time of the event.
     */
    void report(String event, NetworkSnapshot snapshot);

    /**
     * Returns a reporter that discards everything.
     */
    static Reporter noop() {
        return (event, snapshot) -> {
        };
    }

    /**
     * Returns a reporter forwarding every event to each delegate in order.
     *
     * @param reporters delegates; none may be null.
     * @return fan-out reporter.
     */
    static Reporter composite(Reporter... reporters) {
        List<Reporter> delegates = List.of(reporters);
        return (event, snapshot) -> {
            for (Reporter delegate : delegates) {
                delegate.report(event, snapshot);
            }
        };
    }
}
