package org.ripsim.routing.report;

import lombok.Value;
import org.ripsim.routing.snapshot.NetworkSnapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keeps every reported event in memory, in arrival order.
 */
public final class RecordingReporter implements Reporter {

    /**
     * One recorded event.
     */
    @Value
    public static class Event {
        String description;
        NetworkSnapshot snapshot;
    }

    private final List<Event> events = new ArrayList<>();

    @Override
    public void report(String event, NetworkSnapshot snapshot) {
        events.add(new Event(event, snapshot));
    }

    /**
     * Returns recorded events, oldest first.
     */
    public List<Event> events() {
        return Collections.unmodifiableList(events);
    }

    /**
     * Returns the most recent event, or null when nothing was reported.
     */
    public Event last() {
        return events.isEmpty() ? null : events.get(events.size() - 1);
    }

    public void clear() {
        events.clear();
    }
}
