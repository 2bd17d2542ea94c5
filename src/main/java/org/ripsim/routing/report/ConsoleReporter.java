package org.ripsim.routing.report;

import org.ripsim.routing.snapshot.NetworkSnapshot;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Prints each event header followed by every routing table.
 */
public final class ConsoleReporter implements Reporter {
    private final PrintStream out;

    public ConsoleReporter(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public void report(String event, NetworkSnapshot snapshot) {
        out.println();
        out.println("=".repeat(40));
        out.println(event + ":");
        out.print(RoutingTableFormatter.format(snapshot));
        out.flush();
    }
}
