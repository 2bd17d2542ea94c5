package org.ripsim.routing.report;

import org.ripsim.routing.network.Network;
import org.ripsim.routing.snapshot.NetworkSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Reporter Tests")
class ReporterTest {

    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2024-03-05T10:15:30Z"), ZoneOffset.UTC);

    private NetworkSnapshot snapshot;

    @BeforeEach
    void setUp() {
        Network network = new Network();
        network.addNode("A");
        network.addNode("B");
        network.connectNodes("A", "B", 1);
        network.simulateFailure("A", "B");
        snapshot = network.snapshot();
    }

    @Test
    @DisplayName("Formatter renders aligned rows with inf and N/A for unreachable routes")
    void testFormatter() {
        String text = RoutingTableFormatter.format(snapshot);
        String nl = System.lineSeparator();

        assertTrue(text.startsWith("Routing Table for Node A:" + nl));
        assertTrue(text.contains(String.format("%-12s %-10s %-10s%n", "Destination", "Cost", "Next Hop")));
        assertTrue(text.contains(String.format("%-12s %-10s %-10s%n", "A", "0", "A")));
        assertTrue(text.contains(String.format("%-12s %-10s %-10s%n", "B", "inf", "N/A")));
        assertTrue(text.contains("Routing Table for Node B:"));
        assertEquals(2, text.split(RoutingTableFormatter.SECTION_RULE + "\\R", -1).length - 1);
    }

    @Test
    @DisplayName("Console reporter prints event header and tables")
    void testConsoleReporter() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        new ConsoleReporter(new PrintStream(buffer, true, StandardCharsets.UTF_8)).report("Initial network state", snapshot);

        String output = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(output.contains("Initial network state:"));
        assertTrue(output.contains("Routing Table for Node A:"));
        assertTrue(output.contains(RoutingTableFormatter.format(snapshot)));
    }

    @Test
    @DisplayName("Log file gets a single banner and timestamped events appended")
    void testLogFileReporter(@TempDir Path dir) throws Exception {
        Path log = dir.resolve("networkLog.txt");
        LogFileReporter reporter = new LogFileReporter(log, FIXED_CLOCK);

        reporter.report("Initial network state", snapshot);
        reporter.report("Iteration 1 (initial)", snapshot);

        String content = Files.readString(log, StandardCharsets.UTF_8);
        assertTrue(content.startsWith(LogFileReporter.BANNER_TITLE));
        assertEquals(content.indexOf(LogFileReporter.BANNER_TITLE), content.lastIndexOf(LogFileReporter.BANNER_TITLE));
        assertTrue(content.contains("[2024-03-05 10:15:30] Initial network state"));
        assertTrue(content.contains("[2024-03-05 10:15:30] Iteration 1 (initial)"));
        assertTrue(content.indexOf("Initial network state") < content.indexOf("Iteration 1 (initial)"));
        assertEquals(log, reporter.logFile());
    }

    @Test
    @DisplayName("Existing log files are appended without a new banner")
    void testLogFileAppendsToExisting(@TempDir Path dir) throws Exception {
        Path log = dir.resolve("existing.txt");
        Files.writeString(log, "previous run" + System.lineSeparator());

        new LogFileReporter(log, FIXED_CLOCK).report("Link failure between A and B", snapshot);

        String content = Files.readString(log, StandardCharsets.UTF_8);
        assertTrue(content.startsWith("previous run"));
        assertTrue(content.contains("Link failure between A and B"));
        assertEquals(-1, content.indexOf(LogFileReporter.BANNER_TITLE));
    }

    @Test
    @DisplayName("Unwritable log surfaces as UncheckedIOException")
    void testLogFileFailure(@TempDir Path dir) {
        LogFileReporter reporter = new LogFileReporter(dir.resolve("missing").resolve("log.txt"), FIXED_CLOCK);
        assertThrows(UncheckedIOException.class, () -> reporter.report("event", snapshot));
    }

    @Test
    @DisplayName("Composite fans out in order; recording reporter keeps history")
    void testCompositeAndRecording() {
        List<String> order = new ArrayList<>();
        RecordingReporter recording = new RecordingReporter();
        Reporter composite = Reporter.composite(
                (event, s) -> order.add("first:" + event),
                recording,
                (event, s) -> order.add("second:" + event)
        );

        composite.report("one", snapshot);
        composite.report("two", snapshot);

        assertEquals(List.of("first:one", "second:one", "first:two", "second:two"), order);
        assertEquals(2, recording.events().size());
        assertEquals("two", recording.last().getDescription());
        assertSame(snapshot, recording.last().getSnapshot());

        recording.clear();
        assertNull(recording.last());
        Reporter.noop().report("ignored", snapshot);
    }
}
