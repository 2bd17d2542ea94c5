package org.ripsim.routing.report;

import org.ripsim.routing.snapshot.NetworkSnapshot;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Appends timestamped routing-table dumps to a text log.
 * <p>
 * A banner is written once, when the file does not exist yet. Every event then appends
 * {@code [yyyy-MM-dd HH:mm:ss] event}, a rule, and all tables. Existing content is never
 * truncated, so consecutive runs accumulate in the same file.
 * </p>
 */
public final class LogFileReporter implements Reporter {
    static final String BANNER_TITLE = "RIP Protocol Simulation Log";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String BANNER_RULE = "=".repeat(40);

    private final Path logFile;
    private final Clock clock;

    /**
     * Creates a reporter stamping events with the system default clock.
     */
    public LogFileReporter(Path logFile) {
        this(logFile, Clock.systemDefaultZone());
    }

    /**
     * Creates a reporter with an explicit clock.
     *
     * @param logFile target file; parent directories must exist.
     * @param clock clock used for event timestamps.
     */
    public LogFileReporter(Path logFile, Clock clock) {
        this.logFile = Objects.requireNonNull(logFile, "logFile");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Appends one event.
     *
     * @throws UncheckedIOException when the log cannot be written.
     */
    @Override
    public void report(String event, NetworkSnapshot snapshot) {
        boolean fresh = !Files.exists(logFile);
        try (BufferedWriter writer = Files.newBufferedWriter(
                logFile,
                StandardCharsets.UTF_8,
                StandardOpenOption.CREATE,
                StandardOpenOption.APPEND
        )) {
            if (fresh) {
                writeBanner(writer);
            }
            writer.newLine();
            writer.write("[" + LocalDateTime.now(clock).format(TIMESTAMP) + "] " + event);
            writer.newLine();
            writer.write(RoutingTableFormatter.SECTION_RULE);
            writer.newLine();
            writer.write(RoutingTableFormatter.format(snapshot));
        } catch (IOException e) {
            throw new UncheckedIOException("failed to append routing log " + logFile, e);
        }
    }

    public Path logFile() {
        return logFile;
    }

    private static void writeBanner(BufferedWriter writer) throws IOException {
        writer.write(BANNER_TITLE);
        writer.newLine();
        writer.write(BANNER_RULE);
        writer.newLine();
        writer.write("This file contains the routing tables and events recorded during the simulation.");
        writer.newLine();
        writer.write("Each entry carries a timestamp and a description of the event.");
        writer.newLine();
        writer.write(BANNER_RULE);
        writer.newLine();
        writer.newLine();
    }
}
