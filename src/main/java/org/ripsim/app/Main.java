package org.ripsim.app;

import org.ripsim.routing.report.ConsoleReporter;
import org.ripsim.routing.report.LogFileReporter;
import org.ripsim.routing.report.Reporter;
import org.ripsim.routing.simulation.PhaseResult;
import org.ripsim.routing.simulation.Simulation;
import org.ripsim.routing.simulation.SimulationConfig;
import org.ripsim.routing.simulation.SimulationResult;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Command-line entry point running the reference failure scenario.
 *
 * <p>Usage: {@code Main [logFile]}. Without an argument the log path comes from
 * {@link SimulationConfig#fromSystemProperties()}.</p>
 */
public class Main {
    /**
     * Runs the triangle scenario, printing tables and appending them to the log file.
     *
     * @param args optional log-file path.
     */
    public static void main(String[] args) {
        SimulationConfig config = SimulationConfig.fromSystemProperties();
        if (args.length > 0 && !args[0].isBlank()) {
            config = config.toBuilder().logFile(args[0]).build();
        }

        Simulation simulation = Simulation.builder()
                .network(ReferenceTopology.triangle())
                .reporter(Reporter.composite(
                        new ConsoleReporter(System.out),
                        new LogFileReporter(Path.of(config.getLogFile()))
                ))
                .config(config)
                .build();

        SimulationResult result = simulation.run(List.of(ReferenceTopology.FAILURE_A_B));

        System.out.println();
        System.out.println("=".repeat(40));
        for (PhaseResult phase : result.getPhases()) {
            if (phase.isConverged()) {
                System.out.printf("Phase '%s': converged after %d iterations (%d ms)%n",
                        phase.getPhase(), phase.getRoundsUsed(), TimeUnit.NANOSECONDS.toMillis(phase.getElapsedNanos()));
            } else {
                System.out.printf("Phase '%s': not converged after %d iterations%n",
                        phase.getPhase(), phase.getRoundsUsed());
            }
        }
        System.out.printf("Total simulation time: %d ms%n", TimeUnit.NANOSECONDS.toMillis(result.getTotalElapsedNanos()));
    }
}
