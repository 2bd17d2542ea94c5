package org.ripsim.routing.simulation;

import lombok.Builder;
import org.ripsim.routing.network.ConvergenceResult;
import org.ripsim.routing.network.Network;
import org.ripsim.routing.report.Reporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Drives a network through convergence and failure phases and publishes every step.
 *
 * <p>Events handed to the reporter:</p>
 * <ul>
 * <li>{@code Initial network state} once the topology is built.</li>
 * <li>{@code Iteration k (phase)} after every round of a convergence phase.</li>
 * <li>{@code Link failure between A and B} after each injected failure.</li>
 * <li>{@code Total simulation time: X ms} at the end of {@link #run(List)}.</li>
 * </ul>
 *
 * <p>Hitting the round cap is logged as a warning and reported through
 * {@link PhaseResult#isConverged()}; it never aborts the run.</p>
 */
public final class Simulation {
    public static final String PHASE_INITIAL = "initial";
    public static final String EVENT_INITIAL_STATE = "Initial network state";

    private static final Logger log = LoggerFactory.getLogger(Simulation.class);

    private final Network network;
    private final Reporter reporter;
    private final SimulationConfig config;
    private final LongSupplier nanoClock;

    /**
     * Creates a simulation driver.
     *
     * @param network network to drive.
     * @param reporter snapshot consumer; defaults to {@link Reporter#noop()}.
     * @param config runtime config; defaults to {@link SimulationConfig#defaults()}.
     * @param nanoClock monotonic nanosecond source; defaults to {@link System#nanoTime()}.
     */
    @Builder
    public Simulation(Network network, Reporter reporter, SimulationConfig config, LongSupplier nanoClock) {
        this.network = Objects.requireNonNull(network, "network");
        this.reporter = reporter == null ? Reporter.noop() : reporter;
        this.config = config == null ? SimulationConfig.defaults() : config;
        this.nanoClock = nanoClock == null ? System::nanoTime : nanoClock;
        if (this.config.getMaxRounds() <= 0) {
            throw new IllegalArgumentException("maxRounds must be > 0");
        }
    }

    /**
     * Reports the tables as they stand before any round.
     */
    public void reportInitialState() {
        reporter.report(EVENT_INITIAL_STATE, network.snapshot());
    }

    /**
     * Runs one convergence phase, reporting a snapshot after every round.
     *
     * @param phase label appended to each round event.
     * @return rounds used, convergence flag and elapsed time.
     */
    public PhaseResult converge(String phase) {
        Objects.requireNonNull(phase, "phase");
        long start = nanoClock.getAsLong();
        ConvergenceResult result = network.converge(
                config.getMaxRounds(),
                (round, changed) -> reporter.report(
                        "Iteration " + round + " (" + phase + ")",
                        network.snapshot()
                )
        );
        long elapsed = nanoClock.getAsLong() - start;

        if (result.isConverged()) {
            log.info("Network converged after {} rounds ({})", result.getRoundsUsed(), phase);
        } else {
            log.warn("Network did not converge within {} rounds ({})", config.getMaxRounds(), phase);
        }
        return PhaseResult.builder()
                .phase(phase)
                .roundsUsed(result.getRoundsUsed())
                .converged(result.isConverged())
                .elapsedNanos(elapsed)
                .build();
    }

    /**
     * Takes one link down and reports the resulting tables. Does not reconverge.
     */
    public void injectFailure(LinkFailure failure) {
        Objects.requireNonNull(failure, "failure");
        network.simulateFailure(failure.getFirst(), failure.getSecond());
        log.info("Injected link failure {}", failure);
        reporter.report(
                "Link failure between " + failure.getFirst() + " and " + failure.getSecond(),
                network.snapshot()
        );
    }

    /**
     * Runs the full scenario: initial report, initial convergence, then for each failure an
     * injection followed by a reconvergence phase.
     *
     * @param failures links to take down, in order.
     * @return per-phase results and total elapsed time.
     */
    public SimulationResult run(List<LinkFailure> failures) {
        Objects.requireNonNull(failures, "failures");
        SimulationResult.SimulationResultBuilder result = SimulationResult.builder();
        long total = 0L;

        reportInitialState();
        PhaseResult initial = converge(PHASE_INITIAL);
        result.phase(initial);
        total += initial.getElapsedNanos();

        for (LinkFailure failure : failures) {
            injectFailure(failure);
            PhaseResult phase = converge("after failure " + failure);
            result.phase(phase);
            total += phase.getElapsedNanos();
        }

        long totalMillis = TimeUnit.NANOSECONDS.toMillis(total);
        log.info("Simulation finished in {} ms", totalMillis);
        reporter.report("Total simulation time: " + totalMillis + " ms", network.snapshot());
        return result.totalElapsedNanos(total).build();
    }

    public Network network() {
        return network;
    }

    public SimulationConfig config() {
        return config;
    }
}
