package org.ripsim.routing.simulation;

import lombok.Builder;
import lombok.Value;

/**
 * Runtime configuration for a {@link Simulation}.
 *
 * <p>Defaults can be overridden through system properties, see {@link #fromSystemProperties()}.</p>
 */
@Value
@Builder(toBuilder = true)
public class SimulationConfig {
    public static final int DEFAULT_MAX_ROUNDS = 100;
    public static final String DEFAULT_LOG_FILE = "networkLog.txt";

    public static final String PROP_MAX_ROUNDS = "ripsim.simulation.maxRounds";
    public static final String PROP_LOG_FILE = "ripsim.simulation.logFile";

    /**
     * Round cap applied to every convergence phase.
     */
    @Builder.Default
    int maxRounds = DEFAULT_MAX_ROUNDS;

    /**
     * Path of the text log written by the application driver.
     */
    @Builder.Default
    String logFile = DEFAULT_LOG_FILE;

    /**
     * Returns the built-in defaults.
     */
    public static SimulationConfig defaults() {
        return SimulationConfig.builder().build();
    }

    /**
     * Loads configuration from system properties; missing, blank or malformed values fall back to
     * the defaults.
     */
    public static SimulationConfig fromSystemProperties() {
        return SimulationConfig.builder()
                .maxRounds(readPositiveInt(PROP_MAX_ROUNDS, DEFAULT_MAX_ROUNDS))
                .logFile(readString(PROP_LOG_FILE, DEFAULT_LOG_FILE))
                .build();
    }

    private static int readPositiveInt(String property, int fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            return value > 0 ? value : fallback;
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static String readString(String property, String fallback) {
        String raw = System.getProperty(property);
        return raw == null || raw.isBlank() ? fallback : raw.trim();
    }
}
