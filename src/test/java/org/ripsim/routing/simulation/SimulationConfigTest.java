package org.ripsim.routing.simulation;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("SimulationConfig Tests")
class SimulationConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty(SimulationConfig.PROP_MAX_ROUNDS);
        System.clearProperty(SimulationConfig.PROP_LOG_FILE);
    }

    @Test
    @DisplayName("Defaults match the documented values")
    void testDefaults() {
        SimulationConfig config = SimulationConfig.defaults();
        assertEquals(100, config.getMaxRounds());
        assertEquals("networkLog.txt", config.getLogFile());
        assertEquals(config, SimulationConfig.fromSystemProperties());
    }

    @Test
    @DisplayName("System properties override defaults")
    void testSystemPropertyOverrides() {
        System.setProperty(SimulationConfig.PROP_MAX_ROUNDS, " 25 ");
        System.setProperty(SimulationConfig.PROP_LOG_FILE, "custom.log");

        SimulationConfig config = SimulationConfig.fromSystemProperties();
        assertEquals(25, config.getMaxRounds());
        assertEquals("custom.log", config.getLogFile());
    }

    @Test
    @DisplayName("Malformed or non-positive values fall back to defaults")
    void testMalformedValuesFallBack() {
        System.setProperty(SimulationConfig.PROP_MAX_ROUNDS, "many");
        assertEquals(SimulationConfig.DEFAULT_MAX_ROUNDS, SimulationConfig.fromSystemProperties().getMaxRounds());

        System.setProperty(SimulationConfig.PROP_MAX_ROUNDS, "-3");
        assertEquals(SimulationConfig.DEFAULT_MAX_ROUNDS, SimulationConfig.fromSystemProperties().getMaxRounds());

        System.setProperty(SimulationConfig.PROP_LOG_FILE, "   ");
        assertEquals(SimulationConfig.DEFAULT_LOG_FILE, SimulationConfig.fromSystemProperties().getLogFile());
    }
}
