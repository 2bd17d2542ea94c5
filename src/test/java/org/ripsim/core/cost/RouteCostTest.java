package org.ripsim.core.cost;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("RouteCost Tests")
class RouteCostTest {

    @Test
    @DisplayName("Finite costs add exactly")
    void testFiniteAddition() {
        assertEquals(0L, RouteCost.add(0L, 0L));
        assertEquals(5L, RouteCost.add(1L, 4L));
    }

    @Test
    @DisplayName("Infinity absorbs addition from either side")
    void testInfinityAbsorbs() {
        assertEquals(RouteCost.INFINITY, RouteCost.add(RouteCost.INFINITY, 1L));
        assertEquals(RouteCost.INFINITY, RouteCost.add(3L, RouteCost.INFINITY));
        assertEquals(RouteCost.INFINITY, RouteCost.add(RouteCost.INFINITY, RouteCost.INFINITY));
    }

    @Test
    @DisplayName("Sums reaching the sentinel saturate instead of wrapping")
    void testSaturation() {
        assertEquals(RouteCost.INFINITY, RouteCost.add(Long.MAX_VALUE - 1, 1L));
        assertEquals(RouteCost.INFINITY, RouteCost.add(Long.MAX_VALUE / 2 + 1, Long.MAX_VALUE / 2 + 1));
        assertEquals(Long.MAX_VALUE - 1, RouteCost.add(Long.MAX_VALUE - 2, 1L));
    }

    @Test
    @DisplayName("Formatting renders the sentinel as inf")
    void testFormat() {
        assertEquals("7", RouteCost.format(7L));
        assertEquals("inf", RouteCost.format(RouteCost.INFINITY));
        assertTrue(RouteCost.isFinite(0L));
        assertFalse(RouteCost.isFinite(RouteCost.INFINITY));
    }
}
