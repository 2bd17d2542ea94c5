package org.ripsim.core.cost;

import lombok.experimental.UtilityClass;

/**
 * Exact integer cost algebra for distance-vector routes.
 *
 * <p>Costs are non-negative {@code long} values. {@link #INFINITY} is a dedicated sentinel for
 * unreachable destinations and absorbs every addition, so comparisons stay exact and never depend
 * on floating-point infinity semantics.</p>
 */
@UtilityClass
public class RouteCost {
    /** Sentinel cost of an unreachable destination or a link that is down. */
    public static final long INFINITY = Long.MAX_VALUE;

    private static final String INFINITY_TEXT = "inf";

    /**
     * Adds two costs, saturating at {@link #INFINITY}.
     *
     * @param a first non-negative cost.
     * @param b second non-negative cost.
     * @return {@code a + b}, or {@link #INFINITY} when either operand is infinite or the sum
     * would reach the sentinel.
     */
    public static long add(long a, long b) {
        if (a == INFINITY || b == INFINITY) {
            return INFINITY;
        }
        if (a > INFINITY - b) {
            return INFINITY;
        }
        return a + b;
    }

    /**
     * Returns whether a cost denotes a reachable route.
     */
    public static boolean isFinite(long cost) {
        return cost != INFINITY;
    }

    /**
     * Renders a cost as text, using {@code inf} for the sentinel.
     */
    public static String format(long cost) {
        return isFinite(cost) ? Long.toString(cost) : INFINITY_TEXT;
    }
}
