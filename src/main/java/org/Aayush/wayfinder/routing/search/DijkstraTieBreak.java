package org.Aayush.wayfinder.routing.search;

import java.util.Locale;

/**
 * Which node Dijkstra settles when several unvisited nodes share the minimum distance.
 */
public enum DijkstraTieBreak {
    /** Last minimum in ascending index order ({@code <=} scan). */
    LAST_MINIMUM,
    /** First minimum in ascending index order ({@code <} scan). */
    FIRST_MINIMUM;

    static final String PROP_TIE_BREAK = "wayfinder.dijkstra.tieBreak";

    /**
     * Reads {@value #PROP_TIE_BREAK}; blank or unknown values select {@link #LAST_MINIMUM}.
     */
    public static DijkstraTieBreak defaults() {
        return parse(System.getProperty(PROP_TIE_BREAK));
    }

    /**
     * Case-insensitive lookup that never fails.
     */
    public static DijkstraTieBreak parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return LAST_MINIMUM;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return LAST_MINIMUM;
        }
    }

    boolean prefers(long candidate, long best) {
        return this == LAST_MINIMUM ? candidate <= best : candidate < best;
    }
}
