package com.github.routesearch;

/**
 * A candidate extension of a partial solution, such as the next stop to visit.
 * <p>
 * Implementations are immutable value types, so a component doubles as a stable key for drivers that keep
 * per-component state across many solutions (pheromone trails, tabu lists.)
 */
public interface Component {
    /**
     * Identity key for hashing and deduplication.
     *
     * @return an object with value-based {@code equals} and {@code hashCode}; by default the component itself
     */
    default Object cid() {
        return this;
    }
}
