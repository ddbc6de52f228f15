package com.github.routesearch;

import java.util.Random;

/**
 * A read-only problem instance. Implementations never change after construction, so one instance may be shared
 * by any number of solutions, including solutions explored from different threads.
 *
 * @param <S> the solution type this problem creates
 */
public interface Problem<S extends Solution<?, ?, S>> {
    /**
     * The number of units (stops, points) that a complete solution must visit.
     *
     * @return a positive integer
     */
    int size();

    /**
     * Equivalent to <code>emptySolution(new Random())</code>
     *
     * @return a new solution with nothing chosen yet
     */
    default S emptySolution() {
        return emptySolution(new Random());
    }

    /**
     * Create a new empty solution.
     *
     * @param random the generator the solution will sample random moves from. Pass a seeded instance for
     *               reproducible runs.
     * @return a new solution with nothing chosen yet
     */
    S emptySolution(Random random);
}
