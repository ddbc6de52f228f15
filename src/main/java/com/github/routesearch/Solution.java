package com.github.routesearch;

import com.google.errorprone.annotations.CheckReturnValue;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.stream.Stream;

/**
 * The contract between a problem's solution representation and the metaheuristic drivers that search over it.
 * <p>
 * A solution starts empty, grows through {@link #apply(Component)} until it is complete, and may then be
 * mutated through {@link #apply(LocalMove)}. Drivers evaluate candidates with the {@code delta*} methods, which
 * never modify the solution, and commit only the ones they want. Elements are never removed; a driver that needs
 * to backtrack should work on a {@link #copy()}.
 * <p>
 * Every stream returned here is freshly created by each call and lazily evaluated. Applying a component or move
 * invalidates any stream obtained before it.
 * <p>
 * Instances are not thread-safe.
 *
 * @param <C> the component type
 * @param <M> the local move type
 * @param <S> the concrete solution type
 */
public interface Solution<C extends Component, M extends LocalMove, S extends Solution<C, M, S>> {
    /**
     * Return an independent copy. Changes to the copy do not affect this solution.
     *
     * @return the copy, sharing only the immutable problem and the random generator.
     */
    S copy();

    /**
     * @return true if this solution is complete and satisfies all constraints.
     */
    boolean isFeasible();

    /**
     * @return the total cost, including the closing transition, or empty unless the solution is complete.
     */
    OptionalDouble objective();

    /**
     * @return a lower bound on the objective of any completion, or empty if the solution is already complete.
     */
    OptionalDouble lowerBound();

    /**
     * @return all components that may be added next; empty once the solution is complete.
     */
    Stream<C> addCandidates();

    /**
     * @return all local moves applicable to this solution; empty unless the solution is complete.
     */
    Stream<M> localMoveCandidates();

    /**
     * Repeated calls may return the same move.
     *
     * @return a random applicable local move, or empty if none exists.
     */
    Optional<M> randomLocalMove();

    /**
     * @return every move of {@link #localMoveCandidates()} exactly once, in random order.
     */
    Stream<M> randomLocalMovesWithoutReplacement();

    /**
     * @return the component with the smallest immediate cost, or empty once the solution is complete.
     */
    Optional<C> greedyAddCandidate();

    /**
     * Cost increase caused by adding a component, without adding it.
     *
     * @param component a valid next component
     * @return the increase of the running cost, including the closing cost if the addition completes the solution
     * @throws IllegalArgumentException if the component is not a valid extension
     * @throws IllegalStateException    if the solution is already complete
     */
    @CheckReturnValue
    double deltaForAdd(C component);

    /**
     * Objective change caused by a local move, without applying it.
     *
     * @param move a move valid for this (complete) solution
     * @return <code>objective(after) - objective(before)</code>
     */
    @CheckReturnValue
    double deltaForLocalMove(M move);

    /**
     * Lower bound change caused by adding a component, without adding it.
     *
     * @param component a valid next component
     * @return <code>lowerBound(after) - lowerBound(before)</code>, or zero if the addition completes the solution
     * @throws IllegalArgumentException if the component is not a valid extension
     * @throws IllegalStateException    if the solution is already complete
     */
    @CheckReturnValue
    double lowerBoundIncrForAdd(C component);

    /**
     * Add a component.
     *
     * @param component a valid next component
     * @throws IllegalArgumentException if the component is not a valid extension
     * @throws IllegalStateException    if the solution is already complete
     */
    void apply(C component);

    /**
     * Apply a local move.
     *
     * @param move a move valid for this solution
     * @throws IllegalArgumentException if the move's indices are out of range
     * @throws IllegalStateException    if the solution is not complete
     */
    void apply(M move);

    /**
     * Apply <code>strength</code> random local moves in sequence.
     *
     * @param strength the number of moves (kick strength)
     * @throws IllegalArgumentException if <code>strength</code> is negative
     * @throws IllegalStateException    if the solution is not complete
     */
    void perturb(int strength);

    /**
     * @return the components that make up the current solution, in order.
     */
    Stream<C> components();

    /**
     * @return the textual form of this solution, one line per visited unit.
     */
    String output();
}
