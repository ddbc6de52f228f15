package com.github.routesearch;

import org.ojalgo.netio.BasicLogger;

import java.util.Optional;
import java.util.Random;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Abstract superclass of the concrete solutions. Holds the state machine shared by all problems: the
 * <code>apply</code> methods validate their preconditions, delegate to the subclass, then optionally log and
 * verify the result.
 *
 * @param <C> the component type
 * @param <M> the local move type
 * @param <S> the concrete solution type
 */
public abstract class AbstractSolution<C extends Component, M extends LocalMove, S extends AbstractSolution<C, M, S>>
        implements Solution<C, M, S> {
    private final Random random;
    private boolean verify;
    private boolean debug;

    /**
     * Constructor for a new solution.
     *
     * @param random the generator used for all random sampling
     */
    protected AbstractSolution(Random random) {
        this.random = requireNonNull(random);
    }

    /**
     * Copy constructor. Carries over the random generator and the verify and debug properties.
     *
     * @param other the solution being copied
     */
    protected AbstractSolution(AbstractSolution<C, M, S> other) {
        this.random = other.random;
        this.verify = other.verify;
        this.debug = other.debug;
    }

    @Override
    public final void apply(C component) {
        requireIncomplete();
        checkAdd(component);
        doAdd(component);
        afterMutation(component);
    }

    @Override
    public final void apply(M move) {
        requireComplete();
        checkMove(move);
        doStep(move);
        afterMutation(move);
    }

    @Override
    public final void perturb(int strength) {
        if (strength < 0) {
            throw new IllegalArgumentException("strength must not be negative.");
        }
        requireComplete();
        for (var i = 0; i < strength; i++) {
            randomLocalMove().ifPresent(move -> apply(move));
        }
    }

    @Override
    public Optional<M> randomLocalMove() {
        return randomLocalMovesWithoutReplacement().findFirst();
    }

    /**
     * Recompute everything this solution maintains incrementally and compare.
     *
     * @throws IllegalStateException if the visited/unvisited partition, the sequence or the accumulated cost
     *                               is inconsistent
     */
    public final void verify() {
        checkStructure();

        var expected = recomputeCost();
        var actual = accumulatedCost();

        if (!Util.isClose(expected, actual)) {
            throw new IllegalStateException("accumulated cost " + actual + " differs from recomputed " + expected);
        }
    }

    /**
     * The running cost of all transitions made so far, not counting the closing transition of an incomplete
     * solution.
     *
     * @return the accumulated cost
     */
    public abstract double accumulatedCost();

    /**
     * @return true when no further components can be added
     */
    protected abstract boolean isComplete();

    /**
     * Check that <code>component</code> may be added next.
     *
     * @param component the candidate
     * @throws IllegalArgumentException if it may not
     */
    protected abstract void checkAdd(C component);

    /**
     * Check that <code>move</code>'s indices are valid for this solution.
     *
     * @param move the candidate
     * @throws IllegalArgumentException if they are not
     */
    protected abstract void checkMove(M move);

    /**
     * Add a validated component and update the accumulated cost.
     *
     * @param component the component
     */
    protected abstract void doAdd(C component);

    /**
     * Apply a validated move and update the accumulated cost from the changed transitions only.
     *
     * @param move the move
     */
    protected abstract void doStep(M move);

    /**
     * @return the accumulated cost, summed from scratch
     */
    protected abstract double recomputeCost();

    /**
     * Check the sequence and the visited/unvisited partition.
     *
     * @throws IllegalStateException if inconsistent
     */
    protected abstract void checkStructure();

    /**
     * @throws IllegalStateException unless the solution is complete
     */
    protected final void requireComplete() {
        if (!isComplete()) {
            throw new IllegalStateException("solution is not complete");
        }
    }

    /**
     * @throws IllegalStateException if the solution is already complete
     */
    protected final void requireIncomplete() {
        if (isComplete()) {
            throw new IllegalStateException("solution is already complete");
        }
    }

    /**
     * Check that <code>visited</code> and <code>unvisited</code> partition <code>0 .. size - 1</code>.
     *
     * @param visited   the visited units
     * @param unvisited the units not yet visited
     * @param size      the problem size
     * @throws IllegalStateException if they don't
     */
    protected static void checkPartition(Set<Integer> visited, Set<Integer> unvisited, int size) {
        if (visited.size() + unvisited.size() != size) {
            throw new IllegalStateException("visited " + visited + " and unvisited " + unvisited +
                    " don't cover " + size + " units");
        }
        for (var unit = 0; unit < size; unit++) {
            if (visited.contains(unit) == unvisited.contains(unit)) {
                throw new IllegalStateException("unit " + unit + " must be either visited or unvisited");
            }
        }
    }

    /**
     * @return the generator this solution samples from
     */
    protected Random random() {
        return random;
    }

    protected void debug(String s) {
        if (debug) {
            BasicLogger.debug(s);
        }
    }

    private void afterMutation(Object change) {
        debug("Applied " + change + "; accumulated cost " + accumulatedCost());
        if (verify) {
            verify();
        }
    }

    /**
     * Get the verify property
     *
     * @return true if {@link #verify()} runs after every mutation
     */
    public boolean isVerify() {
        return verify;
    }

    /**
     * Set the verify property. If enabled, every <code>apply</code> is followed by a full {@link #verify()}, which
     * costs a complete recomputation. Meant for tests and for chasing delta-evaluation bugs; copies inherit it.
     *
     * @param verify true to verify after every mutation
     */
    public void setVerify(boolean verify) {
        this.verify = verify;
    }

    /**
     * Get the debug property
     *
     * @return true if debug logging is enabled
     */
    public boolean isDebug() {
        return debug;
    }

    /**
     * Set the debug property. If enabled, logging works via ojAlgo's {@link BasicLogger} mechanism.
     * You can supply a thin wrapper implementation to redirect it to the logging library of your choice.
     *
     * @param debug true if debug logging is enabled
     */
    public void setDebug(boolean debug) {
        this.debug = debug;
    }
}
