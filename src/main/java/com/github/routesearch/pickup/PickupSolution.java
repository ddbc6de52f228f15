package com.github.routesearch.pickup;

import com.github.routesearch.AbstractSolution;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static com.github.routesearch.Util.shuffledRange;
import static java.lang.Double.POSITIVE_INFINITY;
import static java.lang.Math.min;

/**
 * A route through the containers of a {@link PickupProblem}, built front to back from the depot.
 * <p>
 * The accumulated cost covers the depot entry and every container-to-container transition so far; the trip to the
 * plant is only added by {@link #objective()}. Local moves swap two containers and re-orient them, and are
 * evaluated from the (at most four) transitions touching the two positions.
 */
public final class PickupSolution extends AbstractSolution<Pickup, SwapMove, PickupSolution> {
    private static final int NONE = -1;

    private final PickupProblem problem;
    private final int[] units;
    private final int[] orientations;
    private final Set<Integer> visited;
    private final TreeSet<Integer> unvisited;
    private int length;
    private double cost;

    PickupSolution(PickupProblem problem, Random random) {
        super(random);
        var size = problem.size();

        this.problem = problem;
        this.units = new int[size];
        this.orientations = new int[size];
        this.visited = new HashSet<>();
        this.unvisited = IntStream.range(0, size).boxed().collect(Collectors.toCollection(TreeSet::new));
    }

    private PickupSolution(PickupSolution other) {
        super(other);
        this.problem = other.problem;
        this.units = other.units.clone();
        this.orientations = other.orientations.clone();
        this.visited = new HashSet<>(other.visited);
        this.unvisited = new TreeSet<>(other.unvisited);
        this.length = other.length;
        this.cost = other.cost;
    }

    @Override
    public PickupSolution copy() {
        return new PickupSolution(this);
    }

    /**
     * @return the problem this solution belongs to
     */
    public PickupProblem getProblem() {
        return problem;
    }

    @Override
    public boolean isFeasible() {
        return visited.size() == problem.size();
    }

    @Override
    public OptionalDouble objective() {
        if (!isComplete()) {
            return OptionalDouble.empty();
        }
        var last = length - 1;
        return OptionalDouble.of(cost + problem.exitCost(units[last], orientations[last]));
    }

    @Override
    public OptionalDouble lowerBound() {
        if (isComplete()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(cost + minimalCompletion(NONE, tailUnit(), tailOrientation()));
    }

    @Override
    public double accumulatedCost() {
        return cost;
    }

    @Override
    public Stream<Pickup> addCandidates() {
        if (isComplete()) {
            return Stream.empty();
        }
        return unvisited.stream().flatMap(unit -> Stream.of(new Pickup(unit, 0), new Pickup(unit, 1)));
    }

    @Override
    public Stream<SwapMove> localMoveCandidates() {
        if (!isComplete()) {
            return Stream.empty();
        }
        var size = length;

        return IntStream.range(0, size).boxed().flatMap(i ->
                IntStream.range(i, size).boxed().flatMap(j ->
                        IntStream.range(0, 4).mapToObj(orientations -> toMove(i, j, orientations))));
    }

    /**
     * Shuffles the first position, the second position and the orientation pair independently. This visits
     * every move exactly once, but the resulting order is not a uniform permutation of all moves.
     */
    @Override
    public Stream<SwapMove> randomLocalMovesWithoutReplacement() {
        if (!isComplete()) {
            return Stream.empty();
        }
        var size = length;
        var random = random();

        return Arrays.stream(shuffledRange(0, size, random)).boxed().flatMap(i ->
                Arrays.stream(shuffledRange(i, size, random)).boxed().flatMap(j ->
                        Arrays.stream(shuffledRange(0, 4, random)).mapToObj(orientations ->
                                toMove(i, j, orientations))));
    }

    @Override
    public Optional<Pickup> greedyAddCandidate() {
        if (isComplete()) {
            return Optional.empty();
        }

        Pickup best = null;
        var bestCost = POSITIVE_INFINITY;

        for (var unit : unvisited) {
            for (var orientation = 0; orientation < 2; orientation++) {
                var candidateCost = costFromTail(unit, orientation);

                if (best == null || candidateCost < bestCost) {
                    best = new Pickup(unit, orientation);
                    bestCost = candidateCost;
                }
            }
        }
        return Optional.ofNullable(best);
    }

    @Override
    public double deltaForAdd(Pickup component) {
        requireIncomplete();
        checkAdd(component);

        var delta = costFromTail(component.unit(), component.orientation());
        if (length + 1 == problem.size()) {
            delta += problem.exitCost(component);
        }
        return delta;
    }

    @Override
    public double deltaForLocalMove(SwapMove move) {
        requireComplete();
        checkMove(move);

        return affectedCost(move, move, true) - affectedCost(move, null, true);
    }

    @Override
    public double lowerBoundIncrForAdd(Pickup component) {
        requireIncomplete();
        checkAdd(component);
        if (unvisited.size() == 1) {
            return 0;
        }

        var unit = component.unit();
        var orientation = component.orientation();
        var bound = cost + costFromTail(unit, orientation) + minimalCompletion(unit, unit, orientation);

        return bound - lowerBound().orElseThrow();
    }

    @Override
    public Stream<Pickup> components() {
        return IntStream.range(0, length).mapToObj(k -> new Pickup(units[k], orientations[k]));
    }

    /**
     * One line per container in visiting order: the 1-based container number and its orientation.
     */
    @Override
    public String output() {
        return IntStream.range(0, length)
                .mapToObj(k -> (units[k] + 1) + " " + orientations[k])
                .collect(Collectors.joining("\n"));
    }

    @Override
    protected boolean isComplete() {
        return length == problem.size();
    }

    @Override
    protected void checkAdd(Pickup component) {
        var unit = component.unit();

        if (unit >= problem.size()) {
            throw new IllegalArgumentException("unit " + unit + " is out of range");
        }
        if (visited.contains(unit)) {
            throw new IllegalArgumentException("unit " + unit + " is already visited");
        }
    }

    @Override
    protected void checkMove(SwapMove move) {
        if (move.i() < 0 || move.i() > move.j() || move.j() >= length) {
            throw new IllegalArgumentException("invalid positions for " + move + " in a route of " + length);
        }
    }

    @Override
    protected void doAdd(Pickup component) {
        var unit = component.unit();

        cost += costFromTail(unit, component.orientation());
        units[length] = unit;
        orientations[length] = component.orientation();
        length++;
        visited.add(unit);
        unvisited.remove(unit);
    }

    @Override
    protected void doStep(SwapMove move) {
        var i = move.i();
        var j = move.j();

        // the plant transition isn't part of the accumulated cost
        cost += affectedCost(move, move, false) - affectedCost(move, null, false);

        var tmp = units[i];
        units[i] = units[j];
        units[j] = tmp;
        orientations[i] = move.iOrientation();
        orientations[j] = move.jOrientation();
    }

    @Override
    protected double recomputeCost() {
        var sum = 0.0;

        for (var k = 0; k < length; k++) {
            sum += transition(k, null);
        }
        return sum;
    }

    @Override
    protected void checkStructure() {
        var size = problem.size();

        checkPartition(visited, unvisited, size);

        var placed = IntStream.range(0, length).mapToObj(k -> units[k]).collect(Collectors.toSet());
        if (placed.size() != length) {
            throw new IllegalStateException("duplicate container in " + output());
        }
        if (!placed.equals(visited)) {
            throw new IllegalStateException("visited " + visited + " doesn't match the route " + placed);
        }
    }

    private static SwapMove toMove(int i, int j, int orientations) {
        return new SwapMove(i, j, orientations >> 1, orientations & 1);
    }

    private int tailUnit() {
        return length == 0 ? NONE : units[length - 1];
    }

    private int tailOrientation() {
        return length == 0 ? NONE : orientations[length - 1];
    }

    // cost of appending (unit, orientation): from the depot if nothing is placed yet
    private double costFromTail(int unit, int orientation) {
        return costFrom(tailUnit(), tailOrientation(), unit, orientation);
    }

    private double costFrom(int fromUnit, int fromOrientation, int unit, int orientation) {
        return fromUnit == NONE ?
                problem.entryCost(unit, orientation) :
                problem.transitionCost(fromUnit, fromOrientation, unit, orientation);
    }

    /*
     * Admissible estimate of the cheapest way to visit every unvisited container except `excluded`, starting from
     * (tailUnit, tailOrientation), and end at the plant.
     *
     * Each remaining container is entered exactly once, either from the tail or from another remaining container,
     * so the cheapest such incoming transition is a lower bound for it. Add the cheapest trip to the plant.
     */
    private double minimalCompletion(int excluded, int tailUnit, int tailOrientation) {
        var total = 0.0;
        var cheapestExit = POSITIVE_INFINITY;

        for (var to : unvisited) {
            if (to == excluded) {
                continue;
            }
            var cheapest = min(costFrom(tailUnit, tailOrientation, to, 0), costFrom(tailUnit, tailOrientation, to, 1));

            for (var from : unvisited) {
                if (from != excluded && !from.equals(to)) {
                    cheapest = min(cheapest, problem.cheapestTransition(from, to));
                }
            }
            total += cheapest;
            cheapestExit = min(cheapestExit, min(problem.exitCost(to, 0), problem.exitCost(to, 1)));
        }
        return total + cheapestExit;
    }

    /*
     * Sum of the transitions entering and leaving positions i and j, each counted once. Transition k enters
     * position k: transition 0 leaves the depot and transition n reaches the plant.
     */
    private double affectedCost(SwapMove move, SwapMove applied, boolean withExit) {
        var i = move.i();
        var j = move.j();
        var sum = transition(i, applied);

        if (i + 1 < length || withExit) {
            sum += transition(i + 1, applied);
        }
        if (j > i + 1) {
            sum += transition(j, applied);
        }
        if (j > i && (j + 1 < length || withExit)) {
            sum += transition(j + 1, applied);
        }
        return sum;
    }

    // transition k, either as things stand or as they would be after `applied`
    private double transition(int k, SwapMove applied) {
        if (k == 0) {
            return problem.entryCost(unitAt(0, applied), orientationAt(0, applied));
        }
        if (k == length) {
            return problem.exitCost(unitAt(k - 1, applied), orientationAt(k - 1, applied));
        }
        return problem.transitionCost(unitAt(k - 1, applied), orientationAt(k - 1, applied),
                unitAt(k, applied), orientationAt(k, applied));
    }

    private int unitAt(int position, SwapMove applied) {
        if (applied != null) {
            if (position == applied.i()) {
                return units[applied.j()];
            }
            if (position == applied.j()) {
                return units[applied.i()];
            }
        }
        return units[position];
    }

    private int orientationAt(int position, SwapMove applied) {
        if (applied != null) {
            if (position == applied.j()) {
                return applied.jOrientation();
            }
            if (position == applied.i()) {
                return applied.iOrientation();
            }
        }
        return orientations[position];
    }
}
