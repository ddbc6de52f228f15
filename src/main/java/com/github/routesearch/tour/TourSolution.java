package com.github.routesearch.tour;

import com.github.routesearch.AbstractSolution;

import java.util.HashSet;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static com.github.routesearch.Util.randomPermutation;

/**
 * A tour of a {@link TourProblem}, grown edge by edge from the start point and closed by an edge back to it.
 * A complete tour holds <code>n + 1</code> points, the start appearing first and last.
 * <p>
 * Local moves are 2-opt segment reversals. Distances are symmetric, so only the two edges at the ends of the
 * reversed segment change.
 */
public final class TourSolution extends AbstractSolution<Edge, TwoOptMove, TourSolution> {
    private final TourProblem problem;
    private final int start;
    private final int[] path;
    private final Set<Integer> used;
    private final TreeSet<Integer> unused;
    private int length;
    private double dist;

    TourSolution(TourProblem problem, int start, Random random) {
        super(random);
        var size = problem.size();

        this.problem = problem;
        this.start = start;
        this.path = new int[size + 1];
        this.path[0] = start;
        this.length = 1;
        this.used = new HashSet<>(Set.of(start));
        this.unused = IntStream.range(0, size).filter(i -> i != start).boxed()
                .collect(Collectors.toCollection(TreeSet::new));
    }

    private TourSolution(TourSolution other) {
        super(other);
        this.problem = other.problem;
        this.start = other.start;
        this.path = other.path.clone();
        this.used = new HashSet<>(other.used);
        this.unused = new TreeSet<>(other.unused);
        this.length = other.length;
        this.dist = other.dist;
    }

    @Override
    public TourSolution copy() {
        return new TourSolution(this);
    }

    /**
     * @return the problem this tour belongs to
     */
    public TourProblem getProblem() {
        return problem;
    }

    /**
     * @return the index of the point the tour starts and ends at
     */
    public int getStart() {
        return start;
    }

    @Override
    public boolean isFeasible() {
        return isComplete();
    }

    @Override
    public OptionalDouble objective() {
        return isComplete() ? OptionalDouble.of(dist) : OptionalDouble.empty();
    }

    /**
     * The distance travelled so far. No attempt is made to estimate the remaining distance.
     */
    @Override
    public OptionalDouble lowerBound() {
        return isComplete() ? OptionalDouble.empty() : OptionalDouble.of(dist);
    }

    @Override
    public double accumulatedCost() {
        return dist;
    }

    @Override
    public Stream<Edge> addCandidates() {
        var size = problem.size();
        var tail = tail();

        if (length < size) {
            return unused.stream().map(dest -> new Edge(tail, dest));
        } else if (length == size) {
            return Stream.of(new Edge(tail, start));
        }
        return Stream.empty();
    }

    @Override
    public Stream<TwoOptMove> localMoveCandidates() {
        if (!isComplete()) {
            return Stream.empty();
        }
        var size = length;

        return IntStream.range(1, size).boxed().flatMap(i ->
                IntStream.range(i + 2, size).mapToObj(j -> new TwoOptMove(i, j)));
    }

    @Override
    public Optional<TwoOptMove> randomLocalMove() {
        if (!isComplete() || length < 4) {
            return Optional.empty();
        }
        var random = random();
        var i = 1 + random.nextInt(length - 3);
        var j = i + 2 + random.nextInt(length - i - 2);

        return Optional.of(new TwoOptMove(i, j));
    }

    /**
     * Draws index pairs from a lazily shuffled permutation of all <code>length * length</code> pairs and keeps the
     * valid ones, so the order is a uniformly random permutation of the moves.
     */
    @Override
    public Stream<TwoOptMove> randomLocalMovesWithoutReplacement() {
        if (!isComplete()) {
            return Stream.empty();
        }
        var size = length;

        return randomPermutation(size * size, random())
                .mapToObj(k -> new TwoOptMove(k / size, k % size))
                .filter(move -> move.i() >= 1 && move.j() >= move.i() + 2);
    }

    /**
     * The edge to the nearest unused point, or back to the start once every point is placed.
     */
    @Override
    public Optional<Edge> greedyAddCandidate() {
        var size = problem.size();
        var tail = tail();

        if (length == size) {
            return Optional.of(new Edge(tail, start));
        } else if (length > size) {
            return Optional.empty();
        }

        var best = -1;
        var bestDist = 0.0;

        for (var dest : unused) {
            var d = problem.pointDistance(tail, dest);

            if (best < 0 || d < bestDist) {
                best = dest;
                bestDist = d;
            }
        }
        return Optional.of(new Edge(tail, best));
    }

    @Override
    public double deltaForAdd(Edge component) {
        requireIncomplete();
        checkAdd(component);

        return problem.pointDistance(component.src(), component.dest());
    }

    @Override
    public double deltaForLocalMove(TwoOptMove move) {
        requireComplete();
        checkMove(move);

        var i = move.i();
        var j = move.j();

        return problem.pointDistance(path[i - 1], path[j - 1]) + problem.pointDistance(path[i], path[j])
                - problem.pointDistance(path[i - 1], path[i]) - problem.pointDistance(path[j - 1], path[j]);
    }

    @Override
    public double lowerBoundIncrForAdd(Edge component) {
        requireIncomplete();
        checkAdd(component);

        // closing the tour makes the bound undefined
        return length < problem.size() ? problem.pointDistance(component.src(), component.dest()) : 0;
    }

    @Override
    public Stream<Edge> components() {
        return IntStream.range(1, length).mapToObj(k -> new Edge(path[k - 1], path[k]));
    }

    /**
     * One point index per line in visiting order, starting with the start point. The closing return to the
     * start is not repeated.
     */
    @Override
    public String output() {
        var end = length > 1 && path[length - 1] == start ? length - 1 : length;

        return IntStream.range(0, end).mapToObj(k -> String.valueOf(path[k])).collect(Collectors.joining("\n"));
    }

    @Override
    protected boolean isComplete() {
        return length == problem.size() + 1;
    }

    @Override
    protected void checkAdd(Edge component) {
        var src = component.src();
        var dest = component.dest();

        if (src != tail()) {
            throw new IllegalArgumentException(component + " doesn't start at the end of the tour (" + tail() + ")");
        }
        if (length == problem.size()) {
            if (dest != start) {
                throw new IllegalArgumentException(component + " must return to the start " + start);
            }
        } else if (!unused.contains(dest)) {
            throw new IllegalArgumentException("point " + dest + " is already visited or out of range");
        }
    }

    @Override
    protected void checkMove(TwoOptMove move) {
        if (move.i() < 1 || move.j() < move.i() + 2 || move.j() >= length) {
            throw new IllegalArgumentException("invalid positions for " + move + " in a tour of " + length);
        }
    }

    @Override
    protected void doAdd(Edge component) {
        var dest = component.dest();

        path[length++] = dest;
        if (dest != start) {
            unused.remove(dest);
        }
        used.add(dest);
        dist += problem.pointDistance(component.src(), dest);
    }

    @Override
    protected void doStep(TwoOptMove move) {
        var i = move.i();
        var j = move.j();

        dist += deltaForLocalMove(move);
        for (int lo = i, hi = j - 1; lo < hi; lo++, hi--) {
            var tmp = path[lo];
            path[lo] = path[hi];
            path[hi] = tmp;
        }
    }

    @Override
    protected double recomputeCost() {
        return components().mapToDouble(edge -> problem.pointDistance(edge.src(), edge.dest())).sum();
    }

    @Override
    protected void checkStructure() {
        checkPartition(used, unused, problem.size());

        if (path[0] != start) {
            throw new IllegalStateException("tour doesn't begin at the start " + start);
        }

        var open = isComplete() ? length - 1 : length;
        if (isComplete() && path[length - 1] != start) {
            throw new IllegalStateException("tour doesn't return to the start " + start);
        }

        var placed = IntStream.range(0, open).mapToObj(k -> path[k]).collect(Collectors.toSet());
        if (placed.size() != open) {
            throw new IllegalStateException("duplicate point in the tour");
        }
        if (!placed.equals(used)) {
            throw new IllegalStateException("used " + used + " doesn't match the tour " + placed);
        }
    }

    private int tail() {
        return path[length - 1];
    }
}
