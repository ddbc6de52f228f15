package com.github.routesearch;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VerificationTest {
    record Unit(int id) implements Component {
    }

    record Stay() implements LocalMove {
    }

    /**
     * Visits units at a cost of 1 each. <code>drift</code> is added on every mutation without being part of the
     * recomputed cost, and a <code>leaky</code> solution forgets to remove added units from the unvisited set.
     */
    static final class Sequence extends AbstractSolution<Unit, Stay, Sequence> {
        private final int size;
        private final Set<Integer> visited = new HashSet<>();
        private final Set<Integer> unvisited;
        private double cost;
        private double drift;
        private boolean leaky;

        Sequence(int size) {
            super(new Random(0));
            this.size = size;
            this.unvisited = IntStream.range(0, size).boxed().collect(Collectors.toCollection(TreeSet::new));
        }

        private Sequence(Sequence other) {
            super(other);
            this.size = other.size;
            this.visited.addAll(other.visited);
            this.unvisited = new TreeSet<>(other.unvisited);
            this.cost = other.cost;
            this.drift = other.drift;
            this.leaky = other.leaky;
        }

        @Override
        public Sequence copy() {
            return new Sequence(this);
        }

        @Override
        public boolean isFeasible() {
            return isComplete();
        }

        @Override
        public OptionalDouble objective() {
            return isComplete() ? OptionalDouble.of(cost) : OptionalDouble.empty();
        }

        @Override
        public OptionalDouble lowerBound() {
            return isComplete() ? OptionalDouble.empty() : OptionalDouble.of(cost);
        }

        @Override
        public Stream<Unit> addCandidates() {
            return isComplete() ? Stream.empty() : unvisited.stream().filter(u -> !visited.contains(u)).map(Unit::new);
        }

        @Override
        public Stream<Stay> localMoveCandidates() {
            return isComplete() ? Stream.of(new Stay()) : Stream.empty();
        }

        @Override
        public Stream<Stay> randomLocalMovesWithoutReplacement() {
            return localMoveCandidates();
        }

        @Override
        public Optional<Unit> greedyAddCandidate() {
            return addCandidates().findFirst();
        }

        @Override
        public double deltaForAdd(Unit component) {
            requireIncomplete();
            checkAdd(component);
            return 1;
        }

        @Override
        public double deltaForLocalMove(Stay move) {
            requireComplete();
            return 0;
        }

        @Override
        public double lowerBoundIncrForAdd(Unit component) {
            requireIncomplete();
            checkAdd(component);
            return visited.size() + 1 == size ? 0 : 1;
        }

        @Override
        public Stream<Unit> components() {
            return visited.stream().sorted().map(Unit::new);
        }

        @Override
        public String output() {
            return components().map(u -> String.valueOf(u.id())).collect(Collectors.joining("\n"));
        }

        @Override
        public double accumulatedCost() {
            return cost;
        }

        @Override
        protected boolean isComplete() {
            return visited.size() == size;
        }

        @Override
        protected void checkAdd(Unit component) {
            if (component.id() < 0 || component.id() >= size || visited.contains(component.id())) {
                throw new IllegalArgumentException("can't add " + component);
            }
        }

        @Override
        protected void checkMove(Stay move) {
        }

        @Override
        protected void doAdd(Unit component) {
            visited.add(component.id());
            if (!leaky) {
                unvisited.remove(component.id());
            }
            cost += 1 + drift;
        }

        @Override
        protected void doStep(Stay move) {
            cost += drift;
        }

        @Override
        protected double recomputeCost() {
            return visited.size();
        }

        @Override
        protected void checkStructure() {
            checkPartition(visited, unvisited, size);
        }
    }

    @Test
    void consistentSolutionPasses() {
        var solution = new Sequence(3);
        solution.setVerify(true);

        solution.apply(new Unit(0));
        solution.apply(new Unit(2));
        solution.apply(new Unit(1));
        solution.apply(new Stay());
        assertDoesNotThrow(solution::verify);
        assertEquals(3.0, solution.objective().orElseThrow());
    }

    @Test
    void detectsCostDrift() {
        var solution = new Sequence(3);
        solution.drift = 0.5;

        solution.apply(new Unit(1));
        var e = assertThrows(IllegalStateException.class, solution::verify);
        assertTrue(e.getMessage().contains("differs from recomputed"), e::getMessage);
    }

    @Test
    void toleratesRoundingNoise() {
        var solution = new Sequence(2);
        solution.drift = 1e-12;
        solution.setVerify(true);

        solution.apply(new Unit(0));
        solution.apply(new Unit(1));
        assertDoesNotThrow(solution::verify);
    }

    @Test
    void verifyModeChecksEveryAdd() {
        var solution = new Sequence(3);
        solution.setVerify(true);

        solution.apply(new Unit(0));
        solution.drift = 0.25;
        assertThrows(IllegalStateException.class, () -> solution.apply(new Unit(1)));
    }

    @Test
    void verifyModeChecksEveryMove() {
        var solution = new Sequence(2);
        solution.setVerify(true);
        solution.apply(new Unit(0));
        solution.apply(new Unit(1));

        solution.drift = 1;
        assertThrows(IllegalStateException.class, () -> solution.apply(new Stay()));

        // copies inherit verification
        var copy = solution.copy();
        copy.drift = 0;
        assertThrows(IllegalStateException.class, () -> copy.apply(new Stay()));
    }

    @Test
    void detectsBrokenPartition() {
        var solution = new Sequence(3);
        solution.leaky = true;

        solution.apply(new Unit(0));
        var e = assertThrows(IllegalStateException.class, solution::verify);
        assertTrue(e.getMessage().contains("don't cover"), e::getMessage);

        var checked = new Sequence(3);
        checked.leaky = true;
        checked.setVerify(true);
        assertThrows(IllegalStateException.class, () -> checked.apply(new Unit(0)));
    }

    @Test
    void checkPartition() {
        assertDoesNotThrow(() -> AbstractSolution.checkPartition(Set.of(0, 2), Set.of(1, 3), 4));
        assertDoesNotThrow(() -> AbstractSolution.checkPartition(Set.of(), Set.of(0), 1));

        // a unit on both sides
        assertThrows(IllegalStateException.class,
                () -> AbstractSolution.checkPartition(Set.of(0, 1), Set.of(1), 3));
        // a unit on neither side
        assertThrows(IllegalStateException.class,
                () -> AbstractSolution.checkPartition(Set.of(0), Set.of(2), 3));
        // right count, wrong units
        var e = assertThrows(IllegalStateException.class,
                () -> AbstractSolution.checkPartition(Set.of(0, 1), Set.of(1, 5), 4));
        assertTrue(e.getMessage().contains("unit"), e::getMessage);
        // out of range
        assertThrows(IllegalStateException.class,
                () -> AbstractSolution.checkPartition(Set.of(0), Set.of(1, 2), 2));
    }
}
