package com.github.routesearch.pickup;

import com.github.routesearch.Problem;
import com.github.routesearch.Util;

import java.io.IOException;
import java.io.LineNumberReader;
import java.io.Reader;
import java.util.Random;

/**
 * <p>
 * A waste collection routing problem: a vehicle leaves the depot, empties every container exactly once, and
 * drives to the treatment plant. Each container can be approached in one of two orientations, and every
 * cost depends on the orientations at both ends of the trip.
 * </p><p>
 * Orientation pairs are indexed as <code>2 * fromOrientation + toOrientation</code>, so index 2 means
 * "leave the first container in orientation 1, reach the second in orientation 0".
 * </p>
 */
public final class PickupProblem implements Problem<PickupSolution> {
    // textual order of the four container-to-container blocks: 00, 01, 11, 10
    private static final int[] BLOCK_ORDER = {0, 1, 3, 2};

    private final int size;
    private final double[][] entry;
    private final double[][] exit;
    private final double[][][] pair;

    /**
     * Constructor. The tables are copied.
     *
     * @param entry depot to container costs, indexed <code>[orientation][unit]</code>
     * @param exit  container to plant costs, indexed <code>[orientation][unit]</code>
     * @param pair  container to container costs, indexed <code>[orientationPair][from][to]</code>
     * @throws IllegalArgumentException if the tables are empty, have inconsistent dimensions or contain
     *                                  non-finite costs
     */
    public PickupProblem(double[][] entry, double[][] exit, double[][][] pair) {
        if (entry.length != 2 || entry[0].length == 0) {
            throw new IllegalArgumentException("entry must have 2 non-empty rows");
        }
        this.size = entry[0].length;
        this.entry = Util.validate(entry, 2, size, "entry");
        this.exit = Util.validate(exit, 2, size, "exit");

        if (pair.length != 4) {
            throw new IllegalArgumentException("pair must have 4 orientation pairs");
        }
        this.pair = new double[4][][];
        for (var orientations = 0; orientations < 4; orientations++) {
            this.pair[orientations] = Util.validate(pair[orientations], size, size, "pair[" + orientations + "]");
        }
    }

    /**
     * Parse the textual format: the size <code>n</code>; two lines of <code>n</code> depot costs (orientation 0,
     * then 1); two lines of <code>n</code> plant costs; then four blocks of <code>n</code> lines of
     * <code>n</code> container costs, for orientation pairs 00, 01, 11 and 10 in that order. All costs are integers.
     *
     * @param reader the input, which is not closed
     * @return the problem
     * @throws IOException              if reading fails
     * @throws IllegalArgumentException if the input is malformed
     */
    public static PickupProblem read(Reader reader) throws IOException {
        var in = new LineNumberReader(reader);
        var size = Util.readSize(in);
        var entry = new double[2][];
        var exit = new double[2][];
        var pair = new double[4][size][];

        for (var orientation = 0; orientation < 2; orientation++) {
            entry[orientation] = Util.readRow(in, size, true);
        }
        for (var orientation = 0; orientation < 2; orientation++) {
            exit[orientation] = Util.readRow(in, size, true);
        }
        for (var orientations : BLOCK_ORDER) {
            for (var row = 0; row < size; row++) {
                pair[orientations][row] = Util.readRow(in, size, true);
            }
        }
        return new PickupProblem(entry, exit, pair);
    }

    @Override
    public int size() {
        return size;
    }

    /**
     * @param unit        the first container
     * @param orientation its orientation
     * @return the cost from the depot
     */
    public double entryCost(int unit, int orientation) {
        return entry[orientation][unit];
    }

    /**
     * @param unit        the last container
     * @param orientation its orientation
     * @return the cost to the plant
     */
    public double exitCost(int unit, int orientation) {
        return exit[orientation][unit];
    }

    /**
     * @param from            the container left
     * @param fromOrientation its orientation
     * @param to              the container reached
     * @param toOrientation   its orientation
     * @return the travel cost
     */
    public double transitionCost(int from, int fromOrientation, int to, int toOrientation) {
        return pair[2 * fromOrientation + toOrientation][from][to];
    }

    /**
     * @param to the first pickup
     * @return the cost from the depot
     */
    public double entryCost(Pickup to) {
        return entryCost(to.unit(), to.orientation());
    }

    /**
     * @param from the last pickup
     * @return the cost to the plant
     */
    public double exitCost(Pickup from) {
        return exitCost(from.unit(), from.orientation());
    }

    /**
     * @param from the pickup left
     * @param to   the pickup reached
     * @return the travel cost
     */
    public double transitionCost(Pickup from, Pickup to) {
        return transitionCost(from.unit(), from.orientation(), to.unit(), to.orientation());
    }

    // cheapest way into `to` from `from` over all four orientation pairs
    double cheapestTransition(int from, int to) {
        var min = pair[0][from][to];

        for (var orientations = 1; orientations < 4; orientations++) {
            min = Math.min(min, pair[orientations][from][to]);
        }
        return min;
    }

    @Override
    public PickupSolution emptySolution(Random random) {
        return new PickupSolution(this, random);
    }
}
