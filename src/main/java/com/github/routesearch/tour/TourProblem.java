package com.github.routesearch.tour;

import com.github.routesearch.Problem;
import com.github.routesearch.Util;

import java.io.IOException;
import java.io.LineNumberReader;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * The symmetric Travelling Salesman Problem over points in the plane. The distance matrix is computed once, at
 * construction.
 */
public final class TourProblem implements Problem<TourSolution> {
    private final List<Point> points;
    private final double[][] distances;

    /**
     * Constructor.
     *
     * @param points the locations to visit, at least one
     */
    public TourProblem(List<Point> points) {
        if (points.isEmpty()) {
            throw new IllegalArgumentException("points must not be empty.");
        }
        var size = points.size();

        this.points = List.copyOf(points);
        this.distances = new double[size][size];

        for (var row = 0; row < size; row++) {
            var src = this.points.get(row);

            for (var col = 0; col < size; col++) {
                distances[row][col] = src.distanceTo(this.points.get(col));
            }
        }
    }

    /**
     * Parse the textual format: the number of points, then one line per point with its x and y coordinates.
     *
     * @param reader the input, which is not closed
     * @return the problem
     * @throws IOException              if reading fails
     * @throws IllegalArgumentException if the input is malformed
     */
    public static TourProblem read(Reader reader) throws IOException {
        var in = new LineNumberReader(reader);
        var size = Util.readSize(in);
        var points = new ArrayList<Point>(size);

        for (var i = 0; i < size; i++) {
            var row = Util.readRow(in, 2, false);
            points.add(new Point(row[0], row[1]));
        }
        return new TourProblem(points);
    }

    @Override
    public int size() {
        return points.size();
    }

    /**
     * @return the points, in index order
     */
    public List<Point> getPoints() {
        return points;
    }

    /**
     * @param a a point index
     * @param b another point index
     * @return the distance between them
     */
    public double pointDistance(int a, int b) {
        return distances[a][b];
    }

    /**
     * Equivalent to <code>emptySolution(0, random)</code>
     */
    @Override
    public TourSolution emptySolution(Random random) {
        return emptySolution(0, random);
    }

    /**
     * Create a tour that starts and will end at <code>start</code>. Ensemble drivers use this to root one
     * solution at every point.
     *
     * @param start  the start point index
     * @param random the generator the solution will sample from
     * @return a solution holding only the start point
     */
    public TourSolution emptySolution(int start, Random random) {
        if (start < 0 || start >= size()) {
            throw new IllegalArgumentException("start " + start + " is out of range");
        }
        return new TourSolution(this, start, random);
    }
}
