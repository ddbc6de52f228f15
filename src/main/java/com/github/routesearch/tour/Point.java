package com.github.routesearch.tour;

/**
 * A location in the plane.
 *
 * @param x the x coordinate
 * @param y the y coordinate
 */
public record Point(double x, double y) {
    /**
     * @throws IllegalArgumentException if a coordinate is not finite
     */
    public Point {
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new IllegalArgumentException("coordinates must be finite.");
        }
    }

    /**
     * @param other another point
     * @return the Euclidean distance
     */
    public double distanceTo(Point other) {
        var dx = x - other.x;
        var dy = y - other.y;

        return Math.sqrt(dx * dx + dy * dy);
    }
}
