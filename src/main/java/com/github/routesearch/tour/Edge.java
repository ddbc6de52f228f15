package com.github.routesearch.tour;

import com.github.routesearch.Component;

/**
 * Represents an edge of a tour, traversed from <code>src</code> to <code>dest</code>.
 *
 * @param src  the source point, as an integer array index into the corresponding problem
 * @param dest the destination point, as an integer array index into the corresponding problem
 */
public record Edge(int src, int dest) implements Component {
    @Override
    public String toString() {
        return src + "-->" + dest;
    }
}
