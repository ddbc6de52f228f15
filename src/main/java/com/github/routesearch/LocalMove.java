package com.github.routesearch;

/**
 * Marker for an immutable descriptor of a structural mutation of a complete solution (a swap, a segment
 * reversal.) Moves are only meaningful for the solution state they were generated from.
 */
public interface LocalMove {
}
