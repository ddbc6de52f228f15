package com.github.routesearch.tour;

import com.github.routesearch.LocalMove;

/**
 * Reverse the tour positions <code>i .. j - 1</code>. This replaces the edges entering positions <code>i</code>
 * and <code>j</code>; every edge inside the segment keeps its length.
 *
 * @param i first reversed position, at least 1
 * @param j position after the last reversed one, at least <code>i + 2</code>
 */
public record TwoOptMove(int i, int j) implements LocalMove {
}
