package com.github.routesearch.pickup;

import com.github.routesearch.LocalMove;

import static com.github.routesearch.pickup.Pickup.checkOrientation;

/**
 * Exchange the containers at positions <code>i</code> and <code>j</code>, then give position <code>i</code>
 * orientation <code>iOrientation</code> and position <code>j</code> orientation <code>jOrientation</code>.
 * When <code>i == j</code> the container stays put and takes <code>jOrientation</code>.
 *
 * @param i            the first position
 * @param j            the second position, not before <code>i</code>
 * @param iOrientation the new orientation at position <code>i</code>
 * @param jOrientation the new orientation at position <code>j</code>
 */
public record SwapMove(int i, int j, int iOrientation, int jOrientation) implements LocalMove {
    /**
     * @throws IllegalArgumentException if an orientation isn't 0 or 1
     */
    public SwapMove {
        checkOrientation(iOrientation);
        checkOrientation(jOrientation);
    }
}
