package com.github.routesearch.pickup;

import com.github.routesearch.Component;

/**
 * Visit a container with a given orientation.
 *
 * @param unit        the container, as an integer array index into the corresponding problem
 * @param orientation 0 or 1, the side the container is approached from
 */
public record Pickup(int unit, int orientation) implements Component {
    /**
     * @throws IllegalArgumentException if <code>unit</code> is negative or <code>orientation</code> isn't 0 or 1
     */
    public Pickup {
        if (unit < 0) {
            throw new IllegalArgumentException("unit must not be negative.");
        }
        checkOrientation(orientation);
    }

    static void checkOrientation(int orientation) {
        if (orientation != 0 && orientation != 1) {
            throw new IllegalArgumentException("orientation must be 0 or 1.");
        }
    }
}
