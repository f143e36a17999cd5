package org.calista.tactica.term;

import java.util.Arrays;

/**
 * Position: path from a statement root to one of its subterms.
 *
 * <p>Each step is a child index (see {@link Term#children()}). The empty position denotes the
 * statement itself. Immutable; {@link #child(int)} and {@link #tail()} return new instances.</p>
 */
public final class Position {

    private static final Position ROOT = new Position(new int[0]);

    private final int[] steps;

    private Position(int[] steps) {
        this.steps = steps;
    }

    public static Position root() {
        return ROOT;
    }

    public static Position of(int... steps) {
        if (steps == null || steps.length == 0) return ROOT;
        for (int s : steps) {
            if (s < 0) throw new IllegalArgumentException("Negative position step: " + s);
        }
        return new Position(steps.clone());
    }

    /** This position extended by one step. */
    public Position child(int index) {
        if (index < 0) throw new IllegalArgumentException("Negative position step: " + index);
        int[] next = Arrays.copyOf(steps, steps.length + 1);
        next[steps.length] = index;
        return new Position(next);
    }

    public boolean isRoot() {
        return steps.length == 0;
    }

    public int head() {
        if (steps.length == 0) throw new IllegalStateException("Root position has no head");
        return steps[0];
    }

    public Position tail() {
        if (steps.length <= 1) return ROOT;
        return new Position(Arrays.copyOfRange(steps, 1, steps.length));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Position p)) return false;
        return Arrays.equals(steps, p.steps);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(steps);
    }

    @Override
    public String toString() {
        return Arrays.toString(steps);
    }
}
