/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.gearbox.spritegen.process;

import static java.lang.Double.doubleToLongBits;

import java.util.Locale;
import java.util.Objects;

/**
 * Normalized point deciding where content is placed within extra canvas
 * space: {@code 0.0} = left/top, {@code 0.5} = center, {@code 1.0} =
 * right/bottom.
 *
 * @see  AlignmentSolver#resolveAnchor(String)
 */
public final class Anchor {

    public static final Anchor TOP_LEFT = new Anchor(0, 0);
    public static final Anchor CENTER = new Anchor(0.5, 0.5);
    public static final Anchor BOTTOM_LEFT = new Anchor(0, 1);

    public final double x;
    public final double y;

    /**
     * @param   x  horizontal position in [0,1]
     * @param   y  vertical position in [0,1]
     * @throws  IllegalArgumentException  if a coordinate is outside [0,1]
     */
    public Anchor(double x, double y) {
        if (!(x >= 0 && x <= 1 && y >= 0 && y <= 1)) {
            throw new IllegalArgumentException("Anchor outside [0,1]: " + x + ", " + y);
        }
        this.x = x;
        this.y = y;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj instanceof Anchor) {
            Anchor other = (Anchor) obj;
            return doubleToLongBits(x) == doubleToLongBits(other.x)
                    && doubleToLongBits(y) == doubleToLongBits(other.y);
        }
        return false;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "(%.1f, %.1f)", x, y);
    }

}
