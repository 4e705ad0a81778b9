/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.gearbox.spritegen.process;

import static java.lang.Double.doubleToLongBits;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Suggested pixel offset for placing an image in-game.  Advisory value,
 * never applied to pixels.
 */
public final class Offset {

    public static final Offset ZERO = new Offset(0, 0);

    public final double x;
    public final double y;

    public Offset(double x, double y) {
        // -0.0 -> 0.0
        this.x = x + 0.0;
        this.y = y + 0.0;
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
        if (obj instanceof Offset) {
            Offset other = (Offset) obj;
            return doubleToLongBits(x) == doubleToLongBits(other.x)
                    && doubleToLongBits(y) == doubleToLongBits(other.y);
        }
        return false;
    }

    private static String format(double value) {
        if (value == 0) return "0";
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    @Override
    public String toString() {
        return "(" + format(x) + ", " + format(y) + ")";
    }

}
