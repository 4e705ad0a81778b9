/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.gearbox.spritegen.process;

import static java.lang.Double.doubleToLongBits;

import java.util.Objects;
import java.util.Optional;

/**
 * Parameters of {@link AspectResizer#resize(io.github.gearbox.awt.PixelBuffer, ResizeSpec)}.
 */
public final class ResizeSpec {

    public final double targetSize;
    public final double scale;
    private final Anchor anchor;

    private ResizeSpec(double targetSize, double scale, Anchor anchor) {
        if (!(scale >= 0)) {
            throw new IllegalArgumentException("Negative scale: " + scale);
        }
        this.targetSize = targetSize;
        this.scale = scale;
        this.anchor = anchor;
    }

    /**
     * {@return a spec fitting the larger dimension to the given size, with
     * scale 1 and no square padding}
     *
     * @param   targetSize  the larger dimension after fit
     */
    public static ResizeSpec fit(double targetSize) {
        return new ResizeSpec(targetSize, 1.0, null);
    }

    public ResizeSpec withScale(double scale) {
        return new ResizeSpec(targetSize, scale, anchor);
    }

    /**
     * {@return a spec padding the result to a square canvas, placing the
     * resized image according to the given anchor}
     *
     * @param   anchor  placement within the square canvas
     */
    public ResizeSpec withAnchor(Anchor anchor) {
        return new ResizeSpec(targetSize, scale, Objects.requireNonNull(anchor));
    }

    public Optional<Anchor> anchor() {
        return Optional.ofNullable(anchor);
    }

    @Override
    public int hashCode() {
        return Objects.hash(targetSize, scale, anchor);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj instanceof ResizeSpec) {
            ResizeSpec other = (ResizeSpec) obj;
            return doubleToLongBits(targetSize) == doubleToLongBits(other.targetSize)
                    && doubleToLongBits(scale) == doubleToLongBits(other.scale)
                    && Objects.equals(anchor, other.anchor);
        }
        return false;
    }

    @Override
    public String toString() {
        return "ResizeSpec(targetSize=" + targetSize + ", scale=" + scale
                + (anchor == null ? "" : ", anchor=" + anchor) + ")";
    }

}
