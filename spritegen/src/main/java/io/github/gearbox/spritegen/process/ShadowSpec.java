/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.gearbox.spritegen.process;

import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

import io.github.gearbox.awt.PixelBuffer;

/**
 * Drop shadow parameters: offset, blur radius, and color with opacity.
 *
 * @see  DropShadowCompositor
 */
public final class ShadowSpec {

    /** Icon atlas default: blur 2, no offset, black at 116/255 (~45%) opacity. */
    public static final ShadowSpec ICON = new ShadowSpec(0, 0, 2, 0x74000000);

    public final int dx;
    public final int dy;
    public final int blurRadius;
    /** Straight-alpha {@code 0xAARRGGBB}. */
    public final int color;

    public ShadowSpec(int dx, int dy, int blurRadius, int color) {
        if (blurRadius < 0) {
            throw new IllegalArgumentException("Negative blur radius: " + blurRadius);
        }
        this.dx = dx;
        this.dy = dy;
        this.blurRadius = blurRadius;
        this.color = color;
    }

    /**
     * Parses {@code <blur>[,<dx>[,<dy>[,<opacity>[,<color>]]]]} where
     * {@code dy} defaults to {@code dx}, {@code opacity} is in [0,1], and
     * {@code color} is an RGB integer ({@code 0x202020}, {@code #202020}).
     * Missing parameters are taken from the given default.
     *
     * @param   paramStr  shadow parameters
     * @param   defaultValue  fallback parameters
     * @return  the parsed shadow spec
     * @throws  IllegalArgumentException  if a parameter is malformed
     */
    public static ShadowSpec decode(String paramStr, ShadowSpec defaultValue) {
        if (paramStr.isBlank()) return defaultValue;

        int distance;
        String[] args = paramStr.split(",", 5);
        int blur = parseValue(args, 0, defaultValue.blurRadius, Integer::valueOf);
        int dx = distance = parseValue(args, 1, defaultValue.dx, Integer::valueOf);
        int dy = parseValue(args, 2, distance, Integer::valueOf);
        float opacity = parseValue(args, 3, defaultValue.opacity(), Float::valueOf);
        int rgb = parseValue(args, 4, defaultValue.color & 0xFFFFFF, Integer::decode);
        if (!(opacity >= 0 && opacity <= 1)) {
            throw new IllegalArgumentException("Opacity outside [0,1]: " + opacity);
        }
        return new ShadowSpec(dx, dy, blur,
                Math.round(opacity * 255) << 24 | (rgb & 0xFFFFFF));
    }

    public static ShadowSpec decode(String paramStr) {
        return decode(paramStr, ICON);
    }

    private static <T> T parseValue(String[] args, int index, T defaultValue,
                                    Function<String, T> valueMapper) {
        return (index < args.length && !args[index].isBlank())
                ? valueMapper.apply(args[index].strip())
                : defaultValue;
    }

    public float opacity() {
        return PixelBuffer.alpha(color) / 255f;
    }

    @Override
    public int hashCode() {
        return Objects.hash(dx, dy, blurRadius, color);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj instanceof ShadowSpec) {
            ShadowSpec other = (ShadowSpec) obj;
            return dx == other.dx
                    && dy == other.dy
                    && blurRadius == other.blurRadius
                    && color == other.color;
        }
        return false;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "ShadowSpec(blur=%d, dx=%d, dy=%d, color=#%08X)",
                             blurRadius, dx, dy, color);
    }

}
