/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.gearbox.spritegen.process;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.github.gearbox.awt.PixelBuffer;

/**
 * Resolves alignment requests and suggests in-game placement offsets for
 * processed images and their shadows.
 * <p>
 * Offsets are computed against a fixed {@value #TILE_SIZE} px reference
 * tile, with the image centered on it at anchor (0.5, 0.5).</p>
 */
public final class AlignmentSolver {

    private static final Logger log = Logger.getLogger(AlignmentSolver.class.getName());

    public static final int TILE_SIZE = 64;

    /** Moves the shadow down just a bit, for aesthetics. */
    private static final double SHADOW_PADDING = 1;

    /** Compensates for rendering oddities. */
    private static final double SHADOW_NUDGE = 0.04;

    private static final Pattern NUMERIC_PAIR = Pattern
            .compile("\\s*([-+]?[0-9]*\\.?[0-9]+)\\s*[,;\\s]\\s*([-+]?[0-9]*\\.?[0-9]+)\\s*");

    private AlignmentSolver() {/* no instances */}

    /**
     * Resolves an alignment request.  The request is either a numeric
     * {@code "x,y"} pair, or a combination of the {@code top}, {@code bottom},
     * {@code left}, {@code right}, {@code center}, {@code middle} keywords,
     * matched case-insensitively, ignoring {@code '-'} and {@code '_'}.
     * Precedence:
     * <ol>
     * <li>{@code center}/{@code middle} with {@code top}, {@code left},
     *     {@code bottom} or {@code right} (checked in that order) &rarr; the
     *     middle of that edge; alone &rarr; (0.5, 0.5)</li>
     * <li>{@code left} with {@code top} &rarr; (0, 0), with {@code bottom}
     *     &rarr; (0, 1), alone &rarr; (0, 0.5)</li>
     * <li>{@code right} with {@code top} &rarr; (1, 0), with {@code bottom}
     *     &rarr; (1, 1), alone &rarr; (1, 0.5)</li>
     * <li>{@code top} &rarr; (0.5, 0); {@code bottom} &rarr; (0.5, 1)</li>
     * </ol>
     * <p>
     * Unrecognized input resolves to (0, 0), logging a warning.</p>
     *
     * @param   request  alignment request
     * @return  the resolved anchor
     * @throws  IllegalArgumentException  if the request is blank, or a
     *          numeric pair outside [0,1]
     */
    public static Anchor resolveAnchor(String request) {
        if (request == null || request.isBlank()) {
            throw new IllegalArgumentException("Alignment cannot be empty");
        }

        Matcher numeric = NUMERIC_PAIR.matcher(request);
        if (numeric.matches()) {
            return new Anchor(Double.parseDouble(numeric.group(1)),
                              Double.parseDouble(numeric.group(2)));
        }

        String tokens = request.strip().toLowerCase(Locale.ROOT)
                               .replace("-", "").replace("_", "");
        if (tokens.contains("center") || tokens.contains("middle")) {
            if (tokens.contains("top")) return new Anchor(0.5, 0);
            if (tokens.contains("left")) return new Anchor(0, 0.5);
            if (tokens.contains("bottom")) return new Anchor(0.5, 1);
            if (tokens.contains("right")) return new Anchor(1, 0.5);
            return Anchor.CENTER;
        }
        if (tokens.contains("left")) {
            if (tokens.contains("top")) return Anchor.TOP_LEFT;
            if (tokens.contains("bottom")) return Anchor.BOTTOM_LEFT;
            return new Anchor(0, 0.5);
        }
        if (tokens.contains("right")) {
            if (tokens.contains("top")) return new Anchor(1, 0);
            if (tokens.contains("bottom")) return new Anchor(1, 1);
            return new Anchor(1, 0.5);
        }
        if (tokens.contains("top")) return new Anchor(0.5, 0);
        if (tokens.contains("bottom")) return new Anchor(0.5, 1);

        log.warning(() -> "Unrecognized alignment \"" + request
                          + "\", defaulting to " + Anchor.TOP_LEFT);
        return Anchor.TOP_LEFT;
    }

    /**
     * Suggests an offset for the given image:
     * <pre>
     * <code>    x = 0.5 * (anchor.x - 0.5) * (TILE_SIZE - width)
     *     y = 0.5 * (anchor.y - 0.5) * (TILE_SIZE - height)</code></pre>
     *
     * @param   image  processed image
     * @param   anchor  alignment
     * @return  suggested image offset
     */
    public static Offset suggestOffset(PixelBuffer image, Anchor anchor) {
        return suggestOffset(image.width(), image.height(), anchor);
    }

    public static Offset suggestOffset(int width, int height, Anchor anchor) {
        return new Offset(0.5 * (anchor.x - 0.5) * (TILE_SIZE - width),
                          0.5 * (anchor.y - 0.5) * (TILE_SIZE - height));
    }

    /**
     * Suggests an offset placing the shadow image directly underneath the
     * given image.  The shadow is first aligned to the bottom-left, then
     * moved right by half the difference between the tile and the image
     * width, and down by half its own height.  The image offset is added
     * last, its vertical component doubled.
     *
     * @param   image  processed image
     * @param   imageOffset  offset suggested for the image
     * @param   shadow  processed shadow image
     * @return  suggested shadow offset
     * @see     #suggestOffset(PixelBuffer, Anchor)
     */
    public static Offset suggestShadowOffset(PixelBuffer image,
                                             Offset imageOffset,
                                             PixelBuffer shadow) {
        Offset base = suggestOffset(shadow, Anchor.BOTTOM_LEFT);
        int width = image.width();

        double x = base.x;
        x += round3((TILE_SIZE / 2.0 - width / 2.0) / 2.0);
        x += width * SHADOW_NUDGE;
        x += imageOffset.x;

        double y = base.y;
        y += shadow.height() / 2.0;
        y += imageOffset.y * 2.0;
        y += SHADOW_PADDING;

        return new Offset(x, y);
    }

    private static double round3(double value) {
        return BigDecimal.valueOf(value)
                .setScale(3, RoundingMode.HALF_EVEN).doubleValue();
    }

}
