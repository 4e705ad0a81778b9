/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.gearbox.spritegen.process;

import java.util.logging.Logger;

import java.awt.image.BufferedImage;

import com.jhlabs.image.GaussianFilter;

import io.github.gearbox.awt.PixelBuffer;

/**
 * Synthesizes a soft silhouette shadow behind image content.  The image
 * canvas is not expanded: shadow parts falling outside it are clipped.
 */
public final class DropShadowCompositor {

    private static final Logger log = Logger.getLogger(DropShadowCompositor.class.getName());

    private DropShadowCompositor() {/* no instances */}

    public static void applyDropShadow(PixelBuffer image, ShadowSpec shadow) {
        applyDropShadow(image, shadow.dx, shadow.dy, shadow.blurRadius, shadow.color);
    }

    /**
     * Applies a drop shadow to the given image, in place.
     * <p>
     * Every pixel with alpha &gt; 0 casts the shadow color, its alpha scaled
     * by the pixel alpha, at the given offset.  Overlapping casts are
     * accumulated with the <i>source-over</i> operator.  The shadow layer is
     * then blurred, and the original image composited over it.</p>
     *
     * @param   image  the image to apply the shadow to
     * @param   offsetX  horizontal shadow offset
     * @param   offsetY  vertical shadow offset
     * @param   blurRadius  Gaussian blur standard deviation, {@code 0} for a
     *          hard shadow
     * @param   shadowColor  straight-alpha {@code 0xAARRGGBB} shadow color
     * @throws  IllegalArgumentException  if {@code blurRadius} is negative
     */
    public static void applyDropShadow(PixelBuffer image,
                                       int offsetX, int offsetY,
                                       int blurRadius, int shadowColor) {
        if (blurRadius < 0) {
            throw new IllegalArgumentException("Negative blur radius: " + blurRadius);
        }
        if (image.isEmpty()) return;

        PixelBuffer shadowLayer = castShadow(image, offsetX, offsetY, shadowColor);
        if (blurRadius > 0) {
            shadowLayer = blur(shadowLayer, blurRadius);
        }
        shadowLayer.drawOver(image, 0, 0);
        image.copyFrom(shadowLayer, 0, 0);
    }

    private static PixelBuffer castShadow(PixelBuffer image,
                                          int offsetX, int offsetY,
                                          int shadowColor) {
        int width = image.width();
        int height = image.height();
        int colorAlpha = PixelBuffer.alpha(shadowColor);
        int rgb = shadowColor & 0xFFFFFF;

        PixelBuffer shadowLayer = new PixelBuffer(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int alpha = image.alpha(x, y);
                if (alpha == 0) continue;

                int sx = x + offsetX;
                int sy = y + offsetY;
                if (!shadowLayer.contains(sx, sy)) continue;

                int castAlpha = (int) Math.round(colorAlpha * (alpha / 255.0));
                int cast = castAlpha << 24 | rgb;
                shadowLayer.setRGB(sx, sy, PixelBuffer
                        .over(cast, shadowLayer.getRGB(sx, sy)));
            }
        }
        return shadowLayer;
    }

    private static PixelBuffer blur(PixelBuffer layer, int radius) {
        log.finer(() -> "Blurring " + layer + " shadow, radius " + radius);
        // Kernel radius of 3 sigma
        BufferedImage blurred = new GaussianFilter(3 * radius).filter(layer.toImage(), null);
        return PixelBuffer.of(blurred);
    }

}
