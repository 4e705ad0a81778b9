/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.gearbox.spritegen.process;

import java.util.Optional;
import java.util.logging.Logger;

import io.github.gearbox.awt.PixelBuffer;
import io.github.gearbox.awt.SmoothResize;

/**
 * Resizes images to fit a target size maintaining their aspect ratio.
 *
 * @see  SmoothResize
 */
public final class AspectResizer {

    private static final Logger log = Logger.getLogger(AspectResizer.class.getName());

    private AspectResizer() {/* no instances */}

    /**
     * Scales the image so its larger dimension (width, when equal) matches
     * the target size, multiplied by the resize scale.  When the resize has an
     * anchor, the result is padded to a square canvas of side
     * {@code round(targetSize * scale)}, placing the resized image at
     * {@code round((side - dimension) * anchor)} on either axis.
     *
     * @param   image  image to resize
     * @param   spec  resize parameters
     * @return  a new image
     * @throws  InvalidDimensionException  if a computed image or canvas
     *          dimension is not positive
     */
    public static PixelBuffer resize(PixelBuffer image, ResizeSpec spec) {
        if (image.isEmpty()) {
            throw new InvalidDimensionException("Cannot resize an empty image ("
                    + image.width() + "x" + image.height() + ")");
        }

        double targetSize = spec.targetSize;
        double newWidth;
        double newHeight;
        if (image.width() >= image.height()) {
            newWidth = targetSize;
            newHeight = image.height() * (targetSize / image.width());
        } else {
            newHeight = targetSize;
            newWidth = image.width() * (targetSize / image.height());
        }
        int width = round(newWidth * spec.scale);
        int height = round(newHeight * spec.scale);
        if (width <= 0 || height <= 0) {
            throw new InvalidDimensionException("Invalid target size "
                    + width + "x" + height + " for " + image.width() + "x"
                    + image.height() + " and " + spec);
        }

        log.fine(() -> "Resampling " + image.width() + "x" + image.height()
                       + " -> " + width + "x" + height);
        PixelBuffer resized = SmoothResize.resize(image, width, height);

        Optional<Anchor> anchor = spec.anchor();
        if (anchor.isEmpty()) {
            return resized;
        }

        int canvasSize = round(targetSize * spec.scale);
        if (canvasSize <= 0) {
            throw new InvalidDimensionException("Invalid canvas size "
                    + canvasSize + " for " + spec);
        }
        PixelBuffer padded = new PixelBuffer(canvasSize, canvasSize);
        padded.copyFrom(resized,
                round((canvasSize - width) * anchor.get().x),
                round((canvasSize - height) * anchor.get().y));
        return padded;
    }

    /**
     * Rounds half away from zero.
     */
    static int round(double value) {
        long rounded = Math.round(Math.abs(value));
        return Math.toIntExact(value < 0 ? -rounded : rounded);
    }

}
