/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.gearbox.spritegen.process;

import java.util.logging.Logger;

import java.awt.Rectangle;

import io.github.gearbox.awt.PixelBuffer;

/**
 * Crops images to the bounding box of their non-transparent content.
 */
public final class AlphaTrimmer {

    private static final Logger log = Logger.getLogger(AlphaTrimmer.class.getName());

    private AlphaTrimmer() {/* no instances */}

    /**
     * Finds the smallest rectangle containing all pixels with alpha &gt; 0.
     *
     * @param   image  image to examine
     * @return  content bounds, inclusive
     * @throws  EmptyImageException  if the image has no pixel with alpha &gt; 0
     */
    public static Rectangle contentBounds(PixelBuffer image) {
        int width = image.width();
        int height = image.height();
        int minX = width, minY = height;
        int maxX = -1, maxY = -1;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (image.alpha(x, y) > 0) {
                    minX = Math.min(x, minX);
                    minY = Math.min(y, minY);
                    maxX = Math.max(x, maxX);
                    maxY = Math.max(y, maxY);
                }
            }
        }
        if (maxX < 0) {
            throw new EmptyImageException("Cannot process an image which is entirely transparent ("
                    + width + "x" + height + ")");
        }
        return new Rectangle(minX, minY,
                maxX - minX + 1, maxY - minY + 1);
    }

    /**
     * Crops the given image to its {@linkplain #contentBounds content bounds}.
     *
     * @param   image  image to trim
     * @return  the cropped image, or the same instance if already tightly
     *          bounded
     * @throws  EmptyImageException  if the image has no pixel with alpha &gt; 0
     */
    public static PixelBuffer trim(PixelBuffer image) {
        return crop(image, contentBounds(image));
    }

    /**
     * Crops all frames to the union of their content bounds.  The frames
     * remain of uniform size, and keep their registration relative to each
     * other.
     *
     * @param   frames  frames to trim
     * @return  the trimmed frames
     * @throws  EmptyImageException  if any frame is entirely transparent
     */
    public static FrameSet trim(FrameSet frames) {
        Rectangle union = null;
        for (int i = 0; i < frames.size(); i++) {
            Rectangle bounds;
            try {
                bounds = contentBounds(frames.get(i));
            } catch (EmptyImageException e) {
                throw new EmptyImageException("Frame #" + (i + 1) + " of " + frames.size()
                        + " is entirely transparent (" + frames.frameWidth()
                        + "x" + frames.frameHeight() + ")", e);
            }
            union = (union == null) ? bounds : union.union(bounds);
        }
        Rectangle region = union;
        return frames.map(frame -> crop(frame, region));
    }

    private static PixelBuffer crop(PixelBuffer image, Rectangle bounds) {
        if (bounds.x == 0 && bounds.y == 0
                && bounds.width == image.width()
                && bounds.height == image.height()) {
            return image;
        }
        log.finer(() -> "Cropping " + image + " to " + bounds);
        return image.crop(bounds);
    }

}
