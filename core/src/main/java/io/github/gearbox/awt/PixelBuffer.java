/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.gearbox.awt;

import java.util.Arrays;

import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferInt;

/**
 * A rectangular grid of RGBA8 pixels with <em>straight</em> (non-premultiplied)
 * alpha.  Pixels are stored int-packed in {@code 0xAARRGGBB} order, the same
 * layout as {@link BufferedImage#TYPE_INT_ARGB}.
 * <p>
 * A buffer is owned by whichever processing stage currently holds it.  Stages
 * either mutate it in place, or return a new buffer replacing the caller's
 * reference to the old one.  Instances are not safe for concurrent
 * mutation.</p>
 */
public final class PixelBuffer {

    private final int width;
    private final int height;
    private final int[] pixels;

    /**
     * Constructs a fully transparent buffer of the given dimension.
     *
     * @param   width  buffer width (&ge; 0)
     * @param   height  buffer height (&ge; 0)
     * @throws  IllegalArgumentException  if either dimension is negative
     */
    public PixelBuffer(int width, int height) {
        this(width, height, new int[checkedSize(width, height)]);
    }

    private PixelBuffer(int width, int height, int[] pixels) {
        this.width = width;
        this.height = height;
        this.pixels = pixels;
    }

    private static int checkedSize(int width, int height) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Negative dimension: "
                    + width + "x" + height);
        }
        return Math.multiplyExact(width, height);
    }

    /**
     * Creates a buffer holding a copy of the given image pixels, converted
     * to non-premultiplied sRGB as necessary.
     *
     * @param   image  source image
     * @return  a new buffer with the image pixels
     */
    public static PixelBuffer of(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        int[] data = image.getRGB(0, 0, w, h, null, 0, w);
        return new PixelBuffer(w, h, data);
    }

    /**
     * Creates a buffer wrapping a copy of the given packed ARGB pixel data.
     *
     * @param   width  buffer width
     * @param   height  buffer height
     * @param   argb  scanline-ordered {@code 0xAARRGGBB} pixels
     * @return  a new buffer
     * @throws  IllegalArgumentException  if {@code argb.length != width * height}
     */
    public static PixelBuffer of(int width, int height, int... argb) {
        if (argb.length != checkedSize(width, height)) {
            throw new IllegalArgumentException("Pixel data length " + argb.length
                    + " doesn't match " + width + "x" + height);
        }
        return new PixelBuffer(width, height, argb.clone());
    }

    /**
     * Returns a new {@code TYPE_INT_ARGB} image with a copy of this buffer's
     * pixels.
     *
     * @return  a new image
     * @throws  IllegalStateException  if this buffer has no pixels
     */
    public BufferedImage toImage() {
        if (isEmpty()) {
            throw new IllegalStateException("Can't create " + width + "x" + height + " image");
        }
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        int[] data = ((DataBufferInt) image.getRaster().getDataBuffer()).getData();
        System.arraycopy(pixels, 0, data, 0, pixels.length);
        return image;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    /**
     * {@return {@code true} if this buffer has zero width or height}
     */
    public boolean isEmpty() {
        return pixels.length == 0;
    }

    public boolean contains(int x, int y) {
        return x >= 0 && y >= 0 && x < width && y < height;
    }

    private int index(int x, int y) {
        if (!contains(x, y)) {
            throw new IndexOutOfBoundsException("(" + x + ", " + y
                    + ") outside " + width + "x" + height);
        }
        return y * width + x;
    }

    public int getRGB(int x, int y) {
        return pixels[index(x, y)];
    }

    public void setRGB(int x, int y, int argb) {
        pixels[index(x, y)] = argb;
    }

    public int alpha(int x, int y) {
        return alpha(getRGB(x, y));
    }

    /**
     * Sets every pixel of this buffer to the given value.
     *
     * @param   argb  pixel value
     */
    public void fill(int argb) {
        Arrays.fill(pixels, argb);
    }

    public PixelBuffer copy() {
        return new PixelBuffer(width, height, pixels.clone());
    }

    /**
     * Returns a new buffer with the pixels of the given region.
     *
     * @param   region  region to copy, inclusive of its origin
     * @return  a new buffer of the region's dimension
     * @throws  IndexOutOfBoundsException  if the region is not fully
     *          contained in this buffer
     */
    public PixelBuffer crop(Rectangle region) {
        if (region.x < 0 || region.y < 0 || region.width < 0 || region.height < 0
                || region.x + region.width > width
                || region.y + region.height > height) {
            throw new IndexOutOfBoundsException(region + " outside " + width + "x" + height);
        }
        PixelBuffer cropped = new PixelBuffer(region.width, region.height);
        for (int row = 0; row < region.height; row++) {
            System.arraycopy(pixels, (region.y + row) * width + region.x,
                             cropped.pixels, row * region.width, region.width);
        }
        return cropped;
    }

    /**
     * Replaces pixels of this buffer with the ones of the given source,
     * placed at the specified position.  Source pixels falling outside
     * this buffer are discarded.
     *
     * @param   source  source pixels
     * @param   x  horizontal position of the source origin
     * @param   y  vertical position of the source origin
     */
    public void copyFrom(PixelBuffer source, int x, int y) {
        Rectangle clip = clip(source, x, y);
        if (clip.isEmpty()) return;

        for (int row = clip.y; row < clip.y + clip.height; row++) {
            System.arraycopy(source.pixels, (row - y) * source.width + (clip.x - x),
                             pixels, row * width + clip.x, clip.width);
        }
    }

    /**
     * Composites the given source over this buffer, using the
     * <i>source-over</i> operator.  Source pixels falling outside this
     * buffer are discarded.
     *
     * @param   source  source pixels
     * @param   x  horizontal position of the source origin
     * @param   y  vertical position of the source origin
     * @see     #over(int, int)
     */
    public void drawOver(PixelBuffer source, int x, int y) {
        Rectangle clip = clip(source, x, y);
        if (clip.isEmpty()) return;

        for (int row = clip.y; row < clip.y + clip.height; row++) {
            int srcOff = (row - y) * source.width + (clip.x - x);
            int dstOff = row * width + clip.x;
            for (int col = 0; col < clip.width; col++) {
                pixels[dstOff + col] = over(source.pixels[srcOff + col],
                                            pixels[dstOff + col]);
            }
        }
    }

    private Rectangle clip(PixelBuffer source, int x, int y) {
        return new Rectangle(x, y, source.width, source.height)
                .intersection(new Rectangle(0, 0, width, height));
    }

    /**
     * Porter-Duff <i>source-over</i> of straight-alpha pixels:
     * <pre>
     * <code>    &alpha;<sub>o</sub> = &alpha;<sub>s</sub> + &alpha;<sub>d</sub> (1 - &alpha;<sub>s</sub>)
     *     C<sub>o</sub> = (C<sub>s</sub> &alpha;<sub>s</sub> + C<sub>d</sub> &alpha;<sub>d</sub> (1 - &alpha;<sub>s</sub>)) / &alpha;<sub>o</sub></code></pre>
     *
     * @param   src  foreground {@code 0xAARRGGBB}
     * @param   dst  background {@code 0xAARRGGBB}
     * @return  the composed pixel, channels rounded and clamped to [0,255]
     */
    public static int over(int src, int dst) {
        int srcAlpha = alpha(src);
        if (srcAlpha == 0xFF) return src;
        if (srcAlpha == 0) return dst;

        double sa = srcAlpha / 255.0;
        double da = alpha(dst) / 255.0;
        double outA = sa + da * (1 - sa);
        if (outA <= 0) return 0;

        double dw = da * (1 - sa);
        return argb(outA * 255,
                (red(src) * sa + red(dst) * dw) / outA,
                (green(src) * sa + green(dst) * dw) / outA,
                (blue(src) * sa + blue(dst) * dw) / outA);
    }

    public static int alpha(int argb) {
        return argb >>> 24;
    }

    public static int red(int argb) {
        return (argb >> 16) & 0xFF;
    }

    public static int green(int argb) {
        return (argb >> 8) & 0xFF;
    }

    public static int blue(int argb) {
        return argb & 0xFF;
    }

    public static int argb(int a, int r, int g, int b) {
        return clamp(a) << 24 | clamp(r) << 16 | clamp(g) << 8 | clamp(b);
    }

    static int argb(double a, double r, double g, double b) {
        return argb((int) Math.round(a), (int) Math.round(r),
                    (int) Math.round(g), (int) Math.round(b));
    }

    private static int clamp(int channel) {
        return channel < 0 ? 0 : channel > 0xFF ? 0xFF : channel;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(pixels);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj instanceof PixelBuffer) {
            PixelBuffer other = (PixelBuffer) obj;
            return width == other.width
                    && height == other.height
                    && Arrays.equals(pixels, other.pixels);
        }
        return false;
    }

    @Override
    public String toString() {
        return "PixelBuffer(" + width + "x" + height + ")";
    }

}
