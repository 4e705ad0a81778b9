/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.gearbox.awt;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.Transparency;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorConvertOp;
import java.awt.image.ColorModel;
import java.awt.image.ComponentColorModel;
import java.awt.image.DataBuffer;

/**
 * Bicubic image resampling.  Downscaling by factor &gt; 2 is performed in
 * steps, halving the size each time, so every source pixel contributes to
 * the result.
 * <p>
 * By default tries to perform gamma-correct resampling, according to:</p>
 * <ul>
 * <li><a href="http://www.ericbrasseur.org/gamma.html">Gamma error in picture scaling</a></li>
 * <li><a href="https://entropymine.com/imageworsener/gamma/">Image scaling and gamma correction</a></li>
 * </ul>
 * <p>
 * Set the {@code gearbox.resize.linearRGB} system property to {@code false}
 * to resample directly in sRGB.</p>
 *
 * @see  <a href="https://blog.nobel-joergensen.com/2008/12/20/downscaling-images-in-java/"
 *              >Downscaling images in Java</a> <i>by Morten Nobel-Jørgensen</i>
 */
public final class SmoothResize {

    private static final boolean LINEAR_RGB = Boolean
            .parseBoolean(System.getProperty("gearbox.resize.linearRGB", "true"));

    private static final RenderingHints defaultHints;
    static {
        RenderingHints hints = new RenderingHints(
                RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
        hints.put(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
        hints.put(RenderingHints.KEY_ALPHA_INTERPOLATION, RenderingHints.VALUE_ALPHA_INTERPOLATION_QUALITY);
        hints.put(RenderingHints.KEY_COLOR_RENDERING, RenderingHints.VALUE_COLOR_RENDER_QUALITY);
        defaultHints = hints;
    }

    private SmoothResize() {/* no instances */}

    /**
     * Resamples the given buffer into a new buffer of the specified
     * dimension.
     *
     * @param   source  source pixels
     * @param   targetWidth  target width (&gt; 0)
     * @param   targetHeight  target height (&gt; 0)
     * @return  a new buffer of the target dimension
     * @throws  IllegalArgumentException  if a target dimension is not positive
     */
    public static PixelBuffer resize(PixelBuffer source,
                                     int targetWidth,
                                     int targetHeight) {
        if (source.width() == targetWidth
                && source.height() == targetHeight) {
            return source.copy();
        }
        return PixelBuffer.of(resize(source.toImage(), targetWidth, targetHeight));
    }

    public static BufferedImage resize(BufferedImage image,
                                       int targetWidth,
                                       int targetHeight) {
        return resize(image, targetWidth, targetHeight, LINEAR_RGB);
    }

    public static BufferedImage resize(BufferedImage image,
                                       int targetWidth,
                                       int targetHeight,
                                       boolean linearRGB) {
        if (targetWidth <= 0 || targetHeight <= 0) {
            throw new IllegalArgumentException("Invalid target size: "
                    + targetWidth + "x" + targetHeight);
        }
        if (!linearRGB) {
            return resampleSteps(image, targetWidth, targetHeight);
        }
        BufferedImage scaled = resampleSteps(convertToLinearRGB(image),
                                             targetWidth, targetHeight);
        scaled = overrideColorSpace(scaled, CS_LINEAR_RGB);
        return convertToDefaultRGB(scaled);
    }

    private static BufferedImage resampleSteps(BufferedImage image,
                                               int targetWidth,
                                               int targetHeight) {
        BufferedImage source = image;
        int doubleWidth = targetWidth * 2;
        int doubleHeight = targetHeight * 2;
        if (doubleWidth < source.getWidth()
                || doubleHeight < source.getHeight()) {
            int tempWidth = doubleWidth < source.getWidth() ? doubleWidth : targetWidth;
            int tempHeight = doubleHeight < source.getHeight() ? doubleHeight : targetHeight;
            source = resampleSteps(source, tempWidth, tempHeight);
        }

        BufferedImage scaled = newBufferedImage(targetWidth, targetHeight,
                getDefaultRGB(source.getColorModel().hasAlpha()));
        Graphics2D g = scaled.createGraphics();
        try {
            g.addRenderingHints(defaultHints);
            g.drawImage(source, 0, 0, targetWidth, targetHeight, null);
        } finally {
            g.dispose();
        }
        return scaled;
    }

    private static BufferedImage convertToLinearRGB(BufferedImage image) {
        BufferedImage target =
                newBufferedImage(image.getWidth(), image.getHeight(),
                                 getLinearRGB(image.getColorModel().hasAlpha()));
        return overrideColorSpace(colorConvertOp.get().filter(image, target),
                                  CS_sRGB); // XXX: Workaround
    }

    private static BufferedImage convertToDefaultRGB(BufferedImage image) {
        BufferedImage target = newBufferedImage(image.getWidth(), image.getHeight(),
                getDefaultRGB(image.getColorModel().hasAlpha()));
        return colorConvertOp.get().filter(image, target);
    }

    private static final ThreadLocal<ColorConvertOp>
            colorConvertOp = ThreadLocal.withInitial(() -> new ColorConvertOp(defaultHints));

    private static BufferedImage newBufferedImage(int width, int height, ColorModel cm) {
        return new BufferedImage(cm,
                cm.createCompatibleWritableRaster(width, height),
                cm.isAlphaPremultiplied(), null);
    }

    private static BufferedImage overrideColorSpace(BufferedImage source, ColorSpace cspace) {
        ColorModel scm = source.getColorModel();
        if (!(scm instanceof ComponentColorModel)) {
            throw new IllegalArgumentException("source.colorModel is not ComponentColorModel");
        }
        ColorModel cm = new ComponentColorModel(cspace, null, scm.hasAlpha(),
                scm.isAlphaPremultiplied(), scm.getTransparency(), scm.getTransferType());
        return new BufferedImage(cm, source.getRaster(), cm.isAlphaPremultiplied(), null);
    }

    private static ColorModel getDefaultRGB(boolean hasAlpha) {
        return hasAlpha ? CM_DEFAULT_ARGB
                        : CM_DEFAULT_RGB;
    }

    private static ColorModel getLinearRGB(boolean hasAlpha) {
        return hasAlpha ? CM_LINEAR_ARGB
                        : CM_LINEAR_RGB;
    }

    private static ColorModel newColorModel(ColorSpace cspace, boolean hasAlpha, int dataType) {
        return new ComponentColorModel(cspace, hasAlpha, false,
                hasAlpha ? Transparency.TRANSLUCENT : Transparency.OPAQUE, dataType);
    }

    private static final ColorSpace
            CS_sRGB = ColorSpace.getInstance(ColorSpace.CS_sRGB),
            CS_LINEAR_RGB = ColorSpace.getInstance(ColorSpace.CS_LINEAR_RGB);

    private static final ColorModel
            CM_DEFAULT_RGB = newColorModel(CS_sRGB, false, DataBuffer.TYPE_BYTE),
            CM_DEFAULT_ARGB = newColorModel(CS_sRGB, true, DataBuffer.TYPE_BYTE),
            CM_LINEAR_RGB = newColorModel(CS_LINEAR_RGB, false, DataBuffer.TYPE_BYTE),
            CM_LINEAR_ARGB = newColorModel(CS_LINEAR_RGB, true, DataBuffer.TYPE_BYTE);

}
