/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.gearbox.spritegen.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

import java.awt.image.BufferedImage;

import javax.imageio.ImageIO;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import javax.imageio.stream.MemoryCacheImageOutputStream;

import io.github.gearbox.awt.PixelBuffer;

/**
 * Reads and writes {@link PixelBuffer}s using the Image I/O API.
 */
public final class ImageFiles {

    private static final ThreadLocal<ImageWriter> pngWriter = ThreadLocal.withInitial(() -> {
        Iterator<ImageWriter> iter = ImageIO.getImageWritersByFormatName("png");
        if (iter.hasNext()) {
            return iter.next();
        }
        throw new IllegalStateException("PNG image writer not registered/available");
    });

    private ImageFiles() {/* no instances */}

    /**
     * @param   file  image file in any format supported by Image I/O
     * @return  the decoded image pixels
     * @throws  IOException  if I/O error occurs, or the image format is not
     *          supported
     */
    public static PixelBuffer read(Path file) throws IOException {
        BufferedImage image;
        try (InputStream fin = Files.newInputStream(file)) {
            image = ImageIO.read(fin);
        }
        if (image == null) {
            throw new IOException("Unsupported image format: " + file);
        }
        return PixelBuffer.of(image);
    }

    public static void writePNG(PixelBuffer image, Path file) throws IOException {
        ImageWriter imageWriter = pngWriter.get();
        try (OutputStream fileOut = Files.newOutputStream(file);
                ImageOutputStream out = new MemoryCacheImageOutputStream(fileOut)) {
            imageWriter.setOutput(out);
            imageWriter.write(image.toImage());
        } finally {
            imageWriter.setOutput(null);
        }
    }

}
