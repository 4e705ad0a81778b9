/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.gearbox.awt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.awt.Rectangle;
import java.awt.image.BufferedImage;

import org.junit.jupiter.api.Test;

public class PixelBufferTest {

    private static final int RED = 0xFFFF0000;
    private static final int BLUE = 0xFF0000FF;

    @Test
    void newBufferIsTransparent() {
        PixelBuffer buffer = new PixelBuffer(3, 2);

        assertThat(buffer.width()).isEqualTo(3);
        assertThat(buffer.height()).isEqualTo(2);
        assertThat(buffer.alpha(2, 1)).isZero();
    }

    @Test
    void negativeDimension() {
        assertThatThrownBy(() -> new PixelBuffer(-1, 2))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void pixelDataLengthMismatch() {
        assertThatThrownBy(() -> PixelBuffer.of(2, 2, RED, RED, RED))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void outOfBoundsAccess() {
        PixelBuffer buffer = new PixelBuffer(2, 2);

        assertThatThrownBy(() -> buffer.getRGB(2, 0))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void imageConversion() {
        BufferedImage image = new BufferedImage(2, 1, BufferedImage.TYPE_INT_ARGB);
        image.setRGB(0, 0, RED);
        image.setRGB(1, 0, 0x80FFFFFF);

        PixelBuffer buffer = PixelBuffer.of(image);

        assertThat(buffer).isEqualTo(PixelBuffer.of(2, 1, RED, 0x80FFFFFF));
        assertThat(PixelBuffer.of(buffer.toImage())).isEqualTo(buffer);
    }

    @Test
    void emptyBufferToImage() {
        assertThatThrownBy(() -> new PixelBuffer(0, 5).toImage())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void crop() {
        PixelBuffer buffer = PixelBuffer.of(3, 2,
                0, RED, 0,
                0, BLUE, 0);

        PixelBuffer cropped = buffer.crop(new Rectangle(1, 0, 1, 2));

        assertThat(cropped).isEqualTo(PixelBuffer.of(1, 2, RED, BLUE));
    }

    @Test
    void cropOutside() {
        PixelBuffer buffer = new PixelBuffer(3, 2);

        assertThatThrownBy(() -> buffer.crop(new Rectangle(2, 0, 2, 2)))
                .isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void copyFromClipsSource() {
        PixelBuffer target = new PixelBuffer(3, 3);
        PixelBuffer source = PixelBuffer.of(2, 2, RED, RED, RED, RED);

        target.copyFrom(source, 2, 2);
        target.copyFrom(source, 5, 5);

        assertThat(target.getRGB(2, 2)).isEqualTo(RED);
        assertThat(target.getRGB(1, 1)).isZero();
    }

    @Test
    void copyFromReplacesPixels() {
        PixelBuffer target = PixelBuffer.of(1, 1, RED);

        target.copyFrom(new PixelBuffer(1, 1), 0, 0);

        assertThat(target.getRGB(0, 0)).isZero();
    }

    @Test
    void drawOverKeepsBackground() {
        PixelBuffer target = PixelBuffer.of(2, 1, RED, RED);

        target.drawOver(PixelBuffer.of(2, 1, 0, BLUE), 0, 0);

        assertThat(target).isEqualTo(PixelBuffer.of(2, 1, RED, BLUE));
    }

    @Test
    void overOpaqueBackground() {
        int result = PixelBuffer.over(0x800000FF, RED);

        assertThat(PixelBuffer.alpha(result)).isEqualTo(0xFF);
        assertThat(PixelBuffer.red(result)).isEqualTo(127);
        assertThat(PixelBuffer.blue(result)).isEqualTo(128);
    }

    @Test
    void overTransparentBackground() {
        assertThat(PixelBuffer.over(0x800000FF, 0)).isEqualTo(0x800000FF);
    }

    @Test
    void overTranslucentLayers() {
        int result = PixelBuffer.over(0x80000000, 0x80000000);

        assertThat(PixelBuffer.alpha(result)).isEqualTo(192);
    }

    @Test
    void argbClamped() {
        assertThat(PixelBuffer.argb(300, -5, 128, 255)).isEqualTo(0xFF0080FF);
    }

}
