/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.gearbox.spritegen.process;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import io.github.gearbox.awt.PixelBuffer;

public class DropShadowCompositorTest {

    private static final int RED = 0xFFFF0000;
    private static final int SHADOW = 0x80000000;

    private static PixelBuffer opaqueSquare() {
        return opaqueSquare(16);
    }

    private static PixelBuffer opaqueSquare(int canvasSize) {
        PixelBuffer image = new PixelBuffer(canvasSize, canvasSize);
        for (int y = 0; y < 10; y++) {
            for (int x = 0; x < 10; x++) {
                image.setRGB(x, y, RED);
            }
        }
        return image;
    }

    @Test
    void hardShadow() {
        PixelBuffer image = opaqueSquare();

        DropShadowCompositor.applyDropShadow(image, 2, 2, 0, SHADOW);

        for (int y = 0; y < 10; y++) {
            for (int x = 0; x < 10; x++) {
                assertThat(image.getRGB(x, y)).as("(%d, %d)", x, y).isEqualTo(RED);
            }
        }
        assertThat(image.getRGB(11, 11)).isEqualTo(SHADOW);
        assertThat(image.getRGB(10, 2)).isEqualTo(SHADOW);
        assertThat(image.getRGB(2, 10)).isEqualTo(SHADOW);
        assertThat(image.getRGB(10, 1)).isZero();
        assertThat(image.getRGB(1, 10)).isZero();
        assertThat(image.getRGB(12, 12)).isZero();
    }

    @Test
    void shadowAlphaFollowsSource() {
        PixelBuffer image = new PixelBuffer(4, 4);
        image.setRGB(0, 0, 0x80FFFFFF);

        DropShadowCompositor.applyDropShadow(image, 1, 1, 0, 0xFF000000);

        assertThat(image.getRGB(1, 1)).isEqualTo(0x80000000);
    }

    @Test
    void shadowClippedToCanvas() {
        PixelBuffer image = opaqueSquare();

        DropShadowCompositor.applyDropShadow(image, 20, 20, 0, SHADOW);

        assertThat(image).isEqualTo(opaqueSquare());
    }

    @Test
    void blurredShadow() {
        PixelBuffer image = opaqueSquare(24);

        DropShadowCompositor.applyDropShadow(image, 2, 2, 2, SHADOW);

        // Hard shadow edge at x = 11
        assertThat(image.getRGB(5, 5)).isEqualTo(RED);
        assertThat(image.alpha(14, 6)).as("spread 3 px").isPositive();
        assertThat(image.alpha(15, 6)).as("spread 4 px").isPositive();
        assertThat(image.alpha(14, 6)).isLessThan(image.alpha(12, 6));
        assertThat(image.alpha(16, 6)).isLessThan(image.alpha(14, 6));
        assertThat(image.alpha(23, 23)).isZero();
    }

    @Test
    void shadowSpec() {
        PixelBuffer image = opaqueSquare();

        DropShadowCompositor.applyDropShadow(image, new ShadowSpec(2, 2, 0, SHADOW));

        assertThat(image.getRGB(11, 11)).isEqualTo(SHADOW);
    }

    @Test
    void negativeBlur() {
        assertThatThrownBy(() -> DropShadowCompositor
                .applyDropShadow(opaqueSquare(), 0, 0, -1, SHADOW))
                .isInstanceOf(IllegalArgumentException.class);
    }

}
