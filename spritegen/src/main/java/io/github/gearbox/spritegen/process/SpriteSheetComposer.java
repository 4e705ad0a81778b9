/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.gearbox.spritegen.process;

import java.util.List;

import io.github.gearbox.awt.PixelBuffer;

/**
 * Lays out variant frames side by side, in a single row.
 */
public final class SpriteSheetComposer {

    private SpriteSheetComposer() {/* no instances */}

    /**
     * @param   frames  frames of identical dimension
     * @return  a new {@code (N * width) x height} image
     * @throws  DimensionMismatchException  if frame dimensions differ
     * @see     #compose(FrameSet)
     */
    public static PixelBuffer compose(List<PixelBuffer> frames) {
        return compose(FrameSet.of(frames));
    }

    /**
     * Copies frame <var>i</var> at horizontal position
     * <code><var>i</var> * width</code>, in frame order.
     *
     * @param   frames  frames to compose
     * @return  a new {@code (N * width) x height} image
     */
    public static PixelBuffer compose(FrameSet frames) {
        int frameWidth = frames.frameWidth();
        PixelBuffer sheet = new PixelBuffer(
                Math.multiplyExact(frames.size(), frameWidth), frames.frameHeight());
        for (int i = 0; i < frames.size(); i++) {
            sheet.copyFrom(frames.get(i), i * frameWidth, 0);
        }
        return sheet;
    }

}
