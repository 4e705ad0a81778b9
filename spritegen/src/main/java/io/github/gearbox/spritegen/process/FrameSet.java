/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.gearbox.spritegen.process;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.function.UnaryOperator;

import io.github.gearbox.awt.PixelBuffer;

/**
 * Ordered sequence of same-size frames (numbered variants).  The order
 * determines the left-to-right placement in a sprite sheet.
 */
public final class FrameSet implements Iterable<PixelBuffer> {

    private final List<PixelBuffer> frames;

    private FrameSet(List<PixelBuffer> frames) {
        this.frames = frames;
    }

    /**
     * @param   frames  one or more frames of identical dimension
     * @return  a new frame set
     * @throws  IllegalArgumentException  if {@code frames} is empty
     * @throws  DimensionMismatchException  if frame dimensions differ
     */
    public static FrameSet of(List<PixelBuffer> frames) {
        if (frames.isEmpty()) {
            throw new IllegalArgumentException("No frames");
        }
        PixelBuffer first = frames.get(0);
        for (int i = 1; i < frames.size(); i++) {
            PixelBuffer frame = frames.get(i);
            if (frame.width() != first.width()
                    || frame.height() != first.height()) {
                throw new DimensionMismatchException("Frame #" + (i + 1) + " ("
                        + frame.width() + "x" + frame.height() + ") differs from frame #1 ("
                        + first.width() + "x" + first.height() + ")");
            }
        }
        return new FrameSet(Collections.unmodifiableList(new ArrayList<>(frames)));
    }

    public static FrameSet of(PixelBuffer... frames) {
        return of(List.of(frames));
    }

    public int size() {
        return frames.size();
    }

    public PixelBuffer get(int index) {
        return frames.get(index);
    }

    public int frameWidth() {
        return frames.get(0).width();
    }

    public int frameHeight() {
        return frames.get(0).height();
    }

    /**
     * Applies the given transformation to each of the frames.
     *
     * @param   transform  frame transformation
     * @return  a new frame set with the transformed frames, in the same order
     * @throws  DimensionMismatchException  if the transformed frames differ
     *          in size
     */
    public FrameSet map(UnaryOperator<PixelBuffer> transform) {
        List<PixelBuffer> result = new ArrayList<>(frames.size());
        for (PixelBuffer frame : frames) {
            result.add(transform.apply(frame));
        }
        return of(result);
    }

    @Override
    public Iterator<PixelBuffer> iterator() {
        return frames.iterator();
    }

    @Override
    public String toString() {
        return "FrameSet(" + frames.size() + " x " + frameWidth() + "x" + frameHeight() + ")";
    }

}
