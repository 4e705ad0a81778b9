/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.gearbox.spritegen.process;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Logger;

import io.github.gearbox.awt.PixelBuffer;

/**
 * Composes multi-resolution (mipmap) icons.  The source is rendered at
 * 64, 32, 16, and 8 px into a single 120x64 atlas, left to right, and a
 * drop shadow is applied over the result.
 * <pre>
 * <code>    0                               64              96      112  120
 *     +-------------------------------+---------------+-------+---+
 *     |                               |      32       |  16   | 8 |
 *     |              64               +---------------+-------+---+
 *     |                               |
 *     +-------------------------------+</code></pre>
 */
public class IconAtlasComposer {

    private static final Logger log = Logger.getLogger(IconAtlasComposer.class.getName());

    public static final int WIDTH = 120;
    public static final int HEIGHT = 64;

    private static final int[] RESOLUTIONS = { 64, 32, 16, 8 };
    private static final int[] POSITIONS = { 0, 64, 96, 112 };


    /**
     * Placement of a single resolution in the atlas.
     */
    public static final class Layer {

        public final int resolution;
        /** Inset keeping room for the shadow blur. */
        public final int padding;
        public final int x;
        public final int y;

        Layer(int resolution, int padding, int x, int y) {
            this.resolution = resolution;
            this.padding = padding;
            this.x = x;
            this.y = y;
        }

        public int tileSize() {
            return resolution - 2 * padding;
        }

        @Override
        public int hashCode() {
            return Objects.hash(resolution, padding, x, y);
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) {
                return true;
            }
            if (obj instanceof Layer) {
                Layer other = (Layer) obj;
                return resolution == other.resolution
                        && padding == other.padding
                        && x == other.x
                        && y == other.y;
            }
            return false;
        }

        @Override
        public String toString() {
            return resolution + "x" + resolution + " at " + x + "," + y
                    + " (padding " + padding + ")";
        }

    } // class Layer


    private final ShadowSpec shadow;

    private final List<Layer> layout;

    public IconAtlasComposer() {
        this(ShadowSpec.ICON);
    }

    public IconAtlasComposer(ShadowSpec shadow) {
        this.shadow = Objects.requireNonNull(shadow);

        List<Layer> layers = new ArrayList<>(RESOLUTIONS.length);
        for (int i = 0; i < RESOLUTIONS.length; i++) {
            int resolution = RESOLUTIONS[i];
            int pad = Math.min(shadow.blurRadius, resolution / 4);
            layers.add(new Layer(resolution, pad, POSITIONS[i] + pad, pad));
        }
        this.layout = Collections.unmodifiableList(layers);
    }

    public ShadowSpec shadow() {
        return shadow;
    }

    /**
     * {@return the atlas layers, largest first}
     */
    public List<Layer> layout() {
        return layout;
    }

    public PixelBuffer composeAtlas(PixelBuffer source) {
        return composeAtlas(source, layer -> {/* no-op */});
    }

    /**
     * Trims the source, and draws it resized to each of the layer tile
     * sizes, centered in a square tile.  Every layer is resized from the
     * trimmed source, not from the previous layer.
     *
     * @param   source  icon artwork
     * @param   progress  notified after each layer is drawn
     * @return  a new {@value #WIDTH}x{@value #HEIGHT} atlas
     * @throws  EmptyImageException  if the source is entirely transparent
     */
    public PixelBuffer composeAtlas(PixelBuffer source, Consumer<? super Layer> progress) {
        PixelBuffer trimmed = AlphaTrimmer.trim(source);
        PixelBuffer atlas = new PixelBuffer(WIDTH, HEIGHT);
        for (Layer layer : layout) {
            PixelBuffer tile = AspectResizer.resize(trimmed.copy(),
                    ResizeSpec.fit(layer.tileSize()).withAnchor(Anchor.CENTER));
            log.fine(() -> "Tile " + tile.width() + "x" + tile.height() + " -> " + layer);
            atlas.drawOver(tile, layer.x, layer.y);
            progress.accept(layer);
        }
        DropShadowCompositor.applyDropShadow(atlas, shadow);
        return atlas;
    }

}
