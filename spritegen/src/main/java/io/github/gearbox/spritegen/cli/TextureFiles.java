/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.gearbox.spritegen.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Texture file naming conventions:
 * <pre>
 * <code>    gear.png               source texture
 *     gear-variant1.png      numbered variants (sprite sheet frames)
 *     gear-variant2.png
 *     gear-shadow.png        shadow texture
 *     gear-processed.png     processing output</code></pre>
 */
public final class TextureFiles {

    static final String VARIANT = "variant";
    static final String SHADOW_SUFFIX = "-shadow";
    static final String OUTPUT_SUFFIX = "-processed";

    private TextureFiles() {/* no instances */}

    static String baseName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return (dot > 0) ? name.substring(0, dot) : name;
    }

    static String extension(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return (dot > 0) ? name.substring(dot) : "";
    }

    /**
     * Expands a texture into numbered variant files:
     * {@code ("gear.png", 3) -> ["gear-variant1.png", "gear-variant2.png",
     * "gear-variant3.png"]}.  The {@code -variant} suffix is not added when
     * the base name already contains it: {@code "gear-variant.png"} expands
     * to {@code "gear-variant1.png"}, while {@code "gearvariant.png"} expands
     * to {@code "gearvariant-variant1.png"}.
     *
     * @param   texture  base texture file
     * @param   count  number of variants
     * @return  the variant files, in number order
     * @throws  MissingCompanionFileException  if a variant file doesn't exist
     */
    public static List<Path> expandVariants(Path texture, int count)
            throws MissingCompanionFileException {
        if (count < 1) {
            throw new IllegalArgumentException("Variant count must be positive: " + count);
        }
        String baseName = baseName(texture);
        if (!baseName.contains("-" + VARIANT)) {
            baseName += "-" + VARIANT;
        }
        String extension = extension(texture);
        List<Path> variants = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            variants.add(requireExisting("Variant",
                    texture.resolveSibling(baseName + i + extension)));
        }
        return variants;
    }

    /**
     * Infers the shadow file for a texture: {@code "gear.png" ->
     * "gear-shadow.png"}.  A {@code variant} part of the base name is not
     * carried over: {@code "gear-variant.png" -> "gear-shadow.png"}.
     *
     * @param   texture  source texture
     * @return  the shadow texture file
     * @throws  MissingCompanionFileException  if the shadow file doesn't exist
     */
    public static Path inferShadow(Path texture) throws MissingCompanionFileException {
        String baseName = baseName(texture)
                .replace("-" + VARIANT, "").replace(VARIANT, "");
        return requireExisting("Shadow", texture
                .resolveSibling(baseName + SHADOW_SUFFIX + extension(texture)));
    }

    public static Path requireExisting(String kind, Path file)
            throws MissingCompanionFileException {
        if (!Files.isRegularFile(file)) {
            throw new MissingCompanionFileException(kind, file);
        }
        return file;
    }

    /**
     * {@return the output file for the given source: {@code "gear.png" ->
     * "gear-processed.png"}}
     *
     * @param   source  source texture
     */
    public static Path outputFile(Path source) {
        return source.resolveSibling(baseName(source) + OUTPUT_SUFFIX + ".png");
    }

    /**
     * {@return the metadata file for the given source: {@code "gear.png" ->
     * "gear-processed.json"}}
     *
     * @param   source  source texture
     */
    public static Path metadataFile(Path source) {
        return source.resolveSibling(baseName(source) + OUTPUT_SUFFIX + ".json");
    }

}
