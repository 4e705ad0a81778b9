/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.gearbox.spritegen.cli;

import static io.github.gearbox.spritegen.Command.exitMessage;
import static io.github.gearbox.spritegen.process.AlignmentSolver.TILE_SIZE;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

import io.github.gearbox.awt.PixelBuffer;
import io.github.gearbox.cli.CommandLine;
import io.github.gearbox.cli.CommandLine.ArgumentException;

import io.github.gearbox.spritegen.ProgressOutput;
import io.github.gearbox.spritegen.process.AlignmentSolver;
import io.github.gearbox.spritegen.process.AlphaTrimmer;
import io.github.gearbox.spritegen.process.Anchor;
import io.github.gearbox.spritegen.process.AspectResizer;
import io.github.gearbox.spritegen.process.DimensionMismatchException;
import io.github.gearbox.spritegen.process.FrameSet;
import io.github.gearbox.spritegen.process.Offset;
import io.github.gearbox.spritegen.process.ResizeSpec;
import io.github.gearbox.spritegen.process.SpriteSheetComposer;

/**
 * Prepares entity pictures: trims and fits the texture(s) into a 64 px
 * tile, optionally composing variants into a single-row sprite sheet, and
 * processes the matching shadow texture with the same ratio.
 * <p>
 * Frames are trimmed to the union of their content bounds so they stay of
 * uniform size.  Only source textures of differing dimensions fail with
 * {@link DimensionMismatchException}.
 */
public class PictureCommand {

    private static final Logger log = Logger.getLogger(PictureCommand.class.getName());

    private final ProgressOutput progress;

    PictureCommand(ProgressOutput progress) {
        this.progress = progress;
    }

    ProcessingReport process(CommandArgs args) throws IOException {
        // Resolve all files before any pixel work.
        List<Path> textures;
        if (args.variants > 1) {
            textures = TextureFiles.expandVariants(args.textures.get(0), args.variants);
        } else {
            textures = new ArrayList<>(args.textures.size());
            for (Path file : args.textures) {
                textures.add(TextureFiles.requireExisting("Texture", file));
            }
        }
        Path shadowFile = null;
        if (args.inferShadow) {
            shadowFile = TextureFiles.inferShadow(args.textures.get(0));
        } else if (args.shadowFile != null) {
            shadowFile = TextureFiles.requireExisting("Shadow", args.shadowFile);
        }

        Path outputFile = TextureFiles.outputFile(textures.get(0));
        ProcessingReport report = new ProcessingReport(textures.get(0), outputFile);
        report.alignment = args.alignment;

        List<PixelBuffer> images = new ArrayList<>(textures.size());
        for (Path file : textures) {
            PixelBuffer image = ImageFiles.read(file);
            progress.next("Loaded image: " + file + " (" + dimensions(image) + ")");
            images.add(image);
        }
        PixelBuffer shadow = null;
        if (shadowFile != null) {
            shadow = ImageFiles.read(shadowFile);
            progress.next("Loaded shadow: " + shadowFile + " (" + dimensions(shadow) + ")");
        }

        FrameSet frames = AlphaTrimmer.trim(FrameSet.of(images));
        double imageScale = (double) TILE_SIZE
                / Math.max(frames.frameWidth(), frames.frameHeight());
        progress.next("Trimmed whitespace, cropped to: "
                + frames.frameWidth() + "x" + frames.frameHeight());

        ResizeSpec imageSpec = ResizeSpec.fit(TILE_SIZE).withScale(args.scale);
        frames = frames.map(frame -> AspectResizer.resize(frame, imageSpec));
        PixelBuffer sprite = frames.get(0);
        progress.next("Resized to: " + dimensions(sprite));

        if (shadow != null) {
            shadow = AlphaTrimmer.trim(shadow);
            progress.next("Trimmed whitespace, cropped shadow to: " + dimensions(shadow));

            double targetSize = Math.max(shadow.width(), shadow.height()) * imageScale;
            log.fine(() -> "Shadow target size: " + targetSize);
            shadow = AspectResizer.resize(shadow,
                    ResizeSpec.fit(targetSize).withScale(args.scale));
            progress.next("Resized shadow to: " + dimensions(shadow));
        }

        PixelBuffer output;
        if (frames.size() > 1) {
            output = SpriteSheetComposer.compose(frames);
            progress.next("Sprite sheet: " + dimensions(output));
            progress.next("Individual sprite size: " + dimensions(sprite));
            progress.next("Variation count: " + frames.size());
            progress.next("Line length: " + frames.size());
            progress.next("Shadow repeat: " + frames.size());
        } else {
            output = sprite;
        }
        report.width = output.width();
        report.height = output.height();
        report.frames = frames.size();
        report.frameWidth = sprite.width();
        report.frameHeight = sprite.height();

        Offset offset = AlignmentSolver.suggestOffset(sprite, args.alignment);
        report.offset = offset;
        progress.next("Using alignment: " + args.alignment);
        progress.next("Suggested offset for image alignment: " + offset);
        if (shadow != null) {
            report.shadowOffset = AlignmentSolver.suggestShadowOffset(sprite, offset, shadow);
            progress.next("Suggested offset for shadow alignment: " + report.shadowOffset);
        }

        ImageFiles.writePNG(output, outputFile);
        progress.next(outputFile);
        if (shadow != null) {
            Path shadowOutput = TextureFiles.outputFile(shadowFile);
            ImageFiles.writePNG(shadow, shadowOutput);
            progress.next(shadowOutput);
            report.shadowSource = String.valueOf(shadowFile.getFileName());
            report.shadowOutput = String.valueOf(shadowOutput.getFileName());
            report.shadowWidth = shadow.width();
            report.shadowHeight = shadow.height();
        }
        if (args.metadata) {
            Path metadataFile = TextureFiles.metadataFile(textures.get(0));
            report.write(metadataFile);
            progress.next(metadataFile);
        }
        return report;
    }

    private static String dimensions(PixelBuffer image) {
        return image.width() + "x" + image.height();
    }

    public static void main(String... args) throws Exception {
        CommandArgs cmdArgs;
        try {
            cmdArgs = new CommandArgs(args);
        } catch (ArgumentException e) {
            exitMessage(1, CommandArgs::printHelp, "Error: ", e);
            return;
        }

        ProgressOutput progress = ProgressOutput.of(System.out);
        try {
            new PictureCommand(progress).process(cmdArgs);
        } catch (IOException | RuntimeException e) {
            progress.finish();
            exitMessage(2, "Error: ", e);
            return;
        }
        progress.finish();
    }


    static class CommandArgs {

        final List<Path> textures;
        Path shadowFile;
        boolean inferShadow;
        int variants = 1;
        double scale = 1.0;
        Anchor alignment = Anchor.TOP_LEFT;
        boolean metadata;

        CommandArgs(String... args) {
            List<Path> files = new ArrayList<>();
            CommandLine cmd = CommandLine.ofUnixStyle()
                    .acceptOptionList("--textures", files::add, Path::of)
                    .acceptOptionalArg("--shadow", val -> {
                        inferShadow = val.isEmpty();
                        shadowFile = val.isEmpty() ? null : Path.of(val);
                    })
                    .acceptOption("--variants", v -> variants = v, Integer::valueOf)
                    .acceptOption("--scale", v -> scale = v, Double::valueOf)
                    .acceptOption("--alignment", v -> alignment = v,
                                  AlignmentSolver::resolveAnchor)
                    .acceptFlag("--metadata", () -> metadata = true)
                    .parseOptions(args);

            for (String path : cmd.arguments()) {
                files.add(Path.of(path));
            }
            if (files.isEmpty())
                throw new ArgumentException("Specify one or more textures");

            if (variants < 1)
                throw ArgumentException.of("--variants", "must be positive: " + variants);

            if (variants > 1 && files.size() != 1)
                throw ArgumentException.of("--variants",
                        "requires exactly one texture, got " + files.size());

            if (!(scale > 0))
                throw ArgumentException.of("--scale", "must be positive: " + scale);

            this.textures = Collections.unmodifiableList(files);
        }

        public static void printHelp(PrintStream out) {
            out.println("USAGE: picture [--shadow[=<shadow-file>]]"
                    + " [--variants <count>] [--scale <factor>]"
                    + " [--alignment <alignment>] [--metadata]"
                    + " [--textures] <texture-file>...");
            out.println();
            out.println("<alignment>: center, top-left, bottom right, ..., or \"<x>,<y>\" in [0,1]");
        }

    } // class CommandArgs


}
