/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.gearbox.spritegen.cli;

import static io.github.gearbox.spritegen.Command.exitMessage;
import static io.github.gearbox.spritegen.Command.printMessage;

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
import io.github.gearbox.spritegen.internal.BatchQueue;
import io.github.gearbox.spritegen.process.AlphaTrimmer;
import io.github.gearbox.spritegen.process.IconAtlasComposer;
import io.github.gearbox.spritegen.process.ShadowSpec;

/**
 * Generates mipmap icon atlases.  Every texture is processed on its own,
 * and a failing texture doesn't stop the rest.
 */
public class IconCommand {

    private static final Logger log = Logger.getLogger(IconCommand.class.getName());

    /** Trimmed width/height difference above which the icon gets distorted. */
    static final int SQUARE_TOLERANCE = 10;

    private final IconAtlasComposer composer;

    private final boolean metadata;

    IconCommand(ShadowSpec shadow, boolean metadata) {
        this.composer = new IconAtlasComposer(shadow);
        this.metadata = metadata;
    }

    ProcessingReport process(Path texture, ProgressOutput progress) throws IOException {
        TextureFiles.requireExisting("Texture", texture);
        Path outputFile = TextureFiles.outputFile(texture);
        ProcessingReport report = new ProcessingReport(texture, outputFile);

        PixelBuffer image = ImageFiles.read(texture);
        progress.push("Loaded image: " + texture
                + " (" + image.width() + "x" + image.height() + ")");

        image = AlphaTrimmer.trim(image);
        progress.next("Trimmed whitespace, cropped to: "
                + image.width() + "x" + image.height());
        int difference = Math.abs(image.width() - image.height());
        if (difference > SQUARE_TOLERANCE) {
            progress.next("Warning: The trimmed image is not square (difference: "
                    + difference + "px). The icon may not appear as expected.");
        }

        PixelBuffer atlas = composer.composeAtlas(image, layer -> {
            progress.next("Icon layer: " + layer);
            report.addLayer(layer);
        });
        log.fine(() -> "Drop shadow: " + composer.shadow());
        report.width = atlas.width();
        report.height = atlas.height();
        report.frameWidth = atlas.width();
        report.frameHeight = atlas.height();

        ImageFiles.writePNG(atlas, outputFile);
        progress.next(outputFile);
        if (metadata) {
            Path metadataFile = TextureFiles.metadataFile(texture);
            report.write(metadataFile);
            progress.next(metadataFile);
        }
        progress.pop();
        return report;
    }

    /**
     * Processes all textures concurrently.  Progress of each texture is
     * printed as a whole, once it completes.
     *
     * @param   textures  icon textures
     * @param   out  progress output
     * @return  failures, empty if all textures were processed successfully
     * @throws  InterruptedException  if interrupted while waiting
     */
    List<BatchQueue.Failure> processAll(List<Path> textures, PrintStream out)
            throws InterruptedException {
        BatchQueue queue = new BatchQueue();
        for (Path texture : textures) {
            queue.submit(texture.toString(), () -> {
                ProgressOutput progress = ProgressOutput.buffered();
                try {
                    process(texture, progress);
                } finally {
                    progress.finish();
                    progress.flushTo(out);
                }
            });
        }
        return queue.await();
    }

    public static void main(String... args) throws Exception {
        CommandArgs cmdArgs;
        try {
            cmdArgs = new CommandArgs(args);
        } catch (ArgumentException e) {
            exitMessage(1, CommandArgs::printHelp, "Error: ", e);
            return;
        }

        List<BatchQueue.Failure> failures = new IconCommand(cmdArgs.shadow, cmdArgs.metadata)
                                            .processAll(cmdArgs.textures, System.out);
        if (!failures.isEmpty()) {
            for (BatchQueue.Failure item : failures) {
                printMessage(System.err, "Error: ", item.name, ": ", item.error);
            }
            exitMessage(2, failures.size() + " of "
                    + cmdArgs.textures.size() + " texture(s) failed");
        }
    }


    static class CommandArgs {

        final List<Path> textures;
        ShadowSpec shadow = ShadowSpec.ICON;
        boolean metadata;

        CommandArgs(String... args) {
            CommandLine cmd = CommandLine.ofUnixStyle()
                    .acceptOption("--shadow", v -> shadow = v,
                                  v -> ShadowSpec.decode(v, ShadowSpec.ICON))
                    .acceptFlag("--metadata", () -> metadata = true)
                    .parseOptions(args);

            List<Path> files = new ArrayList<>();
            for (String path : cmd.arguments()) {
                files.add(Path.of(path));
            }
            if (files.isEmpty())
                throw new ArgumentException("Specify one or more textures");

            this.textures = Collections.unmodifiableList(files);
        }

        public static void printHelp(PrintStream out) {
            out.println("USAGE: icon [--shadow=<blur>[,<dx>[,<dy>[,<opacity>[,<color>]]]]]"
                    + " [--metadata] <texture-file>...");
        }

    } // class CommandArgs


}
