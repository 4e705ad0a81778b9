/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.gearbox.spritegen.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.github.gearbox.awt.PixelBuffer;
import io.github.gearbox.cli.CommandLine.ArgumentException;

import io.github.gearbox.spritegen.ProgressOutput;
import io.github.gearbox.spritegen.internal.BatchQueue;
import io.github.gearbox.spritegen.process.EmptyImageException;
import io.github.gearbox.spritegen.process.ShadowSpec;

public class IconCommandTest {

    @TempDir
    Path dir;

    private Path texture(String name, int width, int height) throws IOException {
        PixelBuffer image = new PixelBuffer(width + 8, height + 8);
        for (int y = 4; y < height + 4; y++) {
            for (int x = 4; x < width + 4; x++) {
                image.setRGB(x, y, 0xFF30A030);
            }
        }
        Path file = dir.resolve(name);
        ImageFiles.writePNG(image, file);
        return file;
    }

    @Test
    void atlas() throws Exception {
        Path icon = texture("icon.png", 40, 40);
        ProgressOutput progress = ProgressOutput.buffered();

        ProcessingReport report = new IconCommand(ShadowSpec.ICON, false).process(icon, progress);

        PixelBuffer output = ImageFiles.read(dir.resolve("icon-processed.png"));
        assertThat(output.width()).isEqualTo(120);
        assertThat(output.height()).isEqualTo(64);
        assertThat(report.width()).isEqualTo(120);
        assertThat(report.layers()).containsExactly(
                "64x64 at 2,2 (padding 2)",
                "32x32 at 66,2 (padding 2)",
                "16x16 at 98,2 (padding 2)",
                "8x8 at 114,2 (padding 2)");
        assertThat(progress.toString())
                .contains("Trimmed whitespace, cropped to: 40x40")
                .doesNotContain("not square");
        assertThat(dir.resolve("icon-processed.json")).doesNotExist();
    }

    @Test
    void notSquareWarning() throws Exception {
        Path icon = texture("wide.png", 60, 20);
        ProgressOutput progress = ProgressOutput.buffered();

        new IconCommand(ShadowSpec.ICON, false).process(icon, progress);

        assertThat(progress.toString()).contains("not square (difference: 40px)");
    }

    @Test
    void metadata() throws Exception {
        Path icon = texture("icon.png", 16, 16);

        new IconCommand(ShadowSpec.ICON, true).process(icon, ProgressOutput.buffered());

        ProcessingReport report = ProcessingReport.read(dir.resolve("icon-processed.json"));
        assertThat(report.output()).isEqualTo("icon-processed.png");
        assertThat(report.height()).isEqualTo(64);
        assertThat(report.layers()).hasSize(4);
    }

    @Test
    void batchContinuesAfterFailure() throws Exception {
        Path good = texture("good.png", 20, 20);
        Path blank = dir.resolve("blank.png");
        ImageFiles.writePNG(new PixelBuffer(16, 16), blank);
        Path missing = dir.resolve("missing.png");
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();

        List<BatchQueue.Failure> failures;
        try (PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
            failures = new IconCommand(ShadowSpec.ICON, false)
                    .processAll(List.of(blank, good, missing), out);
        }

        assertThat(failures).hasSize(2);
        assertThat(failures).filteredOn(item -> item.name.equals(blank.toString()))
                .singleElement()
                .satisfies(item -> assertThat(item.error).isInstanceOf(EmptyImageException.class));
        assertThat(failures).filteredOn(item -> item.name.equals(missing.toString()))
                .singleElement()
                .satisfies(item -> assertThat(item.error).isInstanceOf(MissingCompanionFileException.class));
        assertThat(dir.resolve("good-processed.png")).exists();
        assertThat(buffer.toString(StandardCharsets.UTF_8)).contains("good-processed.png");
    }

    @Test
    void shadowOption() {
        IconCommand.CommandArgs args = new IconCommand.CommandArgs("--shadow=0,1", "icon.png");

        assertThat(args.shadow).isEqualTo(new ShadowSpec(1, 1, 0, 0x74000000));
        assertThat(args.textures).containsExactly(Path.of("icon.png"));
    }

    @Test
    void defaultShadow() {
        IconCommand.CommandArgs args = new IconCommand.CommandArgs("a.png", "b.png");

        assertThat(args.shadow).isSameAs(ShadowSpec.ICON);
        assertThat(args.textures).hasSize(2);
    }

    @Test
    void texturesRequired() {
        assertThatThrownBy(() -> new IconCommand.CommandArgs("--metadata"))
                .isInstanceOf(ArgumentException.class);
    }

    @Test
    void malformedShadow() {
        assertThatThrownBy(() -> new IconCommand.CommandArgs("--shadow=2,0,0,7", "a.png"))
                .isInstanceOf(ArgumentException.class)
                .hasMessageStartingWith("--shadow 2,0,0,7: ");
    }

}
