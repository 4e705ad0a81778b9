/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.gearbox.spritegen.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.io.IOException;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.github.gearbox.awt.PixelBuffer;
import io.github.gearbox.cli.CommandLine.ArgumentException;

import io.github.gearbox.spritegen.ProgressOutput;
import io.github.gearbox.spritegen.process.Anchor;
import io.github.gearbox.spritegen.process.DimensionMismatchException;
import io.github.gearbox.spritegen.process.EmptyImageException;
import io.github.gearbox.spritegen.process.Offset;

public class PictureCommandTest {

    @TempDir
    Path dir;

    private final ProgressOutput progress = ProgressOutput.buffered();

    private Path texture(String name, int width, int height,
                         int x, int y, int contentWidth, int contentHeight)
            throws IOException {
        PixelBuffer image = new PixelBuffer(width, height);
        for (int row = y; row < y + contentHeight; row++) {
            for (int col = x; col < x + contentWidth; col++) {
                image.setRGB(col, row, 0xFF8040C0);
            }
        }
        Path file = dir.resolve(name);
        ImageFiles.writePNG(image, file);
        return file;
    }

    private ProcessingReport process(String... args) throws IOException {
        return new PictureCommand(progress)
                .process(new PictureCommand.CommandArgs(args));
    }

    @Test
    void singleTexture() throws Exception {
        Path gear = texture("gear.png", 100, 50, 10, 5, 80, 40);

        ProcessingReport report = process(gear.toString());

        PixelBuffer output = ImageFiles.read(dir.resolve("gear-processed.png"));
        assertThat(output.width()).isEqualTo(64);
        assertThat(output.height()).isEqualTo(32);
        assertThat(report.frames()).isEqualTo(1);
        assertThat(report.alignment()).isEqualTo(Anchor.TOP_LEFT);
        assertThat(report.offset()).isEqualTo(new Offset(0, -8));
        assertThat(report.shadowOffset()).isNull();
        assertThat(progress.toString())
                .contains("Trimmed whitespace, cropped to: 80x40")
                .contains("Resized to: 64x32")
                .contains("Suggested offset for image alignment: (0, -8)");
    }

    @Test
    void scaleAndAlignment() throws Exception {
        Path gear = texture("gear.png", 40, 40, 0, 0, 40, 40);

        ProcessingReport report = process(gear.toString(),
                "--scale", "0.5", "--alignment", "bottom right");

        assertThat(report.width()).isEqualTo(32);
        assertThat(report.height()).isEqualTo(32);
        assertThat(report.alignment()).isEqualTo(new Anchor(1, 1));
        assertThat(report.offset()).isEqualTo(new Offset(8, 8));
    }

    @Test
    void inferredShadow() throws Exception {
        Path gear = texture("gear.png", 100, 50, 10, 5, 80, 40);
        texture("gear-shadow.png", 50, 20, 5, 5, 40, 10);

        ProcessingReport report = process("--shadow", gear.toString());

        PixelBuffer shadow = ImageFiles.read(dir.resolve("gear-shadow-processed.png"));
        assertThat(shadow.width()).isEqualTo(32);
        assertThat(shadow.height()).isEqualTo(8);
        assertThat(report.shadowOutput()).isEqualTo("gear-shadow-processed.png");
        // x: -8 (bottom-left) + 0 + 64 * 0.04; y: 14 (bottom-left) + 4 - 16 + 1
        assertThat(report.shadowOffset().x).isCloseTo(-5.44, within(1e-9));
        assertThat(report.shadowOffset().y).isCloseTo(3, within(1e-9));
    }

    @Test
    void explicitShadow() throws Exception {
        Path gear = texture("gear.png", 64, 64, 0, 0, 64, 64);
        Path shadow = texture("ground.png", 64, 32, 0, 0, 64, 32);

        ProcessingReport report = process("--shadow=" + shadow, gear.toString());

        assertThat(report.shadowOutput()).isEqualTo("ground-processed.png");
        assertThat(report.shadowWidth()).isEqualTo(64);
        assertThat(report.shadowHeight()).isEqualTo(32);
    }

    @Test
    void missingShadow() throws Exception {
        Path gear = texture("gear.png", 10, 10, 0, 0, 10, 10);

        assertThatThrownBy(() -> process("--shadow", gear.toString()))
                .isInstanceOf(MissingCompanionFileException.class)
                .hasMessageContaining("gear-shadow.png");
        assertThat(dir.resolve("gear-processed.png")).doesNotExist();
    }

    @Test
    void spriteSheetFromVariants() throws Exception {
        texture("gear-variant1.png", 20, 20, 5, 5, 10, 10);
        texture("gear-variant2.png", 20, 20, 4, 4, 10, 10);
        texture("gear-variant3.png", 20, 20, 6, 6, 10, 10);

        ProcessingReport report = process("--variants", "3", dir.resolve("gear.png").toString());

        assertThat(report.frames()).isEqualTo(3);
        assertThat(report.frameWidth()).isEqualTo(64);
        assertThat(report.frameHeight()).isEqualTo(64);
        assertThat(report.width()).isEqualTo(192);
        assertThat(report.height()).isEqualTo(64);
        assertThat(dir.resolve("gear-variant1-processed.png")).exists();
        assertThat(progress.toString())
                .contains("Individual sprite size: 64x64")
                .contains("Variation count: 3")
                .contains("Shadow repeat: 3");
    }

    @Test
    void missingVariant() throws Exception {
        texture("gear-variant1.png", 20, 20, 5, 5, 10, 10);

        assertThatThrownBy(() -> process("--variants", "2", dir.resolve("gear.png").toString()))
                .isInstanceOf(MissingCompanionFileException.class)
                .hasMessageContaining("gear-variant2.png");
    }

    @Test
    void blankVariant() throws Exception {
        texture("gear-variant1.png", 20, 20, 5, 5, 10, 10);
        ImageFiles.writePNG(new PixelBuffer(20, 20), dir.resolve("gear-variant2.png"));
        texture("gear-variant3.png", 20, 20, 6, 6, 10, 10);

        assertThatThrownBy(() -> process("--variants", "3", dir.resolve("gear.png").toString()))
                .isInstanceOf(EmptyImageException.class)
                .hasMessageContaining("Frame #2 of 3");
        assertThat(dir.resolve("gear-variant1-processed.png")).doesNotExist();
    }

    @Test
    void texturesOfDifferentSize() throws Exception {
        Path first = texture("a.png", 20, 20, 0, 0, 20, 20);
        // Same content bounds, different canvas
        Path second = texture("b.png", 20, 24, 0, 0, 20, 20);

        assertThatThrownBy(() -> process("--textures", first.toString(), second.toString()))
                .isInstanceOf(DimensionMismatchException.class);
    }

    @Test
    void metadata() throws Exception {
        Path gear = texture("gear.png", 100, 50, 10, 5, 80, 40);

        process("--metadata", "--alignment=center", gear.toString());

        ProcessingReport report = ProcessingReport.read(dir.resolve("gear-processed.json"));
        assertThat(report.source()).isEqualTo("gear.png");
        assertThat(report.output()).isEqualTo("gear-processed.png");
        assertThat(report.width()).isEqualTo(64);
        assertThat(report.height()).isEqualTo(32);
        assertThat(report.alignment()).isEqualTo(Anchor.CENTER);
        assertThat(report.offset()).isEqualTo(Offset.ZERO);
    }

    @Test
    void variantsRequireSingleTexture() {
        assertThatThrownBy(() -> new PictureCommand.CommandArgs("--variants", "2", "a.png", "b.png"))
                .isInstanceOf(ArgumentException.class)
                .hasMessageContaining("exactly one texture");
    }

    @Test
    void texturesRequired() {
        assertThatThrownBy(() -> new PictureCommand.CommandArgs("--scale", "2"))
                .isInstanceOf(ArgumentException.class)
                .hasMessage("Specify one or more textures");
    }

    @Test
    void alignmentOutOfRange() {
        assertThatThrownBy(() -> new PictureCommand.CommandArgs("--alignment", "5,5", "a.png"))
                .isInstanceOf(ArgumentException.class)
                .hasMessageStartingWith("--alignment 5,5: ");
    }

    @Test
    void shadowOptionWithoutValue() {
        PictureCommand.CommandArgs args = new PictureCommand.CommandArgs("--shadow", "a.png");

        assertThat(args.inferShadow).isTrue();
        assertThat(args.shadowFile).isNull();
        assertThat(args.textures).containsExactly(Path.of("a.png"));
    }

}
