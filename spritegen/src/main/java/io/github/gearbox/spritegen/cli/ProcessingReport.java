/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.gearbox.spritegen.cli;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import io.github.gearbox.spritegen.process.Anchor;
import io.github.gearbox.spritegen.process.Offset;

/**
 * Outcome of processing a single input: output dimensions, suggested
 * offsets, and sprite sheet facts.  Written as a JSON sidecar with
 * {@code --metadata}.
 */
public class ProcessingReport {

    private static final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    String source;
    String output;
    int width;
    int height;

    int frames = 1;
    int frameWidth;
    int frameHeight;

    Anchor alignment;
    Offset offset;

    String shadowSource;
    String shadowOutput;
    Integer shadowWidth;
    Integer shadowHeight;
    Offset shadowOffset;

    List<String> layers;

    ProcessingReport(Path source, Path output) {
        this.source = String.valueOf(source.getFileName());
        this.output = String.valueOf(output.getFileName());
    }

    public String source() {
        return source;
    }

    public String output() {
        return output;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    /**
     * {@return number of sprite sheet frames, 1 for a single image}
     */
    public int frames() {
        return frames;
    }

    public int frameWidth() {
        return frameWidth;
    }

    public int frameHeight() {
        return frameHeight;
    }

    public Anchor alignment() {
        return alignment;
    }

    public Offset offset() {
        return offset;
    }

    public String shadowOutput() {
        return shadowOutput;
    }

    public Integer shadowWidth() {
        return shadowWidth;
    }

    public Integer shadowHeight() {
        return shadowHeight;
    }

    public Offset shadowOffset() {
        return shadowOffset;
    }

    public List<String> layers() {
        return layers;
    }

    void addLayer(Object layer) {
        if (layers == null) {
            layers = new ArrayList<>();
        }
        layers.add(String.valueOf(layer));
    }

    public void write(Path file) throws IOException {
        try (BufferedWriter fout = Files.newBufferedWriter(file)) {
            gson.toJson(this, fout);
            fout.newLine();
        }
    }

    public static ProcessingReport read(Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file)) {
            return gson.fromJson(reader, ProcessingReport.class);
        }
    }

}
