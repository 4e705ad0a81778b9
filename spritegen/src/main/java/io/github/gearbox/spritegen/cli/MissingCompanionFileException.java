/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.gearbox.spritegen.cli;

import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Signals a shadow or variant file, implied by a texture file name, doesn't
 * exist.  Raised before any image is loaded.
 *
 * @see  TextureFiles
 */
public class MissingCompanionFileException extends NoSuchFileException {

    private static final long serialVersionUID = 7104218826530517762L;

    public MissingCompanionFileException(String kind, Path file) {
        super(file.toString(), null, kind + " file not found");
    }

}
