/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.gearbox.spritegen.process;

/**
 * Thrown when images required to have identical dimensions, f.e. sprite
 * sheet frames, differ in size.
 */
public class DimensionMismatchException extends ImageProcessingException {

    private static final long serialVersionUID = 6418036327591466420L;

    public DimensionMismatchException(String message) {
        super(message);
    }

}
