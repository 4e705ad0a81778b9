/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.gearbox.spritegen.process;

/**
 * Thrown when a computed image or canvas dimension is not positive.
 */
public class InvalidDimensionException extends ImageProcessingException {

    private static final long serialVersionUID = -1385602949330712257L;

    public InvalidDimensionException(String message) {
        super(message);
    }

}
