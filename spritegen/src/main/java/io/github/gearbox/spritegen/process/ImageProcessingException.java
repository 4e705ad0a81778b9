/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.gearbox.spritegen.process;

/**
 * Signals a precondition failure of a processing stage.  Not recoverable
 * for the image being processed; other images in the same batch are not
 * affected.
 */
public class ImageProcessingException extends RuntimeException {

    private static final long serialVersionUID = 2480967412795638411L;

    public ImageProcessingException(String message) {
        super(message);
    }

    public ImageProcessingException(String message, Throwable cause) {
        super(message, cause);
    }

}
