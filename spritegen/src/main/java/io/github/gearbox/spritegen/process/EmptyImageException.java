/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.gearbox.spritegen.process;

/**
 * Thrown when trimming an image with no pixel of non-zero alpha.
 *
 * @see  AlphaTrimmer
 */
public class EmptyImageException extends ImageProcessingException {

    private static final long serialVersionUID = -3059218860241196527L;

    public EmptyImageException(String message) {
        super(message);
    }

    public EmptyImageException(String message, Throwable cause) {
        super(message, cause);
    }

}
