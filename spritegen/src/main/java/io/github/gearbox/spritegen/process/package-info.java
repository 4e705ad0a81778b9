/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */

/**
 * Image processing stages.  All operate on straight (non-premultiplied)
 * ARGB {@link io.github.gearbox.awt.PixelBuffer}s, and report precondition
 * failures as {@link ImageProcessingException} subtypes.
 */
package io.github.gearbox.spritegen.process;
