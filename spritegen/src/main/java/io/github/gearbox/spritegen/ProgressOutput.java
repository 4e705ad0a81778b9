/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.gearbox.spritegen;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Prints nested progress items:
 * <pre>
 * <code>    logo.png (300x240)
 *         trimmed: 212x180
 *         resized: 64x54
 *     logo-processed.png</code></pre>
 * <p>
 * {@link #push(Object)} prints an item and starts a nested level,
 * {@link #pop()} closes it.  Not thread-safe; concurrent tasks use their
 * own {@link #buffered() buffered} instance and {@link #flushTo(PrintStream)
 * flush} it as a whole.</p>
 */
public class ProgressOutput {

    private static final String[] prefixes = { "",   "\n    ", "\n        " };
    private static final String[] separators = { "\n", "\n    ", "\n        " };

    private final Appendable out;

    private final List<Boolean> firstItems = new ArrayList<>();

    ProgressOutput(Appendable out) {
        this.out = out;
        firstItems.add(true);
    }

    public static ProgressOutput of(PrintStream out) {
        return new ProgressOutput(out);
    }

    public static ProgressOutput buffered() {
        return new ProgressOutput(new StringBuilder());
    }

    final int level() {
        return firstItems.size() - 1;
    }

    private boolean firstItem() {
        int level = level();
        if (firstItems.get(level)) {
            firstItems.set(level, false);
            return true;
        }
        return false;
    }

    private static String forLevel(String[] values, int level) {
        return values[Math.min(level, values.length - 1)];
    }

    public ProgressOutput next(Object item) {
        int level = level();
        print(firstItem() ? forLevel(prefixes, level)
                          : forLevel(separators, level));
        print(String.valueOf(item));
        return this;
    }

    public ProgressOutput push(Object parent) {
        next(parent);
        firstItems.add(true);
        return this;
    }

    public ProgressOutput pop() {
        int level = level();
        if (level > 0) {
            firstItems.remove(level);
        } else {
            print("\n");
            firstItems.set(0, true);
        }
        return this;
    }

    /**
     * Closes all open levels.
     */
    public void finish() {
        while (level() > 0) {
            pop();
        }
        if (!firstItems.get(0)) {
            pop();
        }
    }

    private void print(String text) {
        try {
            out.append(text);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        if (out instanceof PrintStream) {
            ((PrintStream) out).flush();
        }
    }

    /**
     * Prints the text collected by a {@link #buffered()} instance, as
     * a single block.
     *
     * @param   target  stream to print to
     */
    public void flushTo(PrintStream target) {
        if (out instanceof StringBuilder) {
            StringBuilder buffer = (StringBuilder) out;
            synchronized (target) {
                target.print(buffer);
                target.flush();
            }
            buffer.setLength(0);
        }
    }

    @Override
    public String toString() {
        return (out instanceof StringBuilder) ? out.toString() : super.toString();
    }

}
