/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.gearbox.spritegen;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

import io.github.gearbox.spritegen.cli.IconCommand;
import io.github.gearbox.spritegen.cli.PictureCommand;

public final class Command {

    @FunctionalInterface
    private interface Main {
        void main(String... args) throws Exception;
    }

    private static final Map<String, Main> availableCommands;
    static {
        Map<String, Main> commands = new LinkedHashMap<>();
        // Klass::main references cause eager class initialization.
        commands.put("picture", args -> PictureCommand.main(args));
        commands.put("icon", args -> IconCommand.main(args));
        availableCommands = Collections.unmodifiableMap(commands);
    }

    private Command() {/* no instances */}

    private static void printHelp(PrintStream err) {
        err.println("USAGE: spritegen [-h | --help] <command> [<args>]");
        err.println();
        err.append("Commands: {").append(String
                .join(" | ", availableCommands.keySet())).println("}");
    }

    public static void main(String[] args) throws Exception {
        if (args.length == 0) {
            exitMessage(1, Command::printHelp, "Error: Specify a command");
        }

        String name = args[0];
        Main cmd = availableCommands.get(name);
        if (cmd != null) {
            cmd.main(Arrays.copyOfRange(args, 1, args.length));
        } else if (Arrays.asList("-h", "--help").contains(name)) {
            printHelp(System.out);
        } else {
            exitMessage(1, Command::printHelp, "Error: Unknown command \"" + name + '"');
        }
    }

    public static void exitMessage(int status, Object... message) {
        exitMessage(status, (Consumer<PrintStream>) null, message);
    }

    public static void exitMessage(int status,
            Consumer<PrintStream> help, Object... message) {
        PrintStream out = (status == 0) ? System.out : System.err;
        printMessage(out, message);

        if (help != null) {
            if (message.length > 0) {
                out.println();
            }
            help.accept(out);
        }

        System.exit(status);
    }

    /**
     * Prints the given message parts.  Throwable parts are printed as
     * {@code Type: message} lines following the cause chain.
     *
     * @param   out  stream to print to
     * @param   message  message parts
     */
    public static void printMessage(PrintStream out, Object... message) {
        for (Object item : message) {
            if (item instanceof Throwable) {
                printCauses(out, (Throwable) item);
            } else {
                out.print(item);
            }
        }
        if (message.length > 0) {
            out.println();
        }
    }

    private static void printCauses(PrintStream out, Throwable e) {
        Throwable current = e;
        boolean first = true;
        while (current != null) {
            if (first) {
                first = false;
            } else {
                out.println();
                out.print("Caused by: ");
            }

            String type = current.getClass().getSimpleName()
                                 .replaceFirst("Exception$", "");
            String formatted = current.getMessage();
            formatted = type + (formatted == null ? "" : ": " + formatted);
            out.print(formatted);
            current = current.getCause();
        }
    }

}
