/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.gearbox.cli;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Minimal command-line option parser.
 * <p>
 * Options are registered with an action receiving the (mapped) option
 * value.  Arguments not matching a registered option are left as
 * positional {@link #arguments()}.  Option values may be given as a
 * separate argument ({@code --scale 2}), or attached to the option name
 * with or without a value separator ({@code --scale=2}, {@code -s2}).</p>
 * <p>
 * Batteries <strong>not</strong> included:</p>
 * <ul>
 * <li>Automatic help text from option descriptions</li>
 * <li>Clustering/grouping of POSIX flags</li>
 * </ul>
 */
public class CommandLine {

    private final NavigableMap<String, OptionHandler> registry;

    private final List<String> arguments;

    private final String optionDelimiter;

    private final char[] valueSeparators;

    public CommandLine(boolean ignoreCase, char[] valueSeparators, String optionDelimiter) {
        this.registry = new TreeMap<>(ignoreCase ? String.CASE_INSENSITIVE_ORDER : null);
        this.valueSeparators = Arrays.copyOf(valueSeparators, valueSeparators.length);
        Arrays.sort(this.valueSeparators);
        this.optionDelimiter = optionDelimiter;
        this.arguments = new ArrayList<>();
    }

    public static CommandLine ofUnixStyle() {
        return new CommandLine(false, new char[] { '=' }, "--");
    }

    /**
     * {@return the positional arguments remaining after parsing the known options}
     */
    public List<String> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    public CommandLine acceptFlag(String option, Runnable action) {
        registry.put(option, new OptionHandler(Arity.NONE, Function.identity(), v -> {
            if (!v.isEmpty())
                throw new ArgumentException(option + " doesn't accept argument");

            action.run();
        }));
        return this;
    }

    public CommandLine acceptOption(String option, Consumer<? super String> action) {
        return acceptOption(option, action, Function.identity());
    }

    public <T>
    CommandLine acceptOption(String option,
                             Consumer<? super T> action,
                             Function<String, ? extends T> valueMapper) {
        registry.put(option, new OptionHandler(Arity.ONE, valueMapper, action));
        return this;
    }

    /**
     * Registers an option which value could be omitted.  The action
     * receives an empty string when no value is attached to the option.
     *
     * @param   option  option name
     * @param   action  value consumer
     * @return  this command line
     */
    public CommandLine acceptOptionalArg(String option,
                                         Consumer<? super String> action) {
        registry.put(option, new OptionHandler(Arity.ZERO_OR_ONE,
                                               Function.identity(), action));
        return this;
    }

    /**
     * Registers an option consuming all following arguments up to the next
     * registered option.  The action is invoked once for each value.
     *
     * @param   <T>  value type
     * @param   option  option name
     * @param   action  value consumer
     * @param   valueMapper  value conversion
     * @return  this command line
     */
    public <T>
    CommandLine acceptOptionList(String option,
                                 Consumer<? super T> action,
                                 Function<String, ? extends T> valueMapper) {
        registry.put(option, new OptionHandler(Arity.ONE_OR_MORE, valueMapper, action));
        return this;
    }

    public CommandLine acceptSynonyms(String option, String... synonyms) {
        OptionHandler handler = Objects.requireNonNull(registry.get(option));
        for (String it : synonyms) {
            registry.put(it, handler);
        }
        return this;
    }

    public CommandLine parseOptions(String... args) {
        this.arguments.clear();
        this.arguments.addAll(Arrays.asList(args));

        ListIterator<String> iter = breakAfter(optionDelimiter).listIterator();
        while (iter.hasNext()) {
            String param = iter.next();
            Map.Entry<String, OptionHandler> handler = matchOption(param);
            if (handler == null)
                continue;

            iter.remove();
            handler.getValue().parse(handler.getKey(), param, iter);
        }
        return this;
    }

    private List<String> breakAfter(String delimiter) {
        int breakIndex = (delimiter == null) ? -1 : arguments.indexOf(delimiter);
        if (breakIndex < 0) return arguments;

        arguments.remove(breakIndex);
        return arguments.subList(0, breakIndex);
    }


    private enum Arity { NONE, ZERO_OR_ONE, ONE, ONE_OR_MORE }


    private class OptionHandler {

        private final Arity arity;
        private final Function<String, Object> valueMapper;
        private final Consumer<Object> action;

        @SuppressWarnings("unchecked")
        <T> OptionHandler(Arity arity,
                          Function<String, ? extends T> valueMapper,
                          Consumer<? super T> action) {
            this.arity = arity;
            this.valueMapper = (Function<String, Object>) valueMapper;
            this.action = (Consumer<Object>) action;
        }

        void parse(String option, String param, ListIterator<String> args) {
            String current = param;
            try {
                for (String value : parseValues(option, param, args)) {
                    current = value;
                    action.accept(valueMapper.apply(value));
                }
            } catch (ArgumentException e) {
                throw e;
            } catch (RuntimeException e) {
                throw ArgumentException.of(option.equals(current)
                                           ? option
                                           : option + " " + current, e);
            }
        }

        private List<String> parseValues(String option, String param, ListIterator<String> args) {
            if (param.length() > option.length()) {
                int offset = isSeparator(param.charAt(option.length())) ? 1 : 0;
                return List.of(param.substring(option.length() + offset));
            }
            if (arity == Arity.NONE || arity == Arity.ZERO_OR_ONE)
                return List.of("");

            List<String> values = new ArrayList<>();
            while (args.hasNext()) {
                String nextValue = args.next();
                if (matchOption(nextValue) != null) {
                    args.previous();
                    break;
                }
                args.remove();
                values.add(nextValue);
                if (arity == Arity.ONE)
                    break;
            }
            if (values.isEmpty())
                throw new ArgumentException(option + " requires an argument");

            return values;
        }

    } // class OptionHandler


    /*private*/ Map.Entry<String, OptionHandler> matchOption(String arg) {
        if (arg.length() < 2) return null;

        Map.Entry<String, OptionHandler> candidate = null;
        String prefix = arg.substring(0, 2);
        Map.Entry<String, OptionHandler>
                option = registry.ceilingEntry(prefix);
        if (option == null)
            return null;

        String optionKey = option.getKey();
        while (argStartsWith(optionKey, prefix)) {
            if (argStartsWith(arg, optionKey)) {
                // Higher entries = longer match
                candidate = option;
            }

            option = registry.higherEntry(optionKey);
            if (option == null)
                break;

            optionKey = option.getKey();
        }
        return candidate;
    }

    /*private*/ boolean isSeparator(char charAt) {
        return Arrays.binarySearch(valueSeparators, charAt) >= 0;
    }

    private boolean argStartsWith(String arg, String prefix) {
        boolean ignoreCase = registry.comparator() == String.CASE_INSENSITIVE_ORDER;
        return arg.regionMatches(ignoreCase, 0, prefix, 0, prefix.length());
    }

    public CommandLine withMaxArgs(int count) {
        int extraSize = arguments.size() - count;
        if (extraSize > 0) {
            throw new ArgumentException(extraSize + " too many argument(s): "
                    + String.join(" ", arguments.subList(count, arguments.size())));
        }
        return this;
    }

    public String requireArg(int index, String name) {
        return requireArg(index, name, Function.identity());
    }

    public <T> T requireArg(int index, String name,
                            Function<String, ? extends T> valueMapper) {
        return arg(index, name, valueMapper)
                .orElseThrow(() -> new ArgumentException("Specify " + name));
    }

    public <T> Optional<T> arg(int index, String name,
                               Function<String, ? extends T> valueMapper) {
        try {
            return arg(index).map(valueMapper);
        } catch (RuntimeException e) {
            throw ArgumentException.of(name, e);
        }
    }

    public Optional<String> arg(int index) {
        return arguments.size() > index
                ? Optional.of(arguments.get(index))
                : Optional.empty();
    }

    /**
     * Creates a value mapper splitting a comma-separated list, and
     * converting each of the items.
     *
     * @param   <T>  item type
     * @param   itemMapper  item conversion
     * @return  a list value mapper
     */
    public static <T> Function<String, List<T>>
            splitOnComma(Function<String, ? extends T> itemMapper) {
        return str -> {
            List<T> items = new ArrayList<>();
            for (String it : str.split(",")) {
                if (!it.isBlank()) {
                    items.add(itemMapper.apply(it.strip()));
                }
            }
            return items;
        };
    }


    public static class ArgumentException extends RuntimeException {

        private static final long serialVersionUID = -4199582997575986965L;

        public ArgumentException(String message) {
            super(message);
        }

        public ArgumentException(String message, Throwable cause) {
            super(message, cause);
        }

        public static ArgumentException of(String argument, String message) {
            return new ArgumentException(argument + ": " + message);
        }

        public static ArgumentException of(String argument, Throwable cause) {
            return new ArgumentException(argument
                    + ": " + userMessage(cause), cause);
        }

        public static String userMessage(Throwable cause) {
            String message = cause.getMessage();
            String type = cause.getClass().getSimpleName()
                               .replaceFirst("(Runtime)?Exception$", "");
            return type.isEmpty() ? message : type + ": " + message;
        }

    } // class ArgumentException


} // class CommandLine
