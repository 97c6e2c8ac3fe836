/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.retouch.cli;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Minimal Unix-style command-line parser.  Options are registered with
 * their handlers up front; {@link #parseOptions(String...)} consumes the
 * recognized ones and leaves the positional arguments.
 * <p>
 * Option arguments may follow as the next argument ({@code -c file}) or be
 * attached with {@code =} ({@code -c=file}).  Everything after {@code --}
 * is positional.</p>
 */
public class CommandLine {

    private static final String END_OF_OPTIONS = "--";

    private final Map<String, OptionHandler> registry = new LinkedHashMap<>();

    private final List<String> arguments = new ArrayList<>();

    public CommandLine acceptFlag(String option, Runnable action) {
        registry.put(option, new OptionHandler(false, value -> action.run()));
        return this;
    }

    public CommandLine acceptOption(String option, Consumer<? super String> action) {
        return acceptOption(option, action, Function.identity());
    }

    public <T>
    CommandLine acceptOption(String option,
                             Consumer<? super T> action,
                             Function<String, ? extends T> valueMapper) {
        registry.put(option, new OptionHandler(true,
                value -> action.accept(valueMapper.apply(value))));
        return this;
    }

    /**
     * {@return the positional arguments remaining after parsing the known options}
     */
    public List<String> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    public CommandLine parseOptions(String... args) {
        arguments.clear();

        boolean optionsEnded = false;
        Iterator<String> iter = List.of(args).iterator();
        while (iter.hasNext()) {
            String param = iter.next();
            if (optionsEnded) {
                arguments.add(param);
            } else if (param.equals(END_OF_OPTIONS)) {
                optionsEnded = true;
            } else if (!parseOption(param, iter)) {
                arguments.add(param);
            }
        }
        return this;
    }

    private boolean parseOption(String param, Iterator<String> args) {
        int separator = param.indexOf('=');
        String option = (separator < 0) ? param : param.substring(0, separator);
        OptionHandler handler = registry.get(option);
        if (handler == null)
            return false;

        String value;
        if (!handler.hasArgument) {
            if (separator >= 0)
                throw new ArgumentException(option + " doesn't accept argument");

            value = "";
        } else if (separator >= 0) {
            value = param.substring(separator + 1);
        } else if (args.hasNext()) {
            value = args.next();
        } else {
            throw new ArgumentException(option + " requires an argument");
        }

        try {
            handler.action.accept(value);
        } catch (ArgumentException e) {
            throw e;
        } catch (RuntimeException e) {
            throw ArgumentException.of(option, e);
        }
        return true;
    }

    public String requireArg(int index, String name) {
        return arg(index).orElseThrow(() -> new ArgumentException("Specify " + name));
    }

    public Optional<String> arg(int index) {
        return arguments.size() > index
                ? Optional.of(arguments.get(index))
                : Optional.empty();
    }


    private static final class OptionHandler {

        final boolean hasArgument;
        final Consumer<String> action;

        OptionHandler(boolean hasArgument, Consumer<String> action) {
            this.hasArgument = hasArgument;
            this.action = action;
        }

    }


    public static class ArgumentException extends RuntimeException {

        private static final long serialVersionUID = -4199582997575986965L;

        public ArgumentException(String message) {
            super(message);
        }

        public ArgumentException(String message, Throwable cause) {
            super(message, cause);
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
