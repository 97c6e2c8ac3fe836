/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.retouch.cli;

import java.util.Locale;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.regex.Pattern;

import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;

import io.github.retouch.cli.CommandLine.ArgumentException;
import io.github.retouch.edit.EditEngine;
import io.github.retouch.image.Region;

/**
 * A single edit given on the command line, like {@code resize=50} or
 * {@code crop=10,10,60,60}.
 */
abstract class EditStep {

    private static final Pattern COMMA = Pattern.compile(",");

    private final String text;

    EditStep(String text) {
        this.text = text;
    }

    /**
     * @return  {@code false} if the step had nothing to act on (undo with
     *          empty history and the like)
     */
    abstract boolean applyTo(EditEngine engine);

    static EditStep parse(String arg) {
        int separator = arg.indexOf('=');
        String name = (separator < 0 ? arg : arg.substring(0, separator))
                      .toLowerCase(Locale.ROOT);
        String value = (separator < 0) ? null : arg.substring(separator + 1);

        switch (name) {
        case "grayscale":
            noValue(arg, value);
            return mutation(arg, engine -> engine.grayscale());

        case "blur":
            noValue(arg, value);
            return mutation(arg, engine -> engine.blur());

        case "undo":
            noValue(arg, value);
            return of(arg, EditEngine::undo);

        case "redo":
            noValue(arg, value);
            return of(arg, EditEngine::redo);

        case "reset":
            noValue(arg, value);
            return of(arg, EditEngine::reset);

        case "crop":
            Region region = parseRegion(arg, requireValue(arg, value));
            return mutation(arg, engine -> engine.crop(region));

        case "select":
            return parseSelection(arg, requireValue(arg, value));

        case "resize":
            double percent = parseNumbers(arg, requireValue(arg, value), 1)[0];
            return mutation(arg, engine -> engine.resize(percent));

        default:
            throw new ArgumentException("Unknown edit step: " + arg);
        }
    }

    private static EditStep of(String text, Predicate<EditEngine> action) {
        return new EditStep(text) {
            @Override boolean applyTo(EditEngine engine) {
                return action.test(engine);
            }
        };
    }

    private static EditStep mutation(String text, Consumer<EditEngine> action) {
        return of(text, engine -> {
            action.accept(engine);
            return true;
        });
    }

    private static void noValue(String arg, String value) {
        if (value != null)
            throw new ArgumentException(arg + ": doesn't accept a value");
    }

    private static String requireValue(String arg, String value) {
        if (value == null || value.isBlank())
            throw new ArgumentException(arg + ": requires a value");

        return value;
    }

    private static Region parseRegion(String arg, String value) {
        double[] corners = parseNumbers(arg, value, 4);
        return Region.of(toInt(arg, corners[0]), toInt(arg, corners[1]),
                         toInt(arg, corners[2]), toInt(arg, corners[3]));
    }

    // select=x1,y1,x2,y2@bx,by,bw,bh
    private static EditStep parseSelection(String arg, String value) {
        int at = value.indexOf('@');
        if (at < 0)
            throw new ArgumentException(arg + ": expected <x1,y1,x2,y2>@<x,y,width,height>");

        double[] corners = parseNumbers(arg, value.substring(0, at), 4);
        double[] bounds = parseNumbers(arg, value.substring(at + 1), 4);
        Point2D start = new Point2D.Double(corners[0], corners[1]);
        Point2D end = new Point2D.Double(corners[2], corners[3]);
        Rectangle2D imageBounds = new Rectangle2D.Double(bounds[0], bounds[1],
                                                         bounds[2], bounds[3]);
        return mutation(arg, engine -> engine.crop(start, end, imageBounds));
    }

    private static double[] parseNumbers(String arg, String value, int count) {
        String[] parts = COMMA.split(value.strip(), -1);
        if (parts.length != count)
            throw new ArgumentException(arg + ": expected " + count + " number(s)");

        double[] numbers = new double[count];
        for (int i = 0; i < count; i++) {
            try {
                numbers[i] = Double.parseDouble(parts[i].strip());
            } catch (NumberFormatException e) {
                throw ArgumentException.of(arg, e);
            }
            if (!Double.isFinite(numbers[i]))
                throw new ArgumentException(arg + ": not a finite number: " + parts[i]);
        }
        return numbers;
    }

    private static int toInt(String arg, double value) {
        if (value != Math.rint(value)
                || value < Integer.MIN_VALUE || value > Integer.MAX_VALUE)
            throw new ArgumentException(arg + ": not an integer: " + value);

        return (int) value;
    }

    @Override
    public String toString() {
        return text;
    }

}
