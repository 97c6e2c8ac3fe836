/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.retouch.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.imageio.ImageIO;

import io.github.retouch.cli.CommandLine.ArgumentException;
import io.github.retouch.edit.EditEngine;
import io.github.retouch.edit.EditSettings;
import io.github.retouch.image.ImageBuffer;
import io.github.retouch.image.ImageFilters;

/**
 * Loads an image, applies a sequence of edit steps and saves the result.
 */
public class EditCommand {

    public static void printHelp(PrintStream out) {
        out.println("USAGE: retouch [-c <settings.json>] [-p <preview-dir>] [-v]"
                + " <input> <output> [<step>...]");
        out.println();
        out.println("Steps:");
        out.println("  crop=<x1>,<y1>,<x2>,<y2>                 crop to image pixels");
        out.println("  select=<x1>,<y1>,<x2>,<y2>@<x>,<y>,<w>,<h>"
                + "  crop to a selection on a display showing the image at <x>,<y>,<w>,<h>");
        out.println("  resize=<percent>                         scale from the last non-resize state");
        out.println("  grayscale | blur                         apply an effect");
        out.println("  undo | redo | reset                      step through the history");
    }

    static final String ORIGINAL_PREVIEW = "original-preview.png";
    static final String CURRENT_PREVIEW = "current-preview.png";

    private final EditEngine engine;

    private final PrintStream out;

    EditCommand(EditSettings settings, PrintStream out) {
        this.engine = new EditEngine(settings);
        this.out = Objects.requireNonNull(out);
    }

    EditEngine engine() {
        return engine;
    }

    void run(Path input, Path output, List<EditStep> steps, Path previewDir)
            throws IOException {
        ImageBuffer loaded = engine.load(input);
        out.println(input.getFileName() + ": " + loaded.width() + "x" + loaded.height());

        for (EditStep step : steps) {
            if (!step.applyTo(engine)) {
                out.println(step + ": nothing to do");
            }
        }

        engine.save(output);
        ImageBuffer result = engine.current();
        out.println(output.getFileName() + ": " + result.width() + "x" + result.height());

        if (previewDir != null) {
            writePreviews(previewDir);
        }
    }

    private void writePreviews(Path dir) throws IOException {
        Files.createDirectories(dir);
        int box = engine.settings().previewSize();
        writePreview(ImageFilters.fitWithin(engine.original(), box),
                     dir.resolve(ORIGINAL_PREVIEW));
        writePreview(ImageFilters.fitWithin(engine.current(), box),
                     dir.resolve(CURRENT_PREVIEW));
    }

    private static void writePreview(ImageBuffer image, Path file) throws IOException {
        if (!ImageIO.write(image.toBufferedImage(), "png", file.toFile())) {
            throw new IOException("No PNG writer available");
        }
    }

    public static void main(String[] args) {
        CommandArgs cmdArgs;
        try {
            cmdArgs = CommandArgs.of(args);
        } catch (ArgumentException e) {
            System.err.println(e.getMessage());
            printHelp(System.err);
            System.exit(1);
            return;
        }

        if (cmdArgs.verbose) {
            enableVerboseLogging();
        }

        try {
            EditSettings settings = (cmdArgs.settingsFile == null)
                                    ? EditSettings.fromSystemProperty()
                                    : EditSettings.load(cmdArgs.settingsFile);
            new EditCommand(settings, System.out)
                    .run(cmdArgs.input, cmdArgs.output, cmdArgs.steps, cmdArgs.previewDir);
        } catch (IOException | RuntimeException e) {
            System.err.append("ERROR: ").println(e.getMessage());
            if (cmdArgs.verbose) {
                e.printStackTrace(System.err);
            }
            System.exit(2);
        }
    }

    private static void enableVerboseLogging() {
        Logger logger = Logger.getLogger("io.github.retouch");
        Handler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        logger.addHandler(handler);
        logger.setLevel(Level.FINE);
    }


    static class CommandArgs {

        Path settingsFile;
        Path previewDir;
        boolean verbose;

        Path input;
        Path output;
        final List<EditStep> steps = new ArrayList<>();

        private CommandArgs(String... args) {
            CommandLine cmd = new CommandLine()
                    .acceptOption("-c", p -> settingsFile = p, Path::of)
                    .acceptOption("-p", p -> previewDir = p, Path::of)
                    .acceptFlag("-v", () -> verbose = true)
                    .parseOptions(args);

            input = Path.of(cmd.requireArg(0, "<input>"));
            output = Path.of(cmd.requireArg(1, "<output>"));
            List<String> arguments = cmd.arguments();
            for (String step : arguments.subList(2, arguments.size())) {
                steps.add(EditStep.parse(step));
            }
        }

        static CommandArgs of(String... args) {
            return new CommandArgs(args);
        }

    }

}
