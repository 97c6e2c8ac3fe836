/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.retouch.edit;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;

import io.github.retouch.image.ImageBuffer;
import io.github.retouch.image.ImageFilters;
import io.github.retouch.image.Region;

/**
 * Applies reversible edits to a loaded image.
 * <p>
 * An engine starts out empty.  A successful {@link #load(Path)} starts a
 * new session holding:</p>
 * <ul>
 * <li><i>original</i> &ndash; the image as loaded, unchanged until the next load;</li>
 * <li><i>current</i> &ndash; the image as edited so far;</li>
 * <li><i>resize base</i> &ndash; what {@link #resize(double)} scales from,
 *     so that successive resizes don't compound quality loss;</li>
 * <li>the undo/redo {@link HistoryStack}.</li>
 * </ul>
 * <p>
 * Every mutation records the previous <i>current</i> in the history and
 * invalidates the redo entries.  Arguments are validated before anything
 * changes: a rejected operation leaves the session as it was.  "Nothing to
 * undo/redo/reset" is reported as a {@code false} result.</p>
 * <p>
 * Public methods are synchronized on the engine instance, each one
 * completing as a whole with respect to the others.</p>
 */
public class EditEngine {

    private static final Logger log = Logger.getLogger(EditEngine.class.getName());

    private final EditSettings settings;

    private final ImageCodec codec;

    private final HistoryStack history;

    private Path source;
    private ImageBuffer original;
    private ImageBuffer current;
    private ImageBuffer resizeBase;

    public EditEngine() {
        this(EditSettings.defaults());
    }

    public EditEngine(EditSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.codec = new ImageCodec(settings.jpegQuality());
        this.history = new HistoryStack(settings.historyLimit());
    }

    public EditSettings settings() {
        return settings;
    }

    /**
     * Decodes the given file and starts a new session with it.  On failure
     * the previous session, if any, is kept as is.
     *
     * @return  the loaded image
     * @throws  ImageLoadException  if the file cannot be read or decoded
     */
    public synchronized ImageBuffer load(Path file) throws ImageLoadException {
        ImageBuffer image = codec.read(file);

        source = file;
        original = image;
        current = image;
        resizeBase = image;
        history.clear();
        log.fine(() -> "Loaded " + file + ": " + image);
        return image;
    }

    /**
     * Encodes the current image to the given file.  The format is selected
     * by the file name suffix.
     *
     * @throws  ImageSaveException  if no image is loaded, the file type is
     *          not supported, or writing fails
     */
    public synchronized void save(Path file) throws ImageSaveException {
        if (current == null) {
            throw new ImageSaveException("No image to save");
        }
        codec.write(current, file);
        log.fine(() -> "Saved " + file);
    }

    /**
     * Crops the current image to the given region.  The corners are
     * ordered and clamped to the image bounds first.
     *
     * @throws  InvalidRegionException  if the clamped region has no area
     * @throws  IllegalStateException  if no image is loaded
     */
    public synchronized void crop(Region region) {
        ImageBuffer image = requireLoaded();
        Region bounded = region.ordered().clampTo(image.width(), image.height());
        if (bounded.isEmpty()) {
            throw new InvalidRegionException("Invalid crop area: " + region
                    + " within " + image.width() + "x" + image.height());
        }
        apply("crop", img -> ImageFilters.crop(img, bounded));
    }

    /**
     * Crops to a selection made on a display surface.
     *
     * @param   start  first corner of the selection, in display coordinates
     * @param   end  opposite corner of the selection
     * @param   imageBounds  where the current image is rendered on the display
     * @throws  InvalidRegionException  if the selection covers no pixel
     * @throws  IllegalStateException  if no image is loaded
     * @see     CoordinateMapper
     */
    public synchronized void crop(Point2D start, Point2D end, Rectangle2D imageBounds) {
        ImageBuffer image = requireLoaded();
        crop(CoordinateMapper.toImageRegion(start, end, imageBounds,
                                            image.width(), image.height()));
    }

    /**
     * Scales the resize base by the given percentage.  The resize base
     * itself is not changed, so {@code resize(50)} followed by
     * {@code resize(200)} yields twice the size of the base rather than
     * its original size.
     *
     * @throws  DegenerateSizeException  if the result would be less than
     *          one pixel in either dimension
     * @throws  IllegalStateException  if no image is loaded
     */
    public synchronized void resize(double percent) {
        requireLoaded();
        ImageBuffer base = resizeBase;
        if (!Double.isFinite(percent)) {
            throw new DegenerateSizeException("Invalid resize percentage: " + percent);
        }
        long width = Math.round(base.width() * percent / 100);
        long height = Math.round(base.height() * percent / 100);
        if (width < 1 || height < 1) {
            throw new DegenerateSizeException("Resize to " + percent + "% of "
                    + base.width() + "x" + base.height() + " gives "
                    + width + "x" + height);
        }
        if (!ImageBuffer.isAllocatable(width, height)) {
            throw new DegenerateSizeException("Resize to " + percent + "% of "
                    + base.width() + "x" + base.height() + " is too large");
        }

        ImageBuffer result = ImageFilters.resize(base, (int) width, (int) height);
        history.push(current);
        current = result;
        log.fine(() -> "resize " + percent + "%: " + current + ", " + history);
    }

    /**
     * Desaturates the current image, keeping its three-channel layout.
     *
     * @throws  IllegalStateException  if no image is loaded
     */
    public synchronized void grayscale() {
        requireLoaded();
        apply("grayscale", ImageFilters::grayscale);
    }

    /**
     * Smooths the current image with a Gaussian of the configured kernel
     * size.
     *
     * @throws  IllegalStateException  if no image is loaded
     */
    public synchronized void blur() {
        requireLoaded();
        int kernel = settings.blurKernel();
        apply("blur", img -> ImageFilters.blur(img, kernel));
    }

    private void apply(String operation, UnaryOperator<ImageBuffer> transform) {
        ImageBuffer result = transform.apply(current);
        history.push(current);
        current = result;
        resizeBase = result;
        log.fine(() -> operation + ": " + current + ", " + history);
    }

    /**
     * @return  {@code true} if a previous state was restored,
     *          {@code false} if there is nothing to undo
     */
    public synchronized boolean undo() {
        if (current == null)
            return false;

        return restore("undo", history.undo(current));
    }

    /**
     * @return  {@code true} if an undone state was restored,
     *          {@code false} if there is nothing to redo
     */
    public synchronized boolean redo() {
        if (current == null)
            return false;

        return restore("redo", history.redo(current));
    }

    private boolean restore(String operation, Optional<ImageBuffer> state) {
        if (state.isEmpty())
            return false;

        current = state.get();
        resizeBase = current;
        log.fine(() -> operation + ": " + current + ", " + history);
        return true;
    }

    /**
     * Reverts to the image as loaded and discards the history.
     *
     * @return  {@code true} if reverted, {@code false} if no image is loaded
     */
    public synchronized boolean reset() {
        if (original == null)
            return false;

        current = original;
        resizeBase = original;
        history.clear();
        log.fine(() -> "reset: " + current);
        return true;
    }

    private ImageBuffer requireLoaded() {
        if (current == null) {
            throw new IllegalStateException("No image loaded");
        }
        return current;
    }

    public synchronized boolean isLoaded() {
        return current != null;
    }

    /**
     * @throws  IllegalStateException  if no image is loaded
     */
    public synchronized ImageBuffer current() {
        return requireLoaded();
    }

    /**
     * @throws  IllegalStateException  if no image is loaded
     */
    public synchronized ImageBuffer original() {
        requireLoaded();
        return original;
    }

    /**
     * @throws  IllegalStateException  if no image is loaded
     */
    public synchronized ImageBuffer resizeBase() {
        requireLoaded();
        return resizeBase;
    }

    /**
     * {@return the file the current session was loaded from, if any}
     */
    public synchronized Optional<Path> source() {
        return Optional.ofNullable(source);
    }

    public synchronized boolean canUndo() {
        return history.canUndo();
    }

    public synchronized boolean canRedo() {
        return history.canRedo();
    }

    public synchronized int undoDepth() {
        return history.undoDepth();
    }

    public synchronized int redoDepth() {
        return history.redoDepth();
    }

}
