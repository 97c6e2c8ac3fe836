/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.retouch.edit;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import com.google.gson.Gson;
import com.google.gson.JsonIOException;
import com.google.gson.JsonParseException;

import io.github.retouch.image.ImageFilters;
import io.github.retouch.io.DataFormatException;

/**
 * Tunables of an {@code EditEngine}.  Read from JSON like:
 * <pre>
 * {
 *   "historyLimit": 20,
 *   "blurKernel": 9,
 *   "jpegQuality": 0.95,
 *   "previewSize": 200
 * }</pre>
 * <p>
 * Every property is optional.</p>
 */
public final class EditSettings {

    public static final String SETTINGS_PROPERTY = "retouch.settings";

    private static final EditSettings DEFAULTS = new EditSettings();

    private int historyLimit;
    private int blurKernel;
    private float jpegQuality;
    private int previewSize;

    private EditSettings() {
        this(HistoryStack.DEFAULT_CAPACITY, ImageFilters.DEFAULT_BLUR_KERNEL, 0.95f, 200);
    }

    private EditSettings(int historyLimit, int blurKernel, float jpegQuality, int previewSize) {
        this.historyLimit = historyLimit;
        this.blurKernel = blurKernel;
        this.jpegQuality = jpegQuality;
        this.previewSize = previewSize;
    }

    public static EditSettings defaults() {
        return DEFAULTS;
    }

    /**
     * @throws  IllegalArgumentException  if a value is out of range
     */
    public static EditSettings of(int historyLimit, int blurKernel,
                                  float jpegQuality, int previewSize) {
        EditSettings settings = new EditSettings(historyLimit,
                blurKernel, jpegQuality, previewSize);
        String error = settings.validate();
        if (error != null) {
            throw new IllegalArgumentException(error);
        }
        return settings;
    }

    public int historyLimit() {
        return historyLimit;
    }

    public int blurKernel() {
        return blurKernel;
    }

    public float jpegQuality() {
        return jpegQuality;
    }

    public int previewSize() {
        return previewSize;
    }

    public EditSettings withHistoryLimit(int limit) {
        return of(limit, blurKernel, jpegQuality, previewSize);
    }

    public EditSettings withBlurKernel(int kernel) {
        return of(historyLimit, kernel, jpegQuality, previewSize);
    }

    private String validate() {
        if (historyLimit < 1)
            return "historyLimit must be >= 1: " + historyLimit;

        if (blurKernel < 3 || blurKernel % 2 == 0)
            return "blurKernel must be odd and >= 3: " + blurKernel;

        if (!(jpegQuality > 0 && jpegQuality <= 1))
            return "jpegQuality must be in (0, 1]: " + jpegQuality;

        if (previewSize < 1)
            return "previewSize must be >= 1: " + previewSize;

        return null;
    }

    public static EditSettings load(Path file) throws IOException {
        return loadFrom(file.toUri().toURL());
    }

    public static EditSettings loadFrom(URL resource) throws IOException {
        EditSettings settings;
        try (InputStream in = resource.openStream();
                Reader json = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            settings = new Gson().fromJson(json, EditSettings.class);
        } catch (JsonIOException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new IOException(e);
        } catch (JsonParseException e) {
            throw new DataFormatException(e.getMessage(), e);
        }

        if (settings == null) // empty document
            return DEFAULTS;

        String error = settings.validate();
        if (error != null) {
            throw new DataFormatException(resource + ": " + error);
        }
        return settings;
    }

    /**
     * Loads the file named by the {@value #SETTINGS_PROPERTY} system
     * property, if set.
     */
    public static EditSettings fromSystemProperty() throws IOException {
        String path = System.getProperty(SETTINGS_PROPERTY, "").strip();
        return path.isEmpty() ? DEFAULTS : load(Path.of(path));
    }

    @Override
    public String toString() {
        return "EditSettings(historyLimit=" + historyLimit
                + ", blurKernel=" + blurKernel
                + ", jpegQuality=" + jpegQuality
                + ", previewSize=" + previewSize + ")";
    }

}
