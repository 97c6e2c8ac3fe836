/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.retouch.edit;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Iterator;
import java.util.Locale;
import java.util.logging.Logger;

import java.awt.image.BufferedImage;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;

import io.github.retouch.image.ImageBuffer;

/**
 * Decodes and encodes {@code ImageBuffer}s through Image I/O.  The source
 * format is detected from the content; the destination format is selected
 * by the file name suffix.
 */
class ImageCodec {

    private static final Logger log = Logger.getLogger(ImageCodec.class.getName());

    private final float jpegQuality;

    ImageCodec(float jpegQuality) {
        this.jpegQuality = jpegQuality;
    }

    ImageBuffer read(Path file) throws ImageLoadException {
        BufferedImage image;
        try (InputStream in = Files.newInputStream(file);
                ImageInputStream input = ImageIO.createImageInputStream(in)) {
            image = decode(input);
        } catch (NoSuchFileException e) {
            throw new ImageLoadException("File not found: " + file, e);
        } catch (AccessDeniedException e) {
            throw new ImageLoadException("Access denied: " + file, e);
        } catch (IOException | RuntimeException e) {
            throw new ImageLoadException("Failed to load image: " + file, e);
        }

        if (image == null) {
            throw new ImageLoadException("Unsupported image format: " + file);
        }
        try {
            return ImageBuffer.of(image);
        } catch (IllegalArgumentException e) {
            throw new ImageLoadException("Failed to load image: " + file, e);
        }
    }

    private static BufferedImage decode(ImageInputStream input) throws IOException {
        if (input == null)
            return null;

        Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
        if (!readers.hasNext())
            return null;

        ImageReader reader = readers.next();
        log.finer(() -> "Decoding with " + reader.getClass().getName());
        try {
            reader.setInput(input, true, true);
            return reader.read(0);
        } finally {
            reader.dispose();
        }
    }

    void write(ImageBuffer image, Path file) throws ImageSaveException {
        String suffix = suffixOf(file);
        ImageWriter writer = findWriter(suffix);
        if (writer == null) {
            throw new ImageSaveException("Unsupported file type: " + file);
        }

        Path target = file.toAbsolutePath();
        Path tempFile = null;
        try {
            tempFile = Files.createTempFile(target.getParent(),
                    target.getFileName() + "-", ".tmp");
            log.finer(() -> "Encoding with " + writer.getClass().getName());
            encode(writer, image.toBufferedImage(), tempFile);
            Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING);
            tempFile = null;
        } catch (IOException | RuntimeException e) {
            throw new ImageSaveException("Failed to save image: " + file, e);
        } finally {
            writer.dispose();
            deleteQuietly(tempFile);
        }
    }

    private void encode(ImageWriter writer, BufferedImage image, Path file)
            throws IOException {
        Files.deleteIfExists(file);
        try (ImageOutputStream output = ImageIO.createImageOutputStream(file.toFile())) {
            if (output == null) {
                throw new IOException("Could not open " + file);
            }
            writer.setOutput(output);

            ImageWriteParam param = writer.getDefaultWriteParam();
            if (isJpeg(writer) && param.canWriteCompressed()) {
                param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                param.setCompressionQuality(jpegQuality);
            }
            writer.write(null, new IIOImage(image, null, null), param);
        }
    }

    private static boolean isJpeg(ImageWriter writer) {
        for (String name : writer.getOriginatingProvider().getFormatNames()) {
            if (name.equalsIgnoreCase("jpeg"))
                return true;
        }
        return false;
    }

    private static ImageWriter findWriter(String suffix) {
        if (suffix.isEmpty())
            return null;

        Iterator<ImageWriter> writers = ImageIO.getImageWritersBySuffix(suffix);
        return writers.hasNext() ? writers.next() : null;
    }

    static String suffixOf(Path file) {
        Path name = file.getFileName();
        if (name == null)
            return "";

        String fileName = name.toString();
        int dot = fileName.lastIndexOf('.');
        return (dot < 0) ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private static void deleteQuietly(Path file) {
        if (file == null)
            return;

        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.fine(() -> "Could not delete " + file + ": " + e);
        }
    }

}
