/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.retouch.image;

import java.util.Arrays;
import java.util.Objects;

import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.awt.image.Raster;

/**
 * Immutable rectangular RGB pixel buffer.
 * <p>
 * Pixel data is stored row-major with {@value #CHANNELS} interleaved 8-bit
 * channels (red, green, blue).  Any decoded {@code BufferedImage} is
 * normalized to this layout: alpha is dropped, grayscale and indexed
 * images are expanded to three channels.  Instances never expose their
 * backing array, so buffers may be shared freely.</p>
 */
public final class ImageBuffer {

    public static final int CHANNELS = 3;

    /** Largest sample array a buffer may hold. */
    public static final int MAX_SAMPLES = Integer.MAX_VALUE - 8;

    private final int width;
    private final int height;
    private final byte[] data;

    private ImageBuffer(int width, int height, byte[] data) {
        this.width = width;
        this.height = height;
        this.data = data;
    }

    /**
     * Creates a buffer from a copy of the given interleaved RGB data.
     *
     * @throws  IllegalArgumentException  if the dimensions are not
     *          positive or {@code rgb.length != width * height * 3}
     */
    public static ImageBuffer of(int width, int height, byte[] rgb) {
        checkSize(width, height);
        if (rgb.length != (long) width * height * CHANNELS) {
            throw new IllegalArgumentException("Expected " + width + "x"
                    + height + "x" + CHANNELS + " samples, got " + rgb.length);
        }
        return new ImageBuffer(width, height, rgb.clone());
    }

    /**
     * Captures the pixels of the given image.  The image is not retained.
     */
    public static ImageBuffer of(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        checkSize(w, h);

        byte[] samples = new byte[w * h * CHANNELS];
        int[] row = new int[w];
        for (int y = 0, offset = 0; y < h; y++) {
            image.getRGB(0, y, w, 1, row, 0, w);
            for (int x = 0; x < w; x++) {
                int rgb = row[x];
                samples[offset++] = (byte) (rgb >> 16);
                samples[offset++] = (byte) (rgb >> 8);
                samples[offset++] = (byte) rgb;
            }
        }
        return new ImageBuffer(w, h, samples);
    }

    private static void checkSize(int width, int height) {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("Invalid image size: "
                                               + width + "x" + height);
        }
        if (!isAllocatable(width, height)) {
            throw new IllegalArgumentException("Image too large: "
                                               + width + "x" + height);
        }
    }

    /**
     * {@return whether a buffer of the given positive size stays within
     * {@link #MAX_SAMPLES}}
     */
    public static boolean isAllocatable(long width, long height) {
        return width >= 1 && height >= 1
                && width <= MAX_SAMPLES / CHANNELS / height;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int channels() {
        return CHANNELS;
    }

    /**
     * {@return the {@code 0xRRGGBB} value of the given pixel}
     */
    public int rgb(int x, int y) {
        Objects.checkIndex(x, width);
        Objects.checkIndex(y, height);
        int offset = (y * width + x) * CHANNELS;
        return (data[offset] & 0xFF) << 16
                | (data[offset + 1] & 0xFF) << 8
                | (data[offset + 2] & 0xFF);
    }

    /**
     * {@return a copy of the interleaved RGB samples}
     */
    public byte[] samples() {
        return data.clone();
    }

    /**
     * Copies the pixels inside {@code [x1, x2) × [y1, y2)} into a new
     * buffer.  The region must be non-empty and lie within this buffer.
     */
    public ImageBuffer subImage(Region region) {
        if (region.x1() < 0 || region.y1() < 0
                || region.x2() > width || region.y2() > height
                || region.isEmpty()) {
            throw new IllegalArgumentException(region
                    + " outside " + width + "x" + height);
        }
        int w = region.width();
        int h = region.height();
        byte[] samples = new byte[w * h * CHANNELS];
        int rowLength = w * CHANNELS;
        for (int y = 0; y < h; y++) {
            System.arraycopy(data, ((region.y1() + y) * width + region.x1()) * CHANNELS,
                             samples, y * rowLength, rowLength);
        }
        return new ImageBuffer(w, h, samples);
    }

    /**
     * {@return a new {@code TYPE_3BYTE_BGR} image holding these pixels}
     */
    public BufferedImage toBufferedImage() {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_3BYTE_BGR);
        byte[] bgr = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
        for (int i = 0; i < data.length; i += CHANNELS) {
            bgr[i] = data[i + 2];
            bgr[i + 1] = data[i + 1];
            bgr[i + 2] = data[i];
        }
        return image;
    }

    /**
     * Same as {@link #of(BufferedImage)} but reads the samples straight off
     * a {@code TYPE_3BYTE_BGR} raster when possible.
     */
    static ImageBuffer fromBGR(BufferedImage image) {
        if (image.getType() != BufferedImage.TYPE_3BYTE_BGR) {
            return of(image);
        }
        Raster raster = image.getRaster();
        if (raster.getParent() != null
                || !(raster.getDataBuffer() instanceof DataBufferByte)) {
            return of(image);
        }
        byte[] bgr = ((DataBufferByte) raster.getDataBuffer()).getData();
        int w = image.getWidth();
        int h = image.getHeight();
        if (bgr.length != w * h * CHANNELS) {
            return of(image);
        }
        byte[] samples = new byte[bgr.length];
        for (int i = 0; i < bgr.length; i += CHANNELS) {
            samples[i] = bgr[i + 2];
            samples[i + 1] = bgr[i + 1];
            samples[i + 2] = bgr[i];
        }
        return new ImageBuffer(w, h, samples);
    }

    /**
     * {@return whether {@code obj} has the same dimensions and
     * byte-identical samples}
     */
    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;

        if (!(obj instanceof ImageBuffer))
            return false;

        ImageBuffer other = (ImageBuffer) obj;
        return width == other.width
                && height == other.height
                && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "ImageBuffer(" + width + "x" + height + "x" + CHANNELS + ")";
    }

}
