/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.retouch.image;

import java.awt.image.BufferedImage;

import com.jhlabs.image.GaussianFilter;
import com.jhlabs.image.GrayscaleFilter;

import io.github.retouch.awt.SmoothResample;

/**
 * Pixel transformations producing new {@code ImageBuffer}s.
 */
public final class ImageFilters {

    public static final int DEFAULT_BLUR_KERNEL = 9;

    private ImageFilters() {/* no instances */}

    /**
     * Desaturates to a single luminance value per pixel, replicated over
     * the three channels.
     */
    public static ImageBuffer grayscale(ImageBuffer source) {
        BufferedImage image = source.toBufferedImage();
        return ImageBuffer.fromBGR(new GrayscaleFilter().filter(image, null));
    }

    /**
     * Gaussian blur with a {@code kernelSize}-tap kernel per direction.  The
     * spread is derived from the kernel radius; edge pixels are clamped.
     *
     * @param   kernelSize  odd kernel size, at least 3
     */
    public static ImageBuffer blur(ImageBuffer source, int kernelSize) {
        if (kernelSize < 3 || kernelSize % 2 == 0) {
            throw new IllegalArgumentException("Kernel size must be odd and >= 3: "
                                               + kernelSize);
        }
        GaussianFilter filter = new GaussianFilter((kernelSize - 1) / 2f);
        return ImageBuffer.fromBGR(filter.filter(source.toBufferedImage(), null));
    }

    public static ImageBuffer blur(ImageBuffer source) {
        return blur(source, DEFAULT_BLUR_KERNEL);
    }

    public static ImageBuffer crop(ImageBuffer source, Region region) {
        return source.subImage(region);
    }

    public static ImageBuffer resize(ImageBuffer source, int width, int height) {
        if (width == source.width() && height == source.height()) {
            return source;
        }
        return ImageBuffer.of(SmoothResample
                .resize(source.toBufferedImage(), width, height));
    }

    /**
     * Scales the source so it fits a {@code box × box} square, keeping its
     * aspect ratio.  Smaller images get scaled up.
     */
    public static ImageBuffer fitWithin(ImageBuffer source, int box) {
        if (box < 1) {
            throw new IllegalArgumentException("Invalid box size: " + box);
        }
        double scale = Math.min((double) box / source.width(),
                                (double) box / source.height());
        int width = Math.max(1, (int) (source.width() * scale));
        int height = Math.max(1, (int) (source.height() * scale));
        return resize(source, width, height);
    }

}
