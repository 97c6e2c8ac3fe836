/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.retouch.awt;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.Transparency;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorConvertOp;
import java.awt.image.ColorModel;
import java.awt.image.ComponentColorModel;
import java.awt.image.DataBuffer;

/**
 * Quality-preserving resampling of opaque images, in either direction.
 * <p>
 * Downscaling by a factor greater than 2 is performed in successive
 * halving steps, so every source pixel contributes to the result much like
 * area averaging.  Each step is drawn with bicubic interpolation in linear
 * RGB, according to:</p>
 * <ul>
 * <li><a href="http://www.ericbrasseur.org/gamma.html">Gamma error in picture scaling</a></li>
 * <li><a href="https://entropymine.com/imageworsener/gamma/">Image scaling and gamma correction</a></li>
 * </ul>
 *
 * @see  <a href="https://web.archive.org/web/20080516181120/http://today.java.net/pub/a/today/2007/04/03/perils-of-image-getscaledinstance.html"
 *              >The Perils of Image.getScaledInstance()</a> <i>by Chris Campbell</i>
 */
public final class SmoothResample {

    private static final RenderingHints defaultHints;
    static {
        RenderingHints hints = new RenderingHints(
                RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
        hints.put(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
        hints.put(RenderingHints.KEY_COLOR_RENDERING, RenderingHints.VALUE_COLOR_RENDER_QUALITY);
        defaultHints = hints;
    }

    /** Intermediate steps double the target, which must not overflow. */
    public static final int MAX_DIMENSION = Integer.MAX_VALUE / 2;

    private SmoothResample() {/* no instances */}

    /**
     * Scales the given image to exactly {@code targetWidth × targetHeight}.
     * Any alpha channel of the source is discarded.
     *
     * @return  a new sRGB image; the source is left untouched
     * @throws  IllegalArgumentException  if a target dimension is less than 1
     *          or greater than {@link #MAX_DIMENSION}
     */
    public static BufferedImage resize(BufferedImage image,
                                       int targetWidth,
                                       int targetHeight) {
        if (targetWidth < 1 || targetHeight < 1
                || targetWidth > MAX_DIMENSION || targetHeight > MAX_DIMENSION) {
            throw new IllegalArgumentException("Invalid target size: "
                                               + targetWidth + "x" + targetHeight);
        }
        BufferedImage scaled = resizeLinear(convertToLinearRGB(image),
                                            targetWidth, targetHeight);
        scaled = overrideColorSpace(scaled, CS_LINEAR_RGB);
        return convertToDefaultRGB(scaled);
    }

    private static BufferedImage resizeLinear(BufferedImage image,
                                              int targetWidth,
                                              int targetHeight) {
        BufferedImage source = image;
        int doubleWidth = targetWidth * 2;
        int doubleHeight = targetHeight * 2;
        if (doubleWidth < source.getWidth()
                || doubleHeight < source.getHeight()) {
            int stepWidth = doubleWidth < source.getWidth() ? doubleWidth : targetWidth;
            int stepHeight = doubleHeight < source.getHeight() ? doubleHeight : targetHeight;
            source = resizeLinear(source, stepWidth, stepHeight);
        }

        // Drawing into a linear color model gets converted back to sRGB,
        // so draw into the default one and relabel afterwards.
        BufferedImage scaled = newBufferedImage(targetWidth, targetHeight, CM_DEFAULT_RGB);
        Graphics2D g = scaled.createGraphics();
        try {
            g.addRenderingHints(defaultHints);
            g.drawImage(source, 0, 0, targetWidth, targetHeight, null);
        } finally {
            g.dispose();
        }
        return scaled;
    }

    private static BufferedImage convertToLinearRGB(BufferedImage image) {
        BufferedImage target = newBufferedImage(image.getWidth(),
                                                image.getHeight(), CM_LINEAR_RGB);
        return overrideColorSpace(colorConvertOp.get().filter(image, target),
                                  CS_sRGB);
    }

    private static BufferedImage convertToDefaultRGB(BufferedImage image) {
        BufferedImage target = newBufferedImage(image.getWidth(),
                                                image.getHeight(), CM_DEFAULT_RGB);
        return colorConvertOp.get().filter(image, target);
    }

    private static final ThreadLocal<ColorConvertOp>
            colorConvertOp = ThreadLocal.withInitial(() -> new ColorConvertOp(defaultHints));

    private static BufferedImage newBufferedImage(int width, int height, ColorModel cm) {
        return new BufferedImage(cm,
                cm.createCompatibleWritableRaster(width, height),
                cm.isAlphaPremultiplied(), null);
    }

    private static BufferedImage overrideColorSpace(BufferedImage source, ColorSpace cspace) {
        ColorModel scm = source.getColorModel();
        if (!(scm instanceof ComponentColorModel)) {
            throw new IllegalArgumentException("source.colorModel is not ComponentColorModel");
        }
        ColorModel cm = new ComponentColorModel(cspace, null, scm.hasAlpha(),
                scm.isAlphaPremultiplied(), scm.getTransparency(), scm.getTransferType());
        return new BufferedImage(cm, source.getRaster(), cm.isAlphaPremultiplied(), null);
    }

    private static ColorModel newColorModel(ColorSpace cspace) {
        return new ComponentColorModel(cspace, false, false,
                                       Transparency.OPAQUE, DataBuffer.TYPE_BYTE);
    }

    private static final ColorSpace
            CS_sRGB = ColorSpace.getInstance(ColorSpace.CS_sRGB),
            CS_LINEAR_RGB = ColorSpace.getInstance(ColorSpace.CS_LINEAR_RGB);

    private static final ColorModel
            CM_DEFAULT_RGB = newColorModel(CS_sRGB),
            CM_LINEAR_RGB = newColorModel(CS_LINEAR_RGB);

}
