/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.retouch.edit;

import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;

import io.github.retouch.image.Region;

/**
 * Maps a selection made on a display surface to image pixels.
 * <p>
 * The selection is given by two corner points in the display's coordinate
 * system, along with the bounds the image is currently rendered at in that
 * same system.  Zoom, pan and scroll offset all reduce to those bounds, so
 * the display may change how it presents the image without the editing
 * side knowing.</p>
 */
public final class CoordinateMapper {

    private CoordinateMapper() {/* no instances */}

    /**
     * Resolves a view-space selection to an image-space region.  Parts of the
     * selection falling outside the rendered image bounds are clipped.
     *
     * @param   start  first corner of the selection
     * @param   end  opposite corner of the selection
     * @param   imageBounds  where the image is rendered on the display
     * @param   imageWidth  width of the image in pixels
     * @param   imageHeight  height of the image in pixels
     * @return  an ordered, non-empty region within
     *          {@code [0, imageWidth] × [0, imageHeight]}
     * @throws  InvalidRegionException  if the selection covers no whole
     *          pixel of the image, or {@code imageBounds} is empty
     */
    public static Region toImageRegion(Point2D start,
                                       Point2D end,
                                       Rectangle2D imageBounds,
                                       int imageWidth,
                                       int imageHeight) {
        if (imageBounds.isEmpty()) {
            throw new InvalidRegionException("Empty image bounds: " + imageBounds);
        }

        double minX = Math.min(start.getX(), end.getX());
        double minY = Math.min(start.getY(), end.getY());
        double maxX = Math.max(start.getX(), end.getX());
        double maxY = Math.max(start.getY(), end.getY());

        Region region = new Region(
                toPixel(minX, imageBounds.getX(), imageBounds.getWidth(), imageWidth),
                toPixel(minY, imageBounds.getY(), imageBounds.getHeight(), imageHeight),
                toPixel(maxX, imageBounds.getX(), imageBounds.getWidth(), imageWidth),
                toPixel(maxY, imageBounds.getY(), imageBounds.getHeight(), imageHeight));
        if (region.isEmpty()) {
            throw new InvalidRegionException("Selection has no area: " + region);
        }
        return region;
    }

    private static int toPixel(double view, double origin, double extent, int size) {
        double relative = (view - origin) / extent;
        if (Double.isNaN(relative)) {
            throw new InvalidRegionException("Invalid coordinate: " + view);
        }
        return (int) Math.round(Math.max(0, Math.min(relative, 1)) * size);
    }

}
