/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.retouch.image;

/**
 * Image-space pixel rectangle given by two corners {@code (x1, y1)} and
 * {@code (x2, y2)}.  The corners are not necessarily ordered; the second
 * corner is exclusive once {@linkplain #ordered() ordered}.
 */
public final class Region {

    private final int x1;
    private final int y1;
    private final int x2;
    private final int y2;

    public Region(int x1, int y1, int x2, int y2) {
        this.x1 = x1;
        this.y1 = y1;
        this.x2 = x2;
        this.y2 = y2;
    }

    public static Region of(int x1, int y1, int x2, int y2) {
        return new Region(x1, y1, x2, y2);
    }

    public int x1() { return x1; }
    public int y1() { return y1; }
    public int x2() { return x2; }
    public int y2() { return y2; }

    public int width() {
        return x2 - x1;
    }

    public int height() {
        return y2 - y1;
    }

    /**
     * {@return whether this region has zero or negative width or height}
     */
    public boolean isEmpty() {
        return width() <= 0 || height() <= 0;
    }

    /**
     * {@return a region with {@code x1 <= x2} and {@code y1 <= y2}}
     */
    public Region ordered() {
        if (x1 <= x2 && y1 <= y2)
            return this;

        return new Region(Math.min(x1, x2), Math.min(y1, y2),
                          Math.max(x1, x2), Math.max(y1, y2));
    }

    /**
     * Clamps both corners into {@code [0, width] × [0, height]}.
     */
    public Region clampTo(int width, int height) {
        return new Region(clamp(x1, width), clamp(y1, height),
                          clamp(x2, width), clamp(y2, height));
    }

    private static int clamp(int value, int max) {
        return Math.max(0, Math.min(value, max));
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;

        if (!(obj instanceof Region))
            return false;

        Region other = (Region) obj;
        return x1 == other.x1 && y1 == other.y1
                && x2 == other.x2 && y2 == other.y2;
    }

    @Override
    public int hashCode() {
        int result = x1;
        result = 31 * result + y1;
        result = 31 * result + x2;
        return 31 * result + y2;
    }

    @Override
    public String toString() {
        return "Region(" + x1 + ", " + y1 + ", " + x2 + ", " + y2 + ")";
    }

}
