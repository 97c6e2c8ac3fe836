/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.retouch.edit;

/**
 * Thrown when a crop selection has no area left after clamping to the
 * image bounds.
 */
public class InvalidRegionException extends IllegalArgumentException {

    private static final long serialVersionUID = 6395818225462902157L;

    public InvalidRegionException(String message) {
        super(message);
    }

}
