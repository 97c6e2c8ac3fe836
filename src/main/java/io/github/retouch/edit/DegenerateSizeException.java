/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.retouch.edit;

/**
 * Thrown when a resize would produce an image less than one pixel wide
 * or tall.
 */
public class DegenerateSizeException extends IllegalArgumentException {

    private static final long serialVersionUID = -1722639940513380417L;

    public DegenerateSizeException(String message) {
        super(message);
    }

}
