/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.retouch.edit;

import java.io.IOException;

/**
 * Signals the source file could not be read or could not be decoded as
 * an image.
 */
public class ImageLoadException extends IOException {

    private static final long serialVersionUID = 2873510974210353816L;

    public ImageLoadException(String message) {
        super(message);
    }

    public ImageLoadException(String message, Throwable cause) {
        super(message, cause);
    }

}
