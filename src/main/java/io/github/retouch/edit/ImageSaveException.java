/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.retouch.edit;

import java.io.IOException;

/**
 * Signals there is no image to save, or encoding/writing the destination
 * failed.
 */
public class ImageSaveException extends IOException {

    private static final long serialVersionUID = -5210698325410317406L;

    public ImageSaveException(String message) {
        super(message);
    }

    public ImageSaveException(String message, Throwable cause) {
        super(message, cause);
    }

}
