/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.retouch.io;

import java.io.IOException;

/**
 * Signals malformed or out-of-range content in a file that was otherwise
 * read successfully, such as a settings file with an invalid value.
 */
public class DataFormatException extends IOException {

    private static final long serialVersionUID = 4184120373925178261L;

    public DataFormatException(String message) {
        super(message);
    }

    public DataFormatException(String message, Throwable cause) {
        super(message, cause);
    }

}
