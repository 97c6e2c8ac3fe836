/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
/**
 * Stateful image editing with undo/redo.
 * <p>
 * {@link io.github.retouch.edit.EditEngine} is the entry point.  It owns the
 * image being edited along with its {@link io.github.retouch.edit.HistoryStack};
 * display layers feed it file paths, percentages, and selections resolved
 * through {@link io.github.retouch.edit.CoordinateMapper}, and read back the
 * current and original images for rendering.</p>
 */
package io.github.retouch.edit;
