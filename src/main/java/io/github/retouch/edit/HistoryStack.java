/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.retouch.edit;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;

import io.github.retouch.image.ImageBuffer;

/**
 * Undo/redo snapshots of an edit session.
 * <p>
 * The undo side holds at most {@link #capacity()} entries; pushing past
 * that evicts the oldest one.  The redo side is bounded in practice by
 * the number of consecutive undos.</p>
 */
public class HistoryStack {

    public static final int DEFAULT_CAPACITY = 20;

    private final int capacity;

    // Most recent first
    private final Deque<ImageBuffer> undo = new ArrayDeque<>();
    private final Deque<ImageBuffer> redo = new ArrayDeque<>();

    public HistoryStack() {
        this(DEFAULT_CAPACITY);
    }

    public HistoryStack(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity < 1: " + capacity);
        }
        this.capacity = capacity;
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Records the state before a mutation.  Invalidates the redo side.
     */
    public void push(ImageBuffer snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        undo.push(snapshot);
        while (undo.size() > capacity) {
            undo.removeLast();
        }
        redo.clear();
    }

    /**
     * Steps back: {@code current} goes to the redo side and the most recent
     * undo entry is returned.
     *
     * @return  the state to restore, or empty if there is nothing to undo
     */
    public Optional<ImageBuffer> undo(ImageBuffer current) {
        return transfer(undo, redo, current);
    }

    /**
     * Steps forward: {@code current} goes to the undo side and the most
     * recent redo entry is returned.
     *
     * @return  the state to restore, or empty if there is nothing to redo
     */
    public Optional<ImageBuffer> redo(ImageBuffer current) {
        return transfer(redo, undo, current);
    }

    private static Optional<ImageBuffer> transfer(Deque<ImageBuffer> from,
                                                  Deque<ImageBuffer> to,
                                                  ImageBuffer current) {
        Objects.requireNonNull(current, "current");
        ImageBuffer restored = from.poll();
        if (restored == null)
            return Optional.empty();

        to.push(current);
        return Optional.of(restored);
    }

    public void clear() {
        undo.clear();
        redo.clear();
    }

    public boolean canUndo() {
        return !undo.isEmpty();
    }

    public boolean canRedo() {
        return !redo.isEmpty();
    }

    public int undoDepth() {
        return undo.size();
    }

    public int redoDepth() {
        return redo.size();
    }

    @Override
    public String toString() {
        return "HistoryStack(undo=" + undo.size() + "/" + capacity
                + ", redo=" + redo.size() + ")";
    }

}
