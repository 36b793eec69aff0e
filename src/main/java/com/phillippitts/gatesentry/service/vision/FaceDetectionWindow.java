package com.phillippitts.gatesentry.service.vision;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Sliding window over the last K face-detection results of one session, with a one-shot latch.
 *
 * <p>{@link #push(boolean)} returns {@code true} exactly once per run of absent frames: when the
 * window first becomes full and all false. Any {@code true} entry re-arms the latch.
 *
 * <p>Not thread-safe; owned by the vision consumer thread.
 */
final class FaceDetectionWindow {

    private final int capacity;
    private final Deque<Boolean> entries;
    private boolean fired;

    FaceDetectionWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(capacity);
    }

    /**
     * Records one frame result.
     *
     * @return {@code true} if this push moved the window into the all-absent state
     */
    boolean push(boolean faceDetected) {
        if (entries.size() == capacity) {
            entries.pollFirst();
        }
        entries.addLast(faceDetected);
        if (faceDetected) {
            fired = false;
            return false;
        }
        if (!fired && isAllAbsent()) {
            fired = true;
            return true;
        }
        return false;
    }

    boolean isAllAbsent() {
        return entries.size() == capacity && !entries.contains(Boolean.TRUE);
    }

    int size() {
        return entries.size();
    }

    List<Boolean> snapshot() {
        return new ArrayList<>(entries);
    }
}
