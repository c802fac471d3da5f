package com.customerhub.util;

import java.time.LocalDateTime;

/**
 * Utility class for audit timestamps.
 */
public final class Timestamps {

    private Timestamps() {
    }

    /**
     * Return {@code candidate}, or {@code floor} when the candidate falls before it.
     * Keeps updatedAt from ever preceding createdAt, even if the clock steps back.
     */
    public static LocalDateTime notBefore(LocalDateTime candidate, LocalDateTime floor) {
        if (floor == null || !candidate.isBefore(floor)) {
            return candidate;
        }
        return floor;
    }
}
