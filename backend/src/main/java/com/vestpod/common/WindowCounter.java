package com.vestpod.common;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Live counter for one window. {@code count} only grows until {@code windowResetAt} is reached.
 */
@NoArgsConstructor
@AllArgsConstructor
@Getter
@Setter
public class WindowCounter {

    private WindowKind kind;
    private int limit;
    private int count;
    private Instant windowResetAt;

    public WindowCounter(WindowKind kind, int limit) {
        this.kind = kind;
        this.limit = limit;
    }

    void rollOverIfDue(Instant now) {
        if (windowResetAt == null || !now.isBefore(windowResetAt)) {
            count = 0;
            windowResetAt = kind.nextBoundary(now);
        }
    }

    boolean hasHeadroom() {
        return count < limit;
    }

    public int remaining() {
        return Math.max(0, limit - count);
    }
}
