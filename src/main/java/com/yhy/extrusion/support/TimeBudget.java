package com.yhy.extrusion.support;

/**
 * Wall-clock budget of one run. Immutable, so partitions running in parallel can share it.
 */
public final class TimeBudget {

    /** longest budget whose deadline still fits in a nanosecond clock reading */
    static final long MAX_BUDGET_MS = Long.MAX_VALUE / 2_000_000L;

    private final long startNanos;
    private final long deadlineNanos;

    private TimeBudget(long startNanos, long budgetMs) {
        this.startNanos = startNanos;
        this.deadlineNanos = startNanos + Math.min(budgetMs, MAX_BUDGET_MS) * 1_000_000L;
    }

    public static TimeBudget startingNow(long budgetMs) {
        return new TimeBudget(System.nanoTime(), budgetMs);
    }

    public static TimeBudget unlimited() {
        return new TimeBudget(System.nanoTime(), MAX_BUDGET_MS);
    }

    public long elapsedMs() {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    public long remainingMs() {
        return Math.max(0, (deadlineNanos - System.nanoTime()) / 1_000_000L);
    }

    public boolean exhausted() {
        return System.nanoTime() - deadlineNanos >= 0;
    }
}
