package com.yhy.extrusion.support;

import com.yhy.extrusion.exception.OptimizationCancelledException;

/**
 * Cooperative cancellation flag, polled at generation boundaries and before a new bar is opened.
 * <p>
 * A {@link #linked()} token also trips when its parent does, while cancelling it leaves the
 * parent untouched.
 */
public final class CancellationToken {

    private final CancellationToken parent;
    private volatile boolean cancelled;
    private volatile String reason;

    private CancellationToken(CancellationToken parent) {
        this.parent = parent;
    }

    public static CancellationToken none() {
        return new CancellationToken(null);
    }

    public CancellationToken linked() {
        return new CancellationToken(this);
    }

    public void cancel(String reason) {
        this.reason = reason;
        this.cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled || (parent != null && parent.isCancelled());
    }

    public void checkpoint() {
        if (parent != null) {
            parent.checkpoint();
        }
        if (cancelled) {
            throw new OptimizationCancelledException(reason == null ? "cancelled by caller" : reason);
        }
    }
}
