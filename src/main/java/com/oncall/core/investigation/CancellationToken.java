package com.oncall.core.investigation;

/**
 * Cooperative cancellation flag shared by everything working on one session.
 */
public final class CancellationToken {

    private volatile boolean cancelled;
    private volatile String reason = "";

    public void cancel(String reason) {
        this.reason = reason != null ? reason : "";
        this.cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public String reason() {
        return reason;
    }
}
