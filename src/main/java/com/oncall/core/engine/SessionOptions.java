package com.oncall.core.engine;

import com.oncall.core.config.InvestigatorProperties;

import java.time.Duration;

/**
 * Per-session overrides of the engine defaults.
 *
 * @param maxRetries retry bound, at least 0
 * @param timeout wall-clock budget for the whole session
 */
public record SessionOptions(int maxRetries, Duration timeout) {

    public SessionOptions {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, got " + timeout);
        }
    }

    public static SessionOptions defaults(InvestigatorProperties properties) {
        return new SessionOptions(properties.getMaxRetries(), properties.getSessionTimeout());
    }

    public SessionOptions withMaxRetries(Integer override) {
        return override != null ? new SessionOptions(override, timeout) : this;
    }

    public SessionOptions withTimeout(Duration override) {
        return override != null ? new SessionOptions(maxRetries, override) : this;
    }
}
