package com.oncall.core.investigation;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cancellation tokens and progress records of the sessions currently running, by session id.
 */
@Component
public class CancellationRegistry {

    private final Map<String, CancellationToken> tokens = new ConcurrentHashMap<>();
    private final Map<String, SessionProgress> progress = new ConcurrentHashMap<>();

    public CancellationToken register(String sessionId) {
        progress.computeIfAbsent(sessionId, k -> new SessionProgress());
        return tokens.computeIfAbsent(sessionId, k -> new CancellationToken());
    }

    /**
     * Returns the session's progress record, or a detached one for an unknown session.
     */
    public SessionProgress progressFor(String sessionId) {
        SessionProgress existing = progress.get(sessionId);
        return existing != null ? existing : new SessionProgress();
    }

    /**
     * Returns the session's token, or a fresh never-cancelled token for an unknown session.
     */
    public CancellationToken tokenFor(String sessionId) {
        CancellationToken token = tokens.get(sessionId);
        return token != null ? token : new CancellationToken();
    }

    /**
     * @return false if no such session is running
     */
    public boolean cancel(String sessionId, String reason) {
        CancellationToken token = tokens.get(sessionId);
        if (token == null) {
            return false;
        }
        token.cancel(reason);
        return true;
    }

    public void release(String sessionId) {
        tokens.remove(sessionId);
        progress.remove(sessionId);
    }

    public boolean isRunning(String sessionId) {
        return tokens.containsKey(sessionId);
    }
}
