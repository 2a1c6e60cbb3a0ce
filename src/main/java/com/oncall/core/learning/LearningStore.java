package com.oncall.core.learning;

import com.oncall.core.model.SessionLearning;

import java.util.List;

/**
 * Cross-session memory of finished investigations.
 */
public interface LearningStore {

    /**
     * @return up to {@code limit} most recent sessions, oldest first
     */
    List<SessionLearning> recent(int limit);

    /**
     * Stores a session; implementations may drop the oldest entries beyond their retention.
     */
    void append(SessionLearning session);
}
