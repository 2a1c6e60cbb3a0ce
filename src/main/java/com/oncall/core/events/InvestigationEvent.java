package com.oncall.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A progress event emitted during an investigation session.
 *
 * @param eventType  dotted event name, e.g. "device.completed"
 * @param sessionId  session the event belongs to
 * @param deviceName device the event concerns, or null for session-level events
 * @param payload    event-specific data
 * @param timestamp  when the event was created
 */
public record InvestigationEvent(
    String eventType,
    String sessionId,
    String deviceName,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static InvestigationEvent of(String eventType, String sessionId, String deviceName,
                                        Map<String, Object> payload) {
        return new InvestigationEvent(eventType, sessionId, deviceName, payload, Instant.now());
    }
}
