package com.runway.core.events;

import java.time.Instant;

/**
 * A raw signal forwarded to the remote store's event sink, either a hook delivery
 * received by the callback bridge or an event from a background agent stream.
 *
 * @param sessionId     the session the event belongs to
 * @param interactionId the interaction the event belongs to
 * @param eventType     e.g. "Stop", "assistant_text", "result"
 * @param eventData     the raw payload, forwarded unmodified
 * @param timestamp     when the event was received locally
 */
public record RemoteEvent(
    String sessionId,
    String interactionId,
    String eventType,
    Object eventData,
    Instant timestamp
) {}
