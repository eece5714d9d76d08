package com.runway.core.remote;

import com.runway.core.events.RemoteEvent;
import com.runway.core.model.ResultSubmission;
import com.runway.core.model.Session;

/**
 * The remote command queue and session store. It is the authoritative source of the
 * next command and of session status, and it broadcasts completion notifications
 * after it has processed a submitted result.
 *
 * <p>All methods throw {@link RemoteStoreException} on failure.
 */
public interface RemoteStore {

    /**
     * Returns the session with its next pending interaction. A terminal status ends
     * the session's execution loop.
     */
    Session getNextCommand(String sessionId);

    /**
     * Submits an interaction result. Expected to be idempotent on
     * (sessionId, interactionId) on the remote side.
     */
    void submitResult(String sessionId, String interactionId, ResultSubmission result);

    /**
     * Forwards a raw event (hook delivery or agent stream event).
     */
    void postEvent(RemoteEvent event);
}
