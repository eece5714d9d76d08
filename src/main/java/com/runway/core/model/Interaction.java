package com.runway.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * One unit of work within a session. The id is the idempotency key across the
 * whole pipeline.
 *
 * @param id      unique within its session
 * @param command the command to run
 * @param result  attached by the remote store once a result was submitted; null while pending
 */
public record Interaction(
    String id,
    Command command,
    ResultSubmission result
) {

    public Interaction {
        command = command == null ? Command.of("") : command;
    }

    @JsonIgnore
    public boolean isPending() {
        return result == null;
    }
}
