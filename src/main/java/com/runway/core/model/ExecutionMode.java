package com.runway.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a session's commands are run. {@code MANUAL} runs them visibly in a terminal,
 * {@code AGENTIC} runs them in the background. Affects visibility, not correctness.
 */
public enum ExecutionMode {
    MANUAL,
    AGENTIC;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ExecutionMode fromWire(String value) {
        if (value == null) {
            return MANUAL;
        }
        return ExecutionMode.valueOf(value.trim().toUpperCase());
    }
}
