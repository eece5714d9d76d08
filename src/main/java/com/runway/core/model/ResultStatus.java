package com.runway.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ResultStatus {
    OK,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ResultStatus fromWire(String value) {
        return value == null ? OK : ResultStatus.valueOf(value.trim().toUpperCase());
    }
}
