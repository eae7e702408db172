package com.familyledger.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RevisionOperation {
    CREATE,
    UPDATE,
    SOFT_DELETE,
    PURGE;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    public static RevisionOperation fromValue(String value) {
        return valueOf(value.toUpperCase());
    }
}
