package com.devmanager.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Who produced a {@link Turn}.
 *
 * Serialized by its lower-case wire name so that saved history stays readable
 * and stable across refactors of the constant names.
 */
public enum Sender {
    USER("user"),
    MANAGER("manager"),
    MANAGER_CLARIFICATION_REQUEST("manager_clarification_request"),
    WORKER_LOG("worker_log"),
    SYSTEM("system"),
    SYSTEM_ERROR("system_error");

    private final String wireName;

    Sender(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static Sender fromWireName(String value) {
        for (Sender s : values()) {
            if (s.wireName.equals(value)) return s;
        }
        throw new IllegalArgumentException("Unknown turn sender: " + value);
    }
}
