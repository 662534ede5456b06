package org.example.parallel.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a single test as seen by the dependency graph.
 */
public enum TestState {

    PENDING("pending"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    TestState(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isFinished() {
        return this == COMPLETED || this == FAILED;
    }
}
