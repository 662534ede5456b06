package org.example.parallel.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of one isolated test call.
 */
public enum TestOutcome {

    PASSED("passed"),
    FAILED("failed"),
    SKIPPED_QUARANTINED("quarantined"),
    SKIPPED_DEPENDENCY("dependency_failed"),
    BLOCKED("blocked");

    private final String value;

    TestOutcome(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** True when the test body actually ran. */
    public boolean isExecuted() {
        return this == PASSED || this == FAILED;
    }
}
