package org.example.parallel.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ReportEventType {

    TEST_COMPLETION("test_completion"),
    WORKER_STATUS("worker_status"),
    RESOURCE_UTILIZATION("resource_utilization");

    private final String value;

    ReportEventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
