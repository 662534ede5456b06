package org.example.parallel.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PoolHealthStatus {

    HEALTHY("healthy"),
    DEGRADED("degraded"),
    UNHEALTHY("unhealthy"),
    UNKNOWN("unknown");

    private final String value;

    PoolHealthStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
