package org.example.parallel.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Built-in test-to-worker assignment strategies.
 */
public enum DistributionStrategy {

    ROUND_ROBIN("round_robin"),
    LOAD_BALANCED("load_balanced"),
    CAPABILITY_BASED("capability_based"),
    DURATION_OPTIMIZED("duration_optimized");

    private final String value;

    DistributionStrategy(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static DistributionStrategy fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("strategy must not be blank");
        }
        String normalized = value.trim();
        for (DistributionStrategy strategy : values()) {
            if (strategy.value.equalsIgnoreCase(normalized) || strategy.name().equalsIgnoreCase(normalized)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown distribution strategy: " + value);
    }
}
