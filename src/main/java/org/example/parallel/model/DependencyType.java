package org.example.parallel.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Art der Abhängigkeit zwischen zwei Tests.
 *
 * <p>{@link #BEFORE} requires the referenced test to have completed successfully,
 * {@link #MUTEX} forbids running while the referenced test runs. {@link #AFTER}
 * and {@link #PARALLEL_SAFE} are informational and never block scheduling.</p>
 */
public enum DependencyType {

    BEFORE("before"),
    AFTER("after"),
    PARALLEL_SAFE("parallel_safe"),
    MUTEX("mutex");

    private final String value;

    DependencyType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static DependencyType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("dependency type must not be blank");
        }
        for (DependencyType type : values()) {
            if (type.value.equalsIgnoreCase(value.trim()) || type.name().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown dependency type: " + value);
    }

    public boolean isBlocking() {
        return this == BEFORE || this == MUTEX;
    }
}
