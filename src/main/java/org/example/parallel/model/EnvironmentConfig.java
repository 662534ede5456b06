package org.example.parallel.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Caller-supplied overrides for a new isolated environment.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnvironmentConfig {

    @Builder.Default
    private Map<String, String> environmentVariables = new HashMap<>();

    @Builder.Default
    private Map<String, Object> resources = new HashMap<>();
}
