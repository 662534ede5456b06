package org.example.parallel.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Directed edge {@code dependentTest -> dependencyTest}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TestDependency {

    private String dependentTest;
    private String dependencyTest;

    @Builder.Default
    private DependencyType dependencyType = DependencyType.BEFORE;

    private Duration timeout;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();
}
