package org.example.parallel.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One schedulable test for {@code ParallelTestManager.runTests}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TestCase {

    private String testId;
    private String testName;
    private TestExecutor executor;

    /** Exclusive resources locked for the duration of the call. */
    @Builder.Default
    private List<String> requiredResources = new ArrayList<>();

    /** Pools from which one slot each is allocated for the duration of the call. */
    @Builder.Default
    private List<String> requiredPools = new ArrayList<>();

    @Builder.Default
    private Set<String> requiredCapabilities = new LinkedHashSet<>();

    private Duration estimatedDuration;

    public String getDisplayName() {
        return testName != null && !testName.isBlank() ? testName : testId;
    }
}
