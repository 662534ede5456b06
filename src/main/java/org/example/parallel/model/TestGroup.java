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
 * Gruppe zusammengehöriger Tests für die Verteilung.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TestGroup {

    private String groupId;
    private String groupName;

    @Builder.Default
    private List<String> testIds = new ArrayList<>();

    @Builder.Default
    private String groupType = "functional";

    /** Lower values are handed to the strategies first. */
    @Builder.Default
    private int priority = 1;

    /** Estimate for the whole group; spread evenly over its tests when no history exists. */
    private Duration estimatedDuration;

    @Builder.Default
    private Set<String> requiredCapabilities = new LinkedHashSet<>();
}
