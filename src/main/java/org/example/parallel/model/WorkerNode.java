package org.example.parallel.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Worker-Knoten für die Testverteilung.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class WorkerNode {

    public static final String METRIC_AVERAGE_DURATION = "average_duration";
    public static final String METRIC_SUCCESS_RATE = "success_rate";
    public static final String METRIC_COMPLETED_TESTS = "completed_tests";

    private String workerId;
    private String workerType;

    @Builder.Default
    private Set<String> capabilities = new LinkedHashSet<>();

    private int currentLoad;

    @Builder.Default
    private int maxCapacity = 1;

    @Builder.Default
    private double healthScore = 1.0;

    private LocalDateTime lastHeartbeat;

    @Builder.Default
    private List<String> assignedTests = new ArrayList<>();

    @Builder.Default
    private Map<String, Double> performanceMetrics = new HashMap<>();

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    public boolean hasCapabilities(Iterable<String> required) {
        if (required == null) {
            return true;
        }
        for (String capability : required) {
            if (!capabilities.contains(capability)) {
                return false;
            }
        }
        return true;
    }

    public boolean hasSpareCapacity() {
        return currentLoad < maxCapacity;
    }
}
