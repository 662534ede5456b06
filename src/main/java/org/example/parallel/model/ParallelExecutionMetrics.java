package org.example.parallel.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Metriken einer parallelen Ausführung. Durations are in seconds.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParallelExecutionMetrics {

    private String executionId;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private int totalTests;
    private int completedTests;
    private int failedTests;
    private int workerCount;
    private double averageTestDuration;
    private double totalExecutionTime;

    @Builder.Default
    private Map<String, Double> resourceUtilization = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Double> throughputMetrics = new LinkedHashMap<>();

    public boolean isFinished() {
        return endTime != null;
    }
}
