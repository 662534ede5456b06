package org.example.parallel.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Event handed from worker threads to the reporting consumer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportEvent {

    private ReportEventType type;
    private String executionId;
    private String testId;
    private String workerId;
    private boolean success;

    /** Test duration in seconds. */
    private double duration;

    private String status;
    private String currentTest;

    @Builder.Default
    private Map<String, Double> utilization = new HashMap<>();

    @Builder.Default
    private LocalDateTime timestamp = LocalDateTime.now();

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();
}
