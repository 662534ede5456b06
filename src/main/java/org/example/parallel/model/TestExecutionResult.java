package org.example.parallel.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Ergebnis eines isolierten Testaufrufs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TestExecutionResult {

    private String testId;
    private String workerId;
    private TestOutcome outcome;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private Long durationMs;
    private String failureReason;

    public boolean isSuccess() {
        return outcome == TestOutcome.PASSED;
    }

    public static TestExecutionResult skipped(String testId, String workerId, TestOutcome outcome, String reason) {
        LocalDateTime now = LocalDateTime.now();
        return TestExecutionResult.builder()
                .testId(testId)
                .workerId(workerId)
                .outcome(outcome)
                .startTime(now)
                .endTime(now)
                .durationMs(0L)
                .failureReason(reason)
                .build();
    }
}
