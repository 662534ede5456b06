package org.example.parallel.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.parallel.model.QuarantinedTest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Detects flaky tests and keeps them out of scheduling until they recover.
 *
 * <p>A test is quarantined after {@code failureThreshold} failures and released after
 * {@code successThreshold} successes while quarantined, or once the quarantine
 * duration has elapsed. Every mutation is written to the state file; I/O problems
 * are logged and the manager keeps working from memory.</p>
 */
@Slf4j
public class TestQuarantineManager {

    private final Path quarantineFile;
    private final int failureThreshold;
    private final int successThreshold;
    private final Duration quarantineDuration;
    private final ObjectMapper objectMapper;
    private final Map<String, QuarantinedTest> tests = new LinkedHashMap<>();

    public TestQuarantineManager(Path quarantineFile) {
        this(quarantineFile, 3, 5, Duration.ofHours(24));
    }

    public TestQuarantineManager(Path quarantineFile, int failureThreshold, int successThreshold,
                                 Duration quarantineDuration) {
        if (failureThreshold <= 0 || successThreshold <= 0) {
            throw new IllegalArgumentException("thresholds must be positive");
        }
        this.quarantineFile = quarantineFile;
        this.failureThreshold = failureThreshold;
        this.successThreshold = successThreshold;
        this.quarantineDuration = quarantineDuration;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        loadQuarantineData();
    }

    /**
     * Counts one run of {@code testId} and evaluates the quarantine transitions.
     */
    public synchronized void recordTestResult(String testId, String testName, boolean success, String failureReason) {
        if (testId == null || testId.isBlank()) {
            throw new IllegalArgumentException("testId must not be blank");
        }
        LocalDateTime now = LocalDateTime.now();
        QuarantinedTest test = tests.computeIfAbsent(testId, id -> QuarantinedTest.builder()
                .testId(id)
                .testName(testName != null ? testName : id)
                .build());

        if (success) {
            test.setSuccessCount(test.getSuccessCount() + 1);
            if (test.isQuarantined() && test.getSuccessCount() >= successThreshold) {
                release(test, "Released after " + test.getSuccessCount() + " successful runs");
            }
        } else {
            test.setFailureCount(test.getFailureCount() + 1);
            test.setLastFailureTime(now);
            if (failureReason != null && !failureReason.isBlank()) {
                test.getMetadata().put("last_failure_reason", failureReason);
            }
            if (!test.isQuarantined() && test.getFailureCount() >= failureThreshold) {
                test.setQuarantineStart(now);
                test.setQuarantineReason(failureReason != null && !failureReason.isBlank()
                        ? failureReason : "Excessive failures");
                test.setSuccessCount(0);
                log.warn("Test quarantined: {} ({})", testId, test.getQuarantineReason());
            }
        }
        saveQuarantineData();
    }

    /**
     * Whether {@code testId} is currently quarantined. An expired quarantine is
     * released as a side effect.
     */
    public synchronized boolean isTestQuarantined(String testId) {
        QuarantinedTest test = tests.get(testId);
        if (test == null || !test.isQuarantined()) {
            return false;
        }
        if (releaseIfExpired(test, LocalDateTime.now())) {
            saveQuarantineData();
            return false;
        }
        return true;
    }

    /** Currently quarantined tests; expired quarantines are released first. */
    public synchronized List<QuarantinedTest> getQuarantinedTests() {
        releaseExpired();
        List<QuarantinedTest> quarantined = new ArrayList<>();
        for (QuarantinedTest test : tests.values()) {
            if (test.isQuarantined()) {
                quarantined.add(test.toBuilder().metadata(new LinkedHashMap<>(test.getMetadata())).build());
            }
        }
        return quarantined;
    }

    public synchronized void forceQuarantine(String testId, String reason) {
        if (testId == null || testId.isBlank()) {
            throw new IllegalArgumentException("testId must not be blank");
        }
        QuarantinedTest test = tests.computeIfAbsent(testId, id -> QuarantinedTest.builder()
                .testId(id)
                .testName(id)
                .build());
        test.setQuarantineStart(LocalDateTime.now());
        test.setQuarantineReason(reason != null && !reason.isBlank() ? reason : "Manually quarantined");
        test.setSuccessCount(0);
        log.warn("Test force quarantined: {} ({})", testId, test.getQuarantineReason());
        saveQuarantineData();
    }

    /**
     * @return {@code false} if the test was not quarantined
     */
    public synchronized boolean forceRelease(String testId) {
        QuarantinedTest test = tests.get(testId);
        if (test == null || !test.isQuarantined()) {
            return false;
        }
        release(test, "Manually released");
        saveQuarantineData();
        return true;
    }

    public synchronized Optional<Map<String, Object>> getTestStats(String testId) {
        QuarantinedTest test = tests.get(testId);
        if (test == null) {
            return Optional.empty();
        }
        if (test.isQuarantined() && releaseIfExpired(test, LocalDateTime.now())) {
            saveQuarantineData();
        }
        int totalRuns = test.getTotalRuns();
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("test_id", test.getTestId());
        stats.put("test_name", test.getTestName());
        stats.put("total_runs", totalRuns);
        stats.put("success_count", test.getSuccessCount());
        stats.put("failure_count", test.getFailureCount());
        stats.put("success_rate", totalRuns > 0 ? test.getSuccessCount() * 100.0 / totalRuns : 0.0);
        stats.put("is_quarantined", test.isQuarantined());
        stats.put("quarantine_reason", test.getQuarantineReason());
        stats.put("quarantine_start", test.getQuarantineStart() != null ? test.getQuarantineStart().toString() : null);
        stats.put("last_failure_time", test.getLastFailureTime() != null ? test.getLastFailureTime().toString() : null);
        return Optional.of(stats);
    }

    public synchronized int getTrackedTestCount() {
        return tests.size();
    }

    public Path getQuarantineFile() {
        return quarantineFile;
    }

    private boolean releaseIfExpired(QuarantinedTest test, LocalDateTime now) {
        if (quarantineDuration == null
                || Duration.between(test.getQuarantineStart(), now).compareTo(quarantineDuration) <= 0) {
            return false;
        }
        release(test, "Quarantine period of " + quarantineDuration + " elapsed");
        return true;
    }

    private void releaseExpired() {
        LocalDateTime now = LocalDateTime.now();
        boolean changed = false;
        for (QuarantinedTest test : tests.values()) {
            if (test.isQuarantined() && releaseIfExpired(test, now)) {
                changed = true;
            }
        }
        if (changed) {
            saveQuarantineData();
        }
    }

    // failureCount is not reset on release
    private void release(QuarantinedTest test, String reason) {
        test.setQuarantineStart(null);
        test.setQuarantineReason("");
        log.info("Test released from quarantine: {} ({})", test.getTestId(), reason);
    }

    private void loadQuarantineData() {
        if (quarantineFile == null || !Files.exists(quarantineFile)) {
            return;
        }
        try {
            QuarantineState state = objectMapper.readValue(quarantineFile.toFile(), QuarantineState.class);
            if (state.getQuarantinedTests() != null) {
                for (QuarantinedTest test : state.getQuarantinedTests()) {
                    if (test.getTestId() != null) {
                        if (test.getMetadata() == null) {
                            test.setMetadata(new LinkedHashMap<>());
                        }
                        tests.put(test.getTestId(), test);
                    }
                }
            }
            log.info("Loaded {} quarantine records from {}", tests.size(), quarantineFile);
        } catch (IOException e) {
            log.warn("Could not load quarantine data from {}, starting empty: {}", quarantineFile, e.getMessage());
            tests.clear();
        }
    }

    private void saveQuarantineData() {
        if (quarantineFile == null) {
            return;
        }
        try {
            Path parent = quarantineFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            QuarantineState state = new QuarantineState(new ArrayList<>(tests.values()), LocalDateTime.now());
            objectMapper.writeValue(quarantineFile.toFile(), state);
        } catch (IOException e) {
            log.warn("Could not save quarantine data to {}: {}", quarantineFile, e.getMessage());
        }
    }

    /**
     * On-disk layout of the quarantine file.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    static class QuarantineState {
        private List<QuarantinedTest> quarantinedTests;
        private LocalDateTime updatedAt;
    }
}
