package org.example.parallel.service;

import lombok.extern.slf4j.Slf4j;
import org.example.parallel.model.ParallelExecutionMetrics;
import org.example.parallel.model.ReportEvent;
import org.example.parallel.model.ReportEventType;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Live progress and consolidated reports for parallel executions.
 *
 * <p>Producers only enqueue. A single consumer thread applies every event to the
 * execution metrics and then notifies the registered callbacks, so metrics are
 * never mutated from worker threads.</p>
 */
@Slf4j
public class ParallelReportingManager {

    private final BlockingQueue<ReportEvent> reportQueue = new LinkedBlockingQueue<>();
    private final Map<String, ExecutionData> executions = new LinkedHashMap<>();
    private final List<Consumer<ReportEvent>> callbacks = new CopyOnWriteArrayList<>();
    private final Object metricsLock = new Object();
    private final Object pendingLock = new Object();
    private final int maxTestResults;

    private int pendingEvents;
    private volatile boolean running;
    private ExecutorService consumer;

    public ParallelReportingManager() {
        this(1000);
    }

    public ParallelReportingManager(int maxTestResults) {
        this.maxTestResults = Math.max(maxTestResults, 1);
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        consumer = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "report-consumer");
            t.setDaemon(true);
            return t;
        });
        consumer.submit(this::processReports);
        log.info("Reporting consumer started");
    }

    /**
     * Stops the consumer after it has drained what is already queued.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        consumer.shutdown();
        try {
            if (!consumer.awaitTermination(5, TimeUnit.SECONDS)) {
                consumer.shutdownNow();
            }
        } catch (InterruptedException e) {
            consumer.shutdownNow();
            Thread.currentThread().interrupt();
        }
        consumer = null;
        log.info("Reporting consumer stopped");
    }

    public boolean isRunning() {
        return running;
    }

    public String startExecutionTracking(String executionId, int totalTests, int workerCount) {
        if (executionId == null || executionId.isBlank()) {
            throw new IllegalArgumentException("executionId must not be blank");
        }
        synchronized (metricsLock) {
            ParallelExecutionMetrics metrics = ParallelExecutionMetrics.builder()
                    .executionId(executionId)
                    .startTime(LocalDateTime.now())
                    .totalTests(totalTests)
                    .workerCount(workerCount)
                    .build();
            executions.put(executionId, new ExecutionData(metrics));
        }
        log.info("Started execution tracking: {} ({} tests, {} workers)", executionId, totalTests, workerCount);
        return executionId;
    }

    public void reportTestCompletion(String executionId, String testId, String workerId, boolean success,
                                     Duration duration, Map<String, Object> metadata) {
        enqueue(ReportEvent.builder()
                .type(ReportEventType.TEST_COMPLETION)
                .executionId(executionId)
                .testId(testId)
                .workerId(workerId)
                .success(success)
                .duration(duration != null ? duration.toMillis() / 1000.0 : 0.0)
                .metadata(metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>())
                .build());
    }

    public void reportWorkerStatus(String executionId, String workerId, String status, String currentTest) {
        enqueue(ReportEvent.builder()
                .type(ReportEventType.WORKER_STATUS)
                .executionId(executionId)
                .workerId(workerId)
                .status(status)
                .currentTest(currentTest)
                .build());
    }

    public void updateResourceUtilization(String executionId, Map<String, Double> utilization) {
        enqueue(ReportEvent.builder()
                .type(ReportEventType.RESOURCE_UTILIZATION)
                .executionId(executionId)
                .utilization(utilization != null ? new LinkedHashMap<>(utilization) : new LinkedHashMap<>())
                .build());
    }

    public void addReportCallback(Consumer<ReportEvent> callback) {
        callbacks.add(callback);
    }

    /**
     * Waits until every event enqueued so far has been processed.
     *
     * @return {@code false} if the timeout elapsed first
     */
    public boolean flush(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        synchronized (pendingLock) {
            while (pendingEvents > 0) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMs <= 0) {
                    log.warn("Report flush timed out with {} events pending", pendingEvents);
                    return false;
                }
                try {
                    pendingLock.wait(remainingMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
            return true;
        }
    }

    /**
     * Progress snapshot; empty for an unknown execution.
     */
    public Map<String, Object> getRealTimeMetrics(String executionId) {
        synchronized (metricsLock) {
            ExecutionData data = executions.get(executionId);
            if (data == null) {
                return new LinkedHashMap<>();
            }
            ParallelExecutionMetrics metrics = data.metrics;
            LocalDateTime end = metrics.getEndTime() != null ? metrics.getEndTime() : LocalDateTime.now();
            double elapsed = Duration.between(metrics.getStartTime(), end).toMillis() / 1000.0;
            double testsPerSecond = metrics.getCompletedTests() / Math.max(elapsed, 1.0);
            int remaining = Math.max(metrics.getTotalTests() - metrics.getCompletedTests(), 0);

            Map<String, Object> result = new LinkedHashMap<>();
            result.put("execution_id", executionId);
            result.put("start_time", metrics.getStartTime().toString());
            result.put("elapsed_time", elapsed);
            result.put("total_tests", metrics.getTotalTests());
            result.put("completed_tests", metrics.getCompletedTests());
            result.put("failed_tests", metrics.getFailedTests());
            result.put("success_rate", successRate(metrics));
            result.put("progress_percentage", metrics.getTotalTests() > 0
                    ? (double) metrics.getCompletedTests() / metrics.getTotalTests() * 100 : 0.0);
            result.put("tests_per_second", testsPerSecond);
            result.put("eta_seconds", remaining / Math.max(testsPerSecond, 0.01));
            result.put("worker_count", metrics.getWorkerCount());
            result.put("average_test_duration", metrics.getAverageTestDuration());
            result.put("worker_status", copyNested(data.workerStatus));
            result.put("resource_utilization", new LinkedHashMap<>(metrics.getResourceUtilization()));
            return result;
        }
    }

    /**
     * Marks the execution finished. The end time is set only once.
     */
    public boolean finishExecutionTracking(String executionId) {
        synchronized (metricsLock) {
            ExecutionData data = executions.get(executionId);
            if (data == null) {
                return false;
            }
            finalizeMetrics(data.metrics);
        }
        log.info("Finished execution tracking: {}", executionId);
        return true;
    }

    public Map<String, Object> generateConsolidatedReport(String executionId) {
        synchronized (metricsLock) {
            ExecutionData data = executions.get(executionId);
            if (data == null) {
                return new LinkedHashMap<>();
            }
            ParallelExecutionMetrics metrics = data.metrics;
            finalizeMetrics(metrics);

            double totalTime = metrics.getTotalExecutionTime();
            double divisor = totalTime * metrics.getWorkerCount();
            double efficiency = divisor > 0
                    ? metrics.getTotalTests() * metrics.getAverageTestDuration() / divisor * 100 : 0.0;

            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("execution_id", executionId);
            summary.put("start_time", metrics.getStartTime().toString());
            summary.put("end_time", metrics.getEndTime().toString());
            summary.put("total_execution_time", totalTime);
            summary.put("total_tests", metrics.getTotalTests());
            summary.put("completed_tests", metrics.getCompletedTests());
            summary.put("failed_tests", metrics.getFailedTests());
            summary.put("success_rate", successRate(metrics));
            summary.put("worker_count", metrics.getWorkerCount());

            Map<String, Object> performance = new LinkedHashMap<>();
            performance.put("average_test_duration", metrics.getAverageTestDuration());
            performance.put("tests_per_second", metrics.getCompletedTests() / Math.max(totalTime, 1.0));
            performance.put("parallel_efficiency", efficiency);
            performance.put("resource_utilization", new LinkedHashMap<>(metrics.getResourceUtilization()));
            performance.put("throughput_metrics", new LinkedHashMap<>(metrics.getThroughputMetrics()));

            Map<String, Object> report = new LinkedHashMap<>();
            report.put("execution_summary", summary);
            report.put("performance_metrics", performance);
            report.put("worker_details", copyNested(data.workerDetails));
            report.put("test_results", new ArrayList<>(data.testResults));
            report.put("generation_time", LocalDateTime.now().toString());
            return report;
        }
    }

    public boolean isTracking(String executionId) {
        synchronized (metricsLock) {
            return executions.containsKey(executionId);
        }
    }

    private void enqueue(ReportEvent event) {
        synchronized (pendingLock) {
            pendingEvents++;
        }
        reportQueue.offer(event);
    }

    private void processReports() {
        while (running || !reportQueue.isEmpty()) {
            ReportEvent event;
            try {
                event = reportQueue.poll(1, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (event == null) {
                continue;
            }
            try {
                handleReport(event);
            } catch (Exception e) {
                log.error("Error processing report event {}: {}", event.getType(), e.getMessage(), e);
            } finally {
                synchronized (pendingLock) {
                    pendingEvents--;
                    pendingLock.notifyAll();
                }
            }
        }
    }

    private void handleReport(ReportEvent event) {
        synchronized (metricsLock) {
            ExecutionData data = executions.get(event.getExecutionId());
            if (data == null) {
                log.debug("Dropping {} event for unknown execution {}", event.getType(), event.getExecutionId());
                return;
            }
            switch (event.getType()) {
                case TEST_COMPLETION -> applyTestCompletion(data, event);
                case WORKER_STATUS -> applyWorkerStatus(data, event);
                case RESOURCE_UTILIZATION -> data.metrics.getResourceUtilization().putAll(event.getUtilization());
            }
        }

        for (Consumer<ReportEvent> callback : callbacks) {
            try {
                callback.accept(event);
            } catch (Exception e) {
                log.error("Error in report callback: {}", e.getMessage(), e);
            }
        }
    }

    private void applyTestCompletion(ExecutionData data, ReportEvent event) {
        ParallelExecutionMetrics metrics = data.metrics;
        int completed = metrics.getCompletedTests() + 1;
        metrics.setCompletedTests(completed);
        if (!event.isSuccess()) {
            metrics.setFailedTests(metrics.getFailedTests() + 1);
        }
        double average = metrics.getAverageTestDuration();
        metrics.setAverageTestDuration(average + (event.getDuration() - average) / completed);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("test_id", event.getTestId());
        result.put("worker_id", event.getWorkerId());
        result.put("success", event.isSuccess());
        result.put("duration", event.getDuration());
        result.put("timestamp", event.getTimestamp().toString());
        if (!event.getMetadata().isEmpty()) {
            result.put("metadata", event.getMetadata());
        }
        data.testResults.addLast(result);
        while (data.testResults.size() > maxTestResults) {
            data.testResults.removeFirst();
        }

        Map<String, Object> worker = data.workerDetails.computeIfAbsent(event.getWorkerId(), id -> {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("tests_completed", 0);
            details.put("tests_failed", 0);
            details.put("total_duration", 0.0);
            return details;
        });
        int workerCompleted = (int) worker.get("tests_completed") + 1;
        double workerDuration = (double) worker.get("total_duration") + event.getDuration();
        worker.put("tests_completed", workerCompleted);
        worker.put("tests_failed", (int) worker.get("tests_failed") + (event.isSuccess() ? 0 : 1));
        worker.put("total_duration", workerDuration);
        worker.put("average_duration", workerDuration / workerCompleted);
    }

    private void applyWorkerStatus(ExecutionData data, ReportEvent event) {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", event.getStatus());
        status.put("current_test", event.getCurrentTest());
        status.put("last_update", event.getTimestamp().toString());
        data.workerStatus.put(event.getWorkerId(), status);
    }

    private static void finalizeMetrics(ParallelExecutionMetrics metrics) {
        if (metrics.isFinished()) {
            return;
        }
        metrics.setEndTime(LocalDateTime.now());
        double totalTime = Duration.between(metrics.getStartTime(), metrics.getEndTime()).toMillis() / 1000.0;
        metrics.setTotalExecutionTime(totalTime);
        metrics.getThroughputMetrics().put("tests_per_second", metrics.getCompletedTests() / Math.max(totalTime, 1.0));
        metrics.getThroughputMetrics().put("tests_per_worker",
                (double) metrics.getCompletedTests() / Math.max(metrics.getWorkerCount(), 1));
    }

    private static double successRate(ParallelExecutionMetrics metrics) {
        return (double) (metrics.getCompletedTests() - metrics.getFailedTests())
                / Math.max(metrics.getCompletedTests(), 1) * 100;
    }

    private static Map<String, Object> copyNested(Map<String, Map<String, Object>> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(key, new LinkedHashMap<>(value)));
        return copy;
    }

    private static final class ExecutionData {
        private final ParallelExecutionMetrics metrics;
        private final Deque<Map<String, Object>> testResults = new ArrayDeque<>();
        private final Map<String, Map<String, Object>> workerStatus = new LinkedHashMap<>();
        private final Map<String, Map<String, Object>> workerDetails = new LinkedHashMap<>();

        private ExecutionData(ParallelExecutionMetrics metrics) {
            this.metrics = metrics;
        }
    }
}
