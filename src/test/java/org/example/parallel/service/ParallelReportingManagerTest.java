package org.example.parallel.service;

import org.example.parallel.model.ReportEvent;
import org.example.parallel.model.ReportEventType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class ParallelReportingManagerTest {

    private static final Duration FLUSH_TIMEOUT = Duration.ofSeconds(5);

    private ParallelReportingManager reportingManager;

    @BeforeEach
    void setUp() {
        reportingManager = new ParallelReportingManager(3);
        reportingManager.start();
    }

    @AfterEach
    void tearDown() {
        reportingManager.stop();
    }

    @Test
    void startExecutionTracking_BlankId_Throws() {
        assertThrows(IllegalArgumentException.class, () -> reportingManager.startExecutionTracking(" ", 1, 1));
    }

    @Test
    void getRealTimeMetrics_UnknownExecution_IsEmpty() {
        assertTrue(reportingManager.getRealTimeMetrics("nope").isEmpty());
        assertTrue(reportingManager.generateConsolidatedReport("nope").isEmpty());
        assertFalse(reportingManager.finishExecutionTracking("nope"));
    }

    @Test
    void reportTestCompletion_UpdatesCountersAndAverage() {
        reportingManager.startExecutionTracking("run-1", 4, 2);

        reportingManager.reportTestCompletion("run-1", "t1", "w1", true, Duration.ofSeconds(2), null);
        reportingManager.reportTestCompletion("run-1", "t2", "w2", false, Duration.ofSeconds(4), null);
        assertTrue(reportingManager.flush(FLUSH_TIMEOUT));

        Map<String, Object> metrics = reportingManager.getRealTimeMetrics("run-1");
        assertEquals(2, metrics.get("completed_tests"));
        assertEquals(1, metrics.get("failed_tests"));
        assertEquals(3.0, (double) metrics.get("average_test_duration"), 1e-9);
        assertEquals(50.0, (double) metrics.get("success_rate"), 1e-9);
        assertEquals(50.0, (double) metrics.get("progress_percentage"), 1e-9);
    }

    @Test
    @SuppressWarnings("unchecked")
    void reportWorkerStatusAndUtilization_AppearInMetrics() {
        reportingManager.startExecutionTracking("run-1", 1, 1);

        reportingManager.reportWorkerStatus("run-1", "w1", "running", "t1");
        reportingManager.updateResourceUtilization("run-1", Map.of("browsers", 0.5));
        assertTrue(reportingManager.flush(FLUSH_TIMEOUT));

        Map<String, Object> metrics = reportingManager.getRealTimeMetrics("run-1");
        Map<String, Object> workerStatus = (Map<String, Object>) ((Map<String, Object>) metrics.get("worker_status")).get("w1");
        assertEquals("running", workerStatus.get("status"));
        assertEquals("t1", workerStatus.get("current_test"));
        assertEquals(Map.of("browsers", 0.5), metrics.get("resource_utilization"));
    }

    @Test
    void events_ForUnknownExecution_AreDropped() {
        reportingManager.reportTestCompletion("ghost", "t1", "w1", true, Duration.ofSeconds(1), null);

        assertTrue(reportingManager.flush(FLUSH_TIMEOUT));
        assertFalse(reportingManager.isTracking("ghost"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void generateConsolidatedReport_SummarizesWorkersAndBoundsResults() {
        reportingManager.startExecutionTracking("run-1", 4, 2);
        reportingManager.reportTestCompletion("run-1", "t1", "w1", true, Duration.ofSeconds(1), Map.of("attempt", 1));
        reportingManager.reportTestCompletion("run-1", "t2", "w1", false, Duration.ofSeconds(3), null);
        reportingManager.reportTestCompletion("run-1", "t3", "w2", true, Duration.ofSeconds(2), null);
        reportingManager.reportTestCompletion("run-1", "t4", "w2", true, Duration.ofSeconds(2), null);
        assertTrue(reportingManager.flush(FLUSH_TIMEOUT));

        Map<String, Object> report = reportingManager.generateConsolidatedReport("run-1");

        Map<String, Object> summary = (Map<String, Object>) report.get("execution_summary");
        assertEquals(4, summary.get("completed_tests"));
        assertEquals(1, summary.get("failed_tests"));
        assertNotNull(summary.get("end_time"));

        Map<String, Object> workers = (Map<String, Object>) report.get("worker_details");
        Map<String, Object> w1 = (Map<String, Object>) workers.get("w1");
        assertEquals(2, w1.get("tests_completed"));
        assertEquals(1, w1.get("tests_failed"));
        assertEquals(2.0, (double) w1.get("average_duration"), 1e-9);

        List<Map<String, Object>> results = (List<Map<String, Object>>) report.get("test_results");
        assertEquals(3, results.size());
        assertEquals("t2", results.get(0).get("test_id"));

        Map<String, Object> performance = (Map<String, Object>) report.get("performance_metrics");
        assertTrue(performance.containsKey("parallel_efficiency"));
        assertTrue((double) performance.get("parallel_efficiency") >= 0.0);
    }

    @Test
    void finishExecutionTracking_SetsEndTimeOnce() throws InterruptedException {
        reportingManager.startExecutionTracking("run-1", 0, 1);

        assertTrue(reportingManager.finishExecutionTracking("run-1"));
        Object firstEnd = ((Map<?, ?>) reportingManager.generateConsolidatedReport("run-1").get("execution_summary"))
                .get("end_time");
        Thread.sleep(10);
        reportingManager.finishExecutionTracking("run-1");
        Object secondEnd = ((Map<?, ?>) reportingManager.generateConsolidatedReport("run-1").get("execution_summary"))
                .get("end_time");

        assertEquals(firstEnd, secondEnd);
    }

    @Test
    void callbacks_ThrowingCallbackDoesNotStopProcessing() {
        List<ReportEvent> received = new CopyOnWriteArrayList<>();
        reportingManager.addReportCallback(event -> {
            throw new IllegalStateException("listener broken");
        });
        reportingManager.addReportCallback(received::add);
        reportingManager.startExecutionTracking("run-1", 2, 1);

        reportingManager.reportTestCompletion("run-1", "t1", "w1", true, Duration.ofSeconds(1), null);
        reportingManager.reportWorkerStatus("run-1", "w1", "idle", null);
        assertTrue(reportingManager.flush(FLUSH_TIMEOUT));

        assertEquals(2, received.size());
        assertEquals(ReportEventType.TEST_COMPLETION, received.get(0).getType());
        assertEquals(1, reportingManager.getRealTimeMetrics("run-1").get("completed_tests"));
    }

    @Test
    void stop_DrainsQueuedEvents() {
        reportingManager.startExecutionTracking("run-1", 1, 1);
        reportingManager.reportTestCompletion("run-1", "t1", "w1", true, Duration.ofSeconds(1), null);

        reportingManager.stop();

        assertFalse(reportingManager.isRunning());
        assertEquals(1, reportingManager.getRealTimeMetrics("run-1").get("completed_tests"));
    }
}
