package org.example.parallel.service;

import org.example.parallel.model.QuarantinedTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class TestQuarantineManagerTest {

    @TempDir
    Path tempDir;

    private Path quarantineFile;
    private TestQuarantineManager quarantineManager;

    @BeforeEach
    void setUp() {
        quarantineFile = tempDir.resolve("quarantine.json");
        quarantineManager = new TestQuarantineManager(quarantineFile);
    }

    private void recordFailures(String testId, int times) {
        for (int i = 0; i < times; i++) {
            quarantineManager.recordTestResult(testId, "Flaky login", false, "timeout #" + i);
        }
    }

    private void recordSuccesses(String testId, int times) {
        for (int i = 0; i < times; i++) {
            quarantineManager.recordTestResult(testId, "Flaky login", true, null);
        }
    }

    @Test
    void constructor_NonPositiveThreshold_Throws() {
        assertThrows(IllegalArgumentException.class,
                () -> new TestQuarantineManager(quarantineFile, 0, 5, Duration.ofHours(1)));
    }

    @Test
    void recordTestResult_BelowFailureThreshold_NotQuarantined() {
        recordFailures("login", 2);

        assertFalse(quarantineManager.isTestQuarantined("login"));
    }

    @Test
    void recordTestResult_ThreeFailures_Quarantines() {
        recordFailures("login", 3);

        assertTrue(quarantineManager.isTestQuarantined("login"));
        QuarantinedTest quarantined = quarantineManager.getQuarantinedTests().get(0);
        assertEquals("login", quarantined.getTestId());
        assertEquals("timeout #2", quarantined.getQuarantineReason());
        assertEquals("timeout #2", quarantined.getMetadata().get("last_failure_reason"));
    }

    @Test
    void recordTestResult_FiveSuccessesWhileQuarantined_Releases() {
        recordFailures("login", 3);

        recordSuccesses("login", 4);
        assertTrue(quarantineManager.isTestQuarantined("login"));

        recordSuccesses("login", 1);
        assertFalse(quarantineManager.isTestQuarantined("login"));
        assertTrue(quarantineManager.getQuarantinedTests().isEmpty());
    }

    @Test
    void recordTestResult_SuccessesBeforeQuarantine_DoNotCountTowardsRelease() {
        recordSuccesses("login", 10);
        recordFailures("login", 3);

        recordSuccesses("login", 1);

        assertTrue(quarantineManager.isTestQuarantined("login"));
    }

    @Test
    void recordTestResult_PersistsAcrossInstances() {
        recordFailures("login", 3);

        assertTrue(Files.exists(quarantineFile));
        TestQuarantineManager reloaded = new TestQuarantineManager(quarantineFile);

        assertTrue(reloaded.isTestQuarantined("login"));
        assertEquals(1, reloaded.getTrackedTestCount());
        assertEquals(3, reloaded.getTestStats("login").orElseThrow().get("failure_count"));
    }

    @Test
    void persistedFile_UsesSnakeCaseFields() throws Exception {
        recordFailures("login", 3);

        String json = Files.readString(quarantineFile);

        assertTrue(json.contains("\"quarantined_tests\""));
        assertTrue(json.contains("\"failure_count\" : 3"));
        assertTrue(json.contains("\"updated_at\""));
    }

    @Test
    void constructor_CorruptFile_StartsEmpty() throws Exception {
        Files.writeString(quarantineFile, "{ not json");

        TestQuarantineManager manager = new TestQuarantineManager(quarantineFile);

        assertEquals(0, manager.getTrackedTestCount());
        assertTrue(manager.getQuarantinedTests().isEmpty());
    }

    @Test
    void isTestQuarantined_ExpiredQuarantine_IsReleasedLazily() {
        TestQuarantineManager shortLived = new TestQuarantineManager(tempDir.resolve("short.json"),
                3, 5, Duration.ofMillis(50));
        shortLived.forceQuarantine("login", "flaky");
        assertTrue(shortLived.isTestQuarantined("login"));

        await().atMost(Duration.ofSeconds(2))
                .untilAsserted(() -> assertFalse(shortLived.isTestQuarantined("login")));
        assertTrue(shortLived.getQuarantinedTests().isEmpty());
    }

    @Test
    void getQuarantinedTests_ExpiredQuarantine_NotListedBeforeAnyLookup() {
        TestQuarantineManager shortLived = new TestQuarantineManager(tempDir.resolve("short.json"),
                3, 5, Duration.ofMillis(50));
        for (int i = 0; i < 3; i++) {
            shortLived.recordTestResult("login", "Flaky login", false, "timeout");
        }
        assertEquals(1, shortLived.getQuarantinedTests().size());

        await().atMost(Duration.ofSeconds(2))
                .untilAsserted(() -> assertTrue(shortLived.getQuarantinedTests().isEmpty()));
        assertEquals(Boolean.FALSE, shortLived.getTestStats("login").orElseThrow().get("is_quarantined"));
        assertEquals(3, shortLived.getTestStats("login").orElseThrow().get("failure_count"));
    }

    @Test
    void getTestStats_ExpiredQuarantine_ReportsReleased() {
        TestQuarantineManager shortLived = new TestQuarantineManager(tempDir.resolve("short.json"),
                3, 5, Duration.ofMillis(50));
        shortLived.forceQuarantine("checkout", "flaky");

        await().atMost(Duration.ofSeconds(2))
                .untilAsserted(() -> assertEquals(Boolean.FALSE,
                        shortLived.getTestStats("checkout").orElseThrow().get("is_quarantined")));
        assertEquals("", shortLived.getTestStats("checkout").orElseThrow().get("quarantine_reason"));
        assertTrue(shortLived.getQuarantinedTests().isEmpty());
    }

    @Test
    void recordTestResult_NoFailureReason_UsesExcessiveFailures() {
        for (int i = 0; i < 3; i++) {
            quarantineManager.recordTestResult("search", "Search", false, null);
        }

        assertEquals("Excessive failures", quarantineManager.getQuarantinedTests().get(0).getQuarantineReason());
    }

    @Test
    void forceQuarantineAndRelease() {
        quarantineManager.forceQuarantine("checkout", "");

        assertTrue(quarantineManager.isTestQuarantined("checkout"));
        assertEquals("Manually quarantined", quarantineManager.getQuarantinedTests().get(0).getQuarantineReason());

        assertTrue(quarantineManager.forceRelease("checkout"));
        assertFalse(quarantineManager.forceRelease("checkout"));
        assertFalse(quarantineManager.isTestQuarantined("checkout"));
    }

    @Test
    void forceRelease_KeepsFailureCount() {
        recordFailures("login", 3);

        quarantineManager.forceRelease("login");

        assertEquals(3, quarantineManager.getTestStats("login").orElseThrow().get("failure_count"));
        quarantineManager.recordTestResult("login", "Flaky login", false, "again");
        assertTrue(quarantineManager.isTestQuarantined("login"));
    }

    @Test
    void getTestStats_ComputesSuccessRate() {
        recordSuccesses("search", 3);
        quarantineManager.recordTestResult("search", "Search", false, "assertion");

        Map<String, Object> stats = quarantineManager.getTestStats("search").orElseThrow();

        assertEquals(4, stats.get("total_runs"));
        assertEquals(75.0, (double) stats.get("success_rate"), 1e-9);
        assertEquals(false, stats.get("is_quarantined"));
        assertTrue(quarantineManager.getTestStats("unknown").isEmpty());
    }

    @Test
    void getQuarantinedTests_ReturnsCopies() {
        recordFailures("login", 3);

        List<QuarantinedTest> quarantined = quarantineManager.getQuarantinedTests();
        quarantined.get(0).setQuarantineStart(null);

        assertTrue(quarantineManager.isTestQuarantined("login"));
    }
}
