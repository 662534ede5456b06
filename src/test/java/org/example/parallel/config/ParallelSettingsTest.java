package org.example.parallel.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ParallelSettingsTest {

    @AfterEach
    void cleanup() {
        System.clearProperty("parallel.quarantine.failure.threshold");
        System.clearProperty("parallel.temp.dir");
        System.clearProperty("parallel.scheduler.poll.millis");
    }

    @Test
    void defaults_MatchDocumentedValues() {
        ParallelSettings settings = ParallelSettings.defaults();

        assertEquals(3, settings.getFailureThreshold());
        assertEquals(5, settings.getSuccessThreshold());
        assertEquals(Duration.ofHours(24), settings.getQuarantineDuration());
        assertEquals(Duration.ofSeconds(30), settings.getPoolHealthInterval());
        assertEquals(10, settings.getDurationHistorySize());
        assertEquals(Duration.ofSeconds(60), settings.getDefaultTestDuration());
        assertTrue(settings.getTempDir().endsWith("test_isolation"));
    }

    @Test
    void fromConfig_SystemPropertiesOverrideDefaults() {
        System.setProperty("parallel.quarantine.failure.threshold", "2");
        System.setProperty("parallel.temp.dir", "/tmp/custom_isolation");
        System.setProperty("parallel.scheduler.poll.millis", "10");

        ParallelSettings settings = ParallelSettings.fromConfig();

        assertEquals(2, settings.getFailureThreshold());
        assertEquals(Paths.get("/tmp/custom_isolation"), settings.getTempDir());
        assertEquals(Duration.ofMillis(10), settings.getSchedulerPollInterval());
    }

    @Test
    void fromConfig_ReadsPropertiesFile() {
        ParallelSettings settings = ParallelSettings.fromConfig();

        assertEquals(5, settings.getSuccessThreshold());
        assertEquals(Duration.ofMinutes(1440), settings.getQuarantineDuration());
    }

    @Test
    void toBuilder_KeepsOtherValues() {
        ParallelSettings settings = ParallelSettings.defaults().toBuilder().maxWorkers(8).build();

        assertEquals(8, settings.getMaxWorkers());
        assertEquals(3, settings.getFailureThreshold());
    }
}
