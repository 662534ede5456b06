package org.example.parallel.config;

import lombok.Builder;
import lombok.Value;
import org.example.parallel.utils.ConfigReader;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Tunables of the coordinator. {@link #fromConfig()} resolves every value through
 * {@link ConfigReader}, so env vars, system properties, {@code .env} and
 * {@code config.properties} all apply.
 */
@Value
@Builder(toBuilder = true)
public class ParallelSettings {

    @Builder.Default
    Path tempDir = Paths.get(System.getProperty("java.io.tmpdir"), "test_isolation");

    @Builder.Default
    Path quarantineFile = Paths.get("test_quarantine.json");

    @Builder.Default
    int failureThreshold = 3;

    @Builder.Default
    int successThreshold = 5;

    @Builder.Default
    Duration quarantineDuration = Duration.ofHours(24);

    @Builder.Default
    Duration poolHealthInterval = Duration.ofSeconds(30);

    @Builder.Default
    int maxRealTimeResults = 1000;

    @Builder.Default
    int durationHistorySize = 10;

    @Builder.Default
    Duration defaultTestDuration = Duration.ofSeconds(60);

    @Builder.Default
    Duration heartbeatStaleAfter = Duration.ofSeconds(60);

    @Builder.Default
    Duration schedulerPollInterval = Duration.ofMillis(50);

    @Builder.Default
    Duration runTimeout = Duration.ofMinutes(30);

    @Builder.Default
    int maxWorkers = 4;

    public static ParallelSettings defaults() {
        return ParallelSettings.builder().build();
    }

    public static ParallelSettings fromConfig() {
        ParallelSettings defaults = defaults();
        return ParallelSettings.builder()
                .tempDir(Paths.get(ConfigReader.get("parallel.temp.dir", defaults.getTempDir().toString())))
                .quarantineFile(Paths.get(ConfigReader.get("parallel.quarantine.file",
                        defaults.getQuarantineFile().toString())))
                .failureThreshold(ConfigReader.getInt("parallel.quarantine.failure.threshold",
                        defaults.getFailureThreshold()))
                .successThreshold(ConfigReader.getInt("parallel.quarantine.success.threshold",
                        defaults.getSuccessThreshold()))
                .quarantineDuration(Duration.ofMinutes(ConfigReader.getLong("parallel.quarantine.duration.minutes",
                        defaults.getQuarantineDuration().toMinutes())))
                .poolHealthInterval(Duration.ofSeconds(ConfigReader.getLong("parallel.pool.health.interval.seconds",
                        defaults.getPoolHealthInterval().getSeconds())))
                .maxRealTimeResults(ConfigReader.getInt("parallel.reporting.max.results",
                        defaults.getMaxRealTimeResults()))
                .durationHistorySize(ConfigReader.getInt("parallel.distribution.history.size",
                        defaults.getDurationHistorySize()))
                .defaultTestDuration(Duration.ofSeconds(ConfigReader.getLong(
                        "parallel.distribution.default.duration.seconds",
                        defaults.getDefaultTestDuration().getSeconds())))
                .heartbeatStaleAfter(Duration.ofSeconds(ConfigReader.getLong("parallel.worker.heartbeat.stale.seconds",
                        defaults.getHeartbeatStaleAfter().getSeconds())))
                .schedulerPollInterval(Duration.ofMillis(ConfigReader.getLong("parallel.scheduler.poll.millis",
                        defaults.getSchedulerPollInterval().toMillis())))
                .runTimeout(Duration.ofMinutes(ConfigReader.getLong("parallel.run.timeout.minutes",
                        defaults.getRunTimeout().toMinutes())))
                .maxWorkers(ConfigReader.getInt("parallel.max.workers", defaults.getMaxWorkers()))
                .build();
    }
}
