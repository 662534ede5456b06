package org.example.parallel.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Request-Model für einen parallelen Lauf.
 *
 * <p>When no worker is registered yet, {@code workerCount} workers named
 * {@code worker_0..n-1} are registered for the run.</p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParallelRunRequest {

    private String executionId;

    @Builder.Default
    private List<TestCase> tests = new ArrayList<>();

    private Integer workerCount;

    @Builder.Default
    private DistributionStrategy strategy = DistributionStrategy.LOAD_BALANCED;

    /** TTL applied to each acquired resource lock; {@code null} means no expiry. */
    private Duration lockTimeout;

    /** Upper bound for the whole run; defaults to the configured run timeout. */
    private Duration runTimeout;
}
