package org.example.parallel.service;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.example.parallel.config.ParallelSettings;
import org.example.parallel.context.IsolationContext;
import org.example.parallel.model.DependencyType;
import org.example.parallel.model.DistributionStrategy;
import org.example.parallel.model.EnvironmentConfig;
import org.example.parallel.model.IsolatedEnvironment;
import org.example.parallel.model.ParallelRunRequest;
import org.example.parallel.model.ParallelRunResult;
import org.example.parallel.model.TestCase;
import org.example.parallel.model.TestDependency;
import org.example.parallel.model.TestExecutionResult;
import org.example.parallel.model.TestExecutor;
import org.example.parallel.model.TestGroup;
import org.example.parallel.model.TestOutcome;
import org.example.parallel.model.TestResource;
import org.example.parallel.model.TestState;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Composes the coordination managers into test admission, isolated execution and
 * whole-run scheduling.
 *
 * <p>One instance per process, constructed explicitly and passed to its callers.</p>
 */
@Slf4j
public class ParallelTestManager {

    private static final Duration FLUSH_TIMEOUT = Duration.ofSeconds(5);

    private final ResourceLockManager lockManager;
    private final TestDependencyManager dependencyManager;
    private final IsolatedEnvironmentManager environmentManager;
    private final TestQuarantineManager quarantineManager;
    private final ResourcePoolManager poolManager;
    private final TestDistributionManager distributionManager;
    private final ParallelReportingManager reportingManager;
    private final ParallelSettings settings;

    // dependency check and mark-started must not interleave between workers
    private final Object admissionLock = new Object();
    private final AtomicInteger threadCounter = new AtomicInteger();
    private volatile boolean shutdown;

    public ParallelTestManager(ResourceLockManager lockManager,
                               TestDependencyManager dependencyManager,
                               IsolatedEnvironmentManager environmentManager,
                               TestQuarantineManager quarantineManager,
                               ResourcePoolManager poolManager,
                               TestDistributionManager distributionManager,
                               ParallelReportingManager reportingManager,
                               ParallelSettings settings) {
        this.lockManager = lockManager;
        this.dependencyManager = dependencyManager;
        this.environmentManager = environmentManager;
        this.quarantineManager = quarantineManager;
        this.poolManager = poolManager;
        this.distributionManager = distributionManager;
        this.reportingManager = reportingManager;
        this.settings = settings;
    }

    /**
     * Builds every manager from {@code settings}. Background loops are not started.
     */
    public static ParallelTestManager create(ParallelSettings settings) {
        return new ParallelTestManager(
                new ResourceLockManager(),
                new TestDependencyManager(),
                new IsolatedEnvironmentManager(settings.getTempDir()),
                new TestQuarantineManager(settings.getQuarantineFile(), settings.getFailureThreshold(),
                        settings.getSuccessThreshold(), settings.getQuarantineDuration()),
                new ResourcePoolManager(settings.getPoolHealthInterval()),
                new TestDistributionManager(settings.getDurationHistorySize(), settings.getDefaultTestDuration(),
                        settings.getHeartbeatStaleAfter()),
                new ParallelReportingManager(settings.getMaxRealTimeResults()),
                settings);
    }

    /** Starts the pool health monitor and the reporting consumer. */
    public void start() {
        shutdown = false;
        poolManager.startHealthMonitoring();
        reportingManager.start();
        log.info("Parallel test manager started");
    }

    @PreDestroy
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        log.info("Shutting down parallel test manager");
        poolManager.stopHealthMonitoring();
        reportingManager.stop();
        environmentManager.cleanupAllEnvironments();
    }

    public String registerTestResource(String resourceId, String resourceType, String resourcePath, boolean exclusive) {
        return lockManager.registerResource(TestResource.builder()
                .resourceId(resourceId)
                .resourceType(resourceType)
                .resourcePath(resourcePath)
                .exclusive(exclusive)
                .build());
    }

    public void addTestDependency(String dependentTest, String dependencyTest, DependencyType type, Duration timeout) {
        dependencyManager.addDependency(TestDependency.builder()
                .dependentTest(dependentTest)
                .dependencyTest(dependencyTest)
                .dependencyType(type != null ? type : DependencyType.BEFORE)
                .timeout(timeout)
                .build());
    }

    public String createWorkerEnvironment(String workerId, EnvironmentConfig config) {
        return environmentManager.createEnvironment(workerId, config);
    }

    public String registerWorker(String workerId, String workerType, Collection<String> capabilities,
                                 int maxCapacity, Map<String, Object> metadata) {
        return distributionManager.registerWorker(workerId, workerType, capabilities, maxCapacity, metadata);
    }

    public boolean createResourcePool(String poolId, String resourceType, int capacity) {
        return poolManager.createResourcePool(poolId, resourceType, capacity);
    }

    /**
     * False if the test is quarantined, has unmet dependencies, or needs a resource
     * currently held by another worker.
     */
    public boolean canExecuteTest(String testId, String workerId, Collection<String> requiredResources) {
        if (quarantineManager.isTestQuarantined(testId)) {
            log.debug("Test {} is quarantined", testId);
            return false;
        }
        if (!dependencyManager.canExecuteTest(testId)) {
            log.debug("Test {} has unmet dependencies", testId);
            return false;
        }
        if (requiredResources != null) {
            for (String resourceId : requiredResources) {
                Optional<String> holder = lockManager.getLockHolder(resourceId);
                if (holder.isPresent() && !holder.get().equals(workerId)) {
                    log.debug("Resource {} is locked by {}", resourceId, holder.get());
                    return false;
                }
            }
        }
        return true;
    }

    public boolean executeTestWithIsolation(String testId, String workerId, TestExecutor executor,
                                            List<String> requiredResources, Duration lockTimeout) {
        TestCase test = TestCase.builder()
                .testId(testId)
                .executor(executor)
                .requiredResources(requiredResources != null ? requiredResources : new ArrayList<>())
                .build();
        return executeTestWithIsolation(null, test, workerId, lockTimeout).isSuccess();
    }

    /**
     * Runs one test on {@code workerId} with its resources held and its worker's
     * environment variables applied through {@link IsolationContext}.
     *
     * <p>Exceptions and assertion errors from the test body become a FAILED result.
     * Whatever was acquired is released before returning, on every path.</p>
     *
     * @param executionId reporting execution to notify, or {@code null}
     * @param lockTimeout TTL of the acquired locks, {@code null} for none
     */
    public TestExecutionResult executeTestWithIsolation(String executionId, TestCase test, String workerId,
                                                        Duration lockTimeout) {
        String testId = test.getTestId();
        if (quarantineManager.isTestQuarantined(testId)) {
            log.info("Skipping quarantined test {}", testId);
            return TestExecutionResult.skipped(testId, workerId, TestOutcome.SKIPPED_QUARANTINED, "Test is quarantined");
        }

        List<String> acquiredLocks = new ArrayList<>();
        Map<String, String> acquiredSlots = new LinkedHashMap<>();
        synchronized (admissionLock) {
            if (!dependencyManager.canExecuteTest(testId)) {
                return TestExecutionResult.skipped(testId, workerId, TestOutcome.BLOCKED, "Dependencies not satisfied");
            }
            String missing = acquireAll(test, workerId, lockTimeout, acquiredLocks, acquiredSlots);
            if (missing != null) {
                releaseAll(workerId, acquiredLocks, acquiredSlots);
                return TestExecutionResult.skipped(testId, workerId, TestOutcome.BLOCKED, missing + " unavailable");
            }
            dependencyManager.markTestStarted(testId);
        }

        if (executionId != null) {
            reportingManager.reportWorkerStatus(executionId, workerId, "running", testId);
        }

        Map<String, String> variables = environmentManager.getWorkerEnvironment(workerId)
                .map(IsolatedEnvironment::getEnvironmentVariables)
                .orElse(null);
        LocalDateTime startTime = LocalDateTime.now();
        long started = System.nanoTime();
        boolean success = false;
        String failureReason = null;
        try {
            Map<String, String> previous = variables != null ? IsolationContext.apply(variables) : null;
            try {
                success = test.getExecutor().execute();
                if (!success) {
                    failureReason = "Test reported failure";
                }
            } finally {
                if (variables != null) {
                    IsolationContext.restore(previous);
                }
            }
        } catch (Exception | AssertionError e) {
            failureReason = e.getMessage() != null ? e.getMessage() : e.toString();
            log.error("Test {} failed on {}: {}", testId, workerId, failureReason, e);
        } finally {
            releaseAll(workerId, acquiredLocks, acquiredSlots);
            dependencyManager.markTestCompleted(testId, success);
            quarantineManager.recordTestResult(testId, test.getDisplayName(), success, failureReason);
            Duration duration = Duration.ofNanos(System.nanoTime() - started);
            distributionManager.recordTestCompletion(testId, workerId, duration, success);
            if (executionId != null) {
                reportingManager.reportTestCompletion(executionId, testId, workerId, success, duration,
                        failureReason != null ? Map.of("failure_reason", failureReason) : null);
                reportingManager.reportWorkerStatus(executionId, workerId, "idle", null);
            }
        }

        LocalDateTime endTime = LocalDateTime.now();
        return TestExecutionResult.builder()
                .testId(testId)
                .workerId(workerId)
                .outcome(success ? TestOutcome.PASSED : TestOutcome.FAILED)
                .startTime(startTime)
                .endTime(endTime)
                .durationMs(Duration.between(startTime, endTime).toMillis())
                .failureReason(failureReason)
                .build();
    }

    /**
     * Scoped variant for callers that run the test body themselves:
     * <pre>{@code
     * try (IsolatedExecution execution = manager.isolatedTestExecution("login", "w1", List.of("db"))) {
     *     ...
     *     execution.setSuccess(ok);
     * }
     * }</pre>
     *
     * @throws IllegalStateException if a required resource cannot be locked
     */
    public IsolatedExecution isolatedTestExecution(String testId, String workerId, List<String> requiredResources) {
        return isolatedTestExecution(testId, workerId, requiredResources, List.of());
    }

    /**
     * Same as {@link #isolatedTestExecution(String, String, List)}, also holding one
     * slot of every pool in {@code requiredPools} until the handle is closed.
     *
     * @throws IllegalStateException if a required resource or pool slot is unavailable
     */
    public IsolatedExecution isolatedTestExecution(String testId, String workerId, List<String> requiredResources,
                                                   List<String> requiredPools) {
        TestCase test = TestCase.builder()
                .testId(testId)
                .requiredResources(requiredResources != null ? requiredResources : new ArrayList<>())
                .requiredPools(requiredPools != null ? requiredPools : new ArrayList<>())
                .build();
        List<String> acquiredLocks = new ArrayList<>();
        Map<String, String> acquiredSlots = new LinkedHashMap<>();
        synchronized (admissionLock) {
            String missing = acquireAll(test, workerId, null, acquiredLocks, acquiredSlots);
            if (missing != null) {
                releaseAll(workerId, acquiredLocks, acquiredSlots);
                throw new IllegalStateException("Could not acquire required resources for " + testId + ": "
                        + missing + " unavailable");
            }
            dependencyManager.markTestStarted(testId);
        }
        Map<String, String> variables = environmentManager.getWorkerEnvironment(workerId)
                .map(IsolatedEnvironment::getEnvironmentVariables)
                .orElse(null);
        Map<String, String> previous = variables != null ? IsolationContext.apply(variables) : null;
        return new IsolatedExecution(testId, workerId, acquiredLocks, acquiredSlots, variables != null, previous);
    }

    /** Pending, non-quarantined tests whose dependencies are satisfied. */
    public List<String> getRunnableTests(Collection<String> availableTests) {
        List<String> candidates = new ArrayList<>();
        for (String testId : availableTests) {
            if (!quarantineManager.isTestQuarantined(testId)) {
                candidates.add(testId);
            }
        }
        return dependencyManager.getRunnableTests(candidates);
    }

    /**
     * Releases every lock and pool slot still held by {@code workerId} and tears
     * down its environment. Used when a worker crashes or finishes its batch.
     */
    public void cleanupWorker(String workerId) {
        int locks = 0;
        for (String resourceId : lockManager.getLocksHeldBy(workerId)) {
            if (lockManager.releaseLock(resourceId, workerId)) {
                locks++;
            }
        }
        int slots = poolManager.releaseAllForWorker(workerId);
        boolean environment = environmentManager.getWorkerEnvironment(workerId)
                .map(env -> environmentManager.cleanupEnvironment(env.getEnvironmentId()))
                .orElse(false);
        log.info("Cleaned up worker {} ({} locks, {} pool resources, environment removed: {})",
                workerId, locks, slots, environment);
    }

    public Map<String, Object> getStatusReport() {
        Map<String, Object> dependencies = new LinkedHashMap<>();
        dependencies.put("dependency_graph", dependencyManager.getDependencyGraph());
        dependencies.put("circular_dependencies", dependencyManager.detectCircularDependencies());

        Map<String, Object> environments = new LinkedHashMap<>();
        environments.put("active_environments", environmentManager.getActiveEnvironmentCount());
        environments.put("worker_mappings", environmentManager.getWorkerMappingCount());

        Map<String, Object> quarantine = new LinkedHashMap<>();
        quarantine.put("quarantined_tests", quarantineManager.getQuarantinedTests().size());
        quarantine.put("total_tracked_tests", quarantineManager.getTrackedTestCount());

        Map<String, Object> report = new LinkedHashMap<>();
        report.put("lock_manager", lockManager.getLockStatus());
        report.put("dependency_manager", dependencies);
        report.put("environment_manager", environments);
        report.put("quarantine_manager", quarantine);
        report.put("resource_pools", poolManager.getAllPoolStatus());
        report.put("distribution", distributionManager.getDistributionMetrics());
        return report;
    }

    /**
     * Runs {@code request.tests} across the registered workers (or {@code workerCount}
     * ad-hoc workers when none are registered) and returns one result per test plus
     * the consolidated report.
     *
     * <p>Each worker thread keeps re-polling its assigned tests until all are
     * finished. Tests that are quarantined, sit on a dependency cycle, or whose
     * {@code before} prerequisites failed or are missing from the run are skipped.
     * Tests still pending when the run timeout expires are reported as BLOCKED.</p>
     */
    public ParallelRunResult runTests(ParallelRunRequest request) {
        List<TestCase> tests = request.getTests() != null ? request.getTests() : List.of();
        String executionId = request.getExecutionId() != null && !request.getExecutionId().isBlank()
                ? request.getExecutionId()
                : "exec_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        Duration runTimeout = request.getRunTimeout() != null ? request.getRunTimeout() : settings.getRunTimeout();

        Map<String, TestCase> testsById = new LinkedHashMap<>();
        for (TestCase test : tests) {
            if (test.getTestId() == null || test.getExecutor() == null) {
                throw new IllegalArgumentException("every test needs a testId and an executor");
            }
            if (testsById.put(test.getTestId(), test) != null) {
                throw new IllegalArgumentException("duplicate testId: " + test.getTestId());
            }
        }

        ensureWorkers(request, tests.size());
        buildGroups(tests);
        DistributionStrategy strategy = request.getStrategy() != null
                ? request.getStrategy() : DistributionStrategy.LOAD_BALANCED;
        Map<String, List<String>> distribution = distributionManager.distributeTests(strategy);

        reportingManager.start();
        reportingManager.startExecutionTracking(executionId, tests.size(), distribution.size());
        reportingManager.updateResourceUtilization(executionId, poolManager.getUtilization());
        log.info("Starting parallel execution {} of {} tests on {} workers ({})", executionId, tests.size(),
                distribution.size(), strategy.getValue());

        Map<String, TestExecutionResult> results = new ConcurrentHashMap<>();
        Set<String> unreachable = ConcurrentHashMap.newKeySet();
        dependencyManager.resetTestStates(testsById.keySet());
        for (List<String> cycle : dependencyManager.detectCircularDependencies()) {
            for (String testId : cycle) {
                if (testsById.containsKey(testId) && unreachable.add(testId)) {
                    results.put(testId, TestExecutionResult.skipped(testId, null, TestOutcome.SKIPPED_DEPENDENCY,
                            "Circular dependency: " + String.join(" -> ", cycle)));
                }
            }
        }

        long deadline = System.nanoTime() + runTimeout.toNanos();
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(distribution.size(), 1), r -> {
            Thread t = new Thread(r, "test-executor-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (Map.Entry<String, List<String>> entry : distribution.entrySet()) {
                String workerId = entry.getKey();
                List<String> assigned = new ArrayList<>(entry.getValue());
                assigned.removeIf(results::containsKey);
                if (assigned.isEmpty()) {
                    continue;
                }
                if (environmentManager.getWorkerEnvironment(workerId).isEmpty()) {
                    environmentManager.createEnvironment(workerId);
                }
                futures.add(executor.submit(() -> runWorker(executionId, workerId, assigned, testsById,
                        request.getLockTimeout(), deadline, results, unreachable)));
            }
            awaitWorkers(futures, deadline);
        } finally {
            executor.shutdownNow();
            for (String workerId : distribution.keySet()) {
                cleanupWorker(workerId);
            }
        }

        List<TestExecutionResult> ordered = new ArrayList<>();
        for (String testId : testsById.keySet()) {
            TestExecutionResult result = results.get(testId);
            ordered.add(result != null ? result
                    : TestExecutionResult.skipped(testId, null, TestOutcome.BLOCKED, "Run timeout exceeded"));
        }

        reportingManager.updateResourceUtilization(executionId, poolManager.getUtilization());
        reportingManager.flush(FLUSH_TIMEOUT);
        reportingManager.finishExecutionTracking(executionId);
        Map<String, Object> report = reportingManager.generateConsolidatedReport(executionId);

        ParallelRunResult runResult = ParallelRunResult.builder()
                .executionId(executionId)
                .results(ordered)
                .distribution(distribution)
                .report(report)
                .build();
        log.info("Execution {} finished: {} passed, {} failed, {} skipped, {} blocked", executionId,
                runResult.count(TestOutcome.PASSED), runResult.count(TestOutcome.FAILED),
                runResult.count(TestOutcome.SKIPPED_QUARANTINED) + runResult.count(TestOutcome.SKIPPED_DEPENDENCY),
                runResult.count(TestOutcome.BLOCKED));
        return runResult;
    }

    public ResourceLockManager getLockManager() {
        return lockManager;
    }

    public TestDependencyManager getDependencyManager() {
        return dependencyManager;
    }

    public IsolatedEnvironmentManager getEnvironmentManager() {
        return environmentManager;
    }

    public TestQuarantineManager getQuarantineManager() {
        return quarantineManager;
    }

    public ResourcePoolManager getPoolManager() {
        return poolManager;
    }

    public TestDistributionManager getDistributionManager() {
        return distributionManager;
    }

    public ParallelReportingManager getReportingManager() {
        return reportingManager;
    }

    public ParallelSettings getSettings() {
        return settings;
    }

    private void runWorker(String executionId, String workerId, List<String> assigned, Map<String, TestCase> testsById,
                           Duration lockTimeout, long deadline, Map<String, TestExecutionResult> results,
                           Set<String> unreachable) {
        List<String> pending = new ArrayList<>(assigned);
        reportingManager.reportWorkerStatus(executionId, workerId, "idle", null);
        while (!pending.isEmpty() && System.nanoTime() < deadline && !Thread.currentThread().isInterrupted()) {
            boolean progressed = false;
            Iterator<String> it = pending.iterator();
            while (it.hasNext()) {
                String testId = it.next();
                TestCase test = testsById.get(testId);

                if (quarantineManager.isTestQuarantined(testId)) {
                    unreachable.add(testId);
                    results.put(testId, TestExecutionResult.skipped(testId, workerId,
                            TestOutcome.SKIPPED_QUARANTINED, "Test is quarantined"));
                    it.remove();
                    progressed = true;
                    continue;
                }
                String blockedBy = findUnreachablePrerequisite(testId, testsById, unreachable);
                if (blockedBy != null) {
                    unreachable.add(testId);
                    results.put(testId, TestExecutionResult.skipped(testId, workerId,
                            TestOutcome.SKIPPED_DEPENDENCY, "Prerequisite " + blockedBy + " did not complete"));
                    it.remove();
                    progressed = true;
                    continue;
                }
                if (!dependencyManager.canExecuteTest(testId)) {
                    continue;
                }

                TestExecutionResult result = executeTestWithIsolation(executionId, test, workerId, lockTimeout);
                if (result.getOutcome() == TestOutcome.BLOCKED) {
                    continue;
                }
                if (result.getOutcome() == TestOutcome.SKIPPED_QUARANTINED) {
                    unreachable.add(testId);
                }
                results.put(testId, result);
                it.remove();
                progressed = true;
            }
            if (!progressed && !pending.isEmpty()) {
                sleep(settings.getSchedulerPollInterval());
            }
        }
        if (!pending.isEmpty()) {
            log.warn("Worker {} stopped with {} tests pending: {}", workerId, pending.size(), pending);
        }
        reportingManager.reportWorkerStatus(executionId, workerId, "finished", null);
    }

    private String findUnreachablePrerequisite(String testId, Map<String, TestCase> testsById, Set<String> unreachable) {
        for (String prerequisite : dependencyManager.getPrerequisites(testId)) {
            TestState state = dependencyManager.getTestState(prerequisite);
            if (state == TestState.FAILED || unreachable.contains(prerequisite)) {
                return prerequisite;
            }
            if (!testsById.containsKey(prerequisite) && state != TestState.COMPLETED) {
                return prerequisite;
            }
        }
        return null;
    }

    private void awaitWorkers(List<Future<?>> futures, long deadline) {
        for (Future<?> future : futures) {
            long remaining = deadline - System.nanoTime();
            try {
                // a test still in flight at the deadline gets 20 poll intervals to return
                future.get(Math.max(remaining, 0) + settings.getSchedulerPollInterval().toNanos() * 20,
                        TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                log.warn("Worker did not finish before the run timeout, abandoning it");
                future.cancel(true);
            } catch (ExecutionException e) {
                log.error("Worker failed: {}", e.getCause() != null ? e.getCause().getMessage() : e.getMessage(),
                        e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for workers");
                return;
            }
        }
    }

    private void ensureWorkers(ParallelRunRequest request, int testCount) {
        if (distributionManager.hasWorkers()) {
            return;
        }
        int workerCount = request.getWorkerCount() != null ? request.getWorkerCount() : settings.getMaxWorkers();
        workerCount = Math.max(1, Math.min(workerCount, Math.max(testCount, 1)));
        for (int i = 0; i < workerCount; i++) {
            distributionManager.registerWorker("worker_" + i, "thread", List.of(), 1);
        }
    }

    /**
     * One group per distinct capability set, in first-seen order.
     */
    private void buildGroups(List<TestCase> tests) {
        distributionManager.clearTestGroups();
        Map<Set<String>, List<TestCase>> byCapabilities = new LinkedHashMap<>();
        for (TestCase test : tests) {
            Set<String> capabilities = test.getRequiredCapabilities() != null
                    ? new LinkedHashSet<>(test.getRequiredCapabilities()) : new LinkedHashSet<>();
            byCapabilities.computeIfAbsent(capabilities, c -> new ArrayList<>()).add(test);
        }
        int index = 0;
        for (Map.Entry<Set<String>, List<TestCase>> entry : byCapabilities.entrySet()) {
            List<TestCase> members = entry.getValue();
            Duration estimate = null;
            if (members.stream().allMatch(t -> t.getEstimatedDuration() != null)) {
                estimate = members.stream().map(TestCase::getEstimatedDuration).reduce(Duration.ZERO, Duration::plus);
            }
            String groupId = "group_" + index++;
            distributionManager.createTestGroup(TestGroup.builder()
                    .groupId(groupId)
                    .groupName(entry.getKey().isEmpty() ? "default" : String.join("+", entry.getKey()))
                    .testIds(members.stream().map(TestCase::getTestId).toList())
                    .estimatedDuration(estimate)
                    .requiredCapabilities(entry.getKey())
                    .build());
        }
    }

    /**
     * Locks every required resource, then takes one slot of every required pool.
     *
     * @return the first resource or pool that could not be acquired, or {@code null}
     */
    private String acquireAll(TestCase test, String workerId, Duration lockTimeout,
                              List<String> acquiredLocks, Map<String, String> acquiredSlots) {
        for (String resourceId : test.getRequiredResources()) {
            if (!lockManager.tryAcquireLock(resourceId, workerId, lockTimeout)) {
                return "resource " + resourceId;
            }
            acquiredLocks.add(resourceId);
        }
        for (String poolId : test.getRequiredPools()) {
            Optional<String> slot = poolManager.allocateResource(poolId, workerId);
            if (slot.isEmpty()) {
                return "pool " + poolId;
            }
            acquiredSlots.put(slot.get(), poolId);
        }
        return null;
    }

    private void releaseAll(String workerId, List<String> acquiredLocks, Map<String, String> acquiredSlots) {
        acquiredSlots.forEach((resourceId, poolId) -> poolManager.releaseResource(poolId, resourceId, workerId));
        for (String resourceId : acquiredLocks) {
            lockManager.releaseLock(resourceId, workerId);
        }
    }

    private static void sleep(Duration duration) {
        try {
            Thread.sleep(Math.max(duration.toMillis(), 1));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Handle returned by {@link #isolatedTestExecution}. Closing it restores the
     * thread's isolation context, releases the locks and marks the test completed.
     */
    public final class IsolatedExecution implements AutoCloseable {

        private final String testId;
        private final String workerId;
        private final List<String> acquiredLocks;
        private final Map<String, String> acquiredSlots;
        private final boolean contextApplied;
        private final Map<String, String> previousContext;
        private boolean success = true;
        private boolean closed;

        private IsolatedExecution(String testId, String workerId, List<String> acquiredLocks,
                                  Map<String, String> acquiredSlots, boolean contextApplied,
                                  Map<String, String> previousContext) {
            this.testId = testId;
            this.workerId = workerId;
            this.acquiredLocks = acquiredLocks;
            this.acquiredSlots = acquiredSlots;
            this.contextApplied = contextApplied;
            this.previousContext = previousContext;
        }

        public String getTestId() {
            return testId;
        }

        public void setSuccess(boolean success) {
            this.success = success;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            if (contextApplied) {
                IsolationContext.restore(previousContext);
            }
            releaseAll(workerId, acquiredLocks, acquiredSlots);
            dependencyManager.markTestCompleted(testId, success);
        }
    }
}
