package org.example.parallel.service;

import lombok.extern.slf4j.Slf4j;
import org.example.parallel.model.DistributionStrategy;
import org.example.parallel.model.TestGroup;
import org.example.parallel.model.WorkerNode;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.ToDoubleFunction;

/**
 * Worker registry and test-to-worker assignment.
 *
 * <p>Strategies are looked up by name; the four built-in ones are registered at
 * construction and {@link #registerStrategy} adds more.</p>
 */
@Slf4j
public class TestDistributionManager {

    private static final double HEALTHY_THRESHOLD = 0.5;
    private static final double BASELINE_DURATION_SECONDS = 60.0;

    private final Map<String, WorkerNode> workers = new LinkedHashMap<>();
    private final Map<String, TestGroup> testGroups = new LinkedHashMap<>();
    private final Map<String, TestAssignmentStrategy> strategies = new LinkedHashMap<>();
    private final Map<String, Deque<Double>> executionHistory = new HashMap<>();
    private final int historySize;
    private final Duration defaultTestDuration;
    private final Duration heartbeatStaleAfter;

    public TestDistributionManager() {
        this(10, Duration.ofSeconds(60), Duration.ofSeconds(60));
    }

    public TestDistributionManager(int historySize, Duration defaultTestDuration, Duration heartbeatStaleAfter) {
        this.historySize = Math.max(historySize, 1);
        this.defaultTestDuration = defaultTestDuration;
        this.heartbeatStaleAfter = heartbeatStaleAfter;
        registerStrategy(DistributionStrategy.ROUND_ROBIN.getValue(), TestDistributionManager::roundRobin);
        registerStrategy(DistributionStrategy.LOAD_BALANCED.getValue(), TestDistributionManager::loadBalanced);
        registerStrategy(DistributionStrategy.CAPABILITY_BASED.getValue(), TestDistributionManager::capabilityBased);
        // no dedicated bin packing yet, longest-first greedy is used for both
        registerStrategy(DistributionStrategy.DURATION_OPTIMIZED.getValue(), TestDistributionManager::loadBalanced);
    }

    public synchronized void registerStrategy(String name, TestAssignmentStrategy strategy) {
        if (name == null || name.isBlank() || strategy == null) {
            throw new IllegalArgumentException("strategy name and implementation are required");
        }
        strategies.put(name, strategy);
        log.debug("Registered distribution strategy: {}", name);
    }

    public synchronized Set<String> getStrategyNames() {
        return new LinkedHashSet<>(strategies.keySet());
    }

    public String registerWorker(String workerId, String workerType, Collection<String> capabilities, int maxCapacity) {
        return registerWorker(workerId, workerType, capabilities, maxCapacity, null);
    }

    public synchronized String registerWorker(String workerId, String workerType, Collection<String> capabilities,
                                              int maxCapacity, Map<String, Object> metadata) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be blank");
        }
        if (maxCapacity <= 0) {
            throw new IllegalArgumentException("maxCapacity must be positive, got " + maxCapacity);
        }
        WorkerNode worker = WorkerNode.builder()
                .workerId(workerId)
                .workerType(workerType)
                .capabilities(capabilities != null ? new LinkedHashSet<>(capabilities) : new LinkedHashSet<>())
                .maxCapacity(maxCapacity)
                .lastHeartbeat(LocalDateTime.now())
                .metadata(metadata != null ? new HashMap<>(metadata) : new HashMap<>())
                .build();
        workers.put(workerId, worker);
        log.info("Registered worker: {} with capabilities {}", workerId, worker.getCapabilities());
        return workerId;
    }

    public synchronized boolean unregisterWorker(String workerId) {
        boolean removed = workers.remove(workerId) != null;
        if (removed) {
            log.info("Unregistered worker: {}", workerId);
        }
        return removed;
    }

    public synchronized String createTestGroup(TestGroup group) {
        if (group == null || group.getGroupId() == null || group.getGroupId().isBlank()) {
            throw new IllegalArgumentException("groupId must not be blank");
        }
        testGroups.put(group.getGroupId(), group);
        log.info("Created test group: {} with {} tests", group.getGroupName() != null ? group.getGroupName()
                : group.getGroupId(), group.getTestIds().size());
        return group.getGroupId();
    }

    public synchronized void clearTestGroups() {
        testGroups.clear();
    }

    public Map<String, List<String>> distributeTests(DistributionStrategy strategy) {
        return distributeTests(strategy.getValue());
    }

    /**
     * Runs the named strategy over all groups and records the assignment on each
     * worker ({@code assignedTests}, {@code currentLoad}).
     *
     * @throws IllegalArgumentException for an unknown strategy name
     */
    public synchronized Map<String, List<String>> distributeTests(String strategyName) {
        TestAssignmentStrategy strategy = strategies.get(strategyName);
        if (strategy == null) {
            throw new IllegalArgumentException("Unknown distribution strategy: " + strategyName);
        }
        if (workers.isEmpty()) {
            log.warn("No workers registered, nothing distributed");
            return new LinkedHashMap<>();
        }

        List<WorkerNode> workerSnapshot = new ArrayList<>();
        for (WorkerNode worker : workers.values()) {
            workerSnapshot.add(copyOf(worker));
        }
        List<TestGroup> groups = new ArrayList<>(testGroups.values());
        groups.sort(Comparator.comparingInt(TestGroup::getPriority));
        Map<String, List<String>> distribution = strategy.assign(workerSnapshot, groups, this::estimateSeconds);

        distribution.forEach((workerId, testIds) -> {
            WorkerNode worker = workers.get(workerId);
            if (worker != null) {
                worker.setAssignedTests(new ArrayList<>(testIds));
                worker.setCurrentLoad(testIds.size());
            }
        });
        log.info("Distributed tests using {} strategy", strategyName);
        return distribution;
    }

    /**
     * Among healthy workers with spare capacity and the required capabilities, the one
     * with the lowest load, ties broken by the higher health score.
     */
    public synchronized Optional<String> getOptimalWorker(String testId, Collection<String> requiredCapabilities) {
        return workers.values().stream()
                .filter(w -> w.getHealthScore() > HEALTHY_THRESHOLD)
                .filter(WorkerNode::hasSpareCapacity)
                .filter(w -> w.hasCapabilities(requiredCapabilities))
                .min(Comparator.comparingInt(WorkerNode::getCurrentLoad)
                        .thenComparing(Comparator.comparingDouble(WorkerNode::getHealthScore).reversed()))
                .map(WorkerNode::getWorkerId);
    }

    public synchronized boolean updateWorkerHeartbeat(String workerId, Map<String, Double> performanceMetrics) {
        WorkerNode worker = workers.get(workerId);
        if (worker == null) {
            return false;
        }
        worker.setLastHeartbeat(LocalDateTime.now());
        if (performanceMetrics != null) {
            worker.getPerformanceMetrics().putAll(performanceMetrics);
        }
        worker.setHealthScore(calculateHealthScore(worker));
        return true;
    }

    /**
     * Adds a duration sample for {@code testId} and folds the outcome into the
     * worker's running averages. The health score is only recomputed on the next
     * heartbeat.
     */
    public synchronized void recordTestCompletion(String testId, String workerId, Duration duration, boolean success) {
        double seconds = duration.toMillis() / 1000.0;
        Deque<Double> history = executionHistory.computeIfAbsent(testId, id -> new ArrayDeque<>());
        history.addLast(seconds);
        while (history.size() > historySize) {
            history.removeFirst();
        }

        WorkerNode worker = workers.get(workerId);
        if (worker == null) {
            return;
        }
        worker.setCurrentLoad(Math.max(0, worker.getCurrentLoad() - 1));

        Map<String, Double> metrics = worker.getPerformanceMetrics();
        double completed = metrics.getOrDefault(WorkerNode.METRIC_COMPLETED_TESTS, 0.0) + 1;
        metrics.put(WorkerNode.METRIC_COMPLETED_TESTS, completed);
        metrics.put(WorkerNode.METRIC_AVERAGE_DURATION,
                incrementalMean(metrics.get(WorkerNode.METRIC_AVERAGE_DURATION), seconds, completed));
        metrics.put(WorkerNode.METRIC_SUCCESS_RATE,
                incrementalMean(metrics.get(WorkerNode.METRIC_SUCCESS_RATE), success ? 1.0 : 0.0, completed));
    }

    /**
     * Mean of the recorded history, else the group's estimate spread over its tests,
     * else the configured default.
     */
    public synchronized Duration getEstimatedDuration(String testId) {
        return Duration.ofMillis(Math.round(estimateSeconds(testId) * 1000));
    }

    /**
     * Product of penalties: load above 80% of capacity, success rate, average
     * duration over the 60s baseline and a stale heartbeat. Clamped to [0, 1].
     */
    public double calculateHealthScore(WorkerNode worker) {
        double score = 1.0;
        if (worker.getCurrentLoad() > worker.getMaxCapacity() * 0.8) {
            score *= 0.8;
        }
        Double successRate = worker.getPerformanceMetrics().get(WorkerNode.METRIC_SUCCESS_RATE);
        if (successRate != null) {
            score *= successRate;
        }
        Double averageDuration = worker.getPerformanceMetrics().get(WorkerNode.METRIC_AVERAGE_DURATION);
        if (averageDuration != null && averageDuration > 0) {
            score *= Math.min(BASELINE_DURATION_SECONDS / averageDuration, 1.0);
        }
        if (worker.getLastHeartbeat() != null
                && Duration.between(worker.getLastHeartbeat(), LocalDateTime.now()).compareTo(heartbeatStaleAfter) > 0) {
            score *= 0.5;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    public synchronized Map<String, Object> getDistributionMetrics() {
        Map<String, Object> workerDetails = new LinkedHashMap<>();
        int minAssigned = Integer.MAX_VALUE;
        int maxAssigned = 0;
        int totalAssigned = 0;
        for (WorkerNode worker : workers.values()) {
            int assigned = worker.getAssignedTests().size();
            minAssigned = Math.min(minAssigned, assigned);
            maxAssigned = Math.max(maxAssigned, assigned);
            totalAssigned += assigned;

            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("worker_type", worker.getWorkerType());
            detail.put("capabilities", new ArrayList<>(worker.getCapabilities()));
            detail.put("current_load", worker.getCurrentLoad());
            detail.put("max_capacity", worker.getMaxCapacity());
            detail.put("health_score", worker.getHealthScore());
            detail.put("assigned_tests", assigned);
            detail.put("last_heartbeat", worker.getLastHeartbeat() != null ? worker.getLastHeartbeat().toString() : null);
            detail.put("performance_metrics", new LinkedHashMap<>(worker.getPerformanceMetrics()));
            workerDetails.put(worker.getWorkerId(), detail);
        }

        int totalTests = testGroups.values().stream().mapToInt(g -> g.getTestIds().size()).sum();
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("total_workers", workers.size());
        metrics.put("healthy_workers", workers.values().stream()
                .filter(w -> w.getHealthScore() > HEALTHY_THRESHOLD).count());
        metrics.put("total_groups", testGroups.size());
        Map<String, Integer> groupsByType = new LinkedHashMap<>();
        testGroups.values().forEach(g -> groupsByType.merge(g.getGroupType(), 1, Integer::sum));
        metrics.put("groups_by_type", groupsByType);
        metrics.put("total_tests", totalTests);
        metrics.put("assigned_tests", totalAssigned);
        metrics.put("balance_score", maxAssigned == 0 ? 1.0 : 1.0 - (double) (maxAssigned - minAssigned) / maxAssigned);
        metrics.put("strategies", new ArrayList<>(strategies.keySet()));
        metrics.put("workers", workerDetails);
        return metrics;
    }

    public synchronized List<WorkerNode> getWorkers() {
        List<WorkerNode> snapshot = new ArrayList<>();
        for (WorkerNode worker : workers.values()) {
            snapshot.add(copyOf(worker));
        }
        return snapshot;
    }

    public synchronized Optional<WorkerNode> getWorker(String workerId) {
        WorkerNode worker = workers.get(workerId);
        return worker != null ? Optional.of(copyOf(worker)) : Optional.empty();
    }

    public synchronized boolean hasWorkers() {
        return !workers.isEmpty();
    }

    private double estimateSeconds(String testId) {
        Deque<Double> history = executionHistory.get(testId);
        if (history != null && !history.isEmpty()) {
            return history.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        }
        for (TestGroup group : testGroups.values()) {
            if (group.getEstimatedDuration() != null && group.getTestIds().contains(testId)) {
                return group.getEstimatedDuration().toMillis() / 1000.0 / group.getTestIds().size();
            }
        }
        return defaultTestDuration.toMillis() / 1000.0;
    }

    private static double incrementalMean(Double currentMean, double sample, double count) {
        if (currentMean == null || count <= 1) {
            return sample;
        }
        return currentMean + (sample - currentMean) / count;
    }

    private static WorkerNode copyOf(WorkerNode worker) {
        return worker.toBuilder()
                .capabilities(new LinkedHashSet<>(worker.getCapabilities()))
                .assignedTests(new ArrayList<>(worker.getAssignedTests()))
                .performanceMetrics(new HashMap<>(worker.getPerformanceMetrics()))
                .metadata(new HashMap<>(worker.getMetadata()))
                .build();
    }

    private static Map<String, List<String>> emptyDistribution(List<WorkerNode> workers) {
        Map<String, List<String>> distribution = new LinkedHashMap<>();
        for (WorkerNode worker : workers) {
            distribution.put(worker.getWorkerId(), new ArrayList<>());
        }
        return distribution;
    }

    static Map<String, List<String>> roundRobin(List<WorkerNode> workers, List<TestGroup> groups,
                                                ToDoubleFunction<String> estimatedSeconds) {
        Map<String, List<String>> distribution = emptyDistribution(workers);
        List<String> workerIds = new ArrayList<>(distribution.keySet());
        int index = 0;
        for (TestGroup group : groups) {
            for (String testId : group.getTestIds()) {
                distribution.get(workerIds.get(index % workerIds.size())).add(testId);
                index++;
            }
        }
        return distribution;
    }

    static Map<String, List<String>> loadBalanced(List<WorkerNode> workers, List<TestGroup> groups,
                                                  ToDoubleFunction<String> estimatedSeconds) {
        Map<String, List<String>> distribution = emptyDistribution(workers);
        List<String> allTests = new ArrayList<>();
        Map<String, Double> durations = new HashMap<>();
        for (TestGroup group : groups) {
            for (String testId : group.getTestIds()) {
                allTests.add(testId);
                durations.put(testId, estimatedSeconds.applyAsDouble(testId));
            }
        }
        // stable sort keeps input order among equal estimates
        allTests.sort(Comparator.comparingDouble((String id) -> durations.get(id)).reversed());

        Map<String, Double> loads = new LinkedHashMap<>();
        distribution.keySet().forEach(id -> loads.put(id, 0.0));
        for (String testId : allTests) {
            String lightest = null;
            for (Map.Entry<String, Double> entry : loads.entrySet()) {
                if (lightest == null || entry.getValue() < loads.get(lightest)) {
                    lightest = entry.getKey();
                }
            }
            distribution.get(lightest).add(testId);
            loads.merge(lightest, durations.get(testId), Double::sum);
        }
        return distribution;
    }

    static Map<String, List<String>> capabilityBased(List<WorkerNode> workers, List<TestGroup> groups,
                                                     ToDoubleFunction<String> estimatedSeconds) {
        Map<String, List<String>> distribution = emptyDistribution(workers);
        List<String> allWorkerIds = new ArrayList<>(distribution.keySet());
        for (TestGroup group : groups) {
            List<String> suitable = new ArrayList<>();
            for (WorkerNode worker : workers) {
                if (worker.hasCapabilities(group.getRequiredCapabilities())) {
                    suitable.add(worker.getWorkerId());
                }
            }
            List<String> targets = suitable.isEmpty() ? allWorkerIds : suitable;
            if (suitable.isEmpty()) {
                log.warn("No worker has capabilities {} for group {}, falling back to round robin",
                        group.getRequiredCapabilities(), group.getGroupId());
            }
            List<String> testIds = group.getTestIds();
            for (int i = 0; i < testIds.size(); i++) {
                distribution.get(targets.get(i % targets.size())).add(testIds.get(i));
            }
        }
        return distribution;
    }
}
