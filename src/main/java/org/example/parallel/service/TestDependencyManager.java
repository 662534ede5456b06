package org.example.parallel.service;

import lombok.extern.slf4j.Slf4j;
import org.example.parallel.model.DependencyType;
import org.example.parallel.model.TestDependency;
import org.example.parallel.model.TestState;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BiConsumer;

/**
 * Dependency graph between tests and their run states.
 *
 * <p>Eligibility is pull-based: schedulers re-poll {@link #getRunnableTests} as tests
 * complete, nothing is pushed to them.</p>
 */
@Slf4j
public class TestDependencyManager {

    private final Map<String, List<TestDependency>> dependencies = new LinkedHashMap<>();
    private final Map<String, List<TestDependency>> reverseDependencies = new LinkedHashMap<>();
    private final Map<String, TestState> testStates = new LinkedHashMap<>();
    private final Map<String, List<BiConsumer<String, Boolean>>> completionCallbacks = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public void addDependency(TestDependency dependency) {
        if (dependency == null || dependency.getDependentTest() == null || dependency.getDependencyTest() == null) {
            throw new IllegalArgumentException("dependency must name both tests");
        }
        lock.writeLock().lock();
        try {
            dependencies.computeIfAbsent(dependency.getDependentTest(), id -> new ArrayList<>()).add(dependency);
            reverseDependencies.computeIfAbsent(dependency.getDependencyTest(), id -> new ArrayList<>()).add(dependency);
            testStates.putIfAbsent(dependency.getDependentTest(), TestState.PENDING);
            testStates.putIfAbsent(dependency.getDependencyTest(), TestState.PENDING);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Added dependency: {} depends on {} ({})", dependency.getDependentTest(),
                dependency.getDependencyTest(), dependency.getDependencyType().getValue());
    }

    /**
     * {@code before} prerequisites must have completed, {@code mutex} partners must
     * not be running. {@code after} and {@code parallel_safe} never block.
     */
    public boolean canExecuteTest(String testId) {
        lock.readLock().lock();
        try {
            for (TestDependency dependency : dependencies.getOrDefault(testId, List.of())) {
                TestState state = testStates.getOrDefault(dependency.getDependencyTest(), TestState.PENDING);
                if (dependency.getDependencyType() == DependencyType.BEFORE && state != TestState.COMPLETED) {
                    return false;
                }
                if (dependency.getDependencyType() == DependencyType.MUTEX && state == TestState.RUNNING) {
                    return false;
                }
            }
            return true;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * {@code before} prerequisites of {@code testId} that ended in {@link TestState#FAILED};
     * such a test can never become runnable in the current run.
     */
    public List<String> getFailedPrerequisites(String testId) {
        lock.readLock().lock();
        try {
            List<String> failed = new ArrayList<>();
            for (TestDependency dependency : dependencies.getOrDefault(testId, List.of())) {
                if (dependency.getDependencyType() == DependencyType.BEFORE
                        && testStates.get(dependency.getDependencyTest()) == TestState.FAILED) {
                    failed.add(dependency.getDependencyTest());
                }
            }
            return failed;
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> getPrerequisites(String testId) {
        lock.readLock().lock();
        try {
            List<String> prerequisites = new ArrayList<>();
            for (TestDependency dependency : dependencies.getOrDefault(testId, List.of())) {
                if (dependency.getDependencyType() == DependencyType.BEFORE) {
                    prerequisites.add(dependency.getDependencyTest());
                }
            }
            return prerequisites;
        } finally {
            lock.readLock().unlock();
        }
    }

    public void markTestStarted(String testId) {
        lock.writeLock().lock();
        try {
            testStates.put(testId, TestState.RUNNING);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Test started: {}", testId);
    }

    public void markTestCompleted(String testId, boolean success) {
        List<BiConsumer<String, Boolean>> callbacks;
        lock.writeLock().lock();
        try {
            testStates.put(testId, success ? TestState.COMPLETED : TestState.FAILED);
            callbacks = new ArrayList<>(completionCallbacks.getOrDefault(testId, List.of()));
        } finally {
            lock.writeLock().unlock();
        }

        for (BiConsumer<String, Boolean> callback : callbacks) {
            try {
                callback.accept(testId, success);
            } catch (Exception e) {
                log.error("Error in completion callback for {}: {}", testId, e.getMessage(), e);
            }
        }
        log.info("Test completed: {} ({})", testId, success ? "success" : "failed");
    }

    public TestState getTestState(String testId) {
        lock.readLock().lock();
        try {
            return testStates.getOrDefault(testId, TestState.PENDING);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Puts the given tests back to {@link TestState#PENDING} so they can run again.
     */
    public void resetTestStates(Collection<String> testIds) {
        lock.writeLock().lock();
        try {
            for (String testId : testIds) {
                testStates.put(testId, TestState.PENDING);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Pending tests from {@code availableTests} whose blocking dependencies are satisfied,
     * in input order.
     */
    public List<String> getRunnableTests(Collection<String> availableTests) {
        List<String> runnable = new ArrayList<>();
        for (String testId : availableTests) {
            if (getTestState(testId) == TestState.PENDING && canExecuteTest(testId)) {
                runnable.add(testId);
            }
        }
        return runnable;
    }

    public Map<String, List<String>> getDependencyGraph() {
        lock.readLock().lock();
        try {
            Map<String, List<String>> graph = new LinkedHashMap<>();
            dependencies.forEach((testId, deps) ->
                    graph.put(testId, deps.stream().map(TestDependency::getDependencyTest).toList()));
            return graph;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Tests that depend on {@code testId}. */
    public List<String> getDependents(String testId) {
        lock.readLock().lock();
        try {
            return reverseDependencies.getOrDefault(testId, List.of()).stream()
                    .map(TestDependency::getDependentTest)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void addCompletionCallback(String testId, BiConsumer<String, Boolean> callback) {
        lock.writeLock().lock();
        try {
            completionCallbacks.computeIfAbsent(testId, id -> new ArrayList<>()).add(callback);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Depth-first search from every unvisited test, with a recursion stack per root.
     * Each cycle is returned as the path that closes it, e.g. {@code [A, B, A]}.
     * Advisory only: cycles are logged, scheduling is not vetoed here.
     */
    public List<List<String>> detectCircularDependencies() {
        Map<String, List<String>> graph;
        List<String> nodes;
        lock.readLock().lock();
        try {
            graph = getDependencyGraph();
            nodes = new ArrayList<>(testStates.keySet());
        } finally {
            lock.readLock().unlock();
        }

        Set<String> visited = new HashSet<>();
        List<List<String>> cycles = new ArrayList<>();
        for (String node : nodes) {
            if (!visited.contains(node)) {
                List<String> cycle = findCycle(node, graph, visited, new HashSet<>(), new ArrayList<>());
                if (cycle != null) {
                    cycles.add(cycle);
                    log.warn("Circular dependency detected: {}", String.join(" -> ", cycle));
                }
            }
        }
        return cycles;
    }

    private List<String> findCycle(String node, Map<String, List<String>> graph, Set<String> visited,
                                   Set<String> recursionStack, List<String> path) {
        visited.add(node);
        recursionStack.add(node);
        path.add(node);

        for (String neighbor : graph.getOrDefault(node, List.of())) {
            if (!visited.contains(neighbor)) {
                List<String> cycle = findCycle(neighbor, graph, visited, recursionStack, path);
                if (cycle != null) {
                    return cycle;
                }
            } else if (recursionStack.contains(neighbor)) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(neighbor), path.size()));
                cycle.add(neighbor);
                return cycle;
            }
        }

        recursionStack.remove(node);
        path.remove(path.size() - 1);
        return null;
    }
}
