package org.example.parallel.service;

import org.example.parallel.model.TestGroup;
import org.example.parallel.model.WorkerNode;

import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Assigns the tests of all groups to workers.
 *
 * <p>Implementations receive snapshots in registration order and return
 * workerId -> test ids. Every worker should appear as a key, with an empty list
 * if it got nothing.</p>
 */
@FunctionalInterface
public interface TestAssignmentStrategy {

    Map<String, List<String>> assign(List<WorkerNode> workers, List<TestGroup> groups,
                                     ToDoubleFunction<String> estimatedSeconds);
}
