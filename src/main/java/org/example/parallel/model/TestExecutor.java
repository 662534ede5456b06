package org.example.parallel.model;

/**
 * Test body contract: returns {@code true} on success. Thrown exceptions and
 * assertion errors are treated as failures by the orchestrator.
 */
@FunctionalInterface
public interface TestExecutor {

    boolean execute() throws Exception;
}
