package org.example.parallel.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParallelModelTest {

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    @Test
    void distributionStrategy_FromValue_AcceptsValueAndName() {
        assertEquals(DistributionStrategy.ROUND_ROBIN, DistributionStrategy.fromValue("round_robin"));
        assertEquals(DistributionStrategy.CAPABILITY_BASED, DistributionStrategy.fromValue(" CAPABILITY_BASED "));
        assertThrows(IllegalArgumentException.class, () -> DistributionStrategy.fromValue("random"));
        assertThrows(IllegalArgumentException.class, () -> DistributionStrategy.fromValue(""));
    }

    @Test
    void dependencyType_OnlyBeforeAndMutexBlock() {
        assertTrue(DependencyType.BEFORE.isBlocking());
        assertTrue(DependencyType.MUTEX.isBlocking());
        assertFalse(DependencyType.AFTER.isBlocking());
        assertFalse(DependencyType.PARALLEL_SAFE.isBlocking());
    }

    @Test
    void dependencyType_JsonUsesLowercaseValue() throws Exception {
        assertEquals("\"parallel_safe\"", objectMapper.writeValueAsString(DependencyType.PARALLEL_SAFE));
        assertEquals(DependencyType.MUTEX, objectMapper.readValue("\"mutex\"", DependencyType.class));
    }

    @Test
    void testOutcome_IsExecuted_OnlyForPassedAndFailed() {
        assertTrue(TestOutcome.PASSED.isExecuted());
        assertTrue(TestOutcome.FAILED.isExecuted());
        assertFalse(TestOutcome.BLOCKED.isExecuted());
        assertFalse(TestOutcome.SKIPPED_QUARANTINED.isExecuted());
    }

    @Test
    void testResource_LockWithoutTimeout_NeverExpires() {
        TestResource resource = TestResource.builder().resourceId("db").build();
        LocalDateTime now = LocalDateTime.now();

        resource.lock("w1", now, null);

        assertTrue(resource.isLocked());
        assertFalse(resource.isLockExpired(now.plusDays(1)));
    }

    @Test
    void testResource_LockWithTimeout_ExpiresAfterTtl() {
        TestResource resource = TestResource.builder().resourceId("db").build();
        LocalDateTime now = LocalDateTime.now();

        resource.lock("w1", now, Duration.ofSeconds(10));

        assertFalse(resource.isLockExpired(now.plusSeconds(10)));
        assertTrue(resource.isLockExpired(now.plusSeconds(11)));
        resource.unlock();
        assertFalse(resource.isLocked());
    }

    @Test
    void resourcePool_UtilizationAndPressure() {
        ResourcePool pool = ResourcePool.builder().poolId("p").totalCapacity(4).availableCapacity(1).build();
        LocalDateTime now = LocalDateTime.now();
        pool.getWaitingQueue().add(new ResourcePool.PoolRequest("w9", now, now.plusSeconds(5)));

        assertEquals(0.75, pool.getUtilization(), 1e-9);
        assertEquals(0.25, pool.getQueuePressure(), 1e-9);
        assertTrue(pool.getWaitingQueue().peekFirst().isExpired(now.plusSeconds(6)));
    }

    @Test
    void workerNode_CapabilitiesAndCapacity() {
        WorkerNode worker = WorkerNode.builder()
                .workerId("w1")
                .capabilities(new LinkedHashSet<>(List.of("chrome", "api")))
                .maxCapacity(2)
                .currentLoad(1)
                .build();

        assertTrue(worker.hasCapabilities(List.of("chrome")));
        assertTrue(worker.hasCapabilities(null));
        assertFalse(worker.hasCapabilities(List.of("safari")));
        assertTrue(worker.hasSpareCapacity());
    }

    @Test
    void parallelRunResult_CountsByOutcome() {
        ParallelRunResult result = ParallelRunResult.builder()
                .results(List.of(
                        TestExecutionResult.skipped("a", null, TestOutcome.BLOCKED, "busy"),
                        TestExecutionResult.builder().testId("b").outcome(TestOutcome.PASSED).build(),
                        TestExecutionResult.builder().testId("c").outcome(TestOutcome.PASSED).build()))
                .build();

        assertEquals(2, result.count(TestOutcome.PASSED));
        assertEquals(1, result.count(TestOutcome.BLOCKED));
        assertEquals(0, result.count(TestOutcome.FAILED));
    }

    @Test
    void testCase_DisplayName_FallsBackToId() {
        assertEquals("login", TestCase.builder().testId("login").build().getDisplayName());
        assertEquals("Login works", TestCase.builder().testId("login").testName("Login works").build().getDisplayName());
    }
}
