package org.example.parallel.service;

import org.example.parallel.model.PoolHealthStatus;
import org.example.parallel.model.ResourcePool;
import org.example.parallel.model.ResourcePool.PoolRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class ResourcePoolManagerTest {

    private ResourcePoolManager poolManager;

    @BeforeEach
    void setUp() {
        poolManager = new ResourcePoolManager(Duration.ofMillis(20));
        poolManager.createResourcePool("browsers", "browser", 2);
    }

    @AfterEach
    void tearDown() {
        poolManager.stopHealthMonitoring();
    }

    private int available() {
        return (int) poolManager.getPoolStatus("browsers").orElseThrow().get("available_capacity");
    }

    @Test
    void createResourcePool_InvalidArguments_Throw() {
        assertThrows(IllegalArgumentException.class, () -> poolManager.createResourcePool("db", "database", 0));
        assertThrows(IllegalArgumentException.class, () -> poolManager.createResourcePool(" ", "database", 1));
    }

    @Test
    void createResourcePool_Duplicate_ReturnsFalse() {
        assertFalse(poolManager.createResourcePool("browsers", "browser", 5));
        assertEquals(2, poolManager.getPoolStatus("browsers").orElseThrow().get("total_capacity"));
    }

    @Test
    void allocateResource_UntilExhausted() {
        Optional<String> first = poolManager.allocateResource("browsers", "W1");
        Optional<String> second = poolManager.allocateResource("browsers", "W2");
        Optional<String> third = poolManager.allocateResource("browsers", "W3");

        assertTrue(first.isPresent());
        assertTrue(second.isPresent());
        assertNotEquals(first.get(), second.get());
        assertTrue(third.isEmpty());
        assertEquals(0, available());

        assertTrue(poolManager.releaseResource("browsers", first.get(), "W1"));
        assertEquals(1, available());
    }

    @Test
    void allocateResource_UnknownPool_ReturnsEmpty() {
        assertTrue(poolManager.allocateResource("missing", "W1").isEmpty());
    }

    @Test
    void allocateResource_IdsAreNotReused() {
        String first = poolManager.allocateResource("browsers", "W1").orElseThrow();
        poolManager.releaseResource("browsers", first, "W1");

        String second = poolManager.allocateResource("browsers", "W1").orElseThrow();

        assertEquals("browsers_resource_1", first);
        assertEquals("browsers_resource_2", second);
    }

    @Test
    void releaseResource_NonOwner_ReturnsFalse() {
        String resourceId = poolManager.allocateResource("browsers", "W1").orElseThrow();

        assertFalse(poolManager.releaseResource("browsers", resourceId, "W2"));
        assertFalse(poolManager.releaseResource("browsers", "browsers_resource_99", "W1"));
        assertEquals(1, available());
    }

    @Test
    void releaseResource_GrantsQueuedRequestInFifoOrder() {
        String r1 = poolManager.allocateResource("browsers", "W1").orElseThrow();
        poolManager.allocateResource("browsers", "W2");
        assertTrue(poolManager.allocateResource("browsers", "W3", Duration.ofSeconds(30)).isEmpty());
        assertTrue(poolManager.allocateResource("browsers", "W4", Duration.ofSeconds(30)).isEmpty());
        assertEquals(2, poolManager.getPoolStatus("browsers").orElseThrow().get("waiting_count"));

        poolManager.releaseResource("browsers", r1, "W1");

        assertEquals(1, poolManager.getAllocations("browsers", "W3").size());
        assertTrue(poolManager.getAllocations("browsers", "W4").isEmpty());
        assertEquals(0, available());
    }

    @Test
    void releaseResource_SkipsExpiredQueuedRequests() throws InterruptedException {
        String r1 = poolManager.allocateResource("browsers", "W1").orElseThrow();
        poolManager.allocateResource("browsers", "W2");
        poolManager.allocateResource("browsers", "W3", Duration.ofMillis(1));
        Thread.sleep(20);

        poolManager.releaseResource("browsers", r1, "W1");

        assertTrue(poolManager.getAllocations("browsers", "W3").isEmpty());
        assertEquals(1, available());
    }

    @Test
    void releaseAllForWorker_FreesEverySlot() {
        poolManager.createResourcePool("databases", "database", 3);
        poolManager.allocateResource("browsers", "W1");
        poolManager.allocateResource("databases", "W1");
        poolManager.allocateResource("databases", "W1");
        poolManager.allocateResource("databases", "W2");

        assertEquals(3, poolManager.releaseAllForWorker("W1"));

        assertEquals(2, available());
        assertEquals(List.of(), poolManager.getAllocations("databases", "W1"));
        assertEquals(1, poolManager.getAllocations("databases", "W2").size());
    }

    @Test
    void getUtilization_ReportsAllocatedShare() {
        poolManager.allocateResource("browsers", "W1");

        Map<String, Double> utilization = poolManager.getUtilization();

        assertEquals(0.5, utilization.get("browsers"), 1e-9);
    }

    @Test
    void evaluateHealth_Thresholds() {
        assertEquals(PoolHealthStatus.HEALTHY, ResourcePoolManager.evaluateHealth(pool(10, 5, 0)));
        assertEquals(PoolHealthStatus.DEGRADED, ResourcePoolManager.evaluateHealth(pool(10, 0, 0)));
        assertEquals(PoolHealthStatus.DEGRADED, ResourcePoolManager.evaluateHealth(pool(10, 5, 6)));
        assertEquals(PoolHealthStatus.UNHEALTHY, ResourcePoolManager.evaluateHealth(pool(10, 0, 6)));
        assertEquals(PoolHealthStatus.UNHEALTHY, ResourcePoolManager.evaluateHealth(pool(10, 5, 11)));
    }

    private ResourcePool pool(int capacity, int available, int waiting) {
        ResourcePool pool = ResourcePool.builder()
                .poolId("p")
                .resourceType("t")
                .totalCapacity(capacity)
                .availableCapacity(available)
                .build();
        for (int i = 0; i < capacity - available; i++) {
            pool.getAllocatedResources().put("p_resource_" + i, "w" + i);
        }
        LocalDateTime now = LocalDateTime.now();
        for (int i = 0; i < waiting; i++) {
            pool.getWaitingQueue().addLast(new PoolRequest("q" + i, now, now.plusMinutes(5)));
        }
        return pool;
    }

    @Test
    void checkPoolHealth_UpdatesStatus() {
        poolManager.allocateResource("browsers", "W1");
        poolManager.allocateResource("browsers", "W2");
        poolManager.allocateResource("browsers", "W3", Duration.ofMinutes(1));
        poolManager.allocateResource("browsers", "W4", Duration.ofMinutes(1));

        poolManager.checkPoolHealth();

        assertEquals("unhealthy", poolManager.getPoolStatus("browsers").orElseThrow().get("health_status"));
    }

    @Test
    void healthMonitoring_StartsAndStops() {
        poolManager.allocateResource("browsers", "W1");
        poolManager.allocateResource("browsers", "W2");

        poolManager.startHealthMonitoring();
        poolManager.startHealthMonitoring();
        assertTrue(poolManager.isHealthMonitoringActive());

        await().atMost(Duration.ofSeconds(2)).untilAsserted(() ->
                assertEquals("degraded", poolManager.getPoolStatus("browsers").orElseThrow().get("health_status")));

        poolManager.stopHealthMonitoring();
        assertFalse(poolManager.isHealthMonitoringActive());
    }

    @Test
    void allocateResource_ConcurrentWorkersOnTwoPools_NeverOverAllocates() throws Exception {
        poolManager.createResourcePool("devices", "device", 3);
        int workers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger browsersHeld = new AtomicInteger();
        AtomicInteger devicesHeld = new AtomicInteger();
        AtomicInteger maxBrowsers = new AtomicInteger();
        AtomicInteger maxDevices = new AtomicInteger();
        for (int i = 0; i < workers; i++) {
            String workerId = "w" + i;
            String poolId = i % 2 == 0 ? "browsers" : "devices";
            AtomicInteger held = i % 2 == 0 ? browsersHeld : devicesHeld;
            AtomicInteger max = i % 2 == 0 ? maxBrowsers : maxDevices;
            executor.submit(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int n = 0; n < 50; n++) {
                    Optional<String> slot = poolManager.allocateResource(poolId, workerId);
                    if (slot.isPresent()) {
                        max.accumulateAndGet(held.incrementAndGet(), Math::max);
                        held.decrementAndGet();
                        poolManager.releaseResource(poolId, slot.get(), workerId);
                    }
                }
            });
        }
        start.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));

        assertTrue(maxBrowsers.get() <= 2);
        assertTrue(maxDevices.get() <= 3);
        assertEquals(2, poolManager.getPoolStatus("browsers").orElseThrow().get("available_capacity"));
        assertEquals(3, poolManager.getPoolStatus("devices").orElseThrow().get("available_capacity"));
    }
}
