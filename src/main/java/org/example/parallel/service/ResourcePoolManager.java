package org.example.parallel.service;

import lombok.extern.slf4j.Slf4j;
import org.example.parallel.model.PoolHealthStatus;
import org.example.parallel.model.ResourcePool;
import org.example.parallel.model.ResourcePool.PoolRequest;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-capacity pools of interchangeable slots, allocated and released like a
 * semaphore. Exhausted pools queue requests that carry a timeout; queued workers
 * find their grant through {@link #getAllocations}.
 *
 * <p>Each pool is its own monitor; the registry map is only locked to add or look
 * up pools.</p>
 */
@Slf4j
public class ResourcePoolManager {

    private final Map<String, ResourcePool> pools = new LinkedHashMap<>();
    private final Duration healthCheckInterval;
    private ScheduledExecutorService healthMonitor;

    public ResourcePoolManager() {
        this(Duration.ofSeconds(30));
    }

    public ResourcePoolManager(Duration healthCheckInterval) {
        this.healthCheckInterval = healthCheckInterval;
    }

    /**
     * @return {@code false} if a pool with that id already exists
     */
    public boolean createResourcePool(String poolId, String resourceType, int capacity) {
        if (poolId == null || poolId.isBlank()) {
            throw new IllegalArgumentException("poolId must not be blank");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        synchronized (pools) {
            if (pools.containsKey(poolId)) {
                log.warn("Resource pool {} already exists", poolId);
                return false;
            }
            pools.put(poolId, ResourcePool.builder()
                    .poolId(poolId)
                    .resourceType(resourceType)
                    .totalCapacity(capacity)
                    .availableCapacity(capacity)
                    .build());
        }
        log.info("Created resource pool {} ({}) with capacity {}", poolId, resourceType, capacity);
        return true;
    }

    public Optional<String> allocateResource(String poolId, String workerId) {
        return allocateResource(poolId, workerId, null);
    }

    /**
     * Takes one slot for {@code workerId}.
     *
     * @param timeout how long a queued request stays eligible when the pool is
     *                exhausted; {@code null} means fail fast without queueing
     * @return the allocated resource id, or empty when nothing is free
     */
    public Optional<String> allocateResource(String poolId, String workerId, Duration timeout) {
        ResourcePool pool = poolFor(poolId);
        if (pool == null) {
            log.error("Resource pool not found: {}", poolId);
            return Optional.empty();
        }
        synchronized (pool) {
            if (pool.getAvailableCapacity() > 0) {
                String resourceId = allocate(pool, workerId);
                pool.getWaitingQueue().removeIf(r -> r.workerId().equals(workerId));
                return Optional.of(resourceId);
            }

            if (timeout != null) {
                LocalDateTime now = LocalDateTime.now();
                boolean queued = pool.getWaitingQueue().stream().anyMatch(r -> r.workerId().equals(workerId));
                if (!queued) {
                    pool.getWaitingQueue().addLast(new PoolRequest(workerId, now, now.plus(timeout)));
                    log.debug("Worker {} queued for pool {} (position {})", workerId, poolId,
                            pool.getWaitingQueue().size());
                }
            }
            log.debug("Resource pool {} exhausted", poolId);
            return Optional.empty();
        }
    }

    /**
     * Returns a slot held by {@code workerId} and hands freed capacity to queued
     * workers in FIFO order.
     */
    public boolean releaseResource(String poolId, String resourceId, String workerId) {
        ResourcePool pool = poolFor(poolId);
        if (pool == null) {
            return false;
        }
        synchronized (pool) {
            String holder = pool.getAllocatedResources().get(resourceId);
            if (holder == null || !holder.equals(workerId)) {
                log.warn("Pool release attempt by non-owner: {} for {} in {} (held by {})",
                        workerId, resourceId, poolId, holder);
                return false;
            }
            pool.getAllocatedResources().remove(resourceId);
            pool.setAvailableCapacity(pool.getAvailableCapacity() + 1);
            log.debug("Released {} from pool {} by {}", resourceId, poolId, workerId);
            processWaitingQueue(pool);
            return true;
        }
    }

    /** Resource ids of {@code poolId} currently held by {@code workerId}. */
    public List<String> getAllocations(String poolId, String workerId) {
        ResourcePool pool = poolFor(poolId);
        if (pool == null) {
            return List.of();
        }
        synchronized (pool) {
            List<String> allocations = new ArrayList<>();
            pool.getAllocatedResources().forEach((resourceId, holder) -> {
                if (holder.equals(workerId)) {
                    allocations.add(resourceId);
                }
            });
            return allocations;
        }
    }

    /**
     * Releases every slot of every pool held by {@code workerId} and drops its queued requests.
     *
     * @return number of slots released
     */
    public int releaseAllForWorker(String workerId) {
        int released = 0;
        for (ResourcePool pool : snapshot()) {
            synchronized (pool) {
                pool.getWaitingQueue().removeIf(r -> r.workerId().equals(workerId));
                Iterator<Map.Entry<String, String>> it = pool.getAllocatedResources().entrySet().iterator();
                int freed = 0;
                while (it.hasNext()) {
                    if (it.next().getValue().equals(workerId)) {
                        it.remove();
                        freed++;
                    }
                }
                if (freed > 0) {
                    pool.setAvailableCapacity(pool.getAvailableCapacity() + freed);
                    processWaitingQueue(pool);
                    released += freed;
                }
            }
        }
        if (released > 0) {
            log.info("Released {} pool resources held by {}", released, workerId);
        }
        return released;
    }

    public Optional<Map<String, Object>> getPoolStatus(String poolId) {
        ResourcePool pool = poolFor(poolId);
        if (pool == null) {
            return Optional.empty();
        }
        synchronized (pool) {
            return Optional.of(describe(pool));
        }
    }

    public Map<String, Object> getAllPoolStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        for (ResourcePool pool : snapshot()) {
            synchronized (pool) {
                status.put(pool.getPoolId(), describe(pool));
            }
        }
        return status;
    }

    /**
     * Utilization per pool, for reporting.
     */
    public Map<String, Double> getUtilization() {
        Map<String, Double> utilization = new LinkedHashMap<>();
        for (ResourcePool pool : snapshot()) {
            synchronized (pool) {
                utilization.put(pool.getPoolId(), pool.getUtilization());
            }
        }
        return utilization;
    }

    /**
     * Drops expired waiters and re-scores every pool. Called by the health monitor.
     */
    public void checkPoolHealth() {
        LocalDateTime now = LocalDateTime.now();
        for (ResourcePool pool : snapshot()) {
            synchronized (pool) {
                pool.getWaitingQueue().removeIf(r -> r.isExpired(now));
                PoolHealthStatus previous = pool.getHealthStatus();
                PoolHealthStatus current = evaluateHealth(pool);
                pool.setHealthStatus(current);
                if (previous != current) {
                    if (current == PoolHealthStatus.HEALTHY) {
                        log.info("Pool {} health changed {} -> {}", pool.getPoolId(), previous, current);
                    } else {
                        log.warn("Pool {} health changed {} -> {} (utilization {}, queue pressure {})",
                                pool.getPoolId(), previous, current,
                                String.format("%.2f", pool.getUtilization()),
                                String.format("%.2f", pool.getQueuePressure()));
                    }
                }
            }
        }
    }

    public synchronized void startHealthMonitoring() {
        if (healthMonitor != null && !healthMonitor.isShutdown()) {
            return;
        }
        healthMonitor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "pool-health-monitor");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = Math.max(healthCheckInterval.toMillis(), 1);
        healthMonitor.scheduleWithFixedDelay(() -> {
            try {
                checkPoolHealth();
            } catch (Exception e) {
                log.error("Pool health check failed: {}", e.getMessage(), e);
            }
        }, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Pool health monitoring started (interval {} ms)", intervalMs);
    }

    public synchronized void stopHealthMonitoring() {
        if (healthMonitor == null) {
            return;
        }
        healthMonitor.shutdown();
        try {
            if (!healthMonitor.awaitTermination(5, TimeUnit.SECONDS)) {
                healthMonitor.shutdownNow();
            }
        } catch (InterruptedException e) {
            healthMonitor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        healthMonitor = null;
        log.info("Pool health monitoring stopped");
    }

    public synchronized boolean isHealthMonitoringActive() {
        return healthMonitor != null && !healthMonitor.isShutdown();
    }

    static PoolHealthStatus evaluateHealth(ResourcePool pool) {
        double utilization = pool.getUtilization();
        double queuePressure = pool.getQueuePressure();
        if (queuePressure > 1.0 || (utilization >= 1.0 && queuePressure > 0.5)) {
            return PoolHealthStatus.UNHEALTHY;
        }
        if (utilization > 0.9 || queuePressure > 0.5) {
            return PoolHealthStatus.DEGRADED;
        }
        return PoolHealthStatus.HEALTHY;
    }

    private ResourcePool poolFor(String poolId) {
        synchronized (pools) {
            return pools.get(poolId);
        }
    }

    private List<ResourcePool> snapshot() {
        synchronized (pools) {
            return new ArrayList<>(pools.values());
        }
    }

    private String allocate(ResourcePool pool, String workerId) {
        pool.setAllocationSequence(pool.getAllocationSequence() + 1);
        String resourceId = pool.getPoolId() + "_resource_" + pool.getAllocationSequence();
        pool.getAllocatedResources().put(resourceId, workerId);
        pool.setAvailableCapacity(pool.getAvailableCapacity() - 1);
        log.debug("Allocated {} from pool {} to {}", resourceId, pool.getPoolId(), workerId);
        return resourceId;
    }

    private void processWaitingQueue(ResourcePool pool) {
        LocalDateTime now = LocalDateTime.now();
        while (pool.getAvailableCapacity() > 0 && !pool.getWaitingQueue().isEmpty()) {
            PoolRequest request = pool.getWaitingQueue().pollFirst();
            if (request.isExpired(now)) {
                log.debug("Dropped expired pool request from {} for {}", request.workerId(), pool.getPoolId());
                continue;
            }
            String resourceId = allocate(pool, request.workerId());
            log.info("Granted queued pool resource {} to {}", resourceId, request.workerId());
        }
    }

    private Map<String, Object> describe(ResourcePool pool) {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("pool_id", pool.getPoolId());
        status.put("resource_type", pool.getResourceType());
        status.put("total_capacity", pool.getTotalCapacity());
        status.put("available_capacity", pool.getAvailableCapacity());
        status.put("allocated_count", pool.getAllocatedResources().size());
        status.put("waiting_count", pool.getWaitingQueue().size());
        status.put("utilization", pool.getUtilization());
        status.put("health_status", pool.getHealthStatus().getValue());
        status.put("allocated_resources", new LinkedHashMap<>(pool.getAllocatedResources()));
        return status;
    }
}
