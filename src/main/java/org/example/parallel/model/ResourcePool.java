package org.example.parallel.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fixed-capacity set of interchangeable slots.
 *
 * <p>Invariant: {@code availableCapacity + allocatedResources.size() == totalCapacity}.</p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourcePool {

    private String poolId;
    private String resourceType;
    private int totalCapacity;
    private int availableCapacity;

    /** resourceId -> workerId, in allocation order. */
    @Builder.Default
    private Map<String, String> allocatedResources = new LinkedHashMap<>();

    @Builder.Default
    private Deque<PoolRequest> waitingQueue = new ArrayDeque<>();

    @Builder.Default
    private PoolHealthStatus healthStatus = PoolHealthStatus.HEALTHY;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    private long allocationSequence;

    public double getUtilization() {
        if (totalCapacity <= 0) {
            return 0.0;
        }
        return (double) (totalCapacity - availableCapacity) / totalCapacity;
    }

    public double getQueuePressure() {
        return (double) waitingQueue.size() / Math.max(totalCapacity, 1);
    }

    /**
     * A worker waiting for a slot. Requests past {@code expiresAt} are dropped
     * instead of being served.
     */
    public record PoolRequest(String workerId, LocalDateTime requestTime, LocalDateTime expiresAt) {

        public boolean isExpired(LocalDateTime now) {
            return expiresAt != null && now.isAfter(expiresAt);
        }
    }
}
