package org.example.parallel.service;

import lombok.extern.slf4j.Slf4j;
import org.example.parallel.model.TestResource;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Exclusive, TTL-bounded locks on named test resources.
 *
 * <p>Every resource has its own mutex, so unrelated resources never contend.
 * {@link #acquireLock} never blocks: a busy resource returns {@code false} and, when a
 * timeout was supplied, parks the caller in a FIFO queue that {@link #releaseLock}
 * serves. Unknown resources, foreign releases and busy resources are reported as
 * {@code false}, never as exceptions.</p>
 */
@Slf4j
public class ResourceLockManager {

    private final Map<String, TestResource> resources = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Map<String, Deque<LockRequest>> lockQueues = new ConcurrentHashMap<>();

    public String registerResource(TestResource resource) {
        if (resource == null || resource.getResourceId() == null || resource.getResourceId().isBlank()) {
            throw new IllegalArgumentException("resourceId must not be blank");
        }
        String resourceId = resource.getResourceId();
        ReentrantLock lock = lockFor(resourceId);
        lock.lock();
        try {
            resources.put(resourceId, resource);
            lockQueues.computeIfAbsent(resourceId, id -> new ArrayDeque<>());
            log.debug("Registered resource: {}", resourceId);
            return resourceId;
        } finally {
            lock.unlock();
        }
    }

    public boolean acquireLock(String resourceId, String holder) {
        return acquireLock(resourceId, holder, null);
    }

    /**
     * Tries to take the lock for {@code holder}.
     *
     * @param timeout lock TTL and, when the resource is busy, how long the queued
     *                request stays eligible; {@code null} means no TTL and no queueing
     * @return {@code true} if {@code holder} owns the lock afterwards
     */
    public boolean acquireLock(String resourceId, String holder, Duration timeout) {
        return acquire(resourceId, holder, timeout, timeout != null);
    }

    /**
     * Like {@link #acquireLock(String, String, Duration)} but never queues: a busy
     * resource returns {@code false} and leaves no pending request behind.
     *
     * @param lockTimeout TTL of the lock if acquired, {@code null} for none
     */
    public boolean tryAcquireLock(String resourceId, String holder, Duration lockTimeout) {
        return acquire(resourceId, holder, lockTimeout, false);
    }

    private boolean acquire(String resourceId, String holder, Duration timeout, boolean queueIfBusy) {
        TestResource resource = resources.get(resourceId);
        if (resource == null) {
            log.error("Resource not found: {}", resourceId);
            return false;
        }

        ReentrantLock lock = lockFor(resourceId);
        lock.lock();
        try {
            LocalDateTime now = LocalDateTime.now();
            if (resource.isLocked() && !resource.getLockedBy().equals(holder)) {
                if (resource.isLockExpired(now)) {
                    String previous = resource.getLockedBy();
                    resource.unlock();
                    log.warn("Lock on {} expired (was held by {})", resourceId, previous);
                    serveQueue(resourceId, resource);
                }
                if (resource.isLocked() && !resource.getLockedBy().equals(holder)) {
                    if (queueIfBusy) {
                        enqueue(resourceId, holder, now, timeout);
                    }
                    log.debug("Resource {} is locked by {}", resourceId, resource.getLockedBy());
                    return false;
                }
                if (resource.isLocked()) {
                    // holder was first in line and got the lock from the queue
                    return true;
                }
            }

            resource.lock(holder, now, timeout);
            removeQueued(resourceId, holder);
            log.info("Lock acquired on {} by {}", resourceId, holder);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean releaseLock(String resourceId, String holder) {
        TestResource resource = resources.get(resourceId);
        if (resource == null) {
            return false;
        }

        ReentrantLock lock = lockFor(resourceId);
        lock.lock();
        try {
            if (!resource.isLocked() || !resource.getLockedBy().equals(holder)) {
                log.warn("Lock release attempt by non-owner: {} for {} (held by {})",
                        holder, resourceId, resource.getLockedBy());
                return false;
            }
            resource.unlock();
            log.info("Lock released on {} by {}", resourceId, holder);
            serveQueue(resourceId, resource);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Administrative override regardless of holder. Meant for a supervising
     * component recovering from crashed workers, not for ordinary workers.
     */
    public boolean forceReleaseLock(String resourceId) {
        TestResource resource = resources.get(resourceId);
        if (resource == null) {
            return false;
        }

        ReentrantLock lock = lockFor(resourceId);
        lock.lock();
        try {
            String previous = resource.getLockedBy();
            resource.unlock();
            log.warn("Force released lock on {} (was held by {})", resourceId, previous);
            serveQueue(resourceId, resource);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isLocked(String resourceId) {
        return getLockHolder(resourceId).isPresent();
    }

    /**
     * Current holder, releasing the lock first if its TTL has passed.
     */
    public Optional<String> getLockHolder(String resourceId) {
        TestResource resource = resources.get(resourceId);
        if (resource == null) {
            return Optional.empty();
        }

        ReentrantLock lock = lockFor(resourceId);
        lock.lock();
        try {
            expireIfNeeded(resourceId, resource);
            return Optional.ofNullable(resource.getLockedBy());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sweeps all resources and releases expired holds.
     *
     * @return number of locks released
     */
    public int cleanupExpiredLocks() {
        int released = 0;
        for (Map.Entry<String, TestResource> entry : resources.entrySet()) {
            ReentrantLock lock = lockFor(entry.getKey());
            lock.lock();
            try {
                if (expireIfNeeded(entry.getKey(), entry.getValue())) {
                    released++;
                }
            } finally {
                lock.unlock();
            }
        }
        if (released > 0) {
            log.info("Cleaned up {} expired locks", released);
        }
        return released;
    }

    public List<String> getLocksHeldBy(String holder) {
        List<String> held = new ArrayList<>();
        for (String resourceId : resources.keySet()) {
            if (getLockHolder(resourceId).filter(holder::equals).isPresent()) {
                held.add(resourceId);
            }
        }
        return held;
    }

    public Optional<TestResource> getResource(String resourceId) {
        TestResource resource = resources.get(resourceId);
        if (resource == null) {
            return Optional.empty();
        }
        ReentrantLock lock = lockFor(resourceId);
        lock.lock();
        try {
            return Optional.of(resource.toBuilder().build());
        } finally {
            lock.unlock();
        }
    }

    public Map<String, Object> getLockStatus() {
        Map<String, Object> details = new LinkedHashMap<>();
        int locked = 0;
        int queued = 0;

        for (Map.Entry<String, TestResource> entry : resources.entrySet()) {
            String resourceId = entry.getKey();
            TestResource resource = entry.getValue();
            ReentrantLock lock = lockFor(resourceId);
            lock.lock();
            try {
                int queueLength = lockQueues.getOrDefault(resourceId, new ArrayDeque<>()).size();
                Map<String, Object> status = new LinkedHashMap<>();
                status.put("resource_type", resource.getResourceType());
                status.put("exclusive", resource.isExclusive());
                status.put("locked", resource.isLocked());
                status.put("locked_by", resource.getLockedBy());
                status.put("locked_at", resource.getLockedAt() != null ? resource.getLockedAt().toString() : null);
                status.put("timeout", resource.getLockTimeout() != null
                        ? resource.getLockTimeout().toMillis() / 1000.0 : null);
                status.put("expired", resource.isLockExpired(LocalDateTime.now()));
                status.put("queue_length", queueLength);
                details.put(resourceId, status);
                if (resource.isLocked()) {
                    locked++;
                }
                queued += queueLength;
            } finally {
                lock.unlock();
            }
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("total_resources", resources.size());
        result.put("locked_resources", locked);
        result.put("queued_requests", queued);
        result.put("resources", details);
        return result;
    }

    private boolean expireIfNeeded(String resourceId, TestResource resource) {
        if (resource.isLocked() && resource.isLockExpired(LocalDateTime.now())) {
            String previous = resource.getLockedBy();
            resource.unlock();
            log.warn("Force released expired lock on {} (was held by {})", resourceId, previous);
            serveQueue(resourceId, resource);
            return true;
        }
        return false;
    }

    private void enqueue(String resourceId, String holder, LocalDateTime now, Duration timeout) {
        Deque<LockRequest> queue = lockQueues.computeIfAbsent(resourceId, id -> new ArrayDeque<>());
        boolean alreadyQueued = queue.stream().anyMatch(r -> r.holder().equals(holder));
        if (!alreadyQueued) {
            queue.addLast(new LockRequest(holder, now, now.plus(timeout), timeout));
            log.debug("Queued lock request from {} for {} (position {})", holder, resourceId, queue.size());
        }
    }

    private void removeQueued(String resourceId, String holder) {
        Deque<LockRequest> queue = lockQueues.get(resourceId);
        if (queue != null) {
            queue.removeIf(r -> r.holder().equals(holder));
        }
    }

    /**
     * Grants the free resource to the oldest live waiter. Caller holds the resource mutex.
     */
    private void serveQueue(String resourceId, TestResource resource) {
        Deque<LockRequest> queue = lockQueues.get(resourceId);
        if (queue == null || resource.isLocked()) {
            return;
        }
        LocalDateTime now = LocalDateTime.now();
        while (!queue.isEmpty()) {
            LockRequest next = queue.pollFirst();
            if (now.isAfter(next.expiresAt())) {
                log.debug("Removed expired lock request from {} for {}", next.holder(), resourceId);
                continue;
            }
            resource.lock(next.holder(), now, next.lockTimeout());
            log.info("Granted queued lock to {} for {}", next.holder(), resourceId);
            return;
        }
    }

    private ReentrantLock lockFor(String resourceId) {
        return locks.computeIfAbsent(resourceId, id -> new ReentrantLock());
    }

    private record LockRequest(String holder, LocalDateTime requestedAt, LocalDateTime expiresAt, Duration lockTimeout) {
    }
}
