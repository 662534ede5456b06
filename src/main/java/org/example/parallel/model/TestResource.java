package org.example.parallel.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Exklusiv sperrbare Test-Ressource (Browser-Session, DB-Handle, Datei).
 *
 * <p>{@code lockedBy} is non-null exactly while the resource is held; only that
 * holder may release it.</p>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TestResource {

    private String resourceId;
    private String resourceType;
    private String resourcePath;

    private String lockedBy;
    private LocalDateTime lockedAt;
    private Duration lockTimeout;

    @Builder.Default
    private boolean exclusive = true;

    public boolean isLocked() {
        return lockedBy != null;
    }

    /**
     * Whether the current hold has outlived its TTL. Locks without a TTL never expire.
     */
    public boolean isLockExpired(LocalDateTime now) {
        if (lockedAt == null || lockTimeout == null || lockTimeout.isZero() || lockTimeout.isNegative()) {
            return false;
        }
        return Duration.between(lockedAt, now).compareTo(lockTimeout) > 0;
    }

    public void unlock() {
        lockedBy = null;
        lockedAt = null;
        lockTimeout = null;
    }

    public void lock(String holder, LocalDateTime at, Duration timeout) {
        this.lockedBy = holder;
        this.lockedAt = at;
        this.lockTimeout = timeout;
    }
}
