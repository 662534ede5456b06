package org.example.parallel.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Scratch directory plus environment variables owned by exactly one worker.
 *
 * <p>The {@code IsolatedEnvironmentManager} holds the only strong reference; callers
 * release it through the manager, never by dropping it.</p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IsolatedEnvironment {

    private String environmentId;
    private String workerId;
    private Path basePath;
    private Path tempPath;

    @Builder.Default
    private Map<String, String> environmentVariables = new ConcurrentHashMap<>();

    @JsonIgnore
    @Builder.Default
    private Map<String, Object> resources = new ConcurrentHashMap<>();

    @Builder.Default
    private LocalDateTime createdAt = LocalDateTime.now();

    @JsonIgnore
    @Builder.Default
    private List<Runnable> cleanupCallbacks = new CopyOnWriteArrayList<>();
}
