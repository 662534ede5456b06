package org.example.parallel.service;

import lombok.extern.slf4j.Slf4j;
import org.example.parallel.model.EnvironmentConfig;
import org.example.parallel.model.IsolatedEnvironment;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Per-worker scratch directories and environment variables.
 *
 * <p>One active environment per worker: creating a new one for a worker that
 * already has one tears the old one down first.</p>
 */
@Slf4j
public class IsolatedEnvironmentManager {

    public static final String VAR_WORKER_ID = "TEST_WORKER_ID";
    public static final String VAR_ENVIRONMENT_ID = "TEST_ENVIRONMENT_ID";
    public static final String VAR_TEMP_PATH = "TEST_TEMP_PATH";
    public static final String VAR_BASE_PATH = "TEST_BASE_PATH";
    public static final String VAR_ISOLATION_MODE = "TEST_ISOLATION_MODE";

    private final Path baseTempDir;
    private final Map<String, IsolatedEnvironment> environments = new ConcurrentHashMap<>();
    private final Map<String, String> workerEnvironments = new ConcurrentHashMap<>();
    private final Object lock = new Object();

    public IsolatedEnvironmentManager(Path baseTempDir) {
        this.baseTempDir = baseTempDir;
        try {
            Files.createDirectories(baseTempDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create isolation base directory " + baseTempDir, e);
        }
    }

    public Path getBaseTempDir() {
        return baseTempDir;
    }

    public String createEnvironment(String workerId) {
        return createEnvironment(workerId, null);
    }

    public String createEnvironment(String workerId, EnvironmentConfig config) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be blank");
        }

        synchronized (lock) {
            String existing = workerEnvironments.get(workerId);
            if (existing != null) {
                log.info("Worker {} already has environment {}, replacing it", workerId, existing);
                cleanupEnvironment(existing);
            }

            String environmentId = "env_" + workerId + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
            Path tempPath = baseTempDir.resolve(environmentId);
            Path basePath = tempPath.resolve("workspace");
            try {
                Files.createDirectories(basePath);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot create workspace for " + environmentId, e);
            }

            Map<String, String> variables = new LinkedHashMap<>();
            variables.put(VAR_WORKER_ID, workerId);
            variables.put(VAR_ENVIRONMENT_ID, environmentId);
            variables.put(VAR_TEMP_PATH, tempPath.toString());
            variables.put(VAR_BASE_PATH, basePath.toString());
            variables.put(VAR_ISOLATION_MODE, "true");
            if (config != null && config.getEnvironmentVariables() != null) {
                variables.putAll(config.getEnvironmentVariables());
            }

            IsolatedEnvironment environment = IsolatedEnvironment.builder()
                    .environmentId(environmentId)
                    .workerId(workerId)
                    .basePath(basePath)
                    .tempPath(tempPath)
                    .environmentVariables(new ConcurrentHashMap<>(variables))
                    .createdAt(LocalDateTime.now())
                    .build();
            if (config != null && config.getResources() != null) {
                environment.getResources().putAll(config.getResources());
            }
            environment.getCleanupCallbacks().add(() -> closeResources(environment));

            environments.put(environmentId, environment);
            workerEnvironments.put(workerId, environmentId);
            log.info("Created isolated environment {} for worker {}", environmentId, workerId);
            return environmentId;
        }
    }

    public Optional<IsolatedEnvironment> getEnvironment(String environmentId) {
        return Optional.ofNullable(environments.get(environmentId));
    }

    public Optional<IsolatedEnvironment> getWorkerEnvironment(String workerId) {
        String environmentId = workerEnvironments.get(workerId);
        return environmentId != null ? getEnvironment(environmentId) : Optional.empty();
    }

    public boolean addResourceToEnvironment(String environmentId, String resourceName, Object resourceData) {
        IsolatedEnvironment environment = environments.get(environmentId);
        if (environment == null) {
            return false;
        }
        environment.getResources().put(resourceName, resourceData);
        log.debug("Added resource {} to environment {}", resourceName, environmentId);
        return true;
    }

    public Optional<Object> getResourceFromEnvironment(String environmentId, String resourceName) {
        return getEnvironment(environmentId).map(env -> env.getResources().get(resourceName));
    }

    public boolean addCleanupCallback(String environmentId, Runnable callback) {
        IsolatedEnvironment environment = environments.get(environmentId);
        if (environment == null) {
            return false;
        }
        environment.getCleanupCallbacks().add(callback);
        return true;
    }

    /**
     * Runs the environment's cleanup callbacks (best effort), deletes its temp
     * directory and forgets the worker mapping.
     *
     * @return {@code false} if the environment is unknown
     */
    public boolean cleanupEnvironment(String environmentId) {
        IsolatedEnvironment environment;
        synchronized (lock) {
            environment = environments.remove(environmentId);
            if (environment == null) {
                return false;
            }
            workerEnvironments.remove(environment.getWorkerId(), environmentId);
        }

        for (Runnable callback : environment.getCleanupCallbacks()) {
            try {
                callback.run();
            } catch (Exception e) {
                log.error("Error in cleanup callback for {}: {}", environmentId, e.getMessage(), e);
            }
        }

        Path tempPath = environment.getTempPath();
        if (tempPath != null && Files.exists(tempPath)) {
            try {
                deleteDirectory(tempPath);
            } catch (IOException e) {
                log.warn("Failed to delete temp directory {} of {}", tempPath, environmentId, e);
            }
        }

        log.info("Cleaned up environment {}", environmentId);
        return true;
    }

    public int cleanupAllEnvironments() {
        List<String> environmentIds = new ArrayList<>(environments.keySet());
        int cleaned = 0;
        for (String environmentId : environmentIds) {
            if (cleanupEnvironment(environmentId)) {
                cleaned++;
            }
        }
        log.info("Cleaned up {} environments", cleaned);
        return cleaned;
    }

    /**
     * Creates an environment for {@code workerId}, applies {@code body} to it and
     * always cleans it up afterwards.
     */
    public <T> T withIsolatedEnvironment(String workerId, EnvironmentConfig config,
                                         Function<IsolatedEnvironment, T> body) {
        String environmentId = createEnvironment(workerId, config);
        try {
            return body.apply(environments.get(environmentId));
        } finally {
            cleanupEnvironment(environmentId);
        }
    }

    public int getActiveEnvironmentCount() {
        return environments.size();
    }

    public int getWorkerMappingCount() {
        return workerEnvironments.size();
    }

    private void closeResources(IsolatedEnvironment environment) {
        for (Map.Entry<String, Object> entry : environment.getResources().entrySet()) {
            if (entry.getValue() instanceof AutoCloseable closeable) {
                try {
                    closeable.close();
                } catch (Exception e) {
                    log.warn("Failed to close resource {} of {}", entry.getKey(), environment.getEnvironmentId(), e);
                }
            }
        }
        environment.getResources().clear();
    }

    private void deleteDirectory(Path dir) throws IOException {
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder())
                    .forEach(path -> {
                        try {
                            Files.deleteIfExists(path);
                        } catch (IOException e) {
                            log.debug("Could not delete {}: {}", path, e.getMessage());
                        }
                    });
        }
    }
}
