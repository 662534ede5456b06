package org.example.parallel.service;

import org.example.parallel.model.EnvironmentConfig;
import org.example.parallel.model.IsolatedEnvironment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class IsolatedEnvironmentManagerTest {

    @TempDir
    Path tempDir;

    private IsolatedEnvironmentManager environmentManager;

    @BeforeEach
    void setUp() {
        environmentManager = new IsolatedEnvironmentManager(tempDir.resolve("isolation"));
    }

    @Test
    void constructor_CreatesBaseDirectory() {
        assertTrue(Files.isDirectory(tempDir.resolve("isolation")));
    }

    @Test
    void createEnvironment_CreatesWorkspaceAndVariables() {
        String environmentId = environmentManager.createEnvironment("w1");

        IsolatedEnvironment environment = environmentManager.getEnvironment(environmentId).orElseThrow();
        Map<String, String> variables = environment.getEnvironmentVariables();

        assertTrue(environmentId.startsWith("env_w1_"));
        assertTrue(Files.isDirectory(environment.getBasePath()));
        assertEquals(environment.getTempPath().resolve("workspace"), environment.getBasePath());
        assertEquals("w1", variables.get("TEST_WORKER_ID"));
        assertEquals(environmentId, variables.get("TEST_ENVIRONMENT_ID"));
        assertEquals(environment.getTempPath().toString(), variables.get("TEST_TEMP_PATH"));
        assertEquals(environment.getBasePath().toString(), variables.get("TEST_BASE_PATH"));
        assertEquals("true", variables.get("TEST_ISOLATION_MODE"));
    }

    @Test
    void createEnvironment_MergesCallerOverrides() {
        Map<String, String> overrides = new HashMap<>();
        overrides.put("BROWSER", "firefox");
        overrides.put("TEST_ISOLATION_MODE", "strict");
        EnvironmentConfig config = EnvironmentConfig.builder().environmentVariables(overrides).build();

        String environmentId = environmentManager.createEnvironment("w1", config);
        Map<String, String> variables = environmentManager.getEnvironment(environmentId).orElseThrow()
                .getEnvironmentVariables();

        assertEquals("firefox", variables.get("BROWSER"));
        assertEquals("strict", variables.get("TEST_ISOLATION_MODE"));
    }

    @Test
    void createEnvironment_BlankWorker_Throws() {
        assertThrows(IllegalArgumentException.class, () -> environmentManager.createEnvironment(""));
    }

    @Test
    void createEnvironment_SameWorkerTwice_ReplacesPreviousEnvironment() {
        String first = environmentManager.createEnvironment("w1");
        Path firstPath = environmentManager.getEnvironment(first).orElseThrow().getTempPath();

        String second = environmentManager.createEnvironment("w1");

        assertNotEquals(first, second);
        assertTrue(environmentManager.getEnvironment(first).isEmpty());
        assertFalse(Files.exists(firstPath));
        assertEquals(second, environmentManager.getWorkerEnvironment("w1").orElseThrow().getEnvironmentId());
        assertEquals(1, environmentManager.getActiveEnvironmentCount());
    }

    @Test
    void cleanupEnvironment_RunsCallbacksAndDeletesDirectory() throws Exception {
        String environmentId = environmentManager.createEnvironment("w1");
        IsolatedEnvironment environment = environmentManager.getEnvironment(environmentId).orElseThrow();
        Files.writeString(environment.getBasePath().resolve("data.txt"), "scratch");
        List<String> calls = new ArrayList<>();
        environmentManager.addCleanupCallback(environmentId, () -> {
            throw new IllegalStateException("boom");
        });
        environmentManager.addCleanupCallback(environmentId, () -> calls.add("second"));

        assertTrue(environmentManager.cleanupEnvironment(environmentId));

        assertEquals(List.of("second"), calls);
        assertFalse(Files.exists(environment.getTempPath()));
        assertTrue(environmentManager.getWorkerEnvironment("w1").isEmpty());
        assertEquals(0, environmentManager.getWorkerMappingCount());
    }

    @Test
    void cleanupEnvironment_Unknown_ReturnsFalse() {
        assertFalse(environmentManager.cleanupEnvironment("env_missing"));
    }

    @Test
    void cleanupEnvironment_ClosesAutoCloseableResources() {
        AtomicBoolean closed = new AtomicBoolean();
        String environmentId = environmentManager.createEnvironment("w1");
        environmentManager.addResourceToEnvironment(environmentId, "driver", (AutoCloseable) () -> closed.set(true));

        environmentManager.cleanupEnvironment(environmentId);

        assertTrue(closed.get());
    }

    @Test
    void resources_CanBeStoredAndRead() {
        String environmentId = environmentManager.createEnvironment("w1");

        assertTrue(environmentManager.addResourceToEnvironment(environmentId, "token", "abc"));
        assertFalse(environmentManager.addResourceToEnvironment("env_missing", "token", "abc"));

        assertEquals("abc", environmentManager.getResourceFromEnvironment(environmentId, "token").orElseThrow());
        assertTrue(environmentManager.getResourceFromEnvironment(environmentId, "other").isEmpty());
    }

    @Test
    void withIsolatedEnvironment_CleansUpAfterwards() {
        String seenWorker = environmentManager.withIsolatedEnvironment("w2", null,
                env -> env.getEnvironmentVariables().get("TEST_WORKER_ID"));

        assertEquals("w2", seenWorker);
        assertEquals(0, environmentManager.getActiveEnvironmentCount());
    }

    @Test
    void withIsolatedEnvironment_CleansUpOnException() {
        assertThrows(IllegalStateException.class, () -> environmentManager.withIsolatedEnvironment("w2", null, env -> {
            throw new IllegalStateException("test body failed");
        }));

        assertEquals(0, environmentManager.getActiveEnvironmentCount());
    }

    @Test
    void cleanupAllEnvironments_RemovesEverything() {
        environmentManager.createEnvironment("w1");
        environmentManager.createEnvironment("w2");

        assertEquals(2, environmentManager.cleanupAllEnvironments());
        assertEquals(0, environmentManager.getActiveEnvironmentCount());
    }
}
