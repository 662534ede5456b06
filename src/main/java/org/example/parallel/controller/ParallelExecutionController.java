package org.example.parallel.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.parallel.model.DependencyRequest;
import org.example.parallel.model.HeartbeatRequest;
import org.example.parallel.model.PoolCreationRequest;
import org.example.parallel.model.QuarantineRequest;
import org.example.parallel.model.QuarantinedTest;
import org.example.parallel.model.ResourceRegistrationRequest;
import org.example.parallel.model.TestGroup;
import org.example.parallel.model.TestGroupRequest;
import org.example.parallel.model.WorkerRegistrationRequest;
import org.example.parallel.service.ParallelTestManager;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * REST API Controller für die parallele Testkoordination
 *
 * Read-only status queries plus the supervisory writes (registration, force
 * release, manual quarantine). Test bodies are not submitted over HTTP; they run
 * in-process through {@link ParallelTestManager}.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/parallel")
@RequiredArgsConstructor
@Validated
@Tag(name = "Parallel Execution", description = "Resource locks, pools, workers, dependencies and quarantine")
public class ParallelExecutionController {

    private final ParallelTestManager parallelTestManager;

    @GetMapping(value = "/status", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Gesamtstatus abrufen",
            description = "Locks, dependency graph, environments, quarantine, pools and distribution in one report")
    public ResponseEntity<Map<String, Object>> getStatus() {
        return ResponseEntity.ok(parallelTestManager.getStatusReport());
    }

    @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Health Check")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "UP");
        health.put("reporting_active", parallelTestManager.getReportingManager().isRunning());
        health.put("pool_monitoring_active", parallelTestManager.getPoolManager().isHealthMonitoringActive());
        health.put("active_environments", parallelTestManager.getEnvironmentManager().getActiveEnvironmentCount());
        health.put("quarantined_tests", parallelTestManager.getQuarantineManager().getQuarantinedTests().size());
        return ResponseEntity.ok(health);
    }

    // --- Resources and locks ---

    @PostMapping(value = "/resources", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Ressource registrieren")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Resource registered"),
            @ApiResponse(responseCode = "400", description = "Invalid request")
    })
    public ResponseEntity<Map<String, Object>> registerResource(@Valid @RequestBody ResourceRegistrationRequest request) {
        log.info("Registering resource {} ({})", request.getResourceId(), request.getResourceType());
        String resourceId = parallelTestManager.registerTestResource(request.getResourceId(),
                request.getResourceType(), request.getResourcePath(),
                request.getExclusive() == null || request.getExclusive());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("resource_id", resourceId));
    }

    @GetMapping(value = "/locks", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Lock-Status abrufen")
    public ResponseEntity<Map<String, Object>> getLockStatus() {
        return ResponseEntity.ok(parallelTestManager.getLockManager().getLockStatus());
    }

    @DeleteMapping("/locks/{resourceId}")
    @Operation(summary = "Lock zwangsweise freigeben",
            description = "Administrative release regardless of holder, for recovering from crashed workers")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Lock released"),
            @ApiResponse(responseCode = "404", description = "Unknown resource")
    })
    public ResponseEntity<Void> forceReleaseLock(
            @Parameter(description = "Resource id", required = true) @PathVariable("resourceId") String resourceId) {
        log.warn("Force release of lock {} requested", resourceId);
        return parallelTestManager.getLockManager().forceReleaseLock(resourceId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    // --- Pools ---

    @PostMapping(value = "/pools", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Ressourcen-Pool anlegen")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Pool created"),
            @ApiResponse(responseCode = "409", description = "Pool already exists")
    })
    public ResponseEntity<Map<String, Object>> createPool(@Valid @RequestBody PoolCreationRequest request) {
        boolean created = parallelTestManager.createResourcePool(request.getPoolId(), request.getResourceType(),
                request.getCapacity());
        if (!created) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", "Pool already exists"));
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("pool_id", request.getPoolId()));
    }

    @GetMapping(value = "/pools", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Status aller Pools")
    public ResponseEntity<Map<String, Object>> getPools() {
        return ResponseEntity.ok(parallelTestManager.getPoolManager().getAllPoolStatus());
    }

    @GetMapping(value = "/pools/{poolId}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Status eines Pools")
    public ResponseEntity<Map<String, Object>> getPool(@PathVariable("poolId") String poolId) {
        return parallelTestManager.getPoolManager().getPoolStatus(poolId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    // --- Workers and distribution ---

    @PostMapping(value = "/workers", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Worker registrieren")
    public ResponseEntity<Map<String, Object>> registerWorker(@Valid @RequestBody WorkerRegistrationRequest request) {
        String workerId = parallelTestManager.registerWorker(request.getWorkerId(), request.getWorkerType(),
                request.getCapabilities(), request.getMaxCapacity() != null ? request.getMaxCapacity() : 1,
                request.getMetadata());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("worker_id", workerId));
    }

    @PostMapping(value = "/workers/{workerId}/heartbeat", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Worker-Heartbeat")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Heartbeat recorded"),
            @ApiResponse(responseCode = "404", description = "Unknown worker")
    })
    public ResponseEntity<Void> heartbeat(@PathVariable("workerId") String workerId,
                                          @RequestBody(required = false) HeartbeatRequest request) {
        Map<String, Double> metrics = request != null ? request.getPerformanceMetrics() : null;
        return parallelTestManager.getDistributionManager().updateWorkerHeartbeat(workerId, metrics)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @DeleteMapping("/workers/{workerId}")
    @Operation(summary = "Worker abmelden",
            description = "Releases the worker's locks and pool slots, removes its environment and unregisters it")
    public ResponseEntity<Void> removeWorker(@PathVariable("workerId") String workerId) {
        parallelTestManager.cleanupWorker(workerId);
        return parallelTestManager.getDistributionManager().unregisterWorker(workerId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @PostMapping(value = "/groups", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Testgruppe anlegen")
    public ResponseEntity<Map<String, Object>> createGroup(@Valid @RequestBody TestGroupRequest request) {
        TestGroup group = TestGroup.builder()
                .groupId(request.getGroupId())
                .groupName(request.getGroupName() != null ? request.getGroupName() : request.getGroupId())
                .testIds(List.copyOf(request.getTestIds()))
                .groupType(request.getGroupType() != null ? request.getGroupType() : "functional")
                .priority(request.getPriority() != null ? request.getPriority() : 1)
                .estimatedDuration(request.getEstimatedDurationSeconds() != null
                        ? Duration.ofSeconds(request.getEstimatedDurationSeconds()) : null)
                .requiredCapabilities(request.getRequiredCapabilities() != null
                        ? new LinkedHashSet<>(request.getRequiredCapabilities()) : new LinkedHashSet<>())
                .build();
        String groupId = parallelTestManager.getDistributionManager().createTestGroup(group);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("group_id", groupId));
    }

    @PostMapping(value = "/distribute", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Tests verteilen", description = "Assigns all group tests to workers with the given strategy")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Distribution computed"),
            @ApiResponse(responseCode = "400", description = "Unknown strategy")
    })
    public ResponseEntity<Map<String, List<String>>> distribute(
            @Parameter(description = "round_robin, load_balanced, capability_based, duration_optimized or a custom one")
            @RequestParam(value = "strategy", defaultValue = "load_balanced") String strategy) {
        return ResponseEntity.ok(parallelTestManager.getDistributionManager().distributeTests(strategy));
    }

    @GetMapping(value = "/distribution", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Verteilungsmetriken")
    public ResponseEntity<Map<String, Object>> getDistribution() {
        return ResponseEntity.ok(parallelTestManager.getDistributionManager().getDistributionMetrics());
    }

    // --- Dependencies ---

    @PostMapping(value = "/dependencies", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Abhängigkeit anlegen")
    public ResponseEntity<Void> addDependency(@Valid @RequestBody DependencyRequest request) {
        parallelTestManager.addTestDependency(request.getDependentTest(), request.getDependencyTest(),
                request.getDependencyType(),
                request.getTimeoutSeconds() != null ? Duration.ofSeconds(request.getTimeoutSeconds()) : null);
        return ResponseEntity.status(HttpStatus.CREATED).build();
    }

    @GetMapping(value = "/dependencies", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Abhängigkeitsgraph abrufen")
    public ResponseEntity<Map<String, Object>> getDependencies() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("dependency_graph", parallelTestManager.getDependencyManager().getDependencyGraph());
        body.put("circular_dependencies", parallelTestManager.getDependencyManager().detectCircularDependencies());
        return ResponseEntity.ok(body);
    }

    // --- Quarantine ---

    @GetMapping(value = "/quarantine", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Quarantänierte Tests")
    public ResponseEntity<List<QuarantinedTest>> getQuarantinedTests() {
        return ResponseEntity.ok(parallelTestManager.getQuarantineManager().getQuarantinedTests());
    }

    @GetMapping(value = "/quarantine/{testId}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Statistik eines Tests")
    public ResponseEntity<Map<String, Object>> getTestStats(@PathVariable("testId") String testId) {
        return parallelTestManager.getQuarantineManager().getTestStats(testId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping(value = "/quarantine/{testId}")
    @Operation(summary = "Test manuell quarantänieren")
    public ResponseEntity<Void> quarantine(@PathVariable("testId") String testId,
                                           @RequestBody(required = false) QuarantineRequest request) {
        parallelTestManager.getQuarantineManager().forceQuarantine(testId, request != null ? request.getReason() : null);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/quarantine/{testId}")
    @Operation(summary = "Test aus Quarantäne entlassen")
    public ResponseEntity<Void> release(@PathVariable("testId") String testId) {
        return parallelTestManager.getQuarantineManager().forceRelease(testId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    // --- Executions ---

    @GetMapping(value = "/executions/{executionId}/metrics", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Echtzeit-Metriken einer Ausführung")
    public ResponseEntity<Map<String, Object>> getExecutionMetrics(@PathVariable("executionId") String executionId) {
        Map<String, Object> metrics = parallelTestManager.getReportingManager().getRealTimeMetrics(executionId);
        return metrics.isEmpty() ? ResponseEntity.notFound().build() : ResponseEntity.ok(metrics);
    }

    @GetMapping(value = "/executions/{executionId}/report", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Konsolidierter Report einer Ausführung")
    public ResponseEntity<Map<String, Object>> getExecutionReport(@PathVariable("executionId") String executionId) {
        Map<String, Object> report = parallelTestManager.getReportingManager().generateConsolidatedReport(executionId);
        return report.isEmpty() ? ResponseEntity.notFound().build() : ResponseEntity.ok(report);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
    }
}
