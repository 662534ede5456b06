package org.example.parallel.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Request-Model für die Registrierung eines Workers
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Worker Registration Request")
public class WorkerRegistrationRequest {

    @NotBlank(message = "workerId must not be blank")
    @Schema(description = "Unique worker id", example = "w1", requiredMode = Schema.RequiredMode.REQUIRED)
    private String workerId;

    @Schema(description = "Worker type", example = "thread", defaultValue = "thread")
    @Builder.Default
    private String workerType = "thread";

    @Schema(description = "Capabilities offered by the worker", example = "[\"chrome\", \"api\"]")
    @Builder.Default
    private List<String> capabilities = new ArrayList<>();

    @Min(value = 1, message = "maxCapacity must be at least 1")
    @Schema(description = "Concurrent tests the worker accepts", example = "1", defaultValue = "1")
    @Builder.Default
    private Integer maxCapacity = 1;

    @Schema(description = "Free-form metadata")
    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();
}
