package org.example.parallel.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Test Dependency Request")
public class DependencyRequest {

    @NotBlank(message = "dependentTest must not be blank")
    @Schema(description = "Test that waits", example = "checkout", requiredMode = Schema.RequiredMode.REQUIRED)
    private String dependentTest;

    @NotBlank(message = "dependencyTest must not be blank")
    @Schema(description = "Test that is waited for", example = "login", requiredMode = Schema.RequiredMode.REQUIRED)
    private String dependencyTest;

    @Schema(description = "Dependency type", example = "before", defaultValue = "before",
            allowableValues = {"before", "after", "parallel_safe", "mutex"})
    @Builder.Default
    private DependencyType dependencyType = DependencyType.BEFORE;

    @Schema(description = "Informational timeout in seconds", example = "300")
    private Long timeoutSeconds;
}
