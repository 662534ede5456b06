package org.example.parallel.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Resource Pool Creation Request")
public class PoolCreationRequest {

    @NotBlank(message = "poolId must not be blank")
    @Schema(description = "Unique pool id", example = "selenium_drivers", requiredMode = Schema.RequiredMode.REQUIRED)
    private String poolId;

    @NotBlank(message = "resourceType must not be blank")
    @Schema(description = "Kind of slot", example = "webdriver", requiredMode = Schema.RequiredMode.REQUIRED)
    private String resourceType;

    @NotNull(message = "capacity is required")
    @Min(value = 1, message = "capacity must be at least 1")
    @Schema(description = "Number of slots", example = "4", requiredMode = Schema.RequiredMode.REQUIRED)
    private Integer capacity;
}
