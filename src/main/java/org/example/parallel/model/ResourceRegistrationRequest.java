package org.example.parallel.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request-Model für die Registrierung einer sperrbaren Ressource
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Resource Registration Request")
public class ResourceRegistrationRequest {

    @NotBlank(message = "resourceId must not be blank")
    @Schema(description = "Unique resource id", example = "db_main", requiredMode = Schema.RequiredMode.REQUIRED)
    private String resourceId;

    @NotBlank(message = "resourceType must not be blank")
    @Schema(description = "Kind of resource", example = "database", requiredMode = Schema.RequiredMode.REQUIRED)
    private String resourceType;

    @Schema(description = "Optional path or connection string", example = "/var/data/main.db")
    private String resourcePath;

    @Schema(description = "Exclusive lock", defaultValue = "true")
    @Builder.Default
    private Boolean exclusive = true;
}
