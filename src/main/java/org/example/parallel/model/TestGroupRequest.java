package org.example.parallel.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request-Model für eine Testgruppe
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Test Group Request")
public class TestGroupRequest {

    @NotBlank(message = "groupId must not be blank")
    @Schema(description = "Unique group id", example = "ui_chrome", requiredMode = Schema.RequiredMode.REQUIRED)
    private String groupId;

    @Schema(description = "Display name", example = "Chrome UI tests")
    private String groupName;

    @NotEmpty(message = "at least one test id is required")
    @Schema(description = "Test ids in the group", requiredMode = Schema.RequiredMode.REQUIRED)
    private List<String> testIds;

    @Schema(description = "Group type", example = "functional", defaultValue = "functional")
    @Builder.Default
    private String groupType = "functional";

    @Min(value = 1, message = "priority must be at least 1")
    @Schema(description = "Priority", example = "1", defaultValue = "1")
    @Builder.Default
    private Integer priority = 1;

    @Min(value = 0, message = "estimatedDurationSeconds must not be negative")
    @Schema(description = "Estimated duration of the whole group in seconds", example = "120")
    private Long estimatedDurationSeconds;

    @Schema(description = "Capabilities a worker needs to run the group", example = "[\"chrome\"]")
    @Builder.Default
    private List<String> requiredCapabilities = new ArrayList<>();
}
