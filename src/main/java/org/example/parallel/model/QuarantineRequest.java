package org.example.parallel.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Manual Quarantine Request")
public class QuarantineRequest {

    @Schema(description = "Why the test is quarantined", example = "Unstable on CI")
    private String reason;
}
