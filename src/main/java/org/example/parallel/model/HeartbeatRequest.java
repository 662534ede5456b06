package org.example.parallel.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Worker Heartbeat")
public class HeartbeatRequest {

    @Schema(description = "Performance metrics reported by the worker",
            example = "{\"success_rate\": 0.95, \"average_duration\": 42.0}")
    @Builder.Default
    private Map<String, Double> performanceMetrics = new HashMap<>();
}
