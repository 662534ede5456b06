package org.example.parallel.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParallelRunResult {

    private String executionId;

    @Builder.Default
    private List<TestExecutionResult> results = new ArrayList<>();

    @Builder.Default
    private Map<String, List<String>> distribution = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Object> report = new LinkedHashMap<>();

    public long count(TestOutcome outcome) {
        return results.stream().filter(r -> r.getOutcome() == outcome).count();
    }
}
