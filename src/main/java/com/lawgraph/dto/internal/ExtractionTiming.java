package com.lawgraph.dto.internal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wall-clock breakdown of one extraction, in seconds. Per-unit steps
 * (match, resolve, ...) are summed over all text units; {@code stepCounts}
 * says how many times each ran.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionTiming {

    private Double totalSeconds;

    @Builder.Default
    private Map<String, Double> stepSeconds = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Integer> stepCounts = new LinkedHashMap<>();

    private String completedAt;

    public void addStep(String step, double seconds, int count) {
        stepSeconds.put(step, seconds);
        stepCounts.put(step, count);
    }
}
