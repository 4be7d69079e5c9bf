package com.lawgraph.service.monitoring;

import com.lawgraph.dto.internal.ExtractionTiming;
import lombok.Getter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Step timer for one extraction. Steps are cumulative: a step repeated for
 * every text unit adds up under one name. Not thread-safe; one per document.
 */
public class ExtractionTimer {

    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    @Getter
    private final long startNanos;

    private long lastMark;
    private Long endNanos;

    private final Map<String, Long> nanos = new LinkedHashMap<>();
    private final Map<String, Integer> counts = new LinkedHashMap<>();

    public ExtractionTimer() {
        this.startNanos = System.nanoTime();
        this.lastMark = startNanos;
    }

    /**
     * Charge the time since the previous mark to {@code step}.
     */
    public void mark(String step) {
        long now = System.nanoTime();
        nanos.merge(step, now - lastMark, Long::sum);
        counts.merge(step, 1, Integer::sum);
        lastMark = now;
    }

    public void end() {
        this.endNanos = System.nanoTime();
    }

    public double getTotalSeconds() {
        long end = endNanos != null ? endNanos : System.nanoTime();
        return (end - startNanos) / NANOS_PER_SECOND;
    }

    public int getCount(String step) {
        return counts.getOrDefault(step, 0);
    }

    public ExtractionTiming toTiming() {
        ExtractionTiming timing = ExtractionTiming.builder()
                .totalSeconds(getTotalSeconds())
                .completedAt(Instant.now().toString())
                .build();
        nanos.forEach((step, total) -> timing.addStep(step, total / NANOS_PER_SECOND, counts.get(step)));
        return timing;
    }

    /**
     * One-line summary for debug logs: "total 0.012s, parse 0.004s, match 0.006s x42".
     */
    public String formatDisplay() {
        StringBuilder sb = new StringBuilder(String.format("total %.3fs", getTotalSeconds()));
        nanos.forEach((step, total) -> {
            sb.append(String.format(", %s %.3fs", step, total / NANOS_PER_SECOND));
            int count = counts.get(step);
            if (count > 1) {
                sb.append(" x").append(count);
            }
        });
        return sb.toString();
    }
}
