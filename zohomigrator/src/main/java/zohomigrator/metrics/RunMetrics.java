package zohomigrator.metrics;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable metrics collected during a migration run.
 *
 * <p>Captures:
 * <ul>
 *   <li>Timing information (total duration, per-stage durations)</li>
 *   <li>Destination traffic (requests sent, HTTP 429 answers, rate-window waits)</li>
 *   <li>Token refreshes across both backends</li>
 * </ul>
 *
 * @see RunMetricsCollector
 */
public record RunMetrics(
        String runId,
        Instant startTime,
        Instant endTime,
        Map<String, Long> stageDurations,
        long totalDurationMs,
        long requestsSent,
        long throttleCount,
        long rateLimitWaits,
        long rateLimitWaitMs,
        int tokenRefreshes,
        List<String> failedStages
) {
    public RunMetrics {
        stageDurations = Collections.unmodifiableMap(new LinkedHashMap<>(stageDurations));
        failedStages = List.copyOf(failedStages);
    }

    /**
     * Returns the duration of a stage.
     *
     * @param stage the stage name
     * @return duration in milliseconds, or 0 if the stage did not run
     */
    public long stageDuration(String stage) {
        return stageDurations.getOrDefault(stage, 0L);
    }

    /**
     * Returns a human-readable summary of the run metrics.
     *
     * @return a formatted summary string
     */
    public String summary() {
        return String.format(Locale.ROOT,
                "Run %s in %s | Requests: %d (throttled %d) | Rate-limit waits: %d (%d ms) | Token refreshes: %d%s",
                runId,
                formatDuration(totalDurationMs),
                requestsSent,
                throttleCount,
                rateLimitWaits,
                rateLimitWaitMs,
                tokenRefreshes,
                failedStages.isEmpty() ? "" : " | Failed stages: " + failedStages);
    }

    /**
     * Converts metrics to a map for structured output.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("runId", runId);
        map.put("startTime", startTime.toString());
        map.put("endTime", endTime.toString());
        map.put("totalDurationMs", totalDurationMs);
        map.put("stageDurations", stageDurations);
        map.put("requestsSent", requestsSent);
        map.put("throttleCount", throttleCount);
        map.put("rateLimitWaits", rateLimitWaits);
        map.put("rateLimitWaitMs", rateLimitWaitMs);
        map.put("tokenRefreshes", tokenRefreshes);
        map.put("failedStages", failedStages);
        return map;
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return String.format(Locale.ROOT, "%.1fs", ms / 1000.0);
        return String.format(Locale.ROOT, "%dm%02ds", seconds / 60, seconds % 60);
    }
}
