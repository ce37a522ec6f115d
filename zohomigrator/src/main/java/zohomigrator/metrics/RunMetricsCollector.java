package zohomigrator.metrics;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects timing and traffic figures for a migration run.
 *
 * <h2>Usage:</h2>
 * <pre>
 * RunMetricsCollector collector = new RunMetricsCollector(Clock.systemUTC());
 * collector.start(runId);
 *
 * MigrationResult r = collector.timed("invoices", () -&gt; stage.run());
 *
 * RunMetrics metrics = collector.finish(sources);
 * </pre>
 */
public final class RunMetricsCollector {

    /**
     * Live counters read at the end of the run.
     */
    public interface TrafficSource {
        long requestsSent();

        long throttleCount();

        long rateLimitWaits();

        long rateLimitWaitMs();

        int tokenRefreshes();
    }

    @FunctionalInterface
    public interface ThrowingSupplier<T, E extends Exception> {
        T get() throws E;
    }

    private final Clock clock;
    private final Map<String, Long> stageDurations = new LinkedHashMap<>();
    private final List<String> failedStages = new ArrayList<>();
    private String runId;
    private Instant startTime;

    public RunMetricsCollector(Clock clock) {
        this.clock = clock;
    }

    /**
     * Starts collection for a new run.
     *
     * @param runId identifier of the run, used in logs
     * @return this collector for method chaining
     */
    public RunMetricsCollector start(String runId) {
        this.runId = runId;
        this.startTime = clock.instant();
        this.stageDurations.clear();
        this.failedStages.clear();
        return this;
    }

    /**
     * Time a stage and return its result (can throw checked exceptions).
     */
    public <T, E extends Exception> T timed(String stage, ThrowingSupplier<T, E> action) throws E {
        Instant start = clock.instant();
        try {
            return action.get();
        } finally {
            stageDurations.put(stage, Duration.between(start, clock.instant()).toMillis());
        }
    }

    public RunMetricsCollector stageFailed(String stage) {
        if (!failedStages.contains(stage)) {
            failedStages.add(stage);
        }
        return this;
    }

    public long stageDuration(String stage) {
        return stageDurations.getOrDefault(stage, 0L);
    }

    /**
     * Finishes collection and returns the final metrics.
     *
     * @param traffic counters of the gateway and token manager
     * @return the collected run metrics
     */
    public RunMetrics finish(TrafficSource traffic) {
        if (startTime == null) {
            throw new IllegalStateException("start() was not called");
        }
        Instant endTime = clock.instant();
        return new RunMetrics(
                runId,
                startTime,
                endTime,
                stageDurations,
                Duration.between(startTime, endTime).toMillis(),
                traffic.requestsSent(),
                traffic.throttleCount(),
                traffic.rateLimitWaits(),
                traffic.rateLimitWaitMs(),
                traffic.tokenRefreshes(),
                failedStages);
    }
}
