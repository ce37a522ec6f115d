package zohomigrator.alert;

import zohomigrator.auth.Backend;
import zohomigrator.config.AlertLevel;
import zohomigrator.metrics.RunMetrics;
import zohomigrator.result.MigrationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Structured logging for migration events.
 *
 * <p>Entries use markers like RUN_STARTED, STAGE_COMPLETED, STAGE_FAILED
 * followed by key=value pairs so log aggregators can parse and alert on them.
 *
 * <h2>Alert Level Configuration:</h2>
 * <ul>
 *   <li>DEBUG: logs all events</li>
 *   <li>WARNING: throttling, record failures and stage failures</li>
 *   <li>ERROR: stage failures only</li>
 * </ul>
 *
 * <h2>Example Output:</h2>
 * <pre>
 * 12:00:00.000 INFO  migration - RUN_STARTED id=5f3a stages=[categories, taxes] dry_run=false
 * 12:00:00.010 INFO  migration - STAGE_STARTED stage=categories
 * 12:00:04.200 INFO  migration - RATE_LIMIT_WAIT wait_ms=1800 in_window=100
 * 12:00:09.500 INFO  migration - STAGE_COMPLETED stage=categories duration_ms=9490 succeeded=41 failed=0 skipped=2
 * </pre>
 */
public final class MigrationEventLogger {

    private static final Logger log = LoggerFactory.getLogger("migration");

    private static volatile AlertLevel alertLevel = AlertLevel.WARNING;

    private MigrationEventLogger() {}

    /**
     * Set the alert level for logging.
     *
     * @param level the alert level (DEBUG, WARNING, or ERROR)
     */
    public static void setAlertLevel(AlertLevel level) {
        alertLevel = level != null ? level : AlertLevel.WARNING;
    }

    private static boolean shouldLogInfo() {
        return alertLevel == AlertLevel.DEBUG;
    }

    private static boolean shouldLogWarn() {
        return alertLevel == AlertLevel.DEBUG || alertLevel == AlertLevel.WARNING;
    }

    public static void runStarted(String runId, List<String> stages, boolean dryRun) {
        if (shouldLogInfo()) {
            log.info("RUN_STARTED id={} stages={} dry_run={}", runId, stages, dryRun);
        }
    }

    public static void stageStarted(String stage) {
        if (shouldLogInfo()) {
            log.info("STAGE_STARTED stage={}", stage);
        }
    }

    /**
     * Log when a stage has processed every source record.
     *
     * @param stage stage name
     * @param result the stage counters
     * @param durationMs wall-clock duration of the stage
     */
    public static void stageCompleted(String stage, MigrationResult result, long durationMs) {
        if (shouldLogInfo()) {
            log.info("STAGE_COMPLETED stage={} duration_ms={} succeeded={} failed={} skipped={}",
                    stage, durationMs, result.succeeded(), result.failed(), result.skipped());
        }
    }

    /**
     * Log when a stage is aborted by a fatal error. Always logged.
     *
     * @param stage stage name
     * @param error the fatal error
     * @param partial counters accumulated before the abort, may be null
     */
    public static void stageFailed(String stage, Throwable error, MigrationResult partial) {
        String errorMsg = error != null ? error.getMessage() : "Unknown error";
        if (partial != null) {
            log.error("STAGE_FAILED stage={} error=\"{}\" succeeded={} failed={} skipped={}",
                    stage, errorMsg, partial.succeeded(), partial.failed(), partial.skipped());
        } else {
            log.error("STAGE_FAILED stage={} error=\"{}\"", stage, errorMsg);
        }
    }

    public static void recordFailed(String stage, String entity, String error) {
        if (shouldLogWarn()) {
            log.warn("RECORD_FAILED stage={} entity=\"{}\" error=\"{}\"", stage, entity, error);
        }
    }

    public static void rateLimitWait(long waitMs, int inWindow) {
        if (shouldLogInfo()) {
            log.info("RATE_LIMIT_WAIT wait_ms={} in_window={}", waitMs, inWindow);
        }
    }

    public static void throttled(String path, long backoffMs) {
        if (shouldLogWarn()) {
            log.warn("THROTTLED path={} backoff_ms={}", path, backoffMs);
        }
    }

    public static void tokenRefreshed(Backend backend) {
        if (shouldLogInfo()) {
            log.info("TOKEN_REFRESHED backend={}", backend.name());
        }
    }

    public static void runCompleted(String runId, RunMetrics metrics) {
        if (shouldLogInfo()) {
            log.info("RUN_COMPLETED id={} duration_ms={} requests={} throttled={} token_refreshes={} failed_stages={}",
                    runId,
                    metrics.totalDurationMs(),
                    metrics.requestsSent(),
                    metrics.throttleCount(),
                    metrics.tokenRefreshes(),
                    metrics.failedStages());
        }
    }
}
