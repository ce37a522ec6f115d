package zohomigrator.result;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Counters for one stage of a migration run.
 *
 * <p>{@code succeeded} includes records matched to an existing destination
 * record ({@code existing}). Only the first {@value #MAX_ERRORS} failures
 * keep their detail; the rest are only counted.
 */
public final class MigrationResult {

    public static final int MAX_ERRORS = 10;

    /**
     * One failed record.
     *
     * @param entity label of the source record
     * @param message why it failed
     */
    public record RecordError(String entity, String message) {}

    private final String stage;
    private int succeeded;
    private int existing;
    private int synthesized;
    private int failed;
    private int skipped;
    private final List<RecordError> errors = new ArrayList<>();
    private String abortReason;

    public MigrationResult(String stage) {
        this.stage = stage;
    }

    public String stage() { return stage; }

    public int succeeded() { return succeeded; }

    public int existing() { return existing; }

    /** Records newly written to the destination. */
    public int created() { return succeeded - existing; }

    public int synthesized() { return synthesized; }

    public int failed() { return failed; }

    public int skipped() { return skipped; }

    public int processed() {
        return succeeded + failed + skipped;
    }

    /** Returns the detail of the first failures, at most {@value #MAX_ERRORS}. */
    public List<RecordError> errors() {
        return Collections.unmodifiableList(errors);
    }

    public boolean isAborted() {
        return abortReason != null;
    }

    public String abortReason() {
        return abortReason;
    }

    public void recordCreated() {
        succeeded++;
    }

    /** A source record already present in the destination. */
    public void recordExisting() {
        succeeded++;
        existing++;
    }

    /** A dependency created on the fly, such as a customer rebuilt from an invoice. */
    public void recordSynthesized() {
        synthesized++;
    }

    public void recordSkipped() {
        skipped++;
    }

    public void recordFailure(String entity, String message) {
        failed++;
        if (errors.size() < MAX_ERRORS) {
            errors.add(new RecordError(entity, message));
        }
    }

    public void markAborted(String reason) {
        this.abortReason = reason != null ? reason : "aborted";
    }

    /**
     * Human-readable summary, one line per entry.
     */
    public List<String> summaryLines() {
        List<String> lines = new ArrayList<>();
        String title = isAborted() ? stage + " (aborted)" : stage;
        lines.add(String.format(Locale.ROOT, "%s: %d succeeded (%d existing), %d failed, %d skipped",
                title, succeeded, existing, failed, skipped));
        if (synthesized > 0) {
            lines.add(String.format(Locale.ROOT, "  %d dependent records created on the fly", synthesized));
        }
        if (isAborted()) {
            lines.add("  aborted: " + abortReason);
        }
        for (RecordError e : errors) {
            lines.add("  - " + e.entity() + ": " + e.message());
        }
        if (failed > errors.size()) {
            lines.add(String.format(Locale.ROOT, "  ... and %d more errors", failed - errors.size()));
        }
        return lines;
    }

    @Override
    public String toString() {
        return summaryLines().get(0);
    }
}
