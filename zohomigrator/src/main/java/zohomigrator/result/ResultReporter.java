package zohomigrator.result;

import zohomigrator.metrics.RunMetrics;

import java.io.PrintStream;
import java.util.Collection;
import java.util.Objects;

/**
 * Prints stage and run summaries for the operator.
 */
public final class ResultReporter {

    private final PrintStream out;

    public ResultReporter(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    public void report(MigrationResult result) {
        for (String line : result.summaryLines()) {
            out.println(line);
        }
    }

    public void reportRun(Collection<MigrationResult> results, RunMetrics metrics) {
        out.println();
        out.println("=== Migration summary ===");
        int succeeded = 0;
        int failed = 0;
        int skipped = 0;
        for (MigrationResult r : results) {
            out.println(r);
            succeeded += r.succeeded();
            failed += r.failed();
            skipped += r.skipped();
        }
        out.printf("Total: %d succeeded, %d failed, %d skipped%n", succeeded, failed, skipped);
        if (metrics != null) {
            out.println(metrics.summary());
        }
    }
}
