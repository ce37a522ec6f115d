package zohomigrator.result;

import zohomigrator.metrics.RunMetrics;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResultReporterTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final ResultReporter reporter = new ResultReporter(new PrintStream(buffer, true, StandardCharsets.UTF_8));

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void shouldPrintStageSummary() {
        MigrationResult result = new MigrationResult("customers");
        result.recordCreated();
        result.recordFailure("Acme", "Zoho Books error 1001: invalid");

        reporter.report(result);

        assertThat(output())
                .contains("customers: 1 succeeded (0 existing), 1 failed, 0 skipped")
                .contains("  - Acme: Zoho Books error 1001: invalid");
    }

    @Test
    void shouldTotalTheRun() {
        MigrationResult customers = new MigrationResult("customers");
        customers.recordCreated();
        customers.recordExisting();
        MigrationResult invoices = new MigrationResult("invoices");
        invoices.recordCreated();
        invoices.recordSkipped();
        invoices.recordFailure("invoice 7", "rejected");
        Instant start = Instant.parse("2024-06-01T09:00:00Z");
        RunMetrics metrics = new RunMetrics("r1", start, start.plusSeconds(75), Map.of(), 75_000,
                40, 1, 2, 3000, 1, List.of());

        reporter.reportRun(List.of(customers, invoices), metrics);

        assertThat(output())
                .contains("=== Migration summary ===")
                .contains("Total: 3 succeeded, 1 failed, 1 skipped")
                .contains("Run r1 in 1m15s");
    }
}
