package zohomigrator.registry;

import zohomigrator.model.destination.Expense;
import zohomigrator.model.destination.Payment;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FingerprintPool")
class FingerprintPoolTest {

    @Test
    @DisplayName("should hand out each id once, in listing order")
    void shouldClaimOnce() {
        FingerprintPool pool = FingerprintPool.of(List.of(
                new Payment("p1", "c1", "2024-01-02", new BigDecimal("10.00"), null),
                new Payment("p2", "c1", "2024-01-02", new BigDecimal("10"), null)));
        String key = Fingerprint.of("c1", "2024-01-02", new BigDecimal("10.0"), null);

        assertThat(pool.claim(key)).contains("p1");
        assertThat(pool.claim(key)).contains("p2");
        assertThat(pool.claim(key)).isEmpty();
        assertThat(pool.remaining()).isZero();
    }

    @Test
    @DisplayName("should key listed expenses by their pre-tax total")
    void shouldUsePreTaxTotal() {
        FingerprintPool pool = FingerprintPool.of(List.of(
                new Expense("e1", "2024-03-01", null, new BigDecimal("100.00"), new BigDecimal("113.00"),
                        "tx-1", "Printer")));

        assertThat(pool.claim(Fingerprint.of("2024-03-01", new BigDecimal("113"), "tx-1", "Printer"))).isEmpty();
        assertThat(pool.claim(Fingerprint.of("2024-03-01", new BigDecimal("100"), "tx-1", "Printer"))).contains("e1");
    }

    @Test
    @DisplayName("should ignore blank fingerprints")
    void shouldIgnoreBlank() {
        FingerprintPool pool = new FingerprintPool();
        pool.add(" ", "x");

        assertThat(pool.claim(" ")).isEmpty();
        assertThat(pool.remaining()).isZero();
    }
}
