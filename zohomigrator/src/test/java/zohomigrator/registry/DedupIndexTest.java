package zohomigrator.registry;

import zohomigrator.model.destination.Contact;
import zohomigrator.model.destination.Expense;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DedupIndex")
class DedupIndexTest {

    private final DedupIndex index = new DedupIndex();

    @Test
    @DisplayName("should match keys ignoring case and surrounding blanks")
    void shouldMatchCaseInsensitively() {
        index.add("Acme Corp", "1");

        assertThat(index.find("  acme CORP ")).contains("1");
        assertThat(index.contains("ACME CORP")).isTrue();
    }

    @Test
    @DisplayName("should keep the first id for a key")
    void shouldKeepFirstId() {
        assertThat(index.add("Acme", "1")).isTrue();
        assertThat(index.add("ACME", "2")).isFalse();

        assertThat(index.find("acme")).contains("1");
        assertThat(index.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("should ignore blank and null keys")
    void shouldIgnoreBlankKeys() {
        assertThat(index.add(" ", "1")).isFalse();
        assertThat(index.add(null, "1")).isFalse();

        assertThat(index.find(null)).isEmpty();
        assertThat(index.find("")).isEmpty();
        assertThat(index.size()).isZero();
    }

    @Test
    @DisplayName("should index existing destination records by natural key")
    void shouldIndexExistingRecords() {
        index.addAll(List.of(
                new Contact("c1", "Acme", "customer"),
                new Contact("c2", null, "customer"),
                new Expense("e1", "2024-03-01", new BigDecimal("10.50"), null, null, "tx-1", "Lunch")));

        assertThat(index.size()).isEqualTo(2);
        assertThat(index.find("acme")).contains("c1");
        assertThat(index.find(Fingerprint.of("2024-03-01", new BigDecimal("10.5"), "tx-1", "Lunch"))).contains("e1");
    }
}
