package zohomigrator.registry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Fingerprint")
class FingerprintTest {

    @Test
    @DisplayName("should normalize equal amounts with different scales")
    void shouldNormalizeAmounts() {
        String a = Fingerprint.of("2024-01-02", new BigDecimal("10"), "ref");
        String b = Fingerprint.of("2024-01-02", new BigDecimal("10.00"), "ref");

        assertThat(a).isEqualTo(b).isEqualTo("2024-01-02|10|ref");
    }

    @Test
    @DisplayName("should write zero without an exponent")
    void shouldWriteZeroPlainly() {
        assertThat(Fingerprint.of(new BigDecimal("0.000"))).isEqualTo("0");
        assertThat(Fingerprint.of(new BigDecimal("1E+2"))).isEqualTo("100");
    }

    @Test
    @DisplayName("should keep positions for missing parts")
    void shouldKeepPositionsForNulls() {
        assertThat(Fingerprint.of("a", null, " c ")).isEqualTo("a||c");
    }
}
