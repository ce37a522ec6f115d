package zohomigrator.mapping;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DepositAccountTable")
class DepositAccountTableTest {

    private final DepositAccountTable table = new DepositAccountTable(Map.of(
            "stripe", "acc-stripe",
            "check", "acc-check",
            "default", "acc-default"));

    @Test
    @DisplayName("should match the gateway first")
    void shouldMatchGateway() {
        DepositAccountTable.Resolution r = table.resolve("Stripe", "Check");

        assertThat(r.accountId()).isEqualTo("acc-stripe");
        assertThat(r.mapped()).isTrue();
        assertThat(r.unmappedKey()).isNull();
    }

    @Test
    @DisplayName("should fall back to the payment type")
    void shouldFallBackToType() {
        DepositAccountTable.Resolution r = table.resolve("square", "check");

        assertThat(r.accountId()).isEqualTo("acc-check");
        assertThat(r.mapped()).isTrue();
    }

    @Test
    @DisplayName("should use the default entry and report the unmapped gateway")
    void shouldUseDefault() {
        DepositAccountTable.Resolution r = table.resolve("square", "Bank Transfer");

        assertThat(r.account()).contains("acc-default");
        assertThat(r.mapped()).isFalse();
        assertThat(r.unmappedKey()).isEqualTo("square");
    }

    @Test
    @DisplayName("should resolve to nothing without a default")
    void shouldResolveToNothing() {
        DepositAccountTable.Resolution r = new DepositAccountTable(Map.of()).resolve(null, "cash");

        assertThat(r.account()).isEmpty();
        assertThat(r.unmappedKey()).isEqualTo("cash");
    }
}
