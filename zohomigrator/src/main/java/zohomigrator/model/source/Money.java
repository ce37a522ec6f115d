package zohomigrator.model.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * FreshBooks monetary value: a decimal string and a currency code.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Money(
        @JsonProperty("amount") String amount,
        @JsonProperty("code") String code
) {

    /** Parses the amount; empty if absent or not a number. */
    public Optional<BigDecimal> value() {
        if (amount == null || amount.isBlank()) return Optional.empty();
        try {
            return Optional.of(new BigDecimal(amount.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
