package zohomigrator.model.destination;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import zohomigrator.registry.Fingerprint;

import java.math.BigDecimal;

/**
 * Expense as listed by Zoho Books. Single records report the pre-tax
 * {@code amount}; listings report {@code total_without_tax} next to the
 * tax-inclusive {@code total}. The fingerprint uses the pre-tax figure so it
 * matches the amount a request was created with.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Expense(
        @JsonProperty("expense_id") String expenseId,
        @JsonProperty("date") String date,
        @JsonProperty("amount") BigDecimal amount,
        @JsonProperty("total_without_tax") BigDecimal totalWithoutTax,
        @JsonProperty("total") BigDecimal total,
        @JsonProperty("reference_number") String referenceNumber,
        @JsonProperty("description") String description
) implements DestinationEntity {

    @Override
    public String id() {
        return expenseId;
    }

    @Override
    public String naturalKey() {
        return Fingerprint.of(date, preTaxAmount(), referenceNumber, description);
    }

    BigDecimal preTaxAmount() {
        if (amount != null) return amount;
        return totalWithoutTax != null ? totalWithoutTax : total;
    }
}
