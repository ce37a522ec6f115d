package zohomigrator.model.destination;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Portion of a payment applied to one invoice.
 */
public record PaymentInvoice(
        @JsonProperty("invoice_id") String invoiceId,
        @JsonProperty("amount_applied") BigDecimal amountApplied
) {
}
