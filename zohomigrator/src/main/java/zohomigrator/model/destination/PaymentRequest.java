package zohomigrator.model.destination;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PaymentRequest(
        @JsonProperty("customer_id") String customerId,
        @JsonProperty("payment_mode") String paymentMode,
        @JsonProperty("amount") BigDecimal amount,
        @JsonProperty("date") String date,
        @JsonProperty("reference_number") String referenceNumber,
        @JsonProperty("description") String description,
        @JsonProperty("account_id") String accountId,
        @JsonProperty("invoices") List<PaymentInvoice> invoices
) implements DestinationRequest {
}
