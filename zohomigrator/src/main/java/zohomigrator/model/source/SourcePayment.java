package zohomigrator.model.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * FreshBooks payment ({@code payments/payments}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SourcePayment(
        @JsonProperty("id") int id,
        @JsonProperty("clientid") Integer clientId,
        @JsonProperty("invoiceid") Integer invoiceId,
        @JsonProperty("amount") Money amount,
        @JsonProperty("date") String date,
        @JsonProperty("gateway") String gateway,
        @JsonProperty("type") String type,
        @JsonProperty("note") String note,
        @JsonProperty("orderid") String orderId,
        @JsonProperty("transactionid") String transactionId,
        @JsonProperty("vis_state") Integer visState
) implements SourceRecord {

    @Override
    public String label() {
        if (note != null && !note.isBlank()) return note.trim();
        if (date != null) return "payment " + id + " (" + date + ")";
        return "payment " + id;
    }
}
