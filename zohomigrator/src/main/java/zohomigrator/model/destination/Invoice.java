package zohomigrator.model.destination;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Invoice(
        @JsonProperty("invoice_id") String invoiceId,
        @JsonProperty("invoice_number") String invoiceNumber,
        @JsonProperty("customer_id") String customerId,
        @JsonProperty("status") String status
) implements DestinationEntity {

    @Override
    public String id() {
        return invoiceId;
    }

    @Override
    public String naturalKey() {
        return invoiceNumber;
    }
}
