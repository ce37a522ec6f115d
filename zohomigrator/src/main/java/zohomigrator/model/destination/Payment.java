package zohomigrator.model.destination;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import zohomigrator.registry.Fingerprint;

import java.math.BigDecimal;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Payment(
        @JsonProperty("payment_id") String paymentId,
        @JsonProperty("customer_id") String customerId,
        @JsonProperty("date") String date,
        @JsonProperty("amount") BigDecimal amount,
        @JsonProperty("reference_number") String referenceNumber
) implements DestinationEntity {

    @Override
    public String id() {
        return paymentId;
    }

    @Override
    public String naturalKey() {
        return Fingerprint.of(customerId, date, amount, referenceNumber);
    }
}
