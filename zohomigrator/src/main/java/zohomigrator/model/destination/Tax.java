package zohomigrator.model.destination;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Tax(
        @JsonProperty("tax_id") String taxId,
        @JsonProperty("tax_name") String taxName,
        @JsonProperty("tax_percentage") BigDecimal taxPercentage
) implements DestinationEntity {

    @Override
    public String id() {
        return taxId;
    }

    @Override
    public String naturalKey() {
        return taxName;
    }
}
