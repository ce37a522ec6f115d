package zohomigrator.model.destination;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaxRequest(
        @JsonProperty("tax_name") String taxName,
        @JsonProperty("tax_percentage") BigDecimal taxPercentage,
        @JsonProperty("tax_type") String taxType
) implements DestinationRequest {
}
