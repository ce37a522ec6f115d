package zohomigrator.model.destination;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ItemRequest(
        @JsonProperty("name") String name,
        @JsonProperty("rate") BigDecimal rate,
        @JsonProperty("description") String description,
        @JsonProperty("sku") String sku,
        @JsonProperty("product_type") String productType
) implements DestinationRequest {
}
