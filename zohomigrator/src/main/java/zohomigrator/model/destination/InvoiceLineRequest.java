package zohomigrator.model.destination;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record InvoiceLineRequest(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("rate") BigDecimal rate,
        @JsonProperty("quantity") BigDecimal quantity
) {
}
