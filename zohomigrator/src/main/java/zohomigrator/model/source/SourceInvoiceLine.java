package zohomigrator.model.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One line of a FreshBooks invoice.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SourceInvoiceLine(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("qty") String quantity,
        @JsonProperty("unit_cost") Money unitCost,
        @JsonProperty("amount") Money amount,
        @JsonProperty("taxName1") String taxName1
) {
}
