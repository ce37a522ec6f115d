package zohomigrator.model.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * FreshBooks tax ({@code taxes/taxes}). Taxes carry no liveness flag.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SourceTax(
        @JsonProperty("id") int id,
        @JsonProperty("taxid") Integer taxId,
        @JsonProperty("name") String name,
        @JsonProperty("amount") String amount,
        @JsonProperty("number") String number,
        @JsonProperty("compound") Boolean compound
) implements SourceRecord {

    @Override
    public Integer visState() {
        return null;
    }

    @Override
    public String label() {
        return name != null && !name.isBlank() ? name.trim() : "tax " + id;
    }
}
