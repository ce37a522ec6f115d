package zohomigrator.model.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * FreshBooks item ({@code items/items}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SourceItem(
        @JsonProperty("id") int id,
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("sku") String sku,
        @JsonProperty("unit_cost") Money unitCost,
        @JsonProperty("vis_state") Integer visState
) implements SourceRecord {

    /** Name, or {@code Item <id>} when blank. */
    public String displayName() {
        return name != null && !name.isBlank() ? name.trim() : "Item " + id;
    }

    @Override
    public String label() {
        return displayName();
    }
}
