package zohomigrator.model.destination;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Item(
        @JsonProperty("item_id") String itemId,
        @JsonProperty("name") String name
) implements DestinationEntity {

    @Override
    public String id() {
        return itemId;
    }

    @Override
    public String naturalKey() {
        return name;
    }
}
