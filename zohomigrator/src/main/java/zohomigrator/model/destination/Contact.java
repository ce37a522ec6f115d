package zohomigrator.model.destination;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Contact(
        @JsonProperty("contact_id") String contactId,
        @JsonProperty("contact_name") String contactName,
        @JsonProperty("contact_type") String contactType
) implements DestinationEntity {

    @Override
    public String id() {
        return contactId;
    }

    @Override
    public String naturalKey() {
        return contactName;
    }
}
