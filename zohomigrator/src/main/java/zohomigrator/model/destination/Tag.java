package zohomigrator.model.destination;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Zoho reporting tag assignment.
 */
public record Tag(
        @JsonProperty("tag_id") String tagId,
        @JsonProperty("tag_option_id") String tagOptionId
) {
}
