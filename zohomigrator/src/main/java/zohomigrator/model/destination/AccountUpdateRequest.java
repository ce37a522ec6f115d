package zohomigrator.model.destination;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Re-parents an existing account.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AccountUpdateRequest(
        @JsonProperty("account_name") String accountName,
        @JsonProperty("account_type") String accountType,
        @JsonProperty("parent_account_id") String parentAccountId
) implements DestinationRequest {
}
