package zohomigrator.model.destination;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AccountRequest(
        @JsonProperty("account_name") String accountName,
        @JsonProperty("account_type") String accountType,
        @JsonProperty("description") String description,
        @JsonProperty("parent_account_id") String parentAccountId
) implements DestinationRequest {

    public static final String TYPE_EXPENSE = "expense";
    public static final String TYPE_COST_OF_GOODS_SOLD = "cost_of_goods_sold";
}
