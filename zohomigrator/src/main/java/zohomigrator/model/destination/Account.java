package zohomigrator.model.destination;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Account(
        @JsonProperty("account_id") String accountId,
        @JsonProperty("account_name") String accountName,
        @JsonProperty("account_type") String accountType,
        @JsonProperty("parent_account_id") String parentAccountId
) implements DestinationEntity {

    @Override
    public String id() {
        return accountId;
    }

    @Override
    public String naturalKey() {
        return accountName;
    }

    public boolean isExpense() {
        return "expense".equalsIgnoreCase(accountType);
    }
}
