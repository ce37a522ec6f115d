package zohomigrator.model.destination;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExpenseRequest(
        @JsonProperty("account_id") String accountId,
        @JsonProperty("paid_through_account_id") String paidThroughAccountId,
        @JsonProperty("vendor_id") String vendorId,
        @JsonProperty("date") String date,
        @JsonProperty("amount") BigDecimal amount,
        @JsonProperty("tax_id") String taxId,
        @JsonProperty("is_billable") Boolean billable,
        @JsonProperty("customer_id") String customerId,
        @JsonProperty("reference_number") String referenceNumber,
        @JsonProperty("description") String description,
        @JsonProperty("tags") List<Tag> tags
) implements DestinationRequest {
}
