package zohomigrator.model.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * FreshBooks expense ({@code expenses/expenses}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SourceExpense(
        @JsonProperty("id") int id,
        @JsonProperty("categoryid") Integer categoryId,
        @JsonProperty("clientid") Integer clientId,
        @JsonProperty("vendorid") Integer vendorId,
        @JsonProperty("vendor") String vendor,
        @JsonProperty("amount") Money amount,
        @JsonProperty("date") String date,
        @JsonProperty("notes") String notes,
        @JsonProperty("account_name") String accountName,
        @JsonProperty("taxName1") String taxName1,
        @JsonProperty("transactionid") String transactionId,
        @JsonProperty("billable") Boolean billable,
        @JsonProperty("vis_state") Integer visState
) implements SourceRecord {

    @Override
    public String label() {
        if (notes != null && !notes.isBlank()) {
            String n = notes.trim();
            return n.length() > 60 ? n.substring(0, 60) + "..." : n;
        }
        return "expense " + id;
    }
}
