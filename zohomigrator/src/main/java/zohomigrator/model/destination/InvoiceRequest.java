package zohomigrator.model.destination;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record InvoiceRequest(
        @JsonProperty("customer_id") String customerId,
        @JsonProperty("invoice_number") String invoiceNumber,
        @JsonProperty("reference_number") String referenceNumber,
        @JsonProperty("date") String date,
        @JsonProperty("due_date") String dueDate,
        @JsonProperty("line_items") List<InvoiceLineRequest> lineItems,
        @JsonProperty("notes") String notes,
        @JsonProperty("terms") String terms,
        @JsonProperty("is_inclusive_tax") Boolean inclusiveTax
) implements DestinationRequest {
}
