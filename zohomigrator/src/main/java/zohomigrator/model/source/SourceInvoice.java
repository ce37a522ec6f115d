package zohomigrator.model.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * FreshBooks invoice ({@code invoices/invoices}).
 *
 * <p>Besides the {@code customerid} reference, an invoice embeds a snapshot
 * of the client's name and address, which is enough to recreate a minimal
 * customer when the referenced client was never migrated.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SourceInvoice(
        @JsonProperty("id") int id,
        @JsonProperty("invoice_number") String invoiceNumber,
        @JsonProperty("customerid") Integer customerId,
        @JsonProperty("create_date") String createDate,
        @JsonProperty("due_date") String dueDate,
        @JsonProperty("currency_code") String currencyCode,
        @JsonProperty("po_number") String poNumber,
        @JsonProperty("amount") Money amount,
        @JsonProperty("lines") List<SourceInvoiceLine> lines,
        @JsonProperty("notes") String notes,
        @JsonProperty("terms") String terms,
        @JsonProperty("description") String description,
        @JsonProperty("status") Integer status,
        @JsonProperty("v3_status") String v3Status,
        @JsonProperty("organization") String organization,
        @JsonProperty("fname") String firstName,
        @JsonProperty("lname") String lastName,
        @JsonProperty("street") String street,
        @JsonProperty("street2") String street2,
        @JsonProperty("city") String city,
        @JsonProperty("province") String province,
        @JsonProperty("code") String postalCode,
        @JsonProperty("country") String country,
        @JsonProperty("vis_state") Integer visState
) implements SourceRecord {

    public SourceInvoice {
        lines = lines != null ? List.copyOf(lines) : List.of();
    }

    /** Invoice number, or the source id when the number is missing. */
    public String number() {
        return invoiceNumber != null && !invoiceNumber.isBlank() ? invoiceNumber.trim() : String.valueOf(id);
    }

    /** Name of the embedded client snapshot: organization, else "first last". */
    public String customerName() {
        if (organization != null && !organization.isBlank()) {
            return organization.trim();
        }
        return Names.join(firstName, lastName);
    }

    @Override
    public String label() {
        return "invoice " + number();
    }
}
