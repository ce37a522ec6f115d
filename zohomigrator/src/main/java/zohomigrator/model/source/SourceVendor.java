package zohomigrator.model.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * FreshBooks bill vendor ({@code bill_vendors/bill_vendors}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SourceVendor(
        @JsonProperty("id") int id,
        @JsonProperty("vendor_name") String vendorName,
        @JsonProperty("primary_contact_first_name") String contactFirstName,
        @JsonProperty("primary_contact_last_name") String contactLastName,
        @JsonProperty("primary_contact_email") String contactEmail,
        @JsonProperty("phone") String phone,
        @JsonProperty("street") String street,
        @JsonProperty("street2") String street2,
        @JsonProperty("city") String city,
        @JsonProperty("province") String province,
        @JsonProperty("postal_code") String postalCode,
        @JsonProperty("country") String country,
        @JsonProperty("currency_code") String currencyCode,
        @JsonProperty("note") String note,
        @JsonProperty("website") String website,
        @JsonProperty("tax_id") String taxId,
        @JsonProperty("vis_state") Integer visState
) implements SourceRecord {

    /** Vendor name, else the primary contact's name, else empty. */
    public String displayName() {
        if (vendorName != null && !vendorName.isBlank()) {
            return vendorName.trim();
        }
        return Names.join(contactFirstName, contactLastName);
    }

    @Override
    public String label() {
        String name = displayName();
        return name.isEmpty() ? "vendor " + id : name;
    }
}
