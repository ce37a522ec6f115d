package zohomigrator.model.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * FreshBooks client ({@code users/clients}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SourceCustomer(
        @JsonProperty("id") int id,
        @JsonProperty("organization") String organization,
        @JsonProperty("fname") String firstName,
        @JsonProperty("lname") String lastName,
        @JsonProperty("email") String email,
        @JsonProperty("bus_phone") String businessPhone,
        @JsonProperty("home_phone") String homePhone,
        @JsonProperty("mob_phone") String mobilePhone,
        @JsonProperty("currency_code") String currencyCode,
        @JsonProperty("note") String note,
        @JsonProperty("p_street") String billingStreet,
        @JsonProperty("p_street2") String billingStreet2,
        @JsonProperty("p_city") String billingCity,
        @JsonProperty("p_province") String billingProvince,
        @JsonProperty("p_code") String billingCode,
        @JsonProperty("p_country") String billingCountry,
        @JsonProperty("s_street") String shippingStreet,
        @JsonProperty("s_street2") String shippingStreet2,
        @JsonProperty("s_city") String shippingCity,
        @JsonProperty("s_province") String shippingProvince,
        @JsonProperty("s_code") String shippingCode,
        @JsonProperty("s_country") String shippingCountry,
        @JsonProperty("vat_number") String vatNumber,
        @JsonProperty("vis_state") Integer visState
) implements SourceRecord {

    /** Organization name, else "first last", else empty. */
    public String displayName() {
        if (organization != null && !organization.isBlank()) {
            return organization.trim();
        }
        return Names.join(firstName, lastName);
    }

    @Override
    public String label() {
        String name = displayName();
        return name.isEmpty() ? "client " + id : name;
    }
}
