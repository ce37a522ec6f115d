package zohomigrator.model.destination;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Creates a customer or vendor contact.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ContactRequest(
        @JsonProperty("contact_name") String contactName,
        @JsonProperty("company_name") String companyName,
        @JsonProperty("contact_type") String contactType,
        @JsonProperty("billing_address") Address billingAddress,
        @JsonProperty("shipping_address") Address shippingAddress,
        @JsonProperty("contact_persons") List<ContactPerson> contactPersons,
        @JsonProperty("notes") String notes,
        @JsonProperty("website") String website,
        @JsonProperty("tax_reg_no") String taxRegistrationNumber
) implements DestinationRequest {

    public static final String CUSTOMER = "customer";
    public static final String VENDOR = "vendor";
}
