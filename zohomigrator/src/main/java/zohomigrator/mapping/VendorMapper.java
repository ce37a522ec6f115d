package zohomigrator.mapping;

import zohomigrator.model.destination.Address;
import zohomigrator.model.destination.ContactPerson;
import zohomigrator.model.destination.ContactRequest;
import zohomigrator.model.source.SourceExpense;
import zohomigrator.model.source.SourceVendor;

import java.util.List;
import java.util.Optional;

/**
 * Maps FreshBooks bill vendors to Zoho Books vendor contacts.
 */
public final class VendorMapper {

    private VendorMapper() {}

    public static ContactRequest map(SourceVendor vendor) {
        String name = vendor.displayName().isEmpty() ? "Unknown Vendor " + vendor.id() : vendor.displayName();

        Address billing = null;
        if (vendor.street() != null || vendor.city() != null || vendor.country() != null) {
            billing = new Address(
                    Strings.lines(vendor.street(), vendor.street2()),
                    vendor.city(),
                    vendor.province(),
                    vendor.postalCode(),
                    vendor.country(),
                    vendor.phone());
        }

        List<ContactPerson> persons = null;
        if (vendor.contactFirstName() != null || vendor.contactLastName() != null || vendor.contactEmail() != null) {
            persons = List.of(new ContactPerson(vendor.contactFirstName(), vendor.contactLastName(),
                    vendor.contactEmail(), vendor.phone(), null, true));
        }

        return new ContactRequest(
                name,
                Strings.trimToNull(vendor.vendorName()),
                ContactRequest.VENDOR,
                billing,
                null,
                persons,
                vendor.note(),
                vendor.website(),
                vendor.taxId());
    }

    /**
     * Builds a minimal vendor from the free-text vendor name on an expense.
     *
     * @return the request, or empty when the expense names no vendor
     */
    public static Optional<ContactRequest> fromExpense(SourceExpense expense) {
        String name = Strings.trimToNull(expense.vendor());
        if (name == null) return Optional.empty();
        return Optional.of(new ContactRequest(name, name, ContactRequest.VENDOR,
                null, null, null, null, null, null));
    }
}
