package zohomigrator.mapping;

import zohomigrator.model.destination.Address;
import zohomigrator.model.destination.ContactPerson;
import zohomigrator.model.destination.ContactRequest;
import zohomigrator.model.source.SourceCustomer;
import zohomigrator.model.source.SourceInvoice;

import java.util.List;
import java.util.Optional;

/**
 * Maps FreshBooks clients to Zoho Books customer contacts.
 */
public final class CustomerMapper {

    private CustomerMapper() {}

    public static ContactRequest map(SourceCustomer client) {
        String name = client.displayName().isEmpty() ? "Unknown Client " + client.id() : client.displayName();

        Address billing = null;
        if (client.billingStreet() != null || client.billingCity() != null || client.billingCountry() != null) {
            billing = new Address(
                    Strings.lines(client.billingStreet(), client.billingStreet2()),
                    client.billingCity(),
                    client.billingProvince(),
                    client.billingCode(),
                    client.billingCountry(),
                    null);
        }
        Address shipping = null;
        if (client.shippingStreet() != null || client.shippingCity() != null || client.shippingCountry() != null) {
            shipping = new Address(
                    Strings.lines(client.shippingStreet(), client.shippingStreet2()),
                    client.shippingCity(),
                    client.shippingProvince(),
                    client.shippingCode(),
                    client.shippingCountry(),
                    null);
        }

        List<ContactPerson> persons = null;
        if (client.firstName() != null || client.lastName() != null || client.email() != null) {
            String phone = client.businessPhone() != null ? client.businessPhone() : client.homePhone();
            persons = List.of(new ContactPerson(client.firstName(), client.lastName(), client.email(),
                    phone, client.mobilePhone(), true));
        }

        return new ContactRequest(
                name,
                Strings.trimToNull(client.organization()),
                ContactRequest.CUSTOMER,
                billing,
                shipping,
                persons,
                client.note(),
                null,
                client.vatNumber());
    }

    /**
     * Rebuilds a minimal customer from the client snapshot embedded in an
     * invoice, for invoices whose client was never migrated.
     *
     * @return empty when the invoice embeds neither an organization nor a person name
     */
    public static Optional<ContactRequest> fromInvoice(SourceInvoice invoice) {
        String name = invoice.customerName();
        if (name.isEmpty()) {
            return Optional.empty();
        }

        Address billing = null;
        if (invoice.street() != null || invoice.city() != null || invoice.country() != null) {
            billing = new Address(
                    Strings.lines(invoice.street(), invoice.street2()),
                    invoice.city(),
                    invoice.province(),
                    invoice.postalCode(),
                    invoice.country(),
                    null);
        }

        List<ContactPerson> persons = null;
        if (invoice.firstName() != null || invoice.lastName() != null) {
            persons = List.of(new ContactPerson(invoice.firstName(), invoice.lastName(), null, null, null, true));
        }

        return Optional.of(new ContactRequest(
                name,
                Strings.trimToNull(invoice.organization()),
                ContactRequest.CUSTOMER,
                billing,
                null,
                persons,
                null,
                null,
                null));
    }
}
