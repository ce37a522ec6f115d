package zohomigrator.mapping;

import zohomigrator.model.destination.ContactRequest;
import zohomigrator.model.source.SourceCustomer;
import zohomigrator.model.source.SourceExpense;
import zohomigrator.model.source.SourceInvoice;
import zohomigrator.model.source.SourceVendor;
import zohomigrator.support.Json;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Contact mappers")
class ContactMappersTest {

    @Nested
    @DisplayName("CustomerMapper")
    class Customers {

        @Test
        @DisplayName("should prefer the organization name and carry addresses")
        void shouldPreferOrganization() {
            SourceCustomer client = Json.read("""
                    {"id":7,"organization":" Acme Corp ","fname":"Ada","lname":"Lovelace","email":"ada@acme.test",
                     "bus_phone":"555-1","p_street":"1 Main St","p_street2":"Suite 4","p_city":"Springfield",
                     "p_country":"US","vat_number":"VAT9","vis_state":0}""", SourceCustomer.class);

            ContactRequest request = CustomerMapper.map(client);

            assertThat(request.contactName()).isEqualTo("Acme Corp");
            assertThat(request.companyName()).isEqualTo("Acme Corp");
            assertThat(request.contactType()).isEqualTo(ContactRequest.CUSTOMER);
            assertThat(request.billingAddress().address()).isEqualTo("1 Main St\nSuite 4");
            assertThat(request.shippingAddress()).isNull();
            assertThat(request.contactPersons()).singleElement()
                    .satisfies(p -> assertThat(p.email()).isEqualTo("ada@acme.test"));
            assertThat(request.taxRegistrationNumber()).isEqualTo("VAT9");
        }

        @Test
        @DisplayName("should fall back to the person name, then to a placeholder")
        void shouldFallBackForName() {
            SourceCustomer person = Json.read("{\"id\":8,\"fname\":\"Ada\",\"lname\":\"Lovelace\"}", SourceCustomer.class);
            SourceCustomer anonymous = Json.read("{\"id\":9}", SourceCustomer.class);

            assertThat(CustomerMapper.map(person).contactName()).isEqualTo("Ada Lovelace");
            assertThat(CustomerMapper.map(anonymous).contactName()).isEqualTo("Unknown Client 9");
            assertThat(CustomerMapper.map(anonymous).contactPersons()).isNull();
        }

        @Test
        @DisplayName("should rebuild a customer from an invoice snapshot only when it names one")
        void shouldRebuildFromInvoice() {
            SourceInvoice invoice = Json.read("""
                    {"id":100,"customerid":55,"fname":"Grace","lname":"Hopper","city":"Arlington"}""",
                    SourceInvoice.class);
            SourceInvoice bare = Json.read("{\"id\":101,\"customerid\":56}", SourceInvoice.class);

            ContactRequest rebuilt = CustomerMapper.fromInvoice(invoice).orElseThrow();
            assertThat(rebuilt.contactName()).isEqualTo("Grace Hopper");
            assertThat(rebuilt.billingAddress().city()).isEqualTo("Arlington");
            assertThat(CustomerMapper.fromInvoice(bare)).isEmpty();
        }
    }

    @Nested
    @DisplayName("VendorMapper")
    class Vendors {

        @Test
        @DisplayName("should map a bill vendor")
        void shouldMapVendor() {
            SourceVendor vendor = Json.read("""
                    {"id":3,"vendor_name":"Paper Co","primary_contact_email":"sales@paper.test",
                     "website":"paper.test","city":"Scranton","phone":"555-2"}""", SourceVendor.class);

            ContactRequest request = VendorMapper.map(vendor);

            assertThat(request.contactName()).isEqualTo("Paper Co");
            assertThat(request.contactType()).isEqualTo(ContactRequest.VENDOR);
            assertThat(request.website()).isEqualTo("paper.test");
            assertThat(request.billingAddress().phone()).isEqualTo("555-2");
        }

        @Test
        @DisplayName("should name unnamed vendors after their id")
        void shouldNameUnnamedVendor() {
            SourceVendor vendor = Json.read("{\"id\":4}", SourceVendor.class);

            assertThat(VendorMapper.map(vendor).contactName()).isEqualTo("Unknown Vendor 4");
        }

        @Test
        @DisplayName("should build a vendor from the expense vendor text only when present")
        void shouldBuildFromExpense() {
            SourceExpense named = Json.read("{\"id\":1,\"vendor\":\" Cafe Roma \"}", SourceExpense.class);
            SourceExpense unnamed = Json.read("{\"id\":2,\"vendor\":\"  \"}", SourceExpense.class);

            assertThat(VendorMapper.fromExpense(named)).hasValueSatisfying(r ->
                    assertThat(r.contactName()).isEqualTo("Cafe Roma"));
            assertThat(VendorMapper.fromExpense(unnamed)).isEmpty();
        }
    }
}
