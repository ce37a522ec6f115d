package zohomigrator.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import zohomigrator.auth.TokenManager;
import zohomigrator.exceptions.DestinationApiException;
import zohomigrator.exceptions.MigrateException;
import zohomigrator.model.destination.Account;
import zohomigrator.model.destination.AccountUpdateRequest;
import zohomigrator.model.destination.Contact;
import zohomigrator.model.destination.ContactRequest;
import zohomigrator.model.destination.TaxRequest;
import zohomigrator.support.ScriptedTransport;
import zohomigrator.support.TestContexts;
import zohomigrator.support.VirtualClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DestinationClient")
class DestinationClientTest {

    private final ScriptedTransport transport = new ScriptedTransport();

    private DestinationClient client(boolean dryRun) {
        VirtualClock clock = new VirtualClock(Instant.parse("2024-01-01T00:00:00Z"));
        ObjectMapper mapper = new ObjectMapper();
        TokenManager tokens = new TokenManager(TestContexts.config().build(), transport, mapper);
        DestinationGateway gateway = new DestinationGateway(transport, tokens,
                new RateWindow(100, Duration.ofSeconds(60), clock, clock), "60001", Duration.ofSeconds(60), clock);
        return new DestinationClient(gateway, mapper, java.net.URI.create("http://zoho.test/books/v3/"),
                Set.of(3062), dryRun);
    }

    private static ContactRequest customer(String name) {
        return new ContactRequest(name, name, ContactRequest.CUSTOMER, null, null, null, null, null, null);
    }

    @Nested
    @DisplayName("listAll")
    class ListAll {

        @Test
        @DisplayName("should follow has_more_page across pages")
        void shouldFollowHasMorePage() throws MigrateException {
            transport
                    .then(200, """
                            {"code":0,"contacts":[{"contact_id":"1","contact_name":"Acme","contact_type":"customer"}],
                             "page_context":{"page":1,"has_more_page":true}}""")
                    .then(200, """
                            {"code":0,"contacts":[{"contact_id":"2","contact_name":"Globex","contact_type":"customer"}],
                             "page_context":{"page":2,"has_more_page":false}}""");

            List<Contact> contacts = client(false).listAll(DestinationResource.CUSTOMERS, Contact.class);

            assertThat(contacts).extracting(Contact::contactName).containsExactly("Acme", "Globex");
            assertThat(transport.calls()).hasSize(2);
            assertThat(transport.calls().get(0).uri().getPath()).isEqualTo("/books/v3/contacts");
            assertThat(transport.calls().get(0).uri().getQuery())
                    .contains("contact_type=customer").contains("page=1").contains("per_page=200");
            assertThat(transport.calls().get(1).uri().getQuery()).contains("page=2");
        }

        @Test
        @DisplayName("should read chart of accounts under its own list key")
        void shouldReadAccounts() throws MigrateException {
            transport.then(200, """
                    {"code":0,"chart_of_accounts":[{"account_id":"9","account_name":"Travel","account_type":"expense"}]}""");

            List<Account> accounts = client(false).listAll(DestinationResource.ACCOUNTS, Account.class);

            assertThat(accounts).singleElement().satisfies(a -> {
                assertThat(a.accountId()).isEqualTo("9");
                assertThat(a.isExpense()).isTrue();
            });
        }

        @Test
        @DisplayName("should go to the network even in dry-run mode")
        void shouldListInDryRun() throws MigrateException {
            transport.then(200, "{\"code\":0,\"items\":[]}");

            assertThat(client(true).listAll(DestinationResource.ITEMS, Account.class)).isEmpty();
            assertThat(transport.calls()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("create")
    class Create {

        @Test
        @DisplayName("should post JSON without null fields and return the new id")
        void shouldPostAndReturnId() throws MigrateException {
            transport.then(201, "{\"code\":0,\"message\":\"ok\",\"contact\":{\"contact_id\":\"77\"}}");

            String id = client(false).create(DestinationResource.CUSTOMERS, customer("Acme"), "5");

            assertThat(id).isEqualTo("77");
            assertThat(transport.calls().get(0).method()).isEqualTo("POST");
            assertThat(transport.calls().get(0).body())
                    .contains("\"contact_name\":\"Acme\"")
                    .doesNotContain("billing_address");
        }

        @Test
        @DisplayName("should add fixed create parameters for invoices")
        void shouldAddInvoiceParams() throws MigrateException {
            transport.then(201, "{\"code\":0,\"invoice\":{\"invoice_id\":\"1\"}}");

            client(false).create(DestinationResource.INVOICES,
                    new TaxRequest("x", BigDecimal.ONE, "tax"), "1");

            assertThat(transport.calls().get(0).uri().getQuery()).contains("ignore_auto_number_generation=true");
        }

        @Test
        @DisplayName("should flag configured duplicate codes")
        void shouldFlagDuplicates() {
            transport.then(400, "{\"code\":3062,\"message\":\"already exists\"}");

            assertThatThrownBy(() -> client(false).create(DestinationResource.CUSTOMERS, customer("Acme"), "5"))
                    .isInstanceOf(DestinationApiException.class)
                    .satisfies(e -> {
                        DestinationApiException api = (DestinationApiException) e;
                        assertThat(api.getCode()).isEqualTo(3062);
                        assertThat(api.isDuplicate()).isTrue();
                        assertThat(api.isFatal()).isFalse();
                    });
        }

        @Test
        @DisplayName("should treat a non-zero code in a 200 answer as an error")
        void shouldRejectNonZeroCodeWith200() {
            transport.then(200, "{\"code\":1001,\"message\":\"invalid\"}");

            assertThatThrownBy(() -> client(false).create(DestinationResource.CUSTOMERS, customer("Acme"), "5"))
                    .isInstanceOf(DestinationApiException.class)
                    .hasMessageContaining("invalid")
                    .satisfies(e -> assertThat(((DestinationApiException) e).isDuplicate()).isFalse());
        }

        @Test
        @DisplayName("should fail when the answer carries no id")
        void shouldFailWithoutId() {
            transport.then(201, "{\"code\":0,\"contact\":{}}");

            assertThatThrownBy(() -> client(false).create(DestinationResource.CUSTOMERS, customer("Acme"), "5"))
                    .isInstanceOf(MigrateException.class)
                    .hasMessageContaining("contact_id");
        }

        @Test
        @DisplayName("should return a placeholder without sending in dry-run mode")
        void shouldReturnPlaceholderInDryRun() throws MigrateException {
            String id = client(true).create(DestinationResource.CUSTOMERS, customer("Acme"), "5");

            assertThat(id).isEqualTo("dry-run-customer-5");
            assertThat(DestinationClient.isPlaceholder(id)).isTrue();
            assertThat(transport.calls()).isEmpty();
        }
    }

    @Nested
    @DisplayName("update and mark sent")
    class Writes {

        @Test
        @DisplayName("should PUT to the record path")
        void shouldPutToRecordPath() throws MigrateException {
            transport.then(200, "{\"code\":0}");

            client(false).update(DestinationResource.ACCOUNTS, "42",
                    new AccountUpdateRequest("Travel", "expense", "7"));

            assertThat(transport.calls().get(0).method()).isEqualTo("PUT");
            assertThat(transport.calls().get(0).uri().getPath()).isEqualTo("/books/v3/chartofaccounts/42");
        }

        @Test
        @DisplayName("should post to the sent status path")
        void shouldMarkInvoiceSent() throws MigrateException {
            transport.then(200, "{\"code\":0}");

            client(false).markInvoiceSent("88");

            assertThat(transport.calls().get(0).uri().getPath()).isEqualTo("/books/v3/invoices/88/status/sent");
        }

        @Test
        @DisplayName("should send nothing in dry-run mode")
        void shouldSkipWritesInDryRun() throws MigrateException {
            DestinationClient dry = client(true);

            dry.update(DestinationResource.ACCOUNTS, "42", new AccountUpdateRequest("Travel", "expense", "7"));
            dry.markInvoiceSent("88");

            assertThat(transport.calls()).isEmpty();
        }
    }
}
