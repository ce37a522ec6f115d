package zohomigrator.pipeline;

import zohomigrator.exceptions.DestinationApiException;
import zohomigrator.exceptions.MigrateException;
import zohomigrator.gateway.DestinationClient;
import zohomigrator.gateway.DestinationResource;
import zohomigrator.model.destination.Contact;
import zohomigrator.model.destination.ContactRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("Reconciler")
class ReconcilerTest {

    private final DestinationClient client = mock(DestinationClient.class);
    private final Reconciler reconciler = new Reconciler(client);
    private final ContactRequest request = new ContactRequest("Acme", null, ContactRequest.CUSTOMER,
            null, null, null, null, null, null);

    @Test
    @DisplayName("should return the created id")
    void shouldReturnCreatedId() throws MigrateException {
        when(client.create(eq(DestinationResource.CUSTOMERS), any(), eq("1"))).thenReturn("c-1");

        Reconciler.Outcome outcome = reconciler.createOrMatch(DestinationResource.CUSTOMERS, request, "Acme", "1",
                Contact.class);

        assertThat(outcome).isEqualTo(new Reconciler.Outcome("c-1", false));
        verify(client, never()).listAll(any(), any());
    }

    @Test
    @DisplayName("should match the existing record after a duplicate error")
    void shouldMatchExistingOnDuplicate() throws MigrateException {
        when(client.create(any(), any(), any())).thenThrow(new DestinationApiException(3062, "exists", true));
        when(client.listAll(DestinationResource.CUSTOMERS, Contact.class)).thenReturn(List.of(
                new Contact("c-0", "Other", "customer"),
                new Contact("c-7", " ACME ", "customer")));

        Reconciler.Outcome outcome = reconciler.createOrMatch(DestinationResource.CUSTOMERS, request, "acme", "1",
                Contact.class);

        assertThat(outcome).isEqualTo(new Reconciler.Outcome("c-7", true));
    }

    @Test
    @DisplayName("should rethrow a duplicate error when nothing matches")
    void shouldRethrowUnmatchedDuplicate() throws MigrateException {
        DestinationApiException duplicate = new DestinationApiException(3062, "exists", true);
        when(client.create(any(), any(), any())).thenThrow(duplicate);
        when(client.listAll(DestinationResource.CUSTOMERS, Contact.class)).thenReturn(List.of());

        assertThatThrownBy(() -> reconciler.createOrMatch(DestinationResource.CUSTOMERS, request, "Acme", "1",
                Contact.class)).isSameAs(duplicate);
    }

    @Test
    @DisplayName("should not look up on other errors")
    void shouldNotLookUpOnOtherErrors() throws MigrateException {
        when(client.create(any(), any(), any())).thenThrow(new DestinationApiException(1001, "invalid", false));

        assertThatThrownBy(() -> reconciler.createOrMatch(DestinationResource.CUSTOMERS, request, "Acme", "1",
                Contact.class))
                .isInstanceOf(DestinationApiException.class)
                .hasMessageContaining("1001");
        verify(client, never()).listAll(any(), any());
    }
}
