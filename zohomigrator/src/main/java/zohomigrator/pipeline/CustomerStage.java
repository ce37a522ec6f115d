package zohomigrator.pipeline;

import zohomigrator.exceptions.MigrateException;
import zohomigrator.gateway.DestinationResource;
import zohomigrator.mapping.CustomerMapper;
import zohomigrator.model.destination.Contact;
import zohomigrator.model.destination.ContactRequest;
import zohomigrator.model.source.SourceCustomer;
import zohomigrator.registry.EntityType;
import zohomigrator.result.MigrationResult;
import zohomigrator.source.SourceEndpoint;

import java.util.List;

/**
 * FreshBooks clients to Zoho customers, matched by contact name.
 */
public final class CustomerStage extends AbstractStage<SourceCustomer> {

    public CustomerStage(StageContext context) {
        super(EntityType.CUSTOMER, context);
    }

    @Override
    protected void prepare(MigrationResult result) throws MigrateException {
        indexExisting(context.destination().listAll(DestinationResource.CUSTOMERS, Contact.class));
    }

    @Override
    protected List<SourceCustomer> fetch() throws MigrateException {
        return context.source().fetchAll(SourceEndpoint.CLIENTS);
    }

    @Override
    protected void migrate(SourceCustomer client, MigrationResult result) throws MigrateException {
        ContactRequest request = CustomerMapper.map(client);
        createOrReuse(client, DestinationResource.CUSTOMERS, request, request.contactName(), Contact.class, result);
    }
}
