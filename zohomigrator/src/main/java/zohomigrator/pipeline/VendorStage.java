package zohomigrator.pipeline;

import zohomigrator.exceptions.MigrateException;
import zohomigrator.gateway.DestinationResource;
import zohomigrator.mapping.VendorMapper;
import zohomigrator.model.destination.Contact;
import zohomigrator.model.destination.ContactRequest;
import zohomigrator.model.source.SourceVendor;
import zohomigrator.registry.EntityType;
import zohomigrator.result.MigrationResult;
import zohomigrator.source.SourceEndpoint;

import java.util.List;

public final class VendorStage extends AbstractStage<SourceVendor> {

    public VendorStage(StageContext context) {
        super(EntityType.VENDOR, context);
    }

    @Override
    protected void prepare(MigrationResult result) throws MigrateException {
        indexExisting(context.destination().listAll(DestinationResource.VENDORS, Contact.class));
    }

    @Override
    protected List<SourceVendor> fetch() throws MigrateException {
        return context.source().fetchAll(SourceEndpoint.VENDORS);
    }

    @Override
    protected void migrate(SourceVendor vendor, MigrationResult result) throws MigrateException {
        ContactRequest request = VendorMapper.map(vendor);
        createOrReuse(vendor, DestinationResource.VENDORS, request, request.contactName(), Contact.class, result);
    }
}
