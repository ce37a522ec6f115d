package zohomigrator.pipeline;

import zohomigrator.exceptions.MigrateException;
import zohomigrator.gateway.DestinationResource;
import zohomigrator.mapping.TaxMapper;
import zohomigrator.model.destination.Tax;
import zohomigrator.model.destination.TaxRequest;
import zohomigrator.model.source.SourceTax;
import zohomigrator.registry.EntityType;
import zohomigrator.result.MigrationResult;
import zohomigrator.source.SourceEndpoint;

import java.util.List;
import java.util.Optional;

/**
 * Taxes, matched by name. The tax index also serves the expense stage's
 * tax-name lookup.
 */
public final class TaxStage extends AbstractStage<SourceTax> {

    public TaxStage(StageContext context) {
        super(EntityType.TAX, context);
    }

    @Override
    protected void prepare(MigrationResult result) throws MigrateException {
        indexExisting(context.destination().listAll(DestinationResource.TAXES, Tax.class));
    }

    @Override
    protected List<SourceTax> fetch() throws MigrateException {
        return context.source().fetchAll(SourceEndpoint.TAXES);
    }

    @Override
    protected boolean skipsArchived() {
        return false;
    }

    @Override
    protected void migrate(SourceTax tax, MigrationResult result) throws MigrateException {
        Optional<TaxRequest> request = TaxMapper.map(tax);
        if (request.isEmpty()) {
            log.debug("Skipping tax {} without a name", tax.id());
            result.recordSkipped();
            return;
        }
        createOrReuse(tax, DestinationResource.TAXES, request.get(), request.get().taxName(), Tax.class, result);
    }
}
