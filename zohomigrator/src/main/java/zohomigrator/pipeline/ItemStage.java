package zohomigrator.pipeline;

import zohomigrator.exceptions.MigrateException;
import zohomigrator.gateway.DestinationResource;
import zohomigrator.mapping.ItemMapper;
import zohomigrator.model.destination.Item;
import zohomigrator.model.destination.ItemRequest;
import zohomigrator.model.source.SourceItem;
import zohomigrator.registry.EntityType;
import zohomigrator.result.MigrationResult;
import zohomigrator.source.SourceEndpoint;

import java.util.List;

public final class ItemStage extends AbstractStage<SourceItem> {

    public ItemStage(StageContext context) {
        super(EntityType.ITEM, context);
    }

    @Override
    protected void prepare(MigrationResult result) throws MigrateException {
        indexExisting(context.destination().listAll(DestinationResource.ITEMS, Item.class));
    }

    @Override
    protected List<SourceItem> fetch() throws MigrateException {
        return context.source().fetchAll(SourceEndpoint.ITEMS);
    }

    @Override
    protected void migrate(SourceItem item, MigrationResult result) throws MigrateException {
        ItemRequest request = ItemMapper.map(item);
        createOrReuse(item, DestinationResource.ITEMS, request, request.name(), Item.class, result);
    }
}
