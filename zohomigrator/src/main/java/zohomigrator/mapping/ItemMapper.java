package zohomigrator.mapping;

import zohomigrator.model.destination.ItemRequest;
import zohomigrator.model.source.SourceItem;

import java.math.BigDecimal;

public final class ItemMapper {

    private ItemMapper() {}

    public static ItemRequest map(SourceItem item) {
        BigDecimal rate = item.unitCost() != null ? item.unitCost().value().orElse(null) : null;
        return new ItemRequest(item.displayName(), rate, item.description(),
                Strings.trimToNull(item.sku()), "goods");
    }
}
