package zohomigrator.mapping;

import zohomigrator.model.destination.AccountRequest;
import zohomigrator.model.source.SourceCategory;

import java.util.Locale;

/**
 * Maps expense categories to Zoho Books chart-of-accounts entries.
 */
public final class AccountMapper {

    static final String DESCRIPTION = "Imported from FreshBooks category";

    private AccountMapper() {}

    public static AccountRequest map(SourceCategory category) {
        String type = category.isCogs() ? AccountRequest.TYPE_COST_OF_GOODS_SOLD : AccountRequest.TYPE_EXPENSE;
        return new AccountRequest(category.name(), type, DESCRIPTION, null);
    }

    /**
     * Account from the configured hierarchy, optionally under a parent.
     * Names mentioning "cost of" become cost-of-goods-sold accounts.
     */
    public static AccountRequest hierarchical(String name, String parentAccountId) {
        String type = name.toLowerCase(Locale.ROOT).contains("cost of")
                ? AccountRequest.TYPE_COST_OF_GOODS_SOLD
                : AccountRequest.TYPE_EXPENSE;
        return new AccountRequest(name, type, null, parentAccountId);
    }
}
