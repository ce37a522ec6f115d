package zohomigrator.pipeline;

import zohomigrator.exceptions.MigrateException;
import zohomigrator.gateway.DestinationResource;
import zohomigrator.mapping.AccountMapper;
import zohomigrator.model.destination.Account;
import zohomigrator.model.destination.AccountRequest;
import zohomigrator.model.source.SourceCategory;
import zohomigrator.registry.EntityType;
import zohomigrator.result.MigrationResult;
import zohomigrator.source.SourceEndpoint;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One Zoho account per FreshBooks expense category.
 *
 * <p>FreshBooks may hold the same category twice under one parent; such
 * duplicates are merged onto the first one's account.
 */
public final class FlatCategoryStage extends AbstractStage<SourceCategory> {

    private final Map<String, Integer> canonicalByKey = new HashMap<>();

    public FlatCategoryStage(StageContext context) {
        super(EntityType.ACCOUNT, context);
    }

    @Override
    protected void prepare(MigrationResult result) throws MigrateException {
        List<Account> accounts = context.destination().listAll(DestinationResource.ACCOUNTS, Account.class);
        indexExisting(accounts);
        for (Account a : accounts) {
            registry.nameAccount(a.accountId(), a.accountName());
        }
        accounts.stream().filter(Account::isExpense).findFirst()
                .ifPresent(a -> registry.offerDefaultExpenseAccount(a.accountId()));
    }

    @Override
    protected List<SourceCategory> fetch() throws MigrateException {
        canonicalByKey.clear();
        return context.source().fetchAll(SourceEndpoint.CATEGORIES);
    }

    @Override
    protected boolean skipsArchived() {
        return false;
    }

    @Override
    protected void migrate(SourceCategory category, MigrationResult result) throws MigrateException {
        Integer canonical = canonicalByKey.putIfAbsent(category.deduplicationKey(), category.id());
        if (canonical != null) {
            Optional<String> accountId = registry.lookup(EntityType.ACCOUNT, canonical);
            if (accountId.isPresent()) {
                registry.register(EntityType.ACCOUNT, category.id(), accountId.get());
                result.recordExisting();
                log.info("  [DUPLICATE] '{}' ids {} and {}, merged", category.name(), canonical, category.id());
            } else {
                result.recordSkipped();
                log.warn("  [DUPLICATE] '{}' id {}: category {} was not migrated", category.name(), category.id(), canonical);
            }
            return;
        }

        AccountRequest request = AccountMapper.map(category);
        String id = createOrReuse(category, DestinationResource.ACCOUNTS, request, request.accountName(),
                Account.class, result);
        registry.nameAccount(id, request.accountName());
        registry.offerDefaultExpenseAccount(id);
    }
}
