package zohomigrator.pipeline;

import zohomigrator.exceptions.MigrateException;
import zohomigrator.gateway.DestinationResource;
import zohomigrator.mapping.AccountMapper;
import zohomigrator.mapping.CategoryHierarchy;
import zohomigrator.model.destination.Account;
import zohomigrator.model.destination.AccountRequest;
import zohomigrator.model.destination.AccountUpdateRequest;
import zohomigrator.model.source.SourceCategory;
import zohomigrator.registry.EntityType;
import zohomigrator.result.MigrationResult;
import zohomigrator.source.SourceEndpoint;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the configured two-level chart of accounts, then maps every
 * FreshBooks category onto it.
 *
 * <p>Parents are created before children. A child that already exists under
 * the wrong parent is re-parented. The result counts configured accounts;
 * FreshBooks categories are only mapped, falling back to the hierarchy's
 * default category.
 */
public final class HierarchicalCategoryStage extends AbstractStage<SourceCategory> {

    private final CategoryHierarchy hierarchy;
    private final Map<String, Account> existingByName = new HashMap<>();
    private int fallbackCount;

    public HierarchicalCategoryStage(StageContext context) {
        super(EntityType.ACCOUNT, context);
        this.hierarchy = new CategoryHierarchy(context.config().categoryHierarchy(),
                context.config().categoryNameMapping());
    }

    @Override
    protected void prepare(MigrationResult result) throws MigrateException {
        if (hierarchy.isEmpty()) {
            throw new MigrateException("Hierarchical categories requested but migration.categories.hierarchy is empty");
        }
        List<Account> accounts = context.destination().listAll(DestinationResource.ACCOUNTS, Account.class);
        indexExisting(accounts);
        for (Account a : accounts) {
            registry.nameAccount(a.accountId(), a.accountName());
            if (a.accountName() != null) {
                existingByName.putIfAbsent(a.accountName().trim().toLowerCase(Locale.ROOT), a);
            }
        }
        accounts.stream().filter(Account::isExpense).findFirst()
                .ifPresent(a -> registry.offerDefaultExpenseAccount(a.accountId()));

        for (String parent : hierarchy.parents()) {
            attempt(parent, result, () -> ensureAccount(parent, null, result));
        }
        for (String parent : hierarchy.parents()) {
            Optional<String> parentId = index().find(parent);
            if (parentId.isEmpty()) {
                log.warn("Parent account '{}' is missing; its children are created at top level", parent);
            }
            for (String child : hierarchy.children(parent)) {
                attempt(child + " (parent: " + parent + ")", result,
                        () -> ensureAccount(child, parentId.orElse(null), result));
            }
        }
    }

    private void ensureAccount(String name, String parentId, MigrationResult result) throws MigrateException {
        Optional<String> found = index().find(name);
        if (found.isPresent()) {
            registry.nameAccount(found.get(), name);
            Account existing = existingByName.get(name.trim().toLowerCase(Locale.ROOT));
            if (parentId != null && existing != null && !parentId.equals(existing.parentAccountId())) {
                reparent(existing, parentId);
            }
            result.recordExisting();
            return;
        }

        AccountRequest request = AccountMapper.hierarchical(name, parentId);
        Reconciler.Outcome outcome = reconciler.createOrMatch(DestinationResource.ACCOUNTS, request, name,
                name.replace(' ', '-'), Account.class);
        index().add(name, outcome.id());
        registry.nameAccount(outcome.id(), name);
        registry.offerDefaultExpenseAccount(outcome.id());
        if (outcome.existing()) {
            result.recordExisting();
        } else {
            result.recordCreated();
        }
        if (context.options().verbose()) {
            log.info("  [{}] {}", outcome.existing() ? "EXISTS" : "CREATED", name);
        }
    }

    private void reparent(Account account, String parentId) throws MigrateException {
        try {
            context.destination().update(DestinationResource.ACCOUNTS, account.accountId(),
                    new AccountUpdateRequest(account.accountName(), account.accountType(), parentId));
            log.info("  [UPDATED] {}: parent set to {}", account.accountName(), parentId);
        } catch (MigrateException e) {
            if (e.isFatal()) throw e;
            log.warn("Could not re-parent account '{}': {}", account.accountName(), e.getMessage());
        }
    }

    @Override
    protected List<SourceCategory> fetch() throws MigrateException {
        fallbackCount = 0;
        return context.source().fetchAll(SourceEndpoint.CATEGORIES);
    }

    @Override
    protected boolean skipsArchived() {
        return false;
    }

    @Override
    protected void migrate(SourceCategory category, MigrationResult result) {
        String translated = hierarchy.translate(category.name());
        String target = hierarchy.resolve(category.name());
        if (!target.equalsIgnoreCase(translated)) {
            fallbackCount++;
            log.debug("Category '{}' has no account in the hierarchy, using '{}'", category.name(), target);
        }
        Optional<String> accountId = index().find(target);
        if (accountId.isPresent()) {
            registry.register(EntityType.ACCOUNT, category.id(), accountId.get());
        } else {
            log.warn("Account '{}' for category '{}' was not migrated", target, category.name());
        }
    }

    @Override
    protected void complete(MigrationResult result) {
        if (fallbackCount > 0) {
            log.info("{} FreshBooks categories mapped to '{}'", fallbackCount, hierarchy.defaultCategory());
        }
    }
}
