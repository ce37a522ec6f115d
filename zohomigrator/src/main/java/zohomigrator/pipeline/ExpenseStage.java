package zohomigrator.pipeline;

import zohomigrator.exceptions.MigrateException;
import zohomigrator.gateway.DestinationResource;
import zohomigrator.mapping.BusinessLineClassifier;
import zohomigrator.mapping.BusinessLineClassifier.BusinessLine;
import zohomigrator.mapping.ExpenseMapper;
import zohomigrator.mapping.ExpenseMapper.MappedExpense;
import zohomigrator.mapping.VendorMapper;
import zohomigrator.model.destination.Contact;
import zohomigrator.model.destination.ContactRequest;
import zohomigrator.model.destination.Expense;
import zohomigrator.model.source.SourceExpense;
import zohomigrator.registry.DedupIndex;
import zohomigrator.registry.EntityType;
import zohomigrator.registry.FingerprintPool;
import zohomigrator.result.MigrationResult;
import zohomigrator.source.SourceEndpoint;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Expenses, matched against the expenses already in Zoho Books by a date,
 * amount, reference and description fingerprint. Each existing expense
 * matches at most one FreshBooks expense.
 *
 * <p>An expense whose vendor is only known by name gets a vendor created
 * on the fly, or reuses the existing vendor of that name.
 */
public final class ExpenseStage extends AbstractStage<SourceExpense> {

    private final ExpenseMapper mapper;
    private final BusinessLineClassifier classifier;
    private final Map<BusinessLine, Integer> lineCounts = new EnumMap<>(BusinessLine.class);
    private final Set<String> unmappedPaidThrough = new TreeSet<>();
    private FingerprintPool existing = new FingerprintPool();

    public ExpenseStage(StageContext context) {
        super(EntityType.EXPENSE, context);
        this.classifier = context.config().businessTags().map(BusinessLineClassifier::new).orElse(null);
        this.mapper = new ExpenseMapper(registry, context.config().paidThroughAccounts(), classifier, context.clock());
    }

    @Override
    protected void prepare(MigrationResult result) throws MigrateException {
        lineCounts.clear();
        unmappedPaidThrough.clear();
        List<Expense> listed = context.destination().listAll(DestinationResource.EXPENSES, Expense.class);
        existing = FingerprintPool.of(listed);
        log.info("Found {} existing expense records in Zoho Books", listed.size());
    }

    @Override
    protected List<SourceExpense> fetch() throws MigrateException {
        return context.source().fetchAll(SourceEndpoint.EXPENSES);
    }

    @Override
    protected void migrate(SourceExpense expense, MigrationResult result) throws MigrateException {
        String vendorId = resolveVendor(expense, result);
        Optional<MappedExpense> mapped = mapper.map(expense, vendorId);
        if (mapped.isEmpty()) {
            log.info("  Skipping expense {}: no account mapping or amount", expense.id());
            result.recordSkipped();
            return;
        }
        MappedExpense m = mapped.get();
        if (m.businessLine() != null) {
            lineCounts.merge(m.businessLine(), 1, Integer::sum);
        }
        if (m.unmappedPaidThrough() != null) {
            unmappedPaidThrough.add(m.unmappedPaidThrough());
        }

        Optional<String> match = existing.claim(m.fingerprint());
        if (match.isPresent()) {
            registry.register(EntityType.EXPENSE, expense.id(), match.get());
            result.recordExisting();
            if (context.options().verbose()) {
                log.info("  [EXISTS] {}", expense.label());
            }
            return;
        }

        String id = context.destination().create(DestinationResource.EXPENSES, m.request(),
                String.valueOf(expense.id()));
        registry.register(EntityType.EXPENSE, expense.id(), id);
        result.recordCreated();
        if (context.options().verbose()) {
            log.info("  [CREATED] {} ({})", expense.label(), m.categoryName() != null ? m.categoryName() : "Unknown");
        }
    }

    private String resolveVendor(SourceExpense expense, MigrationResult result) throws MigrateException {
        Optional<String> mapped = registry.lookup(EntityType.VENDOR, expense.vendorId());
        if (mapped.isPresent()) return mapped.get();

        Optional<ContactRequest> request = VendorMapper.fromExpense(expense);
        if (request.isEmpty()) return null;

        String name = request.get().contactName();
        DedupIndex vendors = registry.dedup(EntityType.VENDOR);
        Optional<String> byName = vendors.find(name);
        if (byName.isPresent()) return byName.get();

        try {
            Reconciler.Outcome outcome = reconciler.createOrMatch(DestinationResource.VENDORS, request.get(), name,
                    "from-expense-" + expense.id(), Contact.class);
            vendors.add(name, outcome.id());
            if (!outcome.existing()) {
                result.recordSynthesized();
                log.info("  [CREATED] vendor '{}' from expense {}", name, expense.id());
            }
            return outcome.id();
        } catch (MigrateException e) {
            if (e.isFatal()) throw e;
            log.warn("Could not create vendor '{}' from expense {}: {}", name, expense.id(), e.getMessage());
            return null;
        }
    }

    @Override
    protected void complete(MigrationResult result) {
        if (classifier != null && !lineCounts.isEmpty()) {
            lineCounts.forEach((line, count) -> log.info("  {}: {} expenses", classifier.tagName(line), count));
        }
        if (!unmappedPaidThrough.isEmpty()) {
            log.warn("No paid-through account configured for: {}", unmappedPaidThrough);
        }
    }
}
