package zohomigrator.mapping;

import zohomigrator.mapping.BusinessLineClassifier.BusinessLine;
import zohomigrator.model.destination.ExpenseRequest;
import zohomigrator.model.destination.Tag;
import zohomigrator.model.source.SourceExpense;
import zohomigrator.registry.EntityType;
import zohomigrator.registry.Fingerprint;
import zohomigrator.registry.IdMappingRegistry;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps FreshBooks expenses to Zoho Books expenses.
 *
 * <p>The expense account is the migrated account of the expense's category,
 * else the registry's default expense account. The paid-through account is
 * looked up by the FreshBooks account name, the tax by its name in the tax
 * stage's index. A blank account name is normal for manually entered
 * expenses and is not reported as unmapped.
 */
public final class ExpenseMapper {

    /**
     * @param request payload for Zoho
     * @param businessLine line the expense was assigned to, null without tag settings
     * @param categoryName name of the destination account, for reporting
     * @param unmappedPaidThrough FreshBooks account name with no paid-through entry, or null
     */
    public record MappedExpense(ExpenseRequest request,
                                BusinessLine businessLine,
                                String categoryName,
                                String unmappedPaidThrough) {

        /** Identity of the expense in the destination, see {@link zohomigrator.model.destination.Expense}. */
        public String fingerprint() {
            return Fingerprint.of(request.date(), request.amount(), request.referenceNumber(), request.description());
        }
    }

    private final IdMappingRegistry registry;
    private final Map<String, String> paidThroughAccounts;
    private final BusinessLineClassifier classifier;
    private final Clock clock;

    /**
     * @param registry id mappings of the earlier stages
     * @param paidThroughAccounts lower-cased FreshBooks account names to Zoho account ids
     * @param classifier business-line classifier, may be null
     * @param clock source of today's date for undated expenses
     */
    public ExpenseMapper(IdMappingRegistry registry,
                         Map<String, String> paidThroughAccounts,
                         BusinessLineClassifier classifier,
                         Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.paidThroughAccounts = Map.copyOf(paidThroughAccounts);
        this.classifier = classifier;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @param expense the source expense
     * @param vendorId destination vendor id, may be null
     * @return the mapped expense, or empty when it has no account or no parsable amount
     */
    public Optional<MappedExpense> map(SourceExpense expense, String vendorId) {
        Optional<String> mappedAccount = registry.lookup(EntityType.ACCOUNT, expense.categoryId());
        String accountId;
        String categoryName;
        if (mappedAccount.isPresent()) {
            accountId = mappedAccount.get();
            categoryName = registry.accountName(accountId).orElse(null);
        } else if (registry.defaultExpenseAccount().isPresent()) {
            accountId = registry.defaultExpenseAccount().get();
            categoryName = registry.accountName(accountId).orElse("Uncategorized");
        } else {
            return Optional.empty();
        }

        Optional<BigDecimal> amount = expense.amount() != null ? expense.amount().value() : Optional.empty();
        if (amount.isEmpty()) return Optional.empty();

        String date = Strings.isBlank(expense.date()) ? LocalDate.now(clock).toString() : expense.date().trim();

        BusinessLine line = null;
        List<Tag> tags = null;
        if (classifier != null) {
            line = classifier.classify(expense.date(), expense.notes());
            List<Tag> t = classifier.tags(line);
            tags = t.isEmpty() ? null : t;
        }

        String paidThrough = null;
        String unmapped = null;
        String accountName = Strings.trimToNull(expense.accountName());
        if (accountName != null) {
            paidThrough = paidThroughAccounts.get(accountName.toLowerCase(Locale.ROOT));
            if (paidThrough == null) unmapped = accountName;
        }

        String taxId = null;
        if (expense.taxName1() != null) {
            taxId = registry.dedup(EntityType.TAX).find(expense.taxName1()).orElse(null);
        }

        ExpenseRequest request = new ExpenseRequest(
                accountId,
                paidThrough,
                vendorId,
                date,
                amount.get(),
                taxId,
                expense.billable(),
                registry.lookup(EntityType.CUSTOMER, expense.clientId()).orElse(null),
                Strings.trimToNull(expense.transactionId()),
                expense.notes(),
                tags);
        return Optional.of(new MappedExpense(request, line, categoryName, unmapped));
    }
}
