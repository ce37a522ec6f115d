package zohomigrator.source;

import zohomigrator.model.source.SourceCategory;
import zohomigrator.model.source.SourceCustomer;
import zohomigrator.model.source.SourceExpense;
import zohomigrator.model.source.SourceInvoice;
import zohomigrator.model.source.SourceItem;
import zohomigrator.model.source.SourcePayment;
import zohomigrator.model.source.SourceTax;
import zohomigrator.model.source.SourceVendor;

/**
 * A FreshBooks accounting collection: its path below
 * {@code /accounting/account/<accountId>/}, the key of the record array in
 * the result envelope, and the record type.
 *
 * @param <T> record type
 */
public final class SourceEndpoint<T> {

    public static final SourceEndpoint<SourceCustomer> CLIENTS =
            new SourceEndpoint<>("users/clients", "clients", SourceCustomer.class);
    public static final SourceEndpoint<SourceVendor> VENDORS =
            new SourceEndpoint<>("bill_vendors/bill_vendors", "bill_vendors", SourceVendor.class);
    public static final SourceEndpoint<SourceInvoice> INVOICES =
            new SourceEndpoint<>("invoices/invoices", "invoices", SourceInvoice.class);
    public static final SourceEndpoint<SourceExpense> EXPENSES =
            new SourceEndpoint<>("expenses/expenses", "expenses", SourceExpense.class);
    public static final SourceEndpoint<SourceCategory> CATEGORIES =
            new SourceEndpoint<>("expenses/categories", "categories", SourceCategory.class);
    public static final SourceEndpoint<SourceItem> ITEMS =
            new SourceEndpoint<>("items/items", "items", SourceItem.class);
    public static final SourceEndpoint<SourceTax> TAXES =
            new SourceEndpoint<>("taxes/taxes", "taxes", SourceTax.class);
    public static final SourceEndpoint<SourcePayment> PAYMENTS =
            new SourceEndpoint<>("payments/payments", "payments", SourcePayment.class);

    private final String path;
    private final String pluralKey;
    private final Class<T> type;

    public SourceEndpoint(String path, String pluralKey, Class<T> type) {
        this.path = path;
        this.pluralKey = pluralKey;
        this.type = type;
    }

    public String path() { return path; }

    public String pluralKey() { return pluralKey; }

    public Class<T> type() { return type; }

    @Override
    public String toString() {
        return path;
    }
}
