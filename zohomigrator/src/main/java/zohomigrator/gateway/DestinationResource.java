package zohomigrator.gateway;

import zohomigrator.registry.EntityType;

import java.util.Map;

/**
 * Zoho Books collections the migration reads and writes.
 *
 * <p>Each resource knows its path, the JSON key of a single record in create
 * responses, the JSON key of the record array in list responses, the id
 * field, and any fixed query parameters for listing and creating.
 */
public enum DestinationResource {
    ACCOUNTS(EntityType.ACCOUNT, "/chartofaccounts", "chart_of_account", "chart_of_accounts", "account_id",
            Map.of(), Map.of()),
    TAXES(EntityType.TAX, "/settings/taxes", "tax", "taxes", "tax_id",
            Map.of(), Map.of()),
    ITEMS(EntityType.ITEM, "/items", "item", "items", "item_id",
            Map.of(), Map.of()),
    CUSTOMERS(EntityType.CUSTOMER, "/contacts", "contact", "contacts", "contact_id",
            Map.of("contact_type", "customer"), Map.of()),
    VENDORS(EntityType.VENDOR, "/contacts", "contact", "contacts", "contact_id",
            Map.of("contact_type", "vendor"), Map.of()),
    // keep FreshBooks numbering so invoice numbers stay a usable natural key
    INVOICES(EntityType.INVOICE, "/invoices", "invoice", "invoices", "invoice_id",
            Map.of(), Map.of("ignore_auto_number_generation", "true")),
    EXPENSES(EntityType.EXPENSE, "/expenses", "expense", "expenses", "expense_id",
            Map.of(), Map.of()),
    PAYMENTS(EntityType.PAYMENT, "/customerpayments", "payment", "customerpayments", "payment_id",
            Map.of(), Map.of());

    private final EntityType entityType;
    private final String path;
    private final String singularKey;
    private final String listKey;
    private final String idField;
    private final Map<String, String> listParams;
    private final Map<String, String> createParams;

    DestinationResource(EntityType entityType, String path, String singularKey, String listKey, String idField,
                        Map<String, String> listParams, Map<String, String> createParams) {
        this.entityType = entityType;
        this.path = path;
        this.singularKey = singularKey;
        this.listKey = listKey;
        this.idField = idField;
        this.listParams = listParams;
        this.createParams = createParams;
    }

    public EntityType entityType() { return entityType; }

    public String path() { return path; }

    public String singularKey() { return singularKey; }

    public String listKey() { return listKey; }

    public String idField() { return idField; }

    public Map<String, String> listParams() { return listParams; }

    public Map<String, String> createParams() { return createParams; }
}
