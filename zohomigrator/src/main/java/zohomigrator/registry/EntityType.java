package zohomigrator.registry;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Entity types in migration order.
 *
 * <p>Declaration order is the fixed pipeline order; every type's
 * dependencies are declared before it.
 */
public enum EntityType {
    ACCOUNT("categories", "account"),
    TAX("taxes", "tax"),
    ITEM("items", "item"),
    CUSTOMER("customers", "customer"),
    VENDOR("vendors", "vendor"),
    INVOICE("invoices", "invoice"),
    EXPENSE("expenses", "expense"),
    PAYMENT("payments", "payment");

    private final String stageName;
    private final String singular;

    EntityType(String stageName, String singular) {
        this.stageName = stageName;
        this.singular = singular;
    }

    /** Name of the stage migrating this type, as used on the command line. */
    public String stageName() {
        return stageName;
    }

    /** Singular lower-case noun, used in placeholders and messages. */
    public String singular() {
        return singular;
    }

    /** Types whose id mappings this type's stage reads. */
    public Set<EntityType> dependencies() {
        return switch (this) {
            case ACCOUNT, TAX, ITEM, CUSTOMER, VENDOR -> Collections.emptySet();
            case INVOICE -> EnumSet.of(CUSTOMER);
            case EXPENSE -> EnumSet.of(ACCOUNT, TAX, CUSTOMER, VENDOR);
            case PAYMENT -> EnumSet.of(CUSTOMER, INVOICE);
        };
    }

    /**
     * Looks up a type by stage name, case-insensitively.
     *
     * @param name stage name such as {@code invoices}
     * @return the type, or empty if unknown
     */
    public static Optional<EntityType> fromStageName(String name) {
        if (name == null) return Optional.empty();
        String n = name.trim().toLowerCase(Locale.ROOT);
        for (EntityType t : values()) {
            if (t.stageName.equals(n)) return Optional.of(t);
        }
        return Optional.empty();
    }
}
