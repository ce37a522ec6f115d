package zohomigrator.mapping;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Chooses the Zoho account a payment is deposited to.
 *
 * <p>Lookup order: the payment gateway, then the payment type, then the
 * {@code default} entry. Keys are matched case-insensitively.
 */
public final class DepositAccountTable {

    public static final String DEFAULT_KEY = "default";

    /**
     * Outcome of a lookup.
     *
     * @param accountId chosen account, null when nothing matched, not even the default
     * @param mapped true if the gateway or type matched an explicit entry
     * @param unmappedKey the gateway or type that had no entry, for reporting
     */
    public record Resolution(String accountId, boolean mapped, String unmappedKey) {
        public Optional<String> account() {
            return Optional.ofNullable(accountId);
        }
    }

    private final Map<String, String> accounts;

    /**
     * @param accounts lower-cased gateway, type or {@code default} keys to account ids
     */
    public DepositAccountTable(Map<String, String> accounts) {
        this.accounts = Map.copyOf(accounts);
    }

    public Resolution resolve(String gateway, String type) {
        String unmapped = null;
        if (gateway != null) {
            String id = accounts.get(gateway.trim().toLowerCase(Locale.ROOT));
            if (id != null) return new Resolution(id, true, null);
            unmapped = gateway;
        }
        if (type != null) {
            String id = accounts.get(type.trim().toLowerCase(Locale.ROOT));
            if (id != null) return new Resolution(id, true, null);
            if (unmapped == null) unmapped = type;
        }
        return new Resolution(accounts.get(DEFAULT_KEY), false, unmapped);
    }
}
