package zohomigrator.mapping;

import java.util.Locale;
import java.util.Map;

/**
 * Translates FreshBooks payment gateways and payment types into Zoho Books
 * payment modes. Unknown values fall back to {@value #FALLBACK}.
 */
public final class PaymentModeTable {

    public static final String FALLBACK = "cash";

    private static final Map<String, String> BY_GATEWAY = Map.of(
            "stripe", "credit_card",
            "square", "credit_card",
            "2checkout", "credit_card",
            "paypal", "paypal",
            "wepay", "bank_transfer");

    private static final Map<String, String> BY_TYPE = Map.of(
            "credit", "credit_card",
            "check", "check",
            "cheque", "check",
            "cash", "cash",
            "bank transfer", "bank_transfer",
            "ach", "bank_transfer");

    private PaymentModeTable() {}

    public static String forGateway(String gateway) {
        return lookup(BY_GATEWAY, gateway);
    }

    public static String forType(String type) {
        return lookup(BY_TYPE, type);
    }

    /**
     * Picks the payment mode for a payment: the gateway decides when present,
     * otherwise the type.
     *
     * @return the payment mode, or null when the payment has neither
     */
    public static String resolve(String gateway, String type) {
        if (gateway != null) return forGateway(gateway);
        if (type != null) return forType(type);
        return null;
    }

    private static String lookup(Map<String, String> table, String key) {
        if (key == null) return FALLBACK;
        return table.getOrDefault(key.trim().toLowerCase(Locale.ROOT), FALLBACK);
    }
}
