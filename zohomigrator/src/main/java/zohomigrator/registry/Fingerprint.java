package zohomigrator.registry;

import java.math.BigDecimal;
import java.util.StringJoiner;

/**
 * Composite natural key for records that have no name, such as expenses and
 * payments. Amounts are normalized so {@code 10}, {@code 10.0} and
 * {@code 10.00} produce the same fingerprint.
 */
public final class Fingerprint {

    private Fingerprint() {}

    public static String of(Object... parts) {
        StringJoiner joiner = new StringJoiner("|");
        for (Object part : parts) {
            joiner.add(normalize(part));
        }
        return joiner.toString();
    }

    private static String normalize(Object part) {
        if (part == null) return "";
        if (part instanceof BigDecimal d) {
            return d.signum() == 0 ? "0" : d.stripTrailingZeros().toPlainString();
        }
        return part.toString().trim();
    }
}
