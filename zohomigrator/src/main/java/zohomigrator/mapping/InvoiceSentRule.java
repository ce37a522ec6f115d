package zohomigrator.mapping;

import zohomigrator.model.source.SourceInvoice;

import java.util.Locale;

/**
 * Decides whether a FreshBooks invoice had left draft state.
 *
 * <p>The string {@code v3_status} wins when present; {@code draft} is the
 * only unsent value. Without it, the numeric {@code status} is used:
 * {@code 1} is draft, {@code 2} to {@code 8} (sent, viewed, paid, partial,
 * disputed and the like) count as sent. Anything else counts as draft.
 */
public final class InvoiceSentRule {

    private InvoiceSentRule() {}

    public static boolean isSent(SourceInvoice invoice) {
        return isSent(invoice.v3Status(), invoice.status());
    }

    public static boolean isSent(String v3Status, Integer status) {
        if (v3Status != null && !v3Status.isBlank()) {
            return !"draft".equals(v3Status.trim().toLowerCase(Locale.ROOT));
        }
        return status != null && status >= 2 && status <= 8;
    }
}
