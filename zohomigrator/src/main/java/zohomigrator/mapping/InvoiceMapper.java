package zohomigrator.mapping;

import zohomigrator.model.destination.InvoiceLineRequest;
import zohomigrator.model.destination.InvoiceRequest;
import zohomigrator.model.source.SourceInvoice;
import zohomigrator.model.source.SourceInvoiceLine;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maps FreshBooks invoices to Zoho Books invoices.
 *
 * <p>Line rate comes from {@code unit_cost} (zero when missing), quantity
 * defaults to one. An invoice without lines is carried over as a single
 * "Invoice Total" line for its amount.
 */
public final class InvoiceMapper {

    public static final String TOTAL_LINE_NAME = "Invoice Total";

    private InvoiceMapper() {}

    /**
     * @param invoice the source invoice
     * @param customerId destination id of the invoice's customer
     * @return the request, or empty when the customer is unknown or the invoice has nothing to bill
     */
    public static Optional<InvoiceRequest> map(SourceInvoice invoice, String customerId) {
        if (customerId == null) return Optional.empty();

        List<InvoiceLineRequest> lines = new ArrayList<>();
        for (SourceInvoiceLine line : invoice.lines()) {
            BigDecimal rate = line.unitCost() != null ? line.unitCost().value().orElse(BigDecimal.ZERO) : BigDecimal.ZERO;
            BigDecimal quantity = Strings.decimal(line.quantity()).orElse(BigDecimal.ONE);
            String name = Strings.isBlank(line.name()) ? "Item" : line.name().trim();
            lines.add(new InvoiceLineRequest(name, line.description(), rate, quantity));
        }
        if (lines.isEmpty() && invoice.amount() != null) {
            invoice.amount().value().ifPresent(total ->
                    lines.add(new InvoiceLineRequest(TOTAL_LINE_NAME, invoice.description(), total, BigDecimal.ONE)));
        }
        if (lines.isEmpty()) return Optional.empty();

        return Optional.of(new InvoiceRequest(
                customerId,
                invoice.number(),
                Strings.trimToNull(invoice.poNumber()),
                invoice.createDate(),
                invoice.dueDate(),
                lines,
                invoice.notes(),
                invoice.terms(),
                false));
    }
}
