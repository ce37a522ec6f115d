package zohomigrator.mapping;

import zohomigrator.model.destination.TaxRequest;
import zohomigrator.model.source.SourceTax;

import java.math.BigDecimal;
import java.util.Optional;

public final class TaxMapper {

    private TaxMapper() {}

    /** Returns empty for taxes without a name; the percentage defaults to zero. */
    public static Optional<TaxRequest> map(SourceTax tax) {
        String name = Strings.trimToNull(tax.name());
        if (name == null) return Optional.empty();
        BigDecimal percentage = Strings.decimal(tax.amount()).orElse(BigDecimal.ZERO);
        return Optional.of(new TaxRequest(name, percentage, "tax"));
    }
}
