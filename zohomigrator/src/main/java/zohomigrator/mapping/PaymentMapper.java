package zohomigrator.mapping;

import zohomigrator.model.destination.PaymentInvoice;
import zohomigrator.model.destination.PaymentRequest;
import zohomigrator.model.source.SourcePayment;
import zohomigrator.registry.Fingerprint;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps FreshBooks payments to Zoho Books customer payments.
 *
 * <p>The whole amount is applied to the paid invoice when that invoice was
 * migrated. The reference number is the gateway transaction id, else the
 * order id.
 */
public final class PaymentMapper {

    /**
     * @param request payload for Zoho
     * @param deposit outcome of the deposit account lookup
     */
    public record MappedPayment(PaymentRequest request, DepositAccountTable.Resolution deposit) {

        /** Identity of the payment in the destination, see {@link zohomigrator.model.destination.Payment}. */
        public String fingerprint() {
            return Fingerprint.of(request.customerId(), request.date(), request.amount(), request.referenceNumber());
        }
    }

    private final DepositAccountTable depositAccounts;
    private final Clock clock;

    public PaymentMapper(DepositAccountTable depositAccounts, Clock clock) {
        this.depositAccounts = Objects.requireNonNull(depositAccounts, "depositAccounts");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @param payment the source payment
     * @param customerId destination customer id, may be null
     * @param invoiceId destination invoice id, may be null
     * @return the mapped payment, or empty without a customer or a positive amount
     */
    public Optional<MappedPayment> map(SourcePayment payment, String customerId, String invoiceId) {
        if (customerId == null) return Optional.empty();
        Optional<BigDecimal> amount = payment.amount() != null ? payment.amount().value() : Optional.empty();
        if (amount.isEmpty() || amount.get().signum() <= 0) return Optional.empty();

        String date = Strings.isBlank(payment.date()) ? LocalDate.now(clock).toString() : payment.date().trim();
        List<PaymentInvoice> invoices = invoiceId != null
                ? List.of(new PaymentInvoice(invoiceId, amount.get()))
                : null;
        String reference = Strings.trimToNull(payment.transactionId());
        if (reference == null) reference = Strings.trimToNull(payment.orderId());

        DepositAccountTable.Resolution deposit = depositAccounts.resolve(payment.gateway(), payment.type());
        PaymentRequest request = new PaymentRequest(
                customerId,
                PaymentModeTable.resolve(payment.gateway(), payment.type()),
                amount.get(),
                date,
                reference,
                payment.note(),
                deposit.accountId(),
                invoices);
        return Optional.of(new MappedPayment(request, deposit));
    }
}
