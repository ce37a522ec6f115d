package zohomigrator.pipeline;

import zohomigrator.exceptions.MigrateException;
import zohomigrator.gateway.DestinationResource;
import zohomigrator.mapping.DepositAccountTable;
import zohomigrator.mapping.PaymentMapper;
import zohomigrator.mapping.PaymentMapper.MappedPayment;
import zohomigrator.model.destination.Payment;
import zohomigrator.model.source.SourcePayment;
import zohomigrator.registry.EntityType;
import zohomigrator.registry.FingerprintPool;
import zohomigrator.result.MigrationResult;
import zohomigrator.source.SourceEndpoint;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Customer payments, matched against the payments already in Zoho Books by
 * a customer, date, amount and reference fingerprint. Each existing payment
 * matches at most one FreshBooks payment. Payments without a migrated customer or a positive amount
 * are skipped.
 */
public final class PaymentStage extends AbstractStage<SourcePayment> {

    private final PaymentMapper mapper;
    private final Set<String> unmappedDepositKeys = new TreeSet<>();
    private FingerprintPool existing = new FingerprintPool();

    public PaymentStage(StageContext context) {
        super(EntityType.PAYMENT, context);
        this.mapper = new PaymentMapper(new DepositAccountTable(context.config().depositAccounts()), context.clock());
    }

    @Override
    protected void prepare(MigrationResult result) throws MigrateException {
        unmappedDepositKeys.clear();
        List<Payment> listed = context.destination().listAll(DestinationResource.PAYMENTS, Payment.class);
        existing = FingerprintPool.of(listed);
        log.info("Found {} existing payment records in Zoho Books", listed.size());
    }

    @Override
    protected List<SourcePayment> fetch() throws MigrateException {
        return context.source().fetchAll(SourceEndpoint.PAYMENTS);
    }

    @Override
    protected void migrate(SourcePayment payment, MigrationResult result) throws MigrateException {
        String customerId = registry.lookup(EntityType.CUSTOMER, payment.clientId()).orElse(null);
        String invoiceId = registry.lookup(EntityType.INVOICE, payment.invoiceId()).orElse(null);
        Optional<MappedPayment> mapped = mapper.map(payment, customerId, invoiceId);
        if (mapped.isEmpty()) {
            log.info("  Skipping payment {}: {}", payment.id(), customerId == null ? "no customer" : "no positive amount");
            result.recordSkipped();
            return;
        }
        MappedPayment m = mapped.get();
        if (m.deposit().unmappedKey() != null) {
            unmappedDepositKeys.add(m.deposit().unmappedKey());
        }

        Optional<String> match = existing.claim(m.fingerprint());
        if (match.isPresent()) {
            registry.register(EntityType.PAYMENT, payment.id(), match.get());
            result.recordExisting();
            return;
        }

        String id = context.destination().create(DestinationResource.PAYMENTS, m.request(),
                String.valueOf(payment.id()));
        registry.register(EntityType.PAYMENT, payment.id(), id);
        result.recordCreated();
    }

    @Override
    protected void complete(MigrationResult result) {
        if (!unmappedDepositKeys.isEmpty()) {
            log.warn("No deposit account configured for: {}", unmappedDepositKeys);
        }
    }
}
