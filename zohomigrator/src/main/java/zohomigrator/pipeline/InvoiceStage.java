package zohomigrator.pipeline;

import zohomigrator.exceptions.MigrateException;
import zohomigrator.gateway.DestinationResource;
import zohomigrator.mapping.CustomerMapper;
import zohomigrator.mapping.InvoiceMapper;
import zohomigrator.mapping.InvoiceSentRule;
import zohomigrator.model.destination.Contact;
import zohomigrator.model.destination.ContactRequest;
import zohomigrator.model.destination.Invoice;
import zohomigrator.model.destination.InvoiceRequest;
import zohomigrator.model.source.SourceInvoice;
import zohomigrator.registry.DedupIndex;
import zohomigrator.registry.EntityType;
import zohomigrator.result.MigrationResult;
import zohomigrator.source.SourceEndpoint;

import java.util.List;
import java.util.Optional;

/**
 * Invoices, matched by invoice number.
 *
 * <p>An invoice whose client was never migrated gets a customer rebuilt
 * from the client snapshot it embeds, reusing an existing customer of the
 * same name. Invoices that had been sent in FreshBooks are marked sent.
 */
public final class InvoiceStage extends AbstractStage<SourceInvoice> {

    public InvoiceStage(StageContext context) {
        super(EntityType.INVOICE, context);
    }

    @Override
    protected void prepare(MigrationResult result) throws MigrateException {
        indexExisting(context.destination().listAll(DestinationResource.INVOICES, Invoice.class));
    }

    @Override
    protected List<SourceInvoice> fetch() throws MigrateException {
        return context.source().fetchAll(SourceEndpoint.INVOICES);
    }

    @Override
    protected void migrate(SourceInvoice invoice, MigrationResult result) throws MigrateException {
        String number = invoice.number();
        Optional<String> existing = index().find(number);
        if (existing.isPresent()) {
            registry.register(EntityType.INVOICE, invoice.id(), existing.get());
            result.recordExisting();
            if (context.options().verbose()) {
                log.info("  [EXISTS] invoice {}", number);
            }
            return;
        }

        String customerId = resolveCustomer(invoice, result);
        Optional<InvoiceRequest> request = InvoiceMapper.map(invoice, customerId);
        if (request.isEmpty()) {
            log.info("  Skipping invoice {}: {}", number, customerId == null ? "no customer" : "no line items");
            result.recordSkipped();
            return;
        }

        Reconciler.Outcome outcome = reconciler.createOrMatch(DestinationResource.INVOICES, request.get(), number,
                String.valueOf(invoice.id()), Invoice.class);
        registry.register(EntityType.INVOICE, invoice.id(), outcome.id());
        index().add(number, outcome.id());
        if (outcome.existing()) {
            result.recordExisting();
            return;
        }
        result.recordCreated();
        if (context.options().verbose()) {
            log.info("  [CREATED] invoice {}", number);
        }
        if (InvoiceSentRule.isSent(invoice)) {
            markSent(outcome.id(), number);
        }
    }

    private String resolveCustomer(SourceInvoice invoice, MigrationResult result) throws MigrateException {
        Integer sourceCustomer = invoice.customerId();
        if (sourceCustomer == null) return null;
        Optional<String> mapped = registry.lookup(EntityType.CUSTOMER, sourceCustomer);
        if (mapped.isPresent()) return mapped.get();

        Optional<ContactRequest> snapshot = CustomerMapper.fromInvoice(invoice);
        if (snapshot.isEmpty()) {
            log.info("  Customer {} of invoice {} was not migrated and the invoice carries no client details",
                    sourceCustomer, invoice.number());
            return null;
        }
        ContactRequest request = snapshot.get();
        DedupIndex customers = registry.dedup(EntityType.CUSTOMER);
        Optional<String> byName = customers.find(request.contactName());
        if (byName.isPresent()) {
            registry.register(EntityType.CUSTOMER, sourceCustomer, byName.get());
            log.info("  [EXISTS] customer '{}' for invoice {}", request.contactName(), invoice.number());
            return byName.get();
        }

        try {
            Reconciler.Outcome outcome = reconciler.createOrMatch(DestinationResource.CUSTOMERS, request,
                    request.contactName(), "from-invoice-" + sourceCustomer, Contact.class);
            registry.register(EntityType.CUSTOMER, sourceCustomer, outcome.id());
            customers.add(request.contactName(), outcome.id());
            if (!outcome.existing()) {
                result.recordSynthesized();
                log.info("  [CREATED] customer '{}' from invoice {}", request.contactName(), invoice.number());
            }
            return outcome.id();
        } catch (MigrateException e) {
            if (e.isFatal()) throw e;
            log.warn("Could not create customer from invoice {}: {}", invoice.number(), e.getMessage());
            return null;
        }
    }

    private void markSent(String invoiceId, String number) throws MigrateException {
        try {
            context.destination().markInvoiceSent(invoiceId);
        } catch (MigrateException e) {
            if (e.isFatal()) throw e;
            log.warn("Invoice {} created but not marked as sent: {}", number, e.getMessage());
        }
    }
}
