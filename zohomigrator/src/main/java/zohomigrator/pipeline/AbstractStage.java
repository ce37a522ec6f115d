package zohomigrator.pipeline;

import zohomigrator.alert.MigrationEventLogger;
import zohomigrator.exceptions.MappingConflictException;
import zohomigrator.exceptions.MigrateException;
import zohomigrator.gateway.DestinationResource;
import zohomigrator.model.destination.DestinationEntity;
import zohomigrator.model.destination.DestinationRequest;
import zohomigrator.model.source.SourceRecord;
import zohomigrator.registry.DedupIndex;
import zohomigrator.registry.EntityType;
import zohomigrator.registry.IdMappingRegistry;
import zohomigrator.result.MigrationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Template for a stage that walks FreshBooks records one by one.
 *
 * <p>The run is:
 * <ol>
 *   <li>{@link #prepare}: index the records already in Zoho</li>
 *   <li>{@link #fetch}: read every source record</li>
 *   <li>skip archived records when {@link #skipsArchived()} is true</li>
 *   <li>{@link #migrate} each remaining record in isolation</li>
 *   <li>{@link #complete}: stage-level reporting</li>
 * </ol>
 *
 * <p>A non-fatal {@link MigrateException} or any runtime exception from one
 * record is counted as a failure of that record and the loop goes on. A
 * fatal exception ends the stage.
 *
 * @param <S> source record type
 */
public abstract class AbstractStage<S extends SourceRecord> implements MigrationStage {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final StageContext context;
    protected final IdMappingRegistry registry;
    protected final Reconciler reconciler;
    private final EntityType type;

    protected AbstractStage(EntityType type, StageContext context) {
        this.type = type;
        this.context = context;
        this.registry = context.registry();
        this.reconciler = new Reconciler(context.destination());
    }

    @Override
    public final EntityType type() {
        return type;
    }

    @Override
    public final void run(MigrationResult result) throws MigrateException {
        prepare(result);
        List<S> records = fetch();
        log.info("Migrating {} {} records", records.size(), type.singular());

        for (S record : records) {
            if (skipsArchived() && record.isArchived()) {
                if (context.options().verbose()) {
                    log.info("  [SKIP] archived {}", record.label());
                }
                result.recordSkipped();
                continue;
            }
            attempt(record.label(), result, () -> migrate(record, result));
        }
        complete(result);
    }

    /** Lists existing destination records into the dedup index. */
    protected abstract void prepare(MigrationResult result) throws MigrateException;

    protected abstract List<S> fetch() throws MigrateException;

    /**
     * Migrates one record. Implementations count the outcome in
     * {@code result} unless they throw.
     */
    protected abstract void migrate(S record, MigrationResult result) throws MigrateException;

    /** Whether archived records are skipped. */
    protected boolean skipsArchived() {
        return true;
    }

    protected void complete(MigrationResult result) throws MigrateException {
    }

    @FunctionalInterface
    protected interface RecordAction {
        void run() throws MigrateException;
    }

    /**
     * Runs one unit of work, recording a non-fatal failure against {@code label}.
     *
     * @throws MigrateException only when the failure is fatal
     */
    protected final void attempt(String label, MigrationResult result, RecordAction action) throws MigrateException {
        try {
            action.run();
        } catch (MigrateException e) {
            if (e.isFatal()) {
                throw e;
            }
            fail(label, e.getMessage(), result);
        } catch (MappingConflictException e) {
            log.error("Mapping conflict while migrating {}", label, e);
            fail(label, e.getMessage(), result);
        } catch (RuntimeException e) {
            log.error("Unexpected error while migrating {}", label, e);
            fail(label, e.toString(), result);
        }
    }

    private void fail(String label, String message, MigrationResult result) {
        result.recordFailure(label, message);
        MigrationEventLogger.recordFailed(type.stageName(), label, message);
        if (context.options().verbose()) {
            log.info("  [FAILED] {}: {}", label, message);
        }
    }

    protected final DedupIndex index() {
        return registry.dedup(type);
    }

    protected final void indexExisting(List<? extends DestinationEntity> existing) {
        index().addAll(existing);
        log.info("Found {} existing {} records in Zoho Books", existing.size(), type.singular());
    }

    /**
     * Maps a source record to the destination record with the same natural
     * key, creating it when there is none, and counts the outcome.
     *
     * @return the destination id
     */
    protected final <E extends DestinationEntity> String createOrReuse(S record,
                                                                       DestinationResource resource,
                                                                       DestinationRequest request,
                                                                       String naturalKey,
                                                                       Class<E> entityClass,
                                                                       MigrationResult result) throws MigrateException {
        Optional<String> found = index().find(naturalKey);
        if (found.isPresent()) {
            registry.register(type, record.id(), found.get());
            result.recordExisting();
            if (context.options().verbose()) {
                log.info("  [EXISTS] {}", record.label());
            }
            return found.get();
        }

        Reconciler.Outcome outcome = reconciler.createOrMatch(resource, request, naturalKey,
                String.valueOf(record.id()), entityClass);
        registry.register(type, record.id(), outcome.id());
        index().add(naturalKey, outcome.id());
        if (outcome.existing()) {
            result.recordExisting();
        } else {
            result.recordCreated();
        }
        if (context.options().verbose()) {
            log.info("  [{}] {}", outcome.existing() ? "EXISTS" : "CREATED", record.label());
        }
        return outcome.id();
    }
}
