package zohomigrator.pipeline;

import zohomigrator.alert.MigrationEventLogger;
import zohomigrator.exceptions.MigrateException;
import zohomigrator.exceptions.StageDependencyException;
import zohomigrator.metrics.RunMetrics;
import zohomigrator.metrics.RunMetricsCollector;
import zohomigrator.registry.EntityType;
import zohomigrator.result.MigrationResult;
import zohomigrator.result.ResultReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Runs stages in dependency order.
 *
 * <p>Each stage runs at most once per pipeline. Requesting a stage first
 * runs the stages it depends on that have not run yet. A stage whose
 * dependency failed in this run is refused with a
 * {@link StageDependencyException}. Every stage prints its summary, aborted
 * ones included.
 *
 * <h2>Usage:</h2>
 * <pre>
 * MigrationPipeline pipeline = MigrationPipeline.create(context, reporter, collector);
 * pipeline.start(runId);
 * pipeline.runAll();
 * RunMetrics metrics = pipeline.finish(traffic);
 * </pre>
 */
public final class MigrationPipeline {

    private static final Logger log = LoggerFactory.getLogger(MigrationPipeline.class);

    private final Map<EntityType, MigrationStage> stages;
    private final ResultReporter reporter;
    private final RunMetricsCollector metrics;
    private final boolean dryRun;

    private final Set<EntityType> completed = EnumSet.noneOf(EntityType.class);
    private final Set<EntityType> failed = EnumSet.noneOf(EntityType.class);
    private final Map<EntityType, MigrationResult> results = new LinkedHashMap<>();
    private String runId;

    public MigrationPipeline(Map<EntityType, MigrationStage> stages,
                             ResultReporter reporter,
                             RunMetricsCollector metrics,
                             boolean dryRun) {
        this.stages = new EnumMap<>(stages);
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.dryRun = dryRun;
        for (EntityType type : EntityType.values()) {
            if (!this.stages.containsKey(type)) {
                throw new IllegalArgumentException("No stage for " + type.stageName());
            }
        }
    }

    /**
     * Builds the standard stages over one shared context.
     */
    public static MigrationPipeline create(StageContext context, ResultReporter reporter, RunMetricsCollector metrics) {
        Map<EntityType, MigrationStage> stages = new EnumMap<>(EntityType.class);
        stages.put(EntityType.ACCOUNT, context.options().hierarchicalCategories()
                ? new HierarchicalCategoryStage(context)
                : new FlatCategoryStage(context));
        stages.put(EntityType.TAX, new TaxStage(context));
        stages.put(EntityType.ITEM, new ItemStage(context));
        stages.put(EntityType.CUSTOMER, new CustomerStage(context));
        stages.put(EntityType.VENDOR, new VendorStage(context));
        stages.put(EntityType.INVOICE, new InvoiceStage(context));
        stages.put(EntityType.EXPENSE, new ExpenseStage(context));
        stages.put(EntityType.PAYMENT, new PaymentStage(context));
        return new MigrationPipeline(stages, reporter, metrics, context.options().dryRun());
    }

    public void start(String runId) {
        this.runId = runId;
        metrics.start(runId);
        List<String> names = new ArrayList<>();
        for (EntityType t : EntityType.values()) names.add(t.stageName());
        MigrationEventLogger.runStarted(runId, names, dryRun);
        if (dryRun) {
            log.info("[DRY RUN] No records will be written to Zoho Books");
        }
    }

    /**
     * Runs every stage in order. A failed stage does not stop independent
     * stages; stages depending on it are skipped.
     *
     * @return true if every stage completed
     */
    public boolean runAll() {
        for (EntityType type : EntityType.values()) {
            try {
                run(type);
            } catch (StageDependencyException e) {
                failed.add(type);
                metrics.stageFailed(type.stageName());
                log.warn("Skipping {}: {}", type.stageName(), e.getMessage());
            } catch (MigrateException e) {
                log.error("Stage {} aborted: {}", type.stageName(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("Stage {} aborted by an unexpected error", type.stageName(), e);
            }
        }
        return failed.isEmpty();
    }

    /**
     * Runs one stage, after the stages it depends on.
     *
     * @param type the stage to run
     * @throws StageDependencyException if a dependency failed in this run
     * @throws MigrateException if this stage or a dependency run by it aborts
     */
    public void run(EntityType type) throws MigrateException {
        if (completed.contains(type)) {
            return;
        }
        if (failed.contains(type)) {
            throw new StageDependencyException(type.stageName(), type.stageName());
        }
        for (EntityType dependency : type.dependencies()) {
            if (failed.contains(dependency)) {
                throw new StageDependencyException(type.stageName(), dependency.stageName());
            }
            if (!completed.contains(dependency)) {
                log.info("{} depends on {}; running it first", type.stageName(), dependency.stageName());
                run(dependency);
            }
        }
        execute(type);
    }

    private void execute(EntityType type) throws MigrateException {
        MigrationStage stage = stages.get(type);
        MigrationResult result = new MigrationResult(type.stageName());
        results.put(type, result);
        MigrationEventLogger.stageStarted(type.stageName());
        log.info("Migrating {}...", type.stageName());
        try {
            metrics.timed(type.stageName(), () -> {
                stage.run(result);
                return result;
            });
        } catch (MigrateException e) {
            failed.add(type);
            metrics.stageFailed(type.stageName());
            result.markAborted(e.getMessage());
            MigrationEventLogger.stageFailed(type.stageName(), e, result);
            reporter.report(result);
            throw e;
        } catch (RuntimeException e) {
            failed.add(type);
            metrics.stageFailed(type.stageName());
            result.markAborted(e.toString());
            MigrationEventLogger.stageFailed(type.stageName(), e, result);
            reporter.report(result);
            throw e;
        }
        completed.add(type);
        MigrationEventLogger.stageCompleted(type.stageName(), result, metrics.stageDuration(type.stageName()));
        reporter.report(result);
    }

    /**
     * Ends the run: prints the overall summary and returns the run metrics.
     */
    public RunMetrics finish(RunMetricsCollector.TrafficSource traffic) {
        RunMetrics run = metrics.finish(traffic);
        MigrationEventLogger.runCompleted(runId, run);
        reporter.reportRun(results.values(), run);
        return run;
    }

    /** Results of the stages run so far, in run order. */
    public Map<EntityType, MigrationResult> results() {
        return Collections.unmodifiableMap(results);
    }

    public Set<EntityType> failedStages() {
        return Collections.unmodifiableSet(failed);
    }
}
