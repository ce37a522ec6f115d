package zohomigrator.pipeline;

import zohomigrator.exceptions.MigrateException;
import zohomigrator.registry.EntityType;
import zohomigrator.result.MigrationResult;

/**
 * Migrates every record of one entity type.
 */
public interface MigrationStage {

    EntityType type();

    /**
     * Runs the stage, counting into {@code result}.
     *
     * <p>Per-record failures are recorded in the result. A thrown exception
     * means the stage was aborted; the result then holds the partial counts.
     *
     * @param result counters for this stage
     * @throws MigrateException if the stage cannot continue
     */
    void run(MigrationResult result) throws MigrateException;
}
