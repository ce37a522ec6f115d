package zohomigrator.exceptions;

/**
 * Thrown when the migration thread is interrupted while waiting for a rate
 * limit slot or a throttle back-off.
 */
public class MigrationInterruptedException extends MigrateException {

    public MigrationInterruptedException(String message, InterruptedException cause) {
        super(message, cause);
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
