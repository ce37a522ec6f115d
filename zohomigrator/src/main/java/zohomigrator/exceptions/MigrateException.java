package zohomigrator.exceptions;

/**
 * Exception thrown when a migration operation fails.
 *
 * <p>Subclasses that must abort the whole stage override {@link #isFatal()}.
 * Everything else is treated as a per-record failure by the pipeline.
 *
 * @see zohomigrator.pipeline.AbstractStage
 */
public class MigrateException extends Exception {

    /**
     * Creates a new migration exception with a message.
     *
     * @param message the error message
     */
    public MigrateException(String message) {
        super(message);
    }

    /**
     * Creates a new migration exception with a message and cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public MigrateException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns true if this failure must abort the running stage instead of
     * being recorded against a single record.
     */
    public boolean isFatal() {
        return false;
    }

    @Override
    public String getMessage() {
        String base = super.getMessage();
        return base != null ? base : getClass().getSimpleName();
    }
}
