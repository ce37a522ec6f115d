package zohomigrator.exceptions;

/**
 * Thrown when source records cannot be listed (transport failure, non-success
 * status, malformed page). Fatal: a stage cannot proceed without its input.
 */
public class SourceUnavailableException extends MigrateException {

    public SourceUnavailableException(String message) {
        super(message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
