package zohomigrator.exceptions;

/**
 * Thrown when an OAuth refresh-token exchange fails.
 *
 * <p>Without a valid token no further request can succeed, so this is fatal
 * for the running stage.
 */
public class TokenRefreshException extends MigrateException {

    public TokenRefreshException(String message) {
        super(message);
    }

    public TokenRefreshException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
