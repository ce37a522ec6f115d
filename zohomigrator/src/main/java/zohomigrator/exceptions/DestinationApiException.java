package zohomigrator.exceptions;

/**
 * Application-level error reported by the destination API in its
 * {@code {code, message}} envelope.
 *
 * <p>{@link #isDuplicate()} is true when the code is one of the configured
 * "record already exists" codes, which the reconciliation step resolves by
 * matching against existing destination records.
 */
public class DestinationApiException extends MigrateException {

    private final int code;
    private final boolean duplicate;

    public DestinationApiException(int code, String apiMessage, boolean duplicate) {
        super("Zoho Books error " + code + ": " + apiMessage);
        this.code = code;
        this.duplicate = duplicate;
    }

    public int getCode() {
        return code;
    }

    public boolean isDuplicate() {
        return duplicate;
    }
}
