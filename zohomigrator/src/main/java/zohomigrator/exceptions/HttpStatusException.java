package zohomigrator.exceptions;

/**
 * Thrown when a remote API answers with a non-success HTTP status that is
 * not recovered by retry.
 */
public class HttpStatusException extends MigrateException {

    private static final int MAX_BODY_IN_MESSAGE = 500;

    private final int status;
    private final String body;

    public HttpStatusException(int status, String body) {
        this("HTTP " + status + ": " + abbreviate(body), status, body);
    }

    protected HttpStatusException(String message, int status, String body) {
        super(message);
        this.status = status;
        this.body = body != null ? body : "";
    }

    /** Returns the HTTP status code. */
    public int getStatus() {
        return status;
    }

    /** Returns the raw response body, never null. */
    public String getBody() {
        return body;
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() <= MAX_BODY_IN_MESSAGE ? body : body.substring(0, MAX_BODY_IN_MESSAGE) + "...";
    }
}
