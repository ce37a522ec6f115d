package zohomigrator.exceptions;

/**
 * Thrown when a request is still rejected with HTTP 401 after the access
 * token was refreshed once.
 */
public class AuthorizationException extends HttpStatusException {

    public AuthorizationException(String backend, String body) {
        super(backend + " rejected the request after a token refresh (HTTP 401)", 401, body);
    }
}
