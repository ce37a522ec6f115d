package zohomigrator.http;

/**
 * Status and body of a completed HTTP exchange.
 */
public record HttpResult(int status, String body) {

    public HttpResult {
        body = body != null ? body : "";
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}
