package zohomigrator.http;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An outgoing HTTP request, independent of the client library that sends it.
 *
 * @param method HTTP method name
 * @param uri absolute request URI including query parameters
 * @param headers request headers in insertion order
 * @param body request body, or null for none
 * @param contentType MIME type of the body, or null for none
 */
public record HttpCall(String method, URI uri, Map<String, String> headers, String body, String contentType) {

    public static final String JSON = "application/json";
    public static final String FORM = "application/x-www-form-urlencoded";

    public HttpCall {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(uri, "uri");
        headers = Map.copyOf(headers != null ? headers : Map.of());
    }

    public static HttpCall get(URI uri) {
        return new HttpCall("GET", uri, Map.of(), null, null);
    }

    public static HttpCall post(URI uri, String body, String contentType) {
        return new HttpCall("POST", uri, Map.of(), body, contentType);
    }

    public static HttpCall put(URI uri, String body, String contentType) {
        return new HttpCall("PUT", uri, Map.of(), body, contentType);
    }

    /** Returns a copy with the given header set, replacing any previous value. */
    public HttpCall withHeader(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(headers);
        copy.put(name, value);
        return new HttpCall(method, uri, copy, body, contentType);
    }

    /** Returns a copy targeting another URI. */
    public HttpCall withUri(URI newUri) {
        return new HttpCall(method, newUri, headers, body, contentType);
    }

    @Override
    public String toString() {
        // headers carry credentials
        return method + " " + uri;
    }
}
