package zohomigrator.http;

import java.io.IOException;

/**
 * Sends a single HTTP request and returns whatever the server answered.
 *
 * <p>Implementations never interpret status codes; retry and error policy
 * belong to the callers.
 */
@FunctionalInterface
public interface HttpTransport {

    /**
     * Sends the call.
     *
     * @param call the request to send
     * @return the response status and body
     * @throws IOException if the exchange could not be completed
     */
    HttpResult send(HttpCall call) throws IOException;
}
