package zohomigrator.gateway;

import zohomigrator.alert.MigrationEventLogger;
import zohomigrator.auth.Backend;
import zohomigrator.auth.TokenManager;
import zohomigrator.exceptions.AuthorizationException;
import zohomigrator.exceptions.HttpStatusException;
import zohomigrator.exceptions.MigrateException;
import zohomigrator.exceptions.MigrationInterruptedException;
import zohomigrator.http.HttpCall;
import zohomigrator.http.HttpResult;
import zohomigrator.http.HttpTransport;
import org.apache.hc.core5.net.URIBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single choke point for every Zoho Books request.
 *
 * <p>For each call the gateway:
 * <ol>
 *   <li>appends {@code organization_id} to the query, keeping the caller's parameters</li>
 *   <li>waits for a slot in the {@link RateWindow} before every transmission, retries included</li>
 *   <li>sends with the current access token</li>
 *   <li>on HTTP 401 refreshes the token and retries once; a second 401 is an {@link AuthorizationException}</li>
 *   <li>on HTTP 429 sleeps the throttle back-off and retries, without limit</li>
 *   <li>turns any other non-2xx answer into an {@link HttpStatusException}</li>
 * </ol>
 */
public final class DestinationGateway {

    private static final Logger log = LoggerFactory.getLogger(DestinationGateway.class);

    static final int UNAUTHORIZED = 401;
    static final int TOO_MANY_REQUESTS = 429;

    private final HttpTransport transport;
    private final TokenManager tokens;
    private final RateWindow rateWindow;
    private final String organizationId;
    private final Duration throttleBackoff;
    private final Sleeper sleeper;

    private final AtomicLong requestsSent = new AtomicLong();
    private final AtomicLong throttleCount = new AtomicLong();

    public DestinationGateway(HttpTransport transport,
                              TokenManager tokens,
                              RateWindow rateWindow,
                              String organizationId,
                              Duration throttleBackoff,
                              Sleeper sleeper) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.tokens = Objects.requireNonNull(tokens, "tokens");
        this.rateWindow = Objects.requireNonNull(rateWindow, "rateWindow");
        this.organizationId = Objects.requireNonNull(organizationId, "organizationId");
        this.throttleBackoff = Objects.requireNonNull(throttleBackoff, "throttleBackoff");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * Executes a call with rate limiting and recovery.
     *
     * @param call the request; the gateway adds authorization and organization scope
     * @return the successful response
     * @throws AuthorizationException if the request is rejected twice with 401
     * @throws HttpStatusException for any other non-success status
     * @throws zohomigrator.exceptions.TokenRefreshException if the token cannot be refreshed
     * @throws MigrationInterruptedException if interrupted while waiting
     * @throws MigrateException on transport failure
     */
    public HttpResult execute(HttpCall call) throws MigrateException {
        HttpCall scoped = call.withUri(withOrganization(call.uri()));
        boolean refreshed = false;

        while (true) {
            rateWindow.acquire();
            HttpCall authorized = scoped.withHeader("Authorization",
                    "Zoho-oauthtoken " + tokens.accessToken(Backend.DESTINATION));

            HttpResult result;
            try {
                result = transport.send(authorized);
            } catch (IOException e) {
                throw new MigrateException("Zoho Books request failed: " + call + ": " + e.getMessage(), e);
            } finally {
                requestsSent.incrementAndGet();
            }

            if (result.status() == UNAUTHORIZED) {
                if (refreshed) {
                    throw new AuthorizationException(Backend.DESTINATION.displayName(), result.body());
                }
                log.debug("401 from {}, refreshing token", call.uri().getPath());
                tokens.refreshDestinationToken();
                refreshed = true;
                continue;
            }

            if (result.status() == TOO_MANY_REQUESTS) {
                throttleCount.incrementAndGet();
                log.warn("Zoho Books throttled {}; waiting {} s", call.uri().getPath(), throttleBackoff.toSeconds());
                MigrationEventLogger.throttled(call.uri().getPath(), throttleBackoff.toMillis());
                try {
                    sleeper.sleep(throttleBackoff);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new MigrationInterruptedException("Interrupted during throttle back-off", e);
                }
                continue;
            }

            if (!result.isSuccess()) {
                throw new HttpStatusException(result.status(), result.body());
            }
            return result;
        }
    }

    private URI withOrganization(URI uri) throws MigrateException {
        try {
            return new URIBuilder(uri).addParameter("organization_id", organizationId).build();
        } catch (URISyntaxException e) {
            throw new MigrateException("Invalid request URI: " + uri, e);
        }
    }

    /** Returns the number of transmissions, retries included. */
    public long requestsSent() {
        return requestsSent.get();
    }

    /** Returns the number of HTTP 429 answers received. */
    public long throttleCount() {
        return throttleCount.get();
    }

    public RateWindow rateWindow() {
        return rateWindow;
    }
}
