package zohomigrator.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import zohomigrator.alert.MigrationEventLogger;
import zohomigrator.config.MigrationConfig;
import zohomigrator.config.OAuthCredentials;
import zohomigrator.exceptions.TokenRefreshException;
import zohomigrator.http.HttpCall;
import zohomigrator.http.HttpResult;
import zohomigrator.http.HttpTransport;
import org.apache.hc.core5.net.URIBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the current OAuth tokens for FreshBooks and Zoho Books.
 *
 * <p>Callers read the access token before every request and ask for a
 * refresh when a request comes back with HTTP 401. Reads and refreshes are
 * serialized by a single lock, so a refresh replaces the pair atomically and
 * concurrent callers never observe a half-updated state.
 *
 * <p>Refresh protocols differ per backend:
 * <ul>
 *   <li>{@link Backend#SOURCE}: JSON body {@code {grant_type, client_id, client_secret, refresh_token}}</li>
 *   <li>{@link Backend#DESTINATION}: the same four fields as query parameters with a form content type</li>
 * </ul>
 *
 * <p>Tokens are never written to disk here; register a
 * {@link TokenRefreshListener} to persist them.
 */
public final class TokenManager {

    private static final Logger log = LoggerFactory.getLogger(TokenManager.class);

    private final HttpTransport transport;
    private final ObjectMapper mapper;
    private final Map<Backend, OAuthCredentials> clients = new EnumMap<>(Backend.class);
    private final Map<Backend, URI> tokenUrls = new EnumMap<>(Backend.class);
    private final Map<Backend, TokenPair> tokens = new EnumMap<>(Backend.class);
    private final List<TokenRefreshListener> listeners = new CopyOnWriteArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicInteger refreshCount = new AtomicInteger();

    public TokenManager(MigrationConfig config, HttpTransport transport, ObjectMapper mapper) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        register(Backend.SOURCE, config.sourceCredentials(), config.sourceTokenUrl());
        register(Backend.DESTINATION, config.destinationCredentials(), config.destinationTokenUrl());
    }

    private void register(Backend backend, OAuthCredentials credentials, URI tokenUrl) {
        clients.put(backend, credentials);
        tokenUrls.put(backend, tokenUrl);
        tokens.put(backend, new TokenPair(credentials.accessToken(), credentials.refreshToken()));
    }

    /**
     * Adds a listener notified after every successful refresh.
     *
     * @param listener the listener
     */
    public void addListener(TokenRefreshListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Returns the current access token for a backend.
     *
     * @param backend the backend
     * @return the access token, possibly empty if none has been issued yet
     */
    public String accessToken(Backend backend) {
        lock.lock();
        try {
            return tokens.get(backend).accessToken();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the current token pair for a backend.
     */
    public TokenPair tokens(Backend backend) {
        lock.lock();
        try {
            return tokens.get(backend);
        } finally {
            lock.unlock();
        }
    }

    /** Returns how many refreshes have succeeded since construction. */
    public int refreshCount() {
        return refreshCount.get();
    }

    public void refreshSourceToken() throws TokenRefreshException {
        refresh(Backend.SOURCE);
    }

    public void refreshDestinationToken() throws TokenRefreshException {
        refresh(Backend.DESTINATION);
    }

    /**
     * Exchanges the refresh token for a new access token.
     *
     * <p>On success the access token is replaced, and the refresh token too if
     * the server rotated it. On failure the previous pair is kept.
     *
     * @param backend the backend to refresh
     * @throws TokenRefreshException if the exchange fails for any reason
     */
    public void refresh(Backend backend) throws TokenRefreshException {
        TokenPair updated;
        lock.lock();
        try {
            TokenPair current = tokens.get(backend);
            HttpCall call = backend == Backend.SOURCE
                    ? sourceRefreshCall(current)
                    : destinationRefreshCall(current);

            HttpResult result;
            try {
                result = transport.send(call);
            } catch (IOException e) {
                throw new TokenRefreshException(backend.displayName() + " token refresh failed: " + e.getMessage(), e);
            }
            if (!result.isSuccess()) {
                throw new TokenRefreshException(backend.displayName() + " token refresh failed: HTTP "
                        + result.status() + " " + result.body());
            }

            TokenResponse response;
            try {
                response = mapper.readValue(result.body(), TokenResponse.class);
            } catch (JsonProcessingException e) {
                throw new TokenRefreshException(backend.displayName() + " token refresh returned malformed JSON", e);
            }
            if (response.accessToken() == null || response.accessToken().isBlank()) {
                String reason = response.error() != null ? response.error() : "no access_token in response";
                throw new TokenRefreshException(backend.displayName() + " token refresh failed: " + reason);
            }

            String refreshToken = response.refreshToken() != null && !response.refreshToken().isBlank()
                    ? response.refreshToken()
                    : current.refreshToken();
            updated = new TokenPair(response.accessToken(), refreshToken);
            tokens.put(backend, updated);
            refreshCount.incrementAndGet();
        } finally {
            lock.unlock();
        }

        log.info("Refreshed {} access token", backend.displayName());
        MigrationEventLogger.tokenRefreshed(backend);
        notifyListeners(backend, updated);
    }

    private void notifyListeners(Backend backend, TokenPair updated) {
        for (TokenRefreshListener listener : listeners) {
            try {
                listener.tokensRefreshed(backend, updated);
            } catch (RuntimeException e) {
                // the new token is valid in memory; the run continues without persistence
                log.warn("Token refresh listener failed for {}: {}", backend.displayName(), e.getMessage(), e);
            }
        }
    }

    private HttpCall sourceRefreshCall(TokenPair current) throws TokenRefreshException {
        OAuthCredentials c = clients.get(Backend.SOURCE);
        Map<String, String> body = new LinkedHashMap<>();
        body.put("grant_type", "refresh_token");
        body.put("client_id", c.clientId());
        body.put("client_secret", c.clientSecret());
        body.put("refresh_token", current.refreshToken());
        try {
            return HttpCall.post(tokenUrls.get(Backend.SOURCE), mapper.writeValueAsString(body), HttpCall.JSON);
        } catch (JsonProcessingException e) {
            throw new TokenRefreshException("Cannot encode FreshBooks refresh request", e);
        }
    }

    private HttpCall destinationRefreshCall(TokenPair current) throws TokenRefreshException {
        OAuthCredentials c = clients.get(Backend.DESTINATION);
        try {
            URI uri = new URIBuilder(tokenUrls.get(Backend.DESTINATION))
                    .addParameter("refresh_token", current.refreshToken())
                    .addParameter("client_id", c.clientId())
                    .addParameter("client_secret", c.clientSecret())
                    .addParameter("grant_type", "refresh_token")
                    .build();
            return new HttpCall("POST", uri, Map.of("Content-Type", HttpCall.FORM), null, null);
        } catch (URISyntaxException e) {
            throw new TokenRefreshException("Invalid Zoho token URL", e);
        }
    }
}
