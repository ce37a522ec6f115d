package zohomigrator.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import zohomigrator.auth.Backend;
import zohomigrator.auth.TokenManager;
import zohomigrator.exceptions.AuthorizationException;
import zohomigrator.exceptions.HttpStatusException;
import zohomigrator.exceptions.MigrateException;
import zohomigrator.exceptions.SourceUnavailableException;
import zohomigrator.http.HttpCall;
import zohomigrator.http.HttpResult;
import zohomigrator.http.HttpTransport;
import org.apache.hc.core5.net.URIBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads whole FreshBooks collections page by page.
 *
 * <p>Each page is requested as
 * {@code GET <base>/accounting/account/<accountId>/<path>?page=N&per_page=P}
 * and answered with
 * {@code {response: {result: {<plural>: [...], page, pages, per_page, total}}}}.
 * Paging stops once the current page reaches the server-reported page count.
 *
 * <p>A 401 triggers one token refresh and the same page is requested again;
 * a second 401 for that page is an {@link AuthorizationException}. Transport
 * failures and other error statuses are fatal for the calling stage.
 *
 * <p>Records are returned as-is; archived records are filtered by the stages.
 */
public final class SourceReader {

    private static final Logger log = LoggerFactory.getLogger(SourceReader.class);

    private final HttpTransport transport;
    private final TokenManager tokens;
    private final ObjectMapper mapper;
    private final String accountBase;
    private final int pageSize;

    public SourceReader(HttpTransport transport,
                        TokenManager tokens,
                        ObjectMapper mapper,
                        URI baseUrl,
                        String accountId,
                        int pageSize) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.tokens = Objects.requireNonNull(tokens, "tokens");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        String base = baseUrl.toString();
        if (base.endsWith("/")) base = base.substring(0, base.length() - 1);
        this.accountBase = base + "/accounting/account/" + accountId + "/";
        this.pageSize = pageSize;
    }

    /**
     * Fetches every record of a collection.
     *
     * @param endpoint the collection
     * @return all records across all pages, in server order
     * @throws SourceUnavailableException if a page cannot be fetched or parsed
     * @throws AuthorizationException if a page is rejected twice with 401
     * @throws zohomigrator.exceptions.TokenRefreshException if the token cannot be refreshed
     */
    public <T> List<T> fetchAll(SourceEndpoint<T> endpoint) throws MigrateException {
        List<T> all = new ArrayList<>();
        int page = 1;
        boolean refreshed = false;

        while (true) {
            HttpCall call = HttpCall.get(pageUri(endpoint, page))
                    .withHeader("Authorization", "Bearer " + tokens.accessToken(Backend.SOURCE));

            HttpResult result;
            try {
                result = transport.send(call);
            } catch (IOException e) {
                throw new SourceUnavailableException("FreshBooks unreachable while reading "
                        + endpoint + " page " + page + ": " + e.getMessage(), e);
            }

            if (result.status() == 401) {
                if (refreshed) {
                    throw new AuthorizationException(Backend.SOURCE.displayName(), result.body());
                }
                log.debug("401 reading {} page {}, refreshing token", endpoint, page);
                tokens.refreshSourceToken();
                refreshed = true;
                continue;
            }
            if (!result.isSuccess()) {
                throw new SourceUnavailableException("FreshBooks returned HTTP " + result.status()
                        + " for " + endpoint + " page " + page,
                        new HttpStatusException(result.status(), result.body()));
            }
            refreshed = false;

            JsonNode envelope = parse(result.body(), endpoint, page).path("response").path("result");
            JsonNode records = envelope.path(endpoint.pluralKey());
            if (!records.isArray()) {
                throw new SourceUnavailableException("FreshBooks page " + page + " of " + endpoint
                        + " has no '" + endpoint.pluralKey() + "' array");
            }
            for (JsonNode node : records) {
                try {
                    all.add(mapper.treeToValue(node, endpoint.type()));
                } catch (JsonProcessingException e) {
                    throw new SourceUnavailableException("Cannot read record from " + endpoint
                            + ": " + e.getOriginalMessage(), e);
                }
            }

            int pages = envelope.path("pages").asInt(0);
            log.debug("Read {} page {}/{} ({} records so far)", endpoint, page, pages, all.size());
            if (page >= pages) {
                break;
            }
            page++;
        }
        return all;
    }

    private JsonNode parse(String body, SourceEndpoint<?> endpoint, int page) throws SourceUnavailableException {
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new SourceUnavailableException("Malformed FreshBooks response for " + endpoint
                    + " page " + page, e);
        }
    }

    private URI pageUri(SourceEndpoint<?> endpoint, int page) throws SourceUnavailableException {
        try {
            return new URIBuilder(accountBase + endpoint.path())
                    .addParameter("page", String.valueOf(page))
                    .addParameter("per_page", String.valueOf(pageSize))
                    .build();
        } catch (URISyntaxException e) {
            throw new SourceUnavailableException("Invalid FreshBooks URL for " + endpoint, e);
        }
    }
}
