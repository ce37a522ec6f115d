package zohomigrator.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import zohomigrator.exceptions.AuthorizationException;
import zohomigrator.exceptions.DestinationApiException;
import zohomigrator.exceptions.HttpStatusException;
import zohomigrator.exceptions.MigrateException;
import zohomigrator.http.HttpCall;
import zohomigrator.http.HttpResult;
import zohomigrator.model.destination.DestinationRequest;
import org.apache.hc.core5.net.URIBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Typed Zoho Books operations on top of the {@link DestinationGateway}.
 *
 * <p>Zoho wraps every answer in {@code {code, message, ...}}; a non-zero code
 * is turned into a {@link DestinationApiException} whether it arrives with a
 * 2xx or a 4xx status.
 *
 * <p>In dry-run mode create, update and mark-as-sent return before reaching
 * the gateway. {@link #create} then returns a placeholder id of the form
 * {@code dry-run-<entity>-<key>} so later stages can still resolve their
 * references. Listing always goes to the network.
 */
public final class DestinationClient {

    private static final Logger log = LoggerFactory.getLogger(DestinationClient.class);

    public static final int PAGE_SIZE = 200;
    public static final String PLACEHOLDER_PREFIX = "dry-run-";

    private final DestinationGateway gateway;
    private final ObjectMapper mapper;
    private final String baseUrl;
    private final Set<Integer> duplicateCodes;
    private final boolean dryRun;

    public DestinationClient(DestinationGateway gateway,
                             ObjectMapper mapper,
                             URI baseUrl,
                             Set<Integer> duplicateCodes,
                             boolean dryRun) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.baseUrl = stripTrailingSlash(baseUrl.toString());
        this.duplicateCodes = Set.copyOf(duplicateCodes);
        this.dryRun = dryRun;
    }

    /**
     * Returns the placeholder id a dry run assigns instead of creating a record.
     */
    public static String placeholder(DestinationResource resource, String key) {
        return PLACEHOLDER_PREFIX + resource.entityType().singular() + "-" + key;
    }

    public static boolean isPlaceholder(String id) {
        return id != null && id.startsWith(PLACEHOLDER_PREFIX);
    }

    /**
     * Lists every record of a resource, following {@code page_context.has_more_page}.
     *
     * @param resource the collection to list
     * @param type record class to bind each element to
     * @return all records in server order
     * @throws MigrateException if a page cannot be fetched or parsed
     */
    public <T> List<T> listAll(DestinationResource resource, Class<T> type) throws MigrateException {
        List<T> all = new ArrayList<>();
        int page = 1;
        boolean more = true;
        while (more) {
            URIBuilder uri = uri(resource.path());
            resource.listParams().forEach(uri::addParameter);
            uri.addParameter("page", String.valueOf(page));
            uri.addParameter("per_page", String.valueOf(PAGE_SIZE));

            JsonNode root = envelope(send(HttpCall.get(build(uri))));
            JsonNode records = root.path(resource.listKey());
            for (JsonNode node : records) {
                try {
                    all.add(mapper.treeToValue(node, type));
                } catch (JsonProcessingException e) {
                    throw new MigrateException("Cannot read " + resource.entityType().singular()
                            + " from Zoho Books listing: " + e.getOriginalMessage(), e);
                }
            }
            more = root.path("page_context").path("has_more_page").asBoolean(false);
            page++;
        }
        log.debug("Listed {} existing {} records", all.size(), resource.entityType().singular());
        return all;
    }

    /**
     * Creates a record.
     *
     * @param resource the target collection
     * @param request the payload
     * @param placeholderKey key used for the dry-run placeholder id
     * @return the destination id of the new record, or a placeholder in dry-run mode
     * @throws DestinationApiException if Zoho rejects the record
     * @throws MigrateException on any other failure
     */
    public String create(DestinationResource resource, DestinationRequest request, String placeholderKey)
            throws MigrateException {
        if (dryRun) {
            String id = placeholder(resource, placeholderKey);
            log.info("[DRY RUN] Would create {} {}", resource.entityType().singular(), placeholderKey);
            return id;
        }
        URIBuilder uri = uri(resource.path());
        resource.createParams().forEach(uri::addParameter);

        JsonNode root = envelope(send(HttpCall.post(build(uri), json(request), HttpCall.JSON)));
        String id = root.path(resource.singularKey()).path(resource.idField()).asText("");
        if (id.isEmpty()) {
            throw new MigrateException("Zoho Books response has no " + resource.idField());
        }
        return id;
    }

    /**
     * Updates an existing record.
     */
    public void update(DestinationResource resource, String id, DestinationRequest request) throws MigrateException {
        if (dryRun) {
            log.info("[DRY RUN] Would update {} {}", resource.entityType().singular(), id);
            return;
        }
        URI uri = build(uri(resource.path() + "/" + id));
        envelope(send(HttpCall.put(uri, json(request), HttpCall.JSON)));
    }

    /**
     * Marks an invoice as sent without emailing the customer.
     */
    public void markInvoiceSent(String invoiceId) throws MigrateException {
        if (dryRun) {
            log.info("[DRY RUN] Would mark invoice {} as sent", invoiceId);
            return;
        }
        URI uri = build(uri(DestinationResource.INVOICES.path() + "/" + invoiceId + "/status/sent"));
        envelope(send(HttpCall.post(uri, null, null)));
    }

    private HttpResult send(HttpCall call) throws MigrateException {
        try {
            return gateway.execute(call);
        } catch (AuthorizationException e) {
            throw e;
        } catch (HttpStatusException e) {
            // Zoho reports validation and duplicate errors as 4xx with the usual envelope
            JsonNode body = parseQuietly(e.getBody());
            if (body != null && body.path("code").asInt(0) != 0) {
                throw apiError(body);
            }
            throw e;
        }
    }

    private JsonNode envelope(HttpResult result) throws MigrateException {
        JsonNode root;
        try {
            root = mapper.readTree(result.body());
        } catch (JsonProcessingException e) {
            throw new MigrateException("Malformed Zoho Books response: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new MigrateException("Empty Zoho Books response");
        }
        if (root.path("code").asInt(0) != 0) {
            throw apiError(root);
        }
        return root;
    }

    private DestinationApiException apiError(JsonNode root) {
        int code = root.path("code").asInt();
        return new DestinationApiException(code, root.path("message").asText(""), duplicateCodes.contains(code));
    }

    private JsonNode parseQuietly(String body) {
        if (body == null || body.isBlank()) return null;
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private String json(DestinationRequest request) throws MigrateException {
        try {
            return mapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new MigrateException("Cannot encode " + request.getClass().getSimpleName(), e);
        }
    }

    private URIBuilder uri(String path) throws MigrateException {
        try {
            return new URIBuilder(baseUrl + path);
        } catch (URISyntaxException e) {
            throw new MigrateException("Invalid Zoho Books URL: " + baseUrl + path, e);
        }
    }

    private static URI build(URIBuilder builder) throws MigrateException {
        try {
            return builder.build();
        } catch (URISyntaxException e) {
            throw new MigrateException("Invalid Zoho Books URL", e);
        }
    }

    private static String stripTrailingSlash(String s) {
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }
}
