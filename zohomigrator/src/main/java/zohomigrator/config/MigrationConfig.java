package zohomigrator.config;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Central configuration for a migration run.
 *
 * <p>This class encapsulates:
 * <ul>
 *   <li>FreshBooks and Zoho Books OAuth credentials and account identifiers</li>
 *   <li>Zoho region and API endpoints</li>
 *   <li>Rate limit, throttle and paging parameters</li>
 *   <li>Lookup tables used by the field mappers</li>
 * </ul>
 *
 * <p>Configuration can be loaded from {@code zoho-migration.properties} or
 * {@code zoho-migration.yml} using {@link MigrationConfigLoader}.
 *
 * @see MigrationConfigLoader
 */
public final class MigrationConfig {

    public static final URI DEFAULT_SOURCE_BASE_URL = URI.create("https://api.freshbooks.com");
    public static final URI DEFAULT_SOURCE_TOKEN_URL = URI.create("https://api.freshbooks.com/auth/oauth/token");
    public static final Set<Integer> DEFAULT_DUPLICATE_CODES = Set.of(11002, 3062);

    private final OAuthCredentials sourceCredentials;
    private final String sourceAccountId;
    private final URI sourceBaseUrl;
    private final URI sourceTokenUrl;
    private final int sourcePageSize;

    private final OAuthCredentials destinationCredentials;
    private final String organizationId;
    private final Region region;
    private final URI destinationBaseUrl;
    private final URI destinationTokenUrl;
    private final Set<Integer> duplicateCodes;

    private final int maxRequestsPerWindow;
    private final Duration rateWindow;
    private final Duration throttleBackoff;
    private final Duration httpTimeout;
    private final AlertLevel alertLevel;

    private final Map<String, List<String>> categoryHierarchy;
    private final Map<String, String> categoryNameMapping;
    private final Map<String, String> paidThroughAccounts;
    private final Map<String, String> depositAccounts;
    private final BusinessTagSettings businessTags;

    private final Path sourceFile;

    private MigrationConfig(Builder b) {
        this.sourceCredentials = b.sourceCredentials;
        this.sourceAccountId = b.sourceAccountId;
        this.sourceBaseUrl = b.sourceBaseUrl;
        this.sourceTokenUrl = b.sourceTokenUrl;
        this.sourcePageSize = b.sourcePageSize;
        this.destinationCredentials = b.destinationCredentials;
        this.organizationId = b.organizationId;
        this.region = b.region;
        this.destinationBaseUrl = b.destinationBaseUrl != null ? b.destinationBaseUrl : b.region.apiBaseUrl();
        this.destinationTokenUrl = b.destinationTokenUrl != null ? b.destinationTokenUrl : b.region.tokenUrl();
        this.duplicateCodes = Set.copyOf(b.duplicateCodes);
        this.maxRequestsPerWindow = b.maxRequestsPerWindow;
        this.rateWindow = b.rateWindow;
        this.throttleBackoff = b.throttleBackoff;
        this.httpTimeout = b.httpTimeout;
        this.alertLevel = b.alertLevel;
        this.categoryHierarchy = copyHierarchy(b.categoryHierarchy);
        this.categoryNameMapping = Collections.unmodifiableMap(new LinkedHashMap<>(b.categoryNameMapping));
        this.paidThroughAccounts = lowerCaseKeys(b.paidThroughAccounts);
        this.depositAccounts = lowerCaseKeys(b.depositAccounts);
        this.businessTags = b.businessTags;
        this.sourceFile = b.sourceFile;
    }

    /**
     * Creates a new configuration builder.
     *
     * @return a new builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /** Returns the FreshBooks OAuth credentials. */
    public OAuthCredentials sourceCredentials() { return sourceCredentials; }

    /** Returns the FreshBooks account id used in every accounting path. */
    public String sourceAccountId() { return sourceAccountId; }

    /** Returns the FreshBooks API base URL. */
    public URI sourceBaseUrl() { return sourceBaseUrl; }

    /** Returns the FreshBooks OAuth token endpoint. */
    public URI sourceTokenUrl() { return sourceTokenUrl; }

    /** Returns the number of records requested per FreshBooks page. */
    public int sourcePageSize() { return sourcePageSize; }

    /** Returns the Zoho Books OAuth credentials. */
    public OAuthCredentials destinationCredentials() { return destinationCredentials; }

    /** Returns the Zoho Books organization id appended to every call. */
    public String organizationId() { return organizationId; }

    /** Returns the Zoho data-center region. */
    public Region region() { return region; }

    /** Returns the Zoho Books API base URL (region default unless overridden). */
    public URI destinationBaseUrl() { return destinationBaseUrl; }

    /** Returns the Zoho OAuth token endpoint (region default unless overridden). */
    public URI destinationTokenUrl() { return destinationTokenUrl; }

    /** Returns the Zoho error codes that mean "record already exists". */
    public Set<Integer> duplicateCodes() { return duplicateCodes; }

    /** Returns the maximum number of Zoho requests per rolling window. */
    public int maxRequestsPerWindow() { return maxRequestsPerWindow; }

    /** Returns the length of the rolling rate window. */
    public Duration rateWindow() { return rateWindow; }

    /** Returns how long to wait after an HTTP 429 before retrying. */
    public Duration throttleBackoff() { return throttleBackoff; }

    /** Returns the per-call HTTP timeout. */
    public Duration httpTimeout() { return httpTimeout; }

    /** Returns the alert level for event logging. */
    public AlertLevel alertLevel() { return alertLevel; }

    /** Returns the configured account hierarchy, parent name to child names, in declaration order. */
    public Map<String, List<String>> categoryHierarchy() { return categoryHierarchy; }

    /** Returns the FreshBooks category name to Zoho account name translation table. */
    public Map<String, String> categoryNameMapping() { return categoryNameMapping; }

    /** Returns lower-cased FreshBooks bank account names mapped to Zoho paid-through account ids. */
    public Map<String, String> paidThroughAccounts() { return paidThroughAccounts; }

    /** Returns lower-cased gateway/type keys mapped to Zoho deposit account ids. */
    public Map<String, String> depositAccounts() { return depositAccounts; }

    /** Returns business line tagging settings, if configured. */
    public Optional<BusinessTagSettings> businessTags() { return Optional.ofNullable(businessTags); }

    /** Returns the file this configuration was loaded from, if any. */
    public Optional<Path> sourceFile() { return Optional.ofNullable(sourceFile); }

    /**
     * Returns a copy of this configuration with a different alert level.
     *
     * @param level the new alert level
     * @return a new configuration
     */
    public MigrationConfig withAlertLevel(AlertLevel level) {
        return toBuilder().alertLevel(level).build();
    }

    private Builder toBuilder() {
        Builder b = new Builder();
        b.sourceCredentials = sourceCredentials;
        b.sourceAccountId = sourceAccountId;
        b.sourceBaseUrl = sourceBaseUrl;
        b.sourceTokenUrl = sourceTokenUrl;
        b.sourcePageSize = sourcePageSize;
        b.destinationCredentials = destinationCredentials;
        b.organizationId = organizationId;
        b.region = region;
        b.destinationBaseUrl = destinationBaseUrl;
        b.destinationTokenUrl = destinationTokenUrl;
        b.duplicateCodes = new LinkedHashSet<>(duplicateCodes);
        b.maxRequestsPerWindow = maxRequestsPerWindow;
        b.rateWindow = rateWindow;
        b.throttleBackoff = throttleBackoff;
        b.httpTimeout = httpTimeout;
        b.alertLevel = alertLevel;
        b.categoryHierarchy = new LinkedHashMap<>(categoryHierarchy);
        b.categoryNameMapping = new LinkedHashMap<>(categoryNameMapping);
        b.paidThroughAccounts = new LinkedHashMap<>(paidThroughAccounts);
        b.depositAccounts = new LinkedHashMap<>(depositAccounts);
        b.businessTags = businessTags;
        b.sourceFile = sourceFile;
        return b;
    }

    private static Map<String, List<String>> copyHierarchy(Map<String, List<String>> hierarchy) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        hierarchy.forEach((parent, children) -> copy.put(parent, List.copyOf(children)));
        return Collections.unmodifiableMap(copy);
    }

    private static Map<String, String> lowerCaseKeys(Map<String, String> map) {
        Map<String, String> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(k.trim().toLowerCase(Locale.ROOT), v));
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public String toString() {
        return "MigrationConfig{" +
                "sourceAccountId=" + sourceAccountId +
                ", organizationId=" + organizationId +
                ", region=" + region.code() +
                ", maxRequestsPerWindow=" + maxRequestsPerWindow +
                ", rateWindow=" + rateWindow.toSeconds() + "s" +
                ", throttleBackoff=" + throttleBackoff.toSeconds() + "s" +
                ", sourcePageSize=" + sourcePageSize +
                ", alertLevel=" + alertLevel +
                '}';
    }

    /**
     * Builder for constructing {@link MigrationConfig} instances.
     */
    public static final class Builder {
        private OAuthCredentials sourceCredentials;
        private String sourceAccountId;
        private URI sourceBaseUrl = DEFAULT_SOURCE_BASE_URL;
        private URI sourceTokenUrl = DEFAULT_SOURCE_TOKEN_URL;
        private int sourcePageSize = 100;
        private OAuthCredentials destinationCredentials;
        private String organizationId;
        private Region region = Region.COM;
        private URI destinationBaseUrl;
        private URI destinationTokenUrl;
        private Set<Integer> duplicateCodes = new LinkedHashSet<>(DEFAULT_DUPLICATE_CODES);
        private int maxRequestsPerWindow = 100;
        private Duration rateWindow = Duration.ofSeconds(60);
        private Duration throttleBackoff = Duration.ofSeconds(60);
        private Duration httpTimeout = Duration.ofSeconds(30);
        private AlertLevel alertLevel = AlertLevel.WARNING;
        private Map<String, List<String>> categoryHierarchy = new LinkedHashMap<>();
        private Map<String, String> categoryNameMapping = new LinkedHashMap<>();
        private Map<String, String> paidThroughAccounts = new LinkedHashMap<>();
        private Map<String, String> depositAccounts = new LinkedHashMap<>();
        private BusinessTagSettings businessTags;
        private Path sourceFile;

        public Builder sourceCredentials(OAuthCredentials credentials) {
            this.sourceCredentials = credentials;
            return this;
        }

        public Builder sourceAccountId(String accountId) {
            this.sourceAccountId = accountId;
            return this;
        }

        public Builder sourceBaseUrl(URI url) {
            this.sourceBaseUrl = url;
            return this;
        }

        public Builder sourceTokenUrl(URI url) {
            this.sourceTokenUrl = url;
            return this;
        }

        public Builder sourcePageSize(int size) {
            if (size <= 0) throw new IllegalArgumentException("sourcePageSize must be positive");
            this.sourcePageSize = size;
            return this;
        }

        public Builder destinationCredentials(OAuthCredentials credentials) {
            this.destinationCredentials = credentials;
            return this;
        }

        public Builder organizationId(String organizationId) {
            this.organizationId = organizationId;
            return this;
        }

        public Builder region(Region region) {
            this.region = region;
            return this;
        }

        public Builder destinationBaseUrl(URI url) {
            this.destinationBaseUrl = url;
            return this;
        }

        public Builder destinationTokenUrl(URI url) {
            this.destinationTokenUrl = url;
            return this;
        }

        public Builder duplicateCodes(Set<Integer> codes) {
            this.duplicateCodes = new LinkedHashSet<>(codes);
            return this;
        }

        public Builder maxRequestsPerWindow(int max) {
            if (max <= 0) throw new IllegalArgumentException("maxRequestsPerWindow must be positive");
            this.maxRequestsPerWindow = max;
            return this;
        }

        public Builder rateWindow(Duration window) {
            this.rateWindow = window;
            return this;
        }

        public Builder rateWindowSeconds(long seconds) {
            return rateWindow(Duration.ofSeconds(seconds));
        }

        public Builder throttleBackoff(Duration backoff) {
            this.throttleBackoff = backoff;
            return this;
        }

        public Builder throttleBackoffSeconds(long seconds) {
            return throttleBackoff(Duration.ofSeconds(seconds));
        }

        public Builder httpTimeoutSeconds(long seconds) {
            this.httpTimeout = Duration.ofSeconds(seconds);
            return this;
        }

        public Builder alertLevel(AlertLevel level) {
            this.alertLevel = level;
            return this;
        }

        public Builder categoryHierarchy(Map<String, List<String>> hierarchy) {
            this.categoryHierarchy = new LinkedHashMap<>(hierarchy);
            return this;
        }

        public Builder categoryNameMapping(Map<String, String> mapping) {
            this.categoryNameMapping = new LinkedHashMap<>(mapping);
            return this;
        }

        public Builder paidThroughAccounts(Map<String, String> accounts) {
            this.paidThroughAccounts = new LinkedHashMap<>(accounts);
            return this;
        }

        public Builder depositAccounts(Map<String, String> accounts) {
            this.depositAccounts = new LinkedHashMap<>(accounts);
            return this;
        }

        public Builder businessTags(BusinessTagSettings settings) {
            this.businessTags = settings;
            return this;
        }

        public Builder sourceFile(Path file) {
            this.sourceFile = file;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @throws MigrationConfigException if a required value is missing
         */
        public MigrationConfig build() {
            List<String> missing = new ArrayList<>();
            requireCredentials("source", sourceCredentials, missing);
            requireCredentials("destination", destinationCredentials, missing);
            if (isBlank(sourceAccountId)) missing.add("migration.source.account-id");
            if (isBlank(organizationId)) missing.add("migration.destination.organization-id");
            if (!missing.isEmpty()) {
                throw new MigrationConfigException("Missing required configuration: " + String.join(", ", missing));
            }
            return new MigrationConfig(this);
        }

        private static void requireCredentials(String side, OAuthCredentials c, List<String> missing) {
            String prefix = "migration." + side + ".";
            if (c == null) {
                missing.add(prefix + "client-id");
                missing.add(prefix + "client-secret");
                missing.add(prefix + "refresh-token");
                return;
            }
            if (isBlank(c.clientId())) missing.add(prefix + "client-id");
            if (isBlank(c.clientSecret())) missing.add(prefix + "client-secret");
            if (isBlank(c.refreshToken())) missing.add(prefix + "refresh-token");
        }

        private static boolean isBlank(String s) {
            return s == null || s.isBlank();
        }
    }
}
