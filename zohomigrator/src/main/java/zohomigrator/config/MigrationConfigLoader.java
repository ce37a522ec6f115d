package zohomigrator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Loads migration configuration from properties or YAML files, chosen by
 * file extension.
 *
 * <p>YAML documents are flattened to dotted keys, so nested and dotted
 * spellings are equivalent. System properties override file values
 * (e.g. {@code -Dmigration.rate.max-requests=50}).
 *
 * <h2>Configuration Properties:</h2>
 * <ul>
 *   <li>{@code migration.source.client-id}, {@code client-secret}, {@code access-token},
 *       {@code refresh-token}, {@code account-id}, {@code base-url}, {@code token-url}, {@code page-size}</li>
 *   <li>{@code migration.destination.client-id}, {@code client-secret}, {@code access-token},
 *       {@code refresh-token}, {@code organization-id}, {@code region}, {@code base-url},
 *       {@code token-url}, {@code duplicate-codes}</li>
 *   <li>{@code migration.rate.max-requests}, {@code migration.rate.window.seconds},
 *       {@code migration.rate.throttle-backoff.seconds}</li>
 *   <li>{@code migration.http.timeout.seconds}</li>
 *   <li>{@code migration.alert.level} - DEBUG, WARNING, or ERROR</li>
 *   <li>{@code migration.categories.hierarchy.<parent>} - list of child account names</li>
 *   <li>{@code migration.categories.mapping.<FreshBooks name>} - Zoho account name</li>
 *   <li>{@code migration.expenses.paid-through.<bank account name>} - Zoho account id</li>
 *   <li>{@code migration.payments.deposit-accounts.<gateway|type|default>} - Zoho account id</li>
 *   <li>{@code migration.business-tags.*} - business line tagging</li>
 * </ul>
 *
 * @see MigrationConfig
 */
public final class MigrationConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(MigrationConfigLoader.class);

    private static final String HIERARCHY_PREFIX = "migration.categories.hierarchy.";
    private static final String CATEGORY_MAPPING_PREFIX = "migration.categories.mapping.";
    private static final String PAID_THROUGH_PREFIX = "migration.expenses.paid-through.";
    private static final String DEPOSIT_PREFIX = "migration.payments.deposit-accounts.";
    private static final String TAGS_PREFIX = "migration.business-tags.";

    private MigrationConfigLoader() {}

    /**
     * Loads configuration from an external file.
     *
     * @param path path to the configuration file (.properties or .yml/.yaml)
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     * @throws MigrationConfigException if the configuration is invalid
     */
    public static MigrationConfig loadFromFile(Path path) throws IOException {
        String name = path.getFileName().toString();
        try (InputStream is = Files.newInputStream(path)) {
            if (isYaml(name)) {
                return loadYaml(is, name, path);
            }
            return loadProperties(is, name, path);
        }
    }

    /**
     * Loads configuration from an external file path.
     *
     * @param path path to the configuration file
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     */
    public static MigrationConfig loadFromFile(String path) throws IOException {
        return loadFromFile(Path.of(path));
    }

    static boolean isYaml(String fileName) {
        return fileName.endsWith(".yml") || fileName.endsWith(".yaml");
    }

    private static MigrationConfig loadProperties(InputStream is, String source, Path file) {
        try {
            Properties props = new Properties();
            props.load(is);
            Map<String, String> flat = new TreeMap<>();
            for (String key : props.stringPropertyNames()) {
                flat.put(key, props.getProperty(key));
            }
            log.info("Loaded config from {}", source);
            return parse(flat, file);
        } catch (IOException e) {
            throw new MigrationConfigException("Failed to load " + source, e);
        }
    }

    private static MigrationConfig loadYaml(InputStream is, String source, Path file) {
        Map<String, Object> root;
        try {
            root = new Yaml().load(is);
        } catch (YAMLException e) {
            throw new MigrationConfigException("Failed to parse " + source, e);
        }
        Map<String, String> flat = new LinkedHashMap<>();
        if (root != null) {
            flatten("", root, flat);
        }
        log.info("Loaded config from {}", source);
        return parse(flat, file);
    }

    @SuppressWarnings("unchecked")
    private static void flatten(String prefix, Map<String, Object> map, Map<String, String> out) {
        for (var entry : map.entrySet()) {
            String key = prefix.isEmpty() ? String.valueOf(entry.getKey()) : prefix + "." + entry.getKey();
            Object val = entry.getValue();
            if (val instanceof Map) {
                flatten(key, (Map<String, Object>) val, out);
            } else if (val instanceof List<?> list) {
                out.put(key, list.stream().map(String::valueOf).collect(Collectors.joining(",")));
            } else if (val instanceof Date date) {
                // unquoted YAML dates arrive as timestamps at UTC midnight
                out.put(key, date.toInstant().atZone(ZoneOffset.UTC).toLocalDate().toString());
            } else if (val != null) {
                out.put(key, val.toString());
            }
        }
    }

    private static MigrationConfig parse(Map<String, String> props, Path file) {
        MigrationConfig.Builder b = MigrationConfig.builder().sourceFile(file);

        b.sourceCredentials(credentials(props, "migration.source."));
        getString(props, "migration.source.account-id").ifPresent(b::sourceAccountId);
        getUri(props, "migration.source.base-url").ifPresent(b::sourceBaseUrl);
        getUri(props, "migration.source.token-url").ifPresent(b::sourceTokenUrl);
        getInt(props, "migration.source.page-size").ifPresent(v -> {
            if (v > 0) b.sourcePageSize(v);
        });

        b.destinationCredentials(credentials(props, "migration.destination."));
        getString(props, "migration.destination.organization-id").ifPresent(b::organizationId);
        getString(props, "migration.destination.region").ifPresent(v -> {
            Optional<Region> region = Region.fromCode(v);
            if (region.isPresent()) {
                b.region(region.get());
            } else {
                log.warn("Invalid destination.region: {}", v);
            }
        });
        getUri(props, "migration.destination.base-url").ifPresent(b::destinationBaseUrl);
        getUri(props, "migration.destination.token-url").ifPresent(b::destinationTokenUrl);
        getString(props, "migration.destination.duplicate-codes").ifPresent(v -> {
            Set<Integer> codes = new LinkedHashSet<>();
            for (String part : splitList(v)) {
                try {
                    codes.add(Integer.parseInt(part));
                } catch (NumberFormatException e) {
                    log.warn("Invalid duplicate code: {}", part);
                }
            }
            if (!codes.isEmpty()) b.duplicateCodes(codes);
        });

        getInt(props, "migration.rate.max-requests").ifPresent(v -> {
            if (v > 0) b.maxRequestsPerWindow(v);
        });
        getLong(props, "migration.rate.window.seconds").ifPresent(v -> {
            if (v > 0) b.rateWindowSeconds(v);
        });
        getLong(props, "migration.rate.throttle-backoff.seconds").ifPresent(v -> {
            if (v >= 0) b.throttleBackoffSeconds(v);
        });
        getLong(props, "migration.http.timeout.seconds").ifPresent(v -> {
            if (v > 0) b.httpTimeoutSeconds(v);
        });

        getString(props, "migration.alert.level").ifPresent(v -> {
            try {
                b.alertLevel(AlertLevel.valueOf(v.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid alert.level: {}", v);
            }
        });

        Map<String, List<String>> hierarchy = new LinkedHashMap<>();
        withPrefix(props, HIERARCHY_PREFIX).forEach((parent, children) -> hierarchy.put(parent, splitList(children)));
        b.categoryHierarchy(hierarchy);
        b.categoryNameMapping(withPrefix(props, CATEGORY_MAPPING_PREFIX));
        b.paidThroughAccounts(withPrefix(props, PAID_THROUGH_PREFIX));
        b.depositAccounts(withPrefix(props, DEPOSIT_PREFIX));
        businessTags(props).ifPresent(b::businessTags);

        return b.build();
    }

    private static OAuthCredentials credentials(Map<String, String> props, String prefix) {
        return new OAuthCredentials(
                getString(props, prefix + "client-id").orElse(null),
                getString(props, prefix + "client-secret").orElse(null),
                getString(props, prefix + "access-token").orElse(""),
                getString(props, prefix + "refresh-token").orElse(null));
    }

    private static Optional<BusinessTagSettings> businessTags(Map<String, String> props) {
        Optional<String> primary = getString(props, TAGS_PREFIX + "primary");
        Optional<String> secondary = getString(props, TAGS_PREFIX + "secondary");
        if (primary.isEmpty() || secondary.isEmpty()) {
            return Optional.empty();
        }
        LocalDate startDate = getString(props, TAGS_PREFIX + "secondary-start-date").flatMap(v -> {
            try {
                return Optional.of(LocalDate.parse(v));
            } catch (DateTimeParseException e) {
                log.warn("Invalid business-tags.secondary-start-date: {}", v);
                return Optional.empty();
            }
        }).orElse(null);
        return Optional.of(new BusinessTagSettings(
                primary.get(),
                secondary.get(),
                startDate,
                getString(props, TAGS_PREFIX + "secondary-keywords").map(MigrationConfigLoader::splitList).orElse(List.of()),
                getString(props, TAGS_PREFIX + "tag-id").orElse(null),
                getString(props, TAGS_PREFIX + "primary-option-id").orElse(null),
                getString(props, TAGS_PREFIX + "secondary-option-id").orElse(null)));
    }

    private static Map<String, String> withPrefix(Map<String, String> props, String prefix) {
        Map<String, String> result = new LinkedHashMap<>();
        props.forEach((k, v) -> {
            if (k.startsWith(prefix) && k.length() > prefix.length()) {
                result.put(k.substring(prefix.length()), v.trim());
            }
        });
        for (String k : System.getProperties().stringPropertyNames()) {
            if (k.startsWith(prefix) && k.length() > prefix.length()) {
                result.put(k.substring(prefix.length()), System.getProperty(k).trim());
            }
        }
        return result;
    }

    private static List<String> splitList(String value) {
        List<String> result = new ArrayList<>();
        Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(result::add);
        return result;
    }

    private static Optional<String> getString(Map<String, String> props, String key) {
        String val = System.getProperty(key);
        if (val == null) val = props.get(key);
        if (val == null || val.isBlank()) return Optional.empty();
        return Optional.of(val.trim());
    }

    private static Optional<URI> getUri(Map<String, String> props, String key) {
        return getString(props, key).flatMap(v -> {
            try {
                return Optional.of(URI.create(v.endsWith("/") ? v.substring(0, v.length() - 1) : v));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid URL for {}: {}", key, v);
                return Optional.empty();
            }
        });
    }

    private static Optional<Long> getLong(Map<String, String> props, String key) {
        return getString(props, key).flatMap(v -> {
            try {
                return Optional.of(Long.parseLong(v));
            } catch (NumberFormatException e) {
                log.warn("Invalid number for {}: {}", key, v);
                return Optional.empty();
            }
        });
    }

    private static Optional<Integer> getInt(Map<String, String> props, String key) {
        return getString(props, key).flatMap(v -> {
            try {
                return Optional.of(Integer.parseInt(v));
            } catch (NumberFormatException e) {
                log.warn("Invalid number for {}: {}", key, v);
                return Optional.empty();
            }
        });
    }
}
