package zohomigrator.config;

import java.net.URI;
import java.util.Locale;
import java.util.Optional;

/**
 * Zoho data-center regions. Each region has its own API host and its own
 * accounts server for OAuth.
 */
public enum Region {
    COM("com", "com"),
    EU("eu", "eu"),
    IN("in", "in"),
    AU("au", "com.au");

    private final String code;
    private final String domain;

    Region(String code, String domain) {
        this.code = code;
        this.domain = domain;
    }

    /** Configuration code, e.g. {@code eu}. */
    public String code() {
        return code;
    }

    /** Books API v3 base URL for this region. */
    public URI apiBaseUrl() {
        return URI.create("https://www.zohoapis." + domain + "/books/v3");
    }

    /** OAuth token endpoint for this region. */
    public URI tokenUrl() {
        return URI.create("https://accounts.zoho." + domain + "/oauth/v2/token");
    }

    /**
     * Looks up a region by its configuration code, case-insensitively.
     *
     * @param code region code such as {@code com} or {@code au}
     * @return the region, or empty if unknown
     */
    public static Optional<Region> fromCode(String code) {
        if (code == null) return Optional.empty();
        String c = code.trim().toLowerCase(Locale.ROOT);
        for (Region r : values()) {
            if (r.code.equals(c) || r.domain.equals(c)) return Optional.of(r);
        }
        return Optional.empty();
    }
}
