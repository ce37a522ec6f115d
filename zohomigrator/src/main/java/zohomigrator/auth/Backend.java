package zohomigrator.auth;

/**
 * The two OAuth-protected APIs a migration talks to.
 */
public enum Backend {
    /** FreshBooks, the system records are read from. */
    SOURCE("FreshBooks", "source"),
    /** Zoho Books, the system records are written to. */
    DESTINATION("Zoho Books", "destination");

    private final String displayName;
    private final String configKey;

    Backend(String displayName, String configKey) {
        this.displayName = displayName;
        this.configKey = configKey;
    }

    public String displayName() {
        return displayName;
    }

    /** Key segment used under {@code migration.} in configuration files. */
    public String configKey() {
        return configKey;
    }
}
