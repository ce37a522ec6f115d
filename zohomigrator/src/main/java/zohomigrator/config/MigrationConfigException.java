package zohomigrator.config;

/**
 * Exception thrown when migration configuration cannot be loaded or is invalid.
 *
 * <p>This exception is thrown when:
 * <ul>
 *   <li>The file cannot be parsed (invalid YAML/properties syntax)</li>
 *   <li>Required credentials or identifiers are missing</li>
 * </ul>
 *
 * <p>Unchecked so configuration loading can sit in start-up code without
 * forced exception handling.
 *
 * @see MigrationConfigLoader
 */
public class MigrationConfigException extends RuntimeException {

    public MigrationConfigException(String message) {
        super(message);
    }

    public MigrationConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
