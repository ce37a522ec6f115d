package zohomigrator.exceptions;

/**
 * Thrown when a source identifier is registered twice with different
 * destination identifiers.
 *
 * <p>This indicates a logic error in a stage, so it is unchecked.
 */
public class MappingConflictException extends RuntimeException {

    public MappingConflictException(String entityType, Object sourceKey, String existing, String attempted) {
        super("Conflicting " + entityType + " mapping for source " + sourceKey
                + ": already " + existing + ", attempted " + attempted);
    }
}
