package zohomigrator.model.source;

/**
 * A record read from FreshBooks.
 *
 * <p>Every record has a source-local integer id and a liveness flag:
 * {@code vis_state} absent or {@code 0} means active, anything else means
 * deleted or archived. Archived records are never migrated.
 */
public interface SourceRecord {

    int id();

    Integer visState();

    /** Human-readable label used in summaries and error reports. */
    String label();

    default boolean isArchived() {
        Integer state = visState();
        return state != null && state != 0;
    }
}
