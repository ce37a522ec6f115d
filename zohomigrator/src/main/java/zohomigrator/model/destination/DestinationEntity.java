package zohomigrator.model.destination;

/**
 * A record as returned by Zoho Books.
 */
public interface DestinationEntity {

    /** Destination-assigned id. */
    String id();

    /**
     * Identity used for de-duplication against source records: a name, an
     * invoice number, or a fingerprint for records without a natural name.
     * May be null when the record lacks the identifying fields.
     */
    String naturalKey();
}
