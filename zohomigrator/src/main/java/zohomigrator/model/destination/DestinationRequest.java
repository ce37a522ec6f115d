package zohomigrator.model.destination;

/**
 * Write-side payload for one Zoho Books create or update call.
 *
 * <p>Requests carry only fields the destination accepts and never a
 * destination id; absent fields are omitted from the JSON body.
 */
public interface DestinationRequest {
}
