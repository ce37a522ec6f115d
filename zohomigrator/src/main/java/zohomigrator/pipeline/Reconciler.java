package zohomigrator.pipeline;

import zohomigrator.exceptions.DestinationApiException;
import zohomigrator.exceptions.MigrateException;
import zohomigrator.gateway.DestinationClient;
import zohomigrator.gateway.DestinationResource;
import zohomigrator.model.destination.DestinationEntity;
import zohomigrator.model.destination.DestinationRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Creates a record, falling back to the existing one when Zoho reports that
 * it already exists.
 *
 * <p>On a duplicate error the resource is listed again and matched by
 * natural key, case-insensitively. Without a match the original error
 * stands.
 */
public final class Reconciler {

    private static final Logger log = LoggerFactory.getLogger(Reconciler.class);

    /**
     * @param id destination id
     * @param existing true if the record was already in the destination
     */
    public record Outcome(String id, boolean existing) {}

    private final DestinationClient client;

    public Reconciler(DestinationClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    public <E extends DestinationEntity> Outcome createOrMatch(DestinationResource resource,
                                                               DestinationRequest request,
                                                               String naturalKey,
                                                               String placeholderKey,
                                                               Class<E> type) throws MigrateException {
        try {
            return new Outcome(client.create(resource, request, placeholderKey), false);
        } catch (DestinationApiException e) {
            if (!e.isDuplicate() || naturalKey == null) {
                throw e;
            }
            log.debug("{} '{}' already exists, looking it up", resource.entityType().singular(), naturalKey);
            List<E> current = client.listAll(resource, type);
            for (E entity : current) {
                if (entity.naturalKey() != null && entity.naturalKey().trim().equalsIgnoreCase(naturalKey.trim())) {
                    return new Outcome(entity.id(), true);
                }
            }
            throw e;
        }
    }
}
