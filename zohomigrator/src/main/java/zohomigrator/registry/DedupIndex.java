package zohomigrator.registry;

import zohomigrator.model.destination.DestinationEntity;

import java.util.Collection;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Case-insensitive natural key to destination id lookup.
 *
 * <p>Built from the records already present in the destination and extended
 * with every record created during the stage, so later source records with
 * the same key are recognized as duplicates. The first id seen for a key wins.
 */
public final class DedupIndex {

    private final Map<String, String> byKey = new HashMap<>();

    static String normalize(String key) {
        return key.trim().toLowerCase(Locale.ROOT);
    }

    public Optional<String> find(String key) {
        if (key == null || key.isBlank()) return Optional.empty();
        return Optional.ofNullable(byKey.get(normalize(key)));
    }

    public boolean contains(String key) {
        return find(key).isPresent();
    }

    /**
     * Adds a key unless it is blank or already present.
     *
     * @return true if the key was added
     */
    public boolean add(String key, String destinationId) {
        if (key == null || key.isBlank() || destinationId == null) return false;
        return byKey.putIfAbsent(normalize(key), destinationId) == null;
    }

    /** Indexes existing destination records by their natural key. */
    public void addAll(Collection<? extends DestinationEntity> entities) {
        for (DestinationEntity e : entities) {
            add(e.naturalKey(), e.id());
        }
    }

    public int size() {
        return byKey.size();
    }
}
