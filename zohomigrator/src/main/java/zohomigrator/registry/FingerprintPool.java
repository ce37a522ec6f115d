package zohomigrator.registry;

import zohomigrator.model.destination.DestinationEntity;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Destination records that were present before the stage started, grouped
 * by {@link Fingerprint}.
 *
 * <p>Unlike {@link DedupIndex} every id is handed out at most once: two
 * source records with the same fingerprint match two existing destination
 * records, never one. Records created during the run are not added, so
 * identical source records each get their own write.
 */
public final class FingerprintPool {

    private final Map<String, Deque<String>> available = new HashMap<>();

    public static FingerprintPool of(Collection<? extends DestinationEntity> existing) {
        FingerprintPool pool = new FingerprintPool();
        for (DestinationEntity e : existing) {
            pool.add(e.naturalKey(), e.id());
        }
        return pool;
    }

    public void add(String fingerprint, String destinationId) {
        if (fingerprint == null || fingerprint.isBlank() || destinationId == null) return;
        available.computeIfAbsent(DedupIndex.normalize(fingerprint), k -> new ArrayDeque<>()).addLast(destinationId);
    }

    /**
     * Takes the next unclaimed destination id with this fingerprint.
     */
    public Optional<String> claim(String fingerprint) {
        if (fingerprint == null || fingerprint.isBlank()) return Optional.empty();
        Deque<String> ids = available.get(DedupIndex.normalize(fingerprint));
        if (ids == null || ids.isEmpty()) return Optional.empty();
        return Optional.of(ids.pollFirst());
    }

    /** Returns the number of ids not yet claimed. */
    public int remaining() {
        int n = 0;
        for (Deque<String> ids : available.values()) {
            n += ids.size();
        }
        return n;
    }
}
