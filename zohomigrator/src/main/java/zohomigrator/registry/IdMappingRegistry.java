package zohomigrator.registry;

import zohomigrator.exceptions.MappingConflictException;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Cross-stage memory of a migration run.
 *
 * <p>Holds, per entity type, the source id to destination id mapping and the
 * de-duplication index. Created empty at pipeline start and filled stage by
 * stage; later stages resolve references through it.
 *
 * <p>Mappings are write-once: registering a different destination id for a
 * source id that is already mapped throws {@link MappingConflictException}.
 * Registering the same pair again is a no-op.
 */
public final class IdMappingRegistry {

    private final Map<EntityType, Map<Integer, String>> ids = new EnumMap<>(EntityType.class);
    private final Map<EntityType, DedupIndex> indexes = new EnumMap<>(EntityType.class);
    private final Map<String, String> accountNames = new HashMap<>();
    private String defaultExpenseAccountId;

    /**
     * Records that a source record now exists in the destination.
     *
     * @throws MappingConflictException if the source id is already mapped elsewhere
     */
    public void register(EntityType type, int sourceId, String destinationId) {
        Objects.requireNonNull(destinationId, "destinationId");
        Map<Integer, String> table = ids.computeIfAbsent(type, t -> new HashMap<>());
        String existing = table.putIfAbsent(sourceId, destinationId);
        if (existing != null && !existing.equals(destinationId)) {
            throw new MappingConflictException(type.singular(), sourceId, existing, destinationId);
        }
    }

    /** Returns the destination id for a source id; empty for null or unmapped ids. */
    public Optional<String> lookup(EntityType type, Integer sourceId) {
        if (sourceId == null) return Optional.empty();
        Map<Integer, String> table = ids.get(type);
        return table == null ? Optional.empty() : Optional.ofNullable(table.get(sourceId));
    }

    public boolean isMapped(EntityType type, Integer sourceId) {
        return lookup(type, sourceId).isPresent();
    }

    public int size(EntityType type) {
        Map<Integer, String> table = ids.get(type);
        return table == null ? 0 : table.size();
    }

    /** Returns the de-duplication index for a type, creating it on first use. */
    public DedupIndex dedup(EntityType type) {
        return indexes.computeIfAbsent(type, t -> new DedupIndex());
    }

    /** Remembers the display name of a destination account, for reporting. */
    public void nameAccount(String accountId, String name) {
        if (accountId != null && name != null) {
            accountNames.putIfAbsent(accountId, name);
        }
    }

    public Optional<String> accountName(String accountId) {
        return Optional.ofNullable(accountNames.get(accountId));
    }

    /** Expense account used when an expense's category has no mapping. */
    public Optional<String> defaultExpenseAccount() {
        return Optional.ofNullable(defaultExpenseAccountId);
    }

    /** Sets the default expense account unless one is already chosen. */
    public void offerDefaultExpenseAccount(String accountId) {
        if (defaultExpenseAccountId == null && accountId != null) {
            defaultExpenseAccountId = accountId;
        }
    }
}
