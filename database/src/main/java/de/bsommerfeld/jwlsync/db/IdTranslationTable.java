package de.bsommerfeld.jwlsync.db;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Per-run mapping from source-store surrogate ids to destination-store
 * surrogate ids, one map per {@link EntityKind} with a surrogate id.
 *
 * <p>
 * A table is filled while its kind is merged and only read by kinds merged
 * later. {@link MergeSchedule} guarantees every referenced kind is merged
 * first, so a lookup never hits a kind that has not been merged yet; this is
 * not checked at runtime. Each source id is recorded exactly once per run
 * because every source row is visited once.
 *
 * <p>
 * Instances are not thread-safe and must not be shared between runs.
 */
public final class IdTranslationTable {

    private final Map<EntityKind, Map<Long, Long>> mappings = new EnumMap<>(EntityKind.class);

    /**
     * Records that source id {@code oldId} of {@code kind} corresponds to
     * destination id {@code newId}.
     *
     * @throws IllegalArgumentException if the kind has no surrogate id
     */
    public void record(EntityKind kind, long oldId, long newId) {
        if (!kind.hasSurrogateId()) {
            throw new IllegalArgumentException(kind + " has no surrogate id to translate");
        }
        mappings.computeIfAbsent(kind, k -> new HashMap<>()).put(oldId, newId);
    }

    /** Returns the destination id for {@code oldId}, or {@code null} if unmapped. */
    public Long lookup(EntityKind kind, long oldId) {
        Map<Long, Long> table = mappings.get(kind);
        return table == null ? null : table.get(oldId);
    }

    public int size(EntityKind kind) {
        Map<Long, Long> table = mappings.get(kind);
        return table == null ? 0 : table.size();
    }

    /** Read-only view of one kind's mappings. */
    public Map<Long, Long> mappings(EntityKind kind) {
        return Collections.unmodifiableMap(mappings.getOrDefault(kind, Map.of()));
    }

    /** Binds a foreign key to this table so the merger can translate its values. */
    public ForeignKeyBinding bind(ForeignKey foreignKey) {
        return new ForeignKeyBinding(foreignKey, this);
    }
}
