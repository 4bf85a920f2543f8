package de.bsommerfeld.jwlsync.db;

/**
 * A recovered per-record degradation. Warnings never abort a run; they are
 * collected into the {@link TableMergeResult} and {@link MergeReport} so
 * callers can inspect them.
 *
 * @param type     what went wrong
 * @param kind     the kind of the affected record
 * @param sourceId source-side surrogate id of the record, if any
 * @param column   the affected column, if the warning concerns one
 * @param value    the offending value, if any
 * @param detail   human-readable description
 */
public record MergeWarning(Type type, EntityKind kind, Long sourceId, String column, Object value, String detail) {

    public enum Type {
        /**
         * A non-NULL foreign key had no translation. The source value was kept
         * and may point at an unrelated or missing destination row.
         */
        UNRESOLVED_REFERENCE,
        /**
         * An insert hit a uniqueness constraint and the conflicting
         * destination row could not be located; no id mapping was recorded.
         */
        CONFLICT_UNMAPPED,
        /** After commit, a foreign key in the destination points at no row. */
        DANGLING_REFERENCE
    }

    static MergeWarning unresolved(Row row, ForeignKeyBinding binding, Object value) {
        return new MergeWarning(Type.UNRESOLVED_REFERENCE, row.kind(), row.sourceId(), binding.column(), value,
                row.kind() + "." + binding.column() + ": No mapping found for ID " + value);
    }

    static MergeWarning conflictUnmapped(Row row) {
        return new MergeWarning(Type.CONFLICT_UNMAPPED, row.kind(), row.sourceId(), null, null,
                "Duplicate " + row.kind() + " rejected by the store but no existing record matched "
                        + row.asMap());
    }

    static MergeWarning dangling(EntityKind kind, Long rowId, ForeignKey foreignKey, Object value) {
        return new MergeWarning(Type.DANGLING_REFERENCE, kind, rowId, foreignKey.column(), value,
                kind + "." + foreignKey.column() + "=" + value + " references no "
                        + foreignKey.references());
    }
}
