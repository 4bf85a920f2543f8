package de.bsommerfeld.jwlsync.db;

import java.util.List;

/**
 * Chooses the columns whose exact, NULL-aware equality means "this record
 * already exists in the destination".
 */
@FunctionalInterface
public interface DuplicateKeyPolicy {

    /** Every non-surrogate column must match. */
    DuplicateKeyPolicy ALL_COLUMNS = row -> row.kind().columns();

    /**
     * Returns the detection key columns for the given (already remapped) row.
     * The result must be a subset of {@link EntityKind#columns()}.
     */
    List<String> keyColumns(Row row);
}
