package de.bsommerfeld.jwlsync.db;

import java.util.List;

/**
 * Outcome of merging one {@link EntityKind}.
 *
 * @param kind       the merged kind
 * @param read       source records visited
 * @param inserted   records added to the destination
 * @param duplicates records found already present by the detection key
 * @param conflicts  inserts rejected by a uniqueness constraint and treated as
 *                   duplicates
 * @param warnings   recovered degradations, in source order
 */
public record TableMergeResult(EntityKind kind, int read, int inserted, int duplicates, int conflicts,
        List<MergeWarning> warnings) {

    public TableMergeResult {
        warnings = List.copyOf(warnings);
    }
}
