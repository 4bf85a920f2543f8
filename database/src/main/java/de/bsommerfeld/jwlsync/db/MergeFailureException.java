package de.bsommerfeld.jwlsync.db;

import de.bsommerfeld.jwlsync.core.error.MergePhase;
import de.bsommerfeld.jwlsync.core.error.SyncException;

/**
 * A single entity kind could not be merged because of a store error other than
 * a recoverable duplicate conflict. The whole run is rolled back.
 */
public class MergeFailureException extends SyncException {

    private final EntityKind kind;

    public MergeFailureException(EntityKind kind, Throwable cause) {
        super(MergePhase.MERGE, "Error merging table " + kind + ": " + cause.getMessage(), cause);
        this.kind = kind;
    }

    public EntityKind kind() {
        return kind;
    }
}
