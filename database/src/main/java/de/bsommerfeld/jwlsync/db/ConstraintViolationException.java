package de.bsommerfeld.jwlsync.db;

import de.bsommerfeld.jwlsync.core.error.MergePhase;
import de.bsommerfeld.jwlsync.core.error.SyncException;

/**
 * The destination store rejected the merge transaction because of a
 * constraint that duplicate recovery does not cover (NOT NULL, CHECK,
 * FOREIGN KEY, or a failed commit). The whole run is rolled back.
 */
public class ConstraintViolationException extends SyncException {

    private final EntityKind kind;

    /**
     * @param kind the kind being merged when the violation occurred, or
     *             {@code null} if it surfaced at commit
     */
    public ConstraintViolationException(EntityKind kind, Throwable cause) {
        super(MergePhase.MERGE, "Database constraint violation"
                + (kind != null ? " in " + kind : "") + ": " + cause.getMessage(), cause);
        this.kind = kind;
    }

    public EntityKind kind() {
        return kind;
    }
}
