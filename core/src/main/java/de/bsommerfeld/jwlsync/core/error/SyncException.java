package de.bsommerfeld.jwlsync.core.error;

/**
 * Root of the merge error taxonomy. Thrown when a run fails unrecoverably;
 * any open destination transaction has already been rolled back by the time
 * a caller sees it.
 */
public class SyncException extends Exception {

    private final MergePhase phase;

    public SyncException(MergePhase phase, String message) {
        super(message);
        this.phase = phase;
    }

    public SyncException(MergePhase phase, String message, Throwable cause) {
        super(message, cause);
        this.phase = phase;
    }

    public MergePhase phase() {
        return phase;
    }
}
