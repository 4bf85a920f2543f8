package de.bsommerfeld.jwlsync.core.error;

/**
 * The inputs cannot be merged: schema versions differ, or an archive, store or
 * manifest is missing, unreadable or malformed.
 */
public class IncompatibleInputException extends SyncException {

    public IncompatibleInputException(MergePhase phase, String message) {
        super(phase, message);
    }

    public IncompatibleInputException(MergePhase phase, String message, Throwable cause) {
        super(phase, message, cause);
    }
}
