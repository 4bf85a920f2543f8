package de.bsommerfeld.jwlsync.core.error;

/**
 * I/O failure unrelated to merge logic: unpacking, packing, workspace handling
 * or opening and closing a store.
 */
public class ArchiveIoException extends SyncException {

    public ArchiveIoException(MergePhase phase, String message, Throwable cause) {
        super(phase, message, cause);
    }
}
