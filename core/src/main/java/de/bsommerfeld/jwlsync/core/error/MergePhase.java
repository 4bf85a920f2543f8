package de.bsommerfeld.jwlsync.core.error;

/**
 * Pipeline phase in which a {@link SyncException} was raised. Carried on every
 * error so callers can tell the end user where a run stopped.
 */
public enum MergePhase {

    EXTRACT("Extracting archives"),
    VALIDATE("Validating backups"),
    MERGE("Merging databases"),
    MANIFEST("Updating manifest"),
    PACK("Creating archive");

    private final String label;

    MergePhase(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
