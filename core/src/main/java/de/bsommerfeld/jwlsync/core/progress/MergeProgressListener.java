package de.bsommerfeld.jwlsync.core.progress;

/**
 * Callback for tracking merge progress. Invoked on the thread running the
 * merge; implementations must return quickly and buffer or hand off any slow
 * work.
 */
@FunctionalInterface
public interface MergeProgressListener {

    /** Listener that discards every update. */
    MergeProgressListener NONE = progress -> {
    };

    /**
     * Called zero or more times per run with non-decreasing percentages.
     *
     * @param progress the current progress snapshot
     */
    void onProgress(MergeProgress progress);
}
