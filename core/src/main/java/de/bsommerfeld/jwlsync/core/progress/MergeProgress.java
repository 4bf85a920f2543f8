package de.bsommerfeld.jwlsync.core.progress;

/**
 * Immutable snapshot of merge progress, consumed by whatever the caller uses
 * to render status (console, job table, UI).
 *
 * @param percent overall progress of the run, 0 to 100
 * @param message human-readable status, or {@code null} when only the
 *                percentage advanced
 */
public record MergeProgress(int percent, String message) {

    public static final int COMPLETE = 100;

    public static MergeProgress of(int percent, String message) {
        return new MergeProgress(clamp(percent), message);
    }

    /** Progress update without a new status line. */
    public static MergeProgress of(int percent) {
        return new MergeProgress(clamp(percent), null);
    }

    public boolean isComplete() {
        return percent >= COMPLETE;
    }

    private static int clamp(int percent) {
        return Math.max(0, Math.min(COMPLETE, percent));
    }
}
