package de.bsommerfeld.jwlsync.core.event;

import de.bsommerfeld.jwlsync.core.error.MergePhase;
import de.bsommerfeld.jwlsync.core.progress.MergeProgress;

import java.nio.file.Path;

/**
 * Events published on the {@link ApplicationEventBus} during a merge run.
 */
public class SyncEvents {

    public record ProgressEvent(MergeProgress progress) {
    }

    /**
     * Fired once a merge has produced its archive.
     *
     * @param output   file the archive was written to, {@code null} if it was
     *                 only returned in memory
     * @param warnings number of recovered per-record degradations
     */
    public record MergeCompletedEvent(Path output, int warnings) {
    }

    public record MergeFailedEvent(MergePhase phase, String message) {
    }
}
