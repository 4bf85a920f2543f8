package de.bsommerfeld.jwlsync.core.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-run guard in front of a caller's {@link MergeProgressListener}.
 *
 * <p>
 * Percentages never move backwards: a report below the highest value seen so
 * far is raised to that value. A listener that throws is logged and skipped,
 * the merge itself carries on.
 */
public final class ProgressTracker {

    private static final Logger LOG = LoggerFactory.getLogger(ProgressTracker.class);

    private final MergeProgressListener listener;
    private int current;

    public ProgressTracker(MergeProgressListener listener) {
        this.listener = listener == null ? MergeProgressListener.NONE : listener;
    }

    public void report(int percent, String message) {
        emit(MergeProgress.of(Math.max(current, percent), message));
    }

    public void report(int percent) {
        emit(MergeProgress.of(Math.max(current, percent)));
    }

    public void complete(String message) {
        report(MergeProgress.COMPLETE, message);
    }

    public int current() {
        return current;
    }

    private void emit(MergeProgress progress) {
        current = progress.percent();
        LOG.debug("Progress {}%: {}", progress.percent(), progress.message());
        try {
            listener.onProgress(progress);
        } catch (RuntimeException e) {
            LOG.warn("Progress listener failed at {}%", progress.percent(), e);
        }
    }
}
