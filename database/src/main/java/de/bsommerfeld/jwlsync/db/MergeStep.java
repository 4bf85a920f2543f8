package de.bsommerfeld.jwlsync.db;

/**
 * One entry of the {@link MergeSchedule}.
 *
 * @param kind          the kind merged in this step
 * @param startProgress overall progress reported before the step
 * @param endProgress   overall progress reported after the step
 * @param label         status line shown while the step runs
 */
public record MergeStep(EntityKind kind, int startProgress, int endProgress, String label) {

    public MergeStep {
        if (startProgress > endProgress) {
            throw new IllegalArgumentException("Progress range of " + kind + " runs backwards");
        }
    }
}
