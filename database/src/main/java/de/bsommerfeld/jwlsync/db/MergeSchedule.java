package de.bsommerfeld.jwlsync.db;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Fixed merge order over all {@link EntityKind}s. A kind is only merged after
 * every kind it references, so its foreign keys can always be translated.
 * Progress ranges rise monotonically across the steps.
 */
public final class MergeSchedule {

    public static final MergeSchedule DEFAULT = new MergeSchedule(List.of(
            new MergeStep(EntityKind.LOCATION, 35, 45, "Merging locations..."),
            new MergeStep(EntityKind.USER_MARK, 45, 55, "Merging user marks..."),
            new MergeStep(EntityKind.BLOCK_RANGE, 55, 60, "Merging block ranges..."),
            new MergeStep(EntityKind.NOTE, 60, 70, "Merging notes..."),
            new MergeStep(EntityKind.PLAYLIST_ITEM, 70, 75, "Merging playlist items..."),
            new MergeStep(EntityKind.TAG, 75, 78, "Merging tags..."),
            new MergeStep(EntityKind.INPUT_FIELD, 78, 80, "Merging input fields..."),
            new MergeStep(EntityKind.TAG_MAP, 80, 85, "Merging tag mappings...")));

    private final List<MergeStep> steps;

    /**
     * @throws IllegalArgumentException if a kind appears twice, precedes a
     *                                  kind it references, or the progress
     *                                  ranges are not ascending
     */
    public MergeSchedule(List<MergeStep> steps) {
        Set<EntityKind> merged = EnumSet.noneOf(EntityKind.class);
        int lastProgress = 0;
        for (MergeStep step : steps) {
            EntityKind kind = step.kind();
            if (!merged.add(kind)) {
                throw new IllegalArgumentException(kind + " is scheduled twice");
            }
            for (EntityKind dependency : kind.dependencies()) {
                if (!merged.contains(dependency)) {
                    throw new IllegalArgumentException(kind + " is scheduled before " + dependency);
                }
            }
            if (step.startProgress() < lastProgress) {
                throw new IllegalArgumentException("Progress of " + kind + " goes backwards");
            }
            lastProgress = step.endProgress();
        }
        this.steps = List.copyOf(steps);
    }

    public List<MergeStep> steps() {
        return steps;
    }

    public int endProgress() {
        return steps.isEmpty() ? 0 : steps.get(steps.size() - 1).endProgress();
    }
}
