package de.bsommerfeld.jwlsync.db;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of a committed merge run: one {@link TableMergeResult} per kind in
 * schedule order, plus the dangling references found after commit.
 */
public final class MergeReport {

    private final List<TableMergeResult> tables;
    private final List<MergeWarning> danglingReferences;
    private final boolean referencesVerified;

    public MergeReport(List<TableMergeResult> tables, List<MergeWarning> danglingReferences) {
        this(tables, danglingReferences, true);
    }

    /**
     * @param referencesVerified {@code false} if the post-commit reference check
     *                           could not run; {@code danglingReferences} is
     *                           then empty
     */
    public MergeReport(List<TableMergeResult> tables, List<MergeWarning> danglingReferences,
            boolean referencesVerified) {
        this.tables = List.copyOf(tables);
        this.danglingReferences = List.copyOf(danglingReferences);
        this.referencesVerified = referencesVerified;
    }

    public List<TableMergeResult> tables() {
        return tables;
    }

    public Optional<TableMergeResult> table(EntityKind kind) {
        return tables.stream().filter(t -> t.kind() == kind).findFirst();
    }

    public List<MergeWarning> danglingReferences() {
        return danglingReferences;
    }

    public boolean referencesVerified() {
        return referencesVerified;
    }

    /** Every warning of the run: per-table warnings first, then dangling references. */
    public List<MergeWarning> warnings() {
        List<MergeWarning> all = new ArrayList<>();
        tables.forEach(t -> all.addAll(t.warnings()));
        all.addAll(danglingReferences);
        return Collections.unmodifiableList(all);
    }

    public int totalInserted() {
        return tables.stream().mapToInt(TableMergeResult::inserted).sum();
    }

    public int totalDuplicates() {
        return tables.stream().mapToInt(t -> t.duplicates() + t.conflicts()).sum();
    }

    @Override
    public String toString() {
        return "MergeReport[inserted=" + totalInserted() + ", duplicates=" + totalDuplicates()
                + ", warnings=" + warnings().size() + "]";
    }
}
