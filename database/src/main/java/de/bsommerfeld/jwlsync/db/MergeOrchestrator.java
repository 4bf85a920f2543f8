package de.bsommerfeld.jwlsync.db;

import com.google.inject.Singleton;
import de.bsommerfeld.jwlsync.core.error.ArchiveIoException;
import de.bsommerfeld.jwlsync.core.error.MergePhase;
import de.bsommerfeld.jwlsync.core.error.SyncException;
import de.bsommerfeld.jwlsync.core.progress.ProgressTracker;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the {@link MergeSchedule} against a source and a destination store.
 *
 * <h3>Transaction boundary</h3>
 * The destination connection is opened once with auto-commit off. Every kind
 * is merged inside that single transaction, which commits only after the last
 * kind succeeded. Any failure, whether a {@link SyncException} from the
 * merger, a failed commit or a runtime error, rolls the transaction back
 * before the error propagates: a merge is either fully persisted or not at
 * all.
 *
 * <h3>Progress</h3>
 * Each step reports its start value with its label before the kind is merged
 * and its end value afterwards.
 *
 * <p>
 * Every call creates its own {@link IdTranslationTable}, so independent runs
 * on separate workspaces may use one instance concurrently.
 */
@Singleton
public class MergeOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(MergeOrchestrator.class);

    private final SqliteStores stores;
    private final TableMerger tableMerger;
    private final ReferenceVerifier referenceVerifier;
    private final MergeSchedule schedule;

    @Inject
    public MergeOrchestrator(SqliteStores stores, TableMerger tableMerger, ReferenceVerifier referenceVerifier) {
        this(stores, tableMerger, referenceVerifier, MergeSchedule.DEFAULT);
    }

    public MergeOrchestrator(SqliteStores stores, TableMerger tableMerger, ReferenceVerifier referenceVerifier,
            MergeSchedule schedule) {
        this.stores = stores;
        this.tableMerger = tableMerger;
        this.referenceVerifier = referenceVerifier;
        this.schedule = schedule;
    }

    /**
     * Merges {@code sourceStore} into {@code destinationStore}.
     *
     * @throws SyncException after rolling back, if any kind fails or the commit
     *                       is rejected; the destination store is unchanged
     */
    public MergeReport merge(Path sourceStore, Path destinationStore, ProgressTracker progress)
            throws SyncException {
        LOG.info("Merging {} into {}", sourceStore.getFileName(), destinationStore);

        try (Connection source = stores.openReadOnly(sourceStore);
                Connection destination = stores.open(destinationStore)) {

            destination.setAutoCommit(false);
            List<TableMergeResult> results = runSchedule(source, destination, progress);

            MergeReport report = verifyCommitted(destination, results);
            LOG.info("Merge committed: {}", report);
            return report;
        } catch (SQLException e) {
            throw new ArchiveIoException(MergePhase.MERGE, "Failed to access database: " + e.getMessage(), e);
        }
    }

    /**
     * Runs the reference check on the committed store. The merge is already
     * persisted at this point, so a failing check only degrades the report.
     */
    private MergeReport verifyCommitted(Connection destination, List<TableMergeResult> results) {
        try {
            return new MergeReport(results, referenceVerifier.verify(destination));
        } catch (SQLException e) {
            LOG.warn("Merge committed, but the reference check failed: {}", e.getMessage(), e);
            return new MergeReport(results, List.of(), false);
        }
    }

    /**
     * Merges every scheduled kind and commits. Leaves the connection in
     * auto-commit mode on success.
     */
    private List<TableMergeResult> runSchedule(Connection source, Connection destination, ProgressTracker progress)
            throws SyncException {
        IdTranslationTable translations = new IdTranslationTable();
        List<TableMergeResult> results = new ArrayList<>();
        try {
            for (MergeStep step : schedule.steps()) {
                progress.report(step.startProgress(), step.label());

                List<ForeignKeyBinding> bindings = new ArrayList<>();
                for (ForeignKey fk : step.kind().foreignKeys()) {
                    bindings.add(translations.bind(fk));
                }
                results.add(tableMerger.merge(source, destination, step.kind(), bindings, translations));

                progress.report(step.endProgress());
            }
            commit(destination);
            return results;
        } catch (SyncException | RuntimeException e) {
            LOG.error("Merge aborted, rolling back: {}", e.getMessage());
            rollback(destination, e);
            throw e;
        }
    }

    private void commit(Connection destination) throws ConstraintViolationException, ArchiveIoException {
        try {
            destination.commit();
            destination.setAutoCommit(true);
        } catch (SQLException e) {
            if (SqliteErrors.isConstraintViolation(e)) {
                throw new ConstraintViolationException(null, e);
            }
            throw new ArchiveIoException(MergePhase.MERGE, "Failed to commit merge: " + e.getMessage(), e);
        }
    }

    private void rollback(Connection destination, Exception cause) {
        try {
            destination.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }
}
