package de.bsommerfeld.jwlsync.app;

import com.google.inject.Singleton;
import de.bsommerfeld.jwlsync.archive.ArchiveAdapter;
import de.bsommerfeld.jwlsync.archive.Workspace;
import de.bsommerfeld.jwlsync.archive.manifest.Manifest;
import de.bsommerfeld.jwlsync.archive.manifest.ManifestService;
import de.bsommerfeld.jwlsync.core.config.SyncConfig;
import de.bsommerfeld.jwlsync.core.error.ArchiveIoException;
import de.bsommerfeld.jwlsync.core.error.IncompatibleInputException;
import de.bsommerfeld.jwlsync.core.error.MergePhase;
import de.bsommerfeld.jwlsync.core.error.SyncException;
import de.bsommerfeld.jwlsync.core.event.ApplicationEventBus;
import de.bsommerfeld.jwlsync.core.event.SyncEvents;
import de.bsommerfeld.jwlsync.core.progress.MergeProgressListener;
import de.bsommerfeld.jwlsync.core.progress.ProgressTracker;
import de.bsommerfeld.jwlsync.db.MergeOrchestrator;
import de.bsommerfeld.jwlsync.db.MergeReport;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Merges a source backup into a destination backup.
 *
 * <h3>Pipeline</h3>
 * <pre>
 *  10%  extract both archives into a private workspace
 *  25%  read manifests, compare schema versions, locate both stores
 *  35%  merge the stores table by table (up to 85%)
 *  85%  update the destination manifest and repack the destination
 * 100%  done
 * </pre>
 *
 * The workspace is deleted when the run ends, whether it succeeded or not.
 * The service holds no per-run state, so independent merges may run
 * concurrently.
 */
@Singleton
public class MergeService {

    private static final Logger LOG = LoggerFactory.getLogger(MergeService.class);

    private final SyncConfig config;
    private final ArchiveAdapter archives;
    private final ManifestService manifests;
    private final MergeOrchestrator orchestrator;
    private final ApplicationEventBus eventBus;

    @Inject
    public MergeService(SyncConfig config, ArchiveAdapter archives, ManifestService manifests,
            MergeOrchestrator orchestrator, ApplicationEventBus eventBus) {
        this.config = config;
        this.archives = archives;
        this.manifests = manifests;
        this.orchestrator = orchestrator;
        this.eventBus = eventBus;
    }

    /**
     * Merges the {@code source} archive into the {@code destination} archive.
     *
     * Publishes a {@link SyncEvents.MergeCompletedEvent} without an output
     * path, since the archive is only returned in memory.
     *
     * @param listener receives progress, may be {@code null}
     * @throws SyncException if the run fails; nothing is produced in that case
     */
    public MergeResult merge(InputStream source, InputStream destination, MergeProgressListener listener)
            throws SyncException {
        try {
            MergeResult result = run(source, destination, new ProgressTracker(listener));
            eventBus.post(new SyncEvents.MergeCompletedEvent(null, result.report().warnings().size()));
            return result;
        } catch (SyncException e) {
            publishFailure(e);
            throw e;
        }
    }

    /**
     * Merges two archive files and writes the result as
     * {@code <outputDir>/merged_yyyy-MM-dd_HH-mm-ss.jwlibrary}.
     *
     * @param outputDir target directory, {@code null} for the configured one
     * @return the written archive
     * @throws SyncException if the run fails or the archive cannot be written
     */
    public Path merge(Path sourceArchive, Path destinationArchive, Path outputDir, MergeProgressListener listener)
            throws SyncException {
        Path targetDir = outputDir != null ? outputDir : config.getOutputDirectory();
        try {
            requireArchive(sourceArchive);
            requireArchive(destinationArchive);
            LOG.info("Source: {}", sourceArchive);
            LOG.info("Destination: {}", destinationArchive);

            MergeResult result;
            try (InputStream source = Files.newInputStream(sourceArchive);
                    InputStream destination = Files.newInputStream(destinationArchive)) {
                result = run(source, destination, new ProgressTracker(listener));
            } catch (IOException e) {
                throw new ArchiveIoException(MergePhase.EXTRACT, "Failed to read archive: " + e.getMessage(), e);
            }

            Path output = write(targetDir, result);
            eventBus.post(new SyncEvents.MergeCompletedEvent(output, result.report().warnings().size()));
            return output;
        } catch (SyncException e) {
            publishFailure(e);
            throw e;
        }
    }

    private MergeResult run(InputStream source, InputStream destination, ProgressTracker progress)
            throws SyncException {
        try (Workspace workspace = Workspace.create(config.getWorkspaceRoot())) {
            progress.report(10, "Extracting archives...");
            archives.unpack(source, workspace.sourceDir());
            archives.unpack(destination, workspace.destinationDir());

            progress.report(25, "Validating schema versions...");
            Manifest sourceManifest = manifests.read(workspace.sourceDir());
            Manifest destinationManifest = manifests.read(workspace.destinationDir());
            manifests.validate(sourceManifest, destinationManifest);
            Path sourceStore = manifests.storeFile(workspace.sourceDir(), sourceManifest);
            Path destinationStore = manifests.storeFile(workspace.destinationDir(), destinationManifest);

            progress.report(35, "Merging databases...");
            MergeReport report = orchestrator.merge(sourceStore, destinationStore, progress);

            progress.report(85, "Updating manifest...");
            String fileName = manifests.update(destinationManifest, sourceManifest, destinationStore);
            manifests.write(workspace.destinationDir(), destinationManifest);

            progress.report(85, "Creating new archive...");
            byte[] archive = archives.pack(workspace.destinationDir(), config.getCompressionLevel());

            progress.complete("Merge completed successfully!");
            LOG.info("Merged archive {}: {}", fileName, report);
            return new MergeResult(fileName, archive, destinationManifest, report);
        }
    }

    private static void requireArchive(Path archive) throws IncompatibleInputException {
        if (!Files.isRegularFile(archive)) {
            throw new IncompatibleInputException(MergePhase.EXTRACT, "Archive not found: " + archive);
        }
    }

    private static Path write(Path targetDir, MergeResult result) throws ArchiveIoException {
        try {
            Files.createDirectories(targetDir);
            Path output = targetDir.resolve(result.fileName());
            Files.write(output, result.archive());
            LOG.info("Merged archive written to {}", output);
            return output;
        } catch (IOException e) {
            throw new ArchiveIoException(MergePhase.PACK, "Failed to write merged archive: " + e.getMessage(), e);
        }
    }

    private void publishFailure(SyncException e) {
        LOG.error("Merge failed during {}: {}", e.phase().label(), e.getMessage());
        eventBus.post(new SyncEvents.MergeFailedEvent(e.phase(), e.getMessage()));
    }
}
