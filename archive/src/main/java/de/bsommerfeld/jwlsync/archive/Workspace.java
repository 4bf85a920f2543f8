package de.bsommerfeld.jwlsync.archive;

import de.bsommerfeld.jwlsync.core.error.ArchiveIoException;
import de.bsommerfeld.jwlsync.core.error.MergePhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Private scratch directory of one merge run, holding the unpacked source and
 * destination archives side by side.
 *
 * <pre>
 * {root}/
 *   source/        unpacked source archive, read only
 *   destination/   unpacked destination archive, merged in place and repacked
 * </pre>
 *
 * Closing the workspace deletes the whole tree. Runs never share a workspace.
 */
public final class Workspace implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(Workspace.class);
    private static final String PREFIX = "jwlsync-";
    private static final String[] SIZE_UNITS = {"B", "KB", "MB", "GB"};

    private final Path root;
    private final Path sourceDir;
    private final Path destinationDir;

    private Workspace(Path root) {
        this.root = root;
        this.sourceDir = root.resolve("source");
        this.destinationDir = root.resolve("destination");
    }

    /**
     * Creates a fresh, uniquely named workspace below {@code parent}.
     *
     * @throws ArchiveIoException if the directories cannot be created
     */
    public static Workspace create(Path parent) throws ArchiveIoException {
        try {
            Files.createDirectories(parent);
            Workspace workspace = new Workspace(Files.createTempDirectory(parent, PREFIX));
            Files.createDirectory(workspace.sourceDir);
            Files.createDirectory(workspace.destinationDir);
            LOG.debug("Created workspace {}", workspace.root);
            return workspace;
        } catch (IOException e) {
            throw new ArchiveIoException(MergePhase.EXTRACT, "Failed to create workspace in " + parent, e);
        }
    }

    public Path root() {
        return root;
    }

    public Path sourceDir() {
        return sourceDir;
    }

    public Path destinationDir() {
        return destinationDir;
    }

    /**
     * Deletes the workspace tree. Failures are logged, never thrown, so that
     * releasing a workspace cannot mask the outcome of the run.
     */
    @Override
    public void close() {
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
            long files = 0;
            long bytes = 0;
            for (Path path : paths) {
                if (Files.isRegularFile(path)) {
                    files++;
                    bytes += Files.size(path);
                }
                Files.delete(path);
            }
            LOG.info("Released workspace: {} files, {} freed", files, describeSize(bytes));
        } catch (IOException | UncheckedIOException e) {
            LOG.warn("Failed to delete workspace {}", root, e);
        }
    }

    /** Size for log output, e.g. {@code 1.5 MB}. Plain bytes below 1 KB. */
    static String describeSize(long bytes) {
        if (bytes < 1024) {
            return bytes + " B";
        }
        double size = bytes;
        int unit = 0;
        while (size >= 1024 && unit < SIZE_UNITS.length - 1) {
            size /= 1024;
            unit++;
        }
        return String.format(Locale.ROOT, "%.1f %s", size, SIZE_UNITS[unit]);
    }
}
