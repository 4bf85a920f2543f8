package de.bsommerfeld.jwlsync.core.config;

import de.bsommerfeld.jwlsync.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.zip.Deflater;

/**
 * Runtime settings of the merger.
 *
 * <p>
 * Every value is resolved from a system property first, then from an
 * environment variable, then falls back to a default:
 *
 * <pre>
 * jwlsync.workspace.dir      JWLSYNC_WORKSPACE_DIR      java.io.tmpdir
 * jwlsync.output.dir         JWLSYNC_OUTPUT_DIR         {appData}/jwlibrary-sync/merged
 * jwlsync.compression.level  JWLSYNC_COMPRESSION_LEVEL  6
 * </pre>
 */
public final class SyncConfig {

    private static final Logger LOG = LoggerFactory.getLogger(SyncConfig.class);

    public static final String APP_NAME = "jwlibrary-sync";
    public static final int DEFAULT_COMPRESSION_LEVEL = 6;

    private final Path workspaceRoot;
    private final Path outputDirectory;
    private final int compressionLevel;

    public SyncConfig(Path workspaceRoot, Path outputDirectory, int compressionLevel) {
        if (compressionLevel < Deflater.NO_COMPRESSION || compressionLevel > Deflater.BEST_COMPRESSION) {
            throw new IllegalArgumentException("Compression level out of range: " + compressionLevel);
        }
        this.workspaceRoot = workspaceRoot;
        this.outputDirectory = outputDirectory;
        this.compressionLevel = compressionLevel;
    }

    /** Resolves the configuration from system properties and environment. */
    public static SyncConfig load() {
        Path workspace = Paths.get(resolve("jwlsync.workspace.dir", "JWLSYNC_WORKSPACE_DIR",
                System.getProperty("java.io.tmpdir")));
        String output = resolve("jwlsync.output.dir", "JWLSYNC_OUTPUT_DIR", null);
        Path outputDir = output != null ? Paths.get(output) : StorageUtils.getMergedDir(APP_NAME);

        int level = DEFAULT_COMPRESSION_LEVEL;
        String levelValue = resolve("jwlsync.compression.level", "JWLSYNC_COMPRESSION_LEVEL", null);
        if (levelValue != null) {
            try {
                level = Integer.parseInt(levelValue.trim());
            } catch (NumberFormatException e) {
                LOG.warn("Invalid compression level '{}'. Defaulting to {}.", levelValue, DEFAULT_COMPRESSION_LEVEL);
            }
            if (level < Deflater.NO_COMPRESSION || level > Deflater.BEST_COMPRESSION) {
                LOG.warn("Compression level {} out of range. Defaulting to {}.", level, DEFAULT_COMPRESSION_LEVEL);
                level = DEFAULT_COMPRESSION_LEVEL;
            }
        }
        return new SyncConfig(workspace.toAbsolutePath(), outputDir.toAbsolutePath(), level);
    }

    private static String resolve(String property, String env, String fallback) {
        String value = System.getProperty(property);
        if (value == null || value.isEmpty()) {
            value = System.getenv(env);
        }
        return value == null || value.isEmpty() ? fallback : value;
    }

    /** Directory under which each run creates its private workspace. */
    public Path getWorkspaceRoot() {
        return workspaceRoot;
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }

    public int getCompressionLevel() {
        return compressionLevel;
    }

    @Override
    public String toString() {
        return "SyncConfig[workspaceRoot=" + workspaceRoot + ", outputDirectory=" + outputDirectory
                + ", compressionLevel=" + compressionLevel + "]";
    }
}
