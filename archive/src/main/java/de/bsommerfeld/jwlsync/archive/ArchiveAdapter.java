package de.bsommerfeld.jwlsync.archive;

import com.google.inject.Singleton;
import de.bsommerfeld.jwlsync.core.error.ArchiveIoException;
import de.bsommerfeld.jwlsync.core.error.IncompatibleInputException;
import de.bsommerfeld.jwlsync.core.error.MergePhase;
import de.bsommerfeld.jwlsync.core.error.SyncException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

/**
 * Converts between a {@code .jwlibrary} backup (a ZIP archive) and a
 * workspace directory holding its files.
 */
@Singleton
public class ArchiveAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(ArchiveAdapter.class);

    /**
     * Extracts every file of {@code archive} into {@code targetDir}.
     *
     * @return the number of files extracted
     * @throws IncompatibleInputException if the stream is not a ZIP archive, is
     *                                    empty, or names an entry outside
     *                                    {@code targetDir}
     * @throws ArchiveIoException         if reading or writing fails
     */
    public int unpack(InputStream archive, Path targetDir) throws SyncException {
        Path root = targetDir.toAbsolutePath().normalize();
        int files = 0;
        try (ZipInputStream zis = new ZipInputStream(archive)) {
            ZipEntry entry;
            while ((entry = zis.getNextEntry()) != null) {
                String name = entry.getName().replace('\\', '/');
                Path target = root.resolve(name).normalize();
                if (!target.startsWith(root)) {
                    throw new IncompatibleInputException(MergePhase.EXTRACT,
                            "Archive entry escapes the workspace: " + name);
                }
                // "./" and empty names point at the workspace itself
                if (target.equals(root)) {
                    continue;
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                    continue;
                }
                Files.createDirectories(target.getParent());
                Files.copy(zis, target, StandardCopyOption.REPLACE_EXISTING);
                files++;
                LOG.debug("  Extracted {}", name);
            }
        } catch (ZipException e) {
            throw new IncompatibleInputException(MergePhase.EXTRACT, "Not a valid backup archive: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ArchiveIoException(MergePhase.EXTRACT, "Failed to extract archive: " + e.getMessage(), e);
        }

        if (files == 0) {
            throw new IncompatibleInputException(MergePhase.EXTRACT, "Archive is empty or not a ZIP file");
        }
        LOG.debug("Extracted {} files into {}", files, root);
        return files;
    }

    /**
     * Packs every regular file below {@code sourceDir} into a ZIP archive.
     * Entry names are relative to {@code sourceDir}, use {@code /} separators
     * and are written in sorted order.
     *
     * @param compressionLevel deflate level, 0 to 9
     * @throws ArchiveIoException if a file cannot be read
     */
    public byte[] pack(Path sourceDir, int compressionLevel) throws ArchiveIoException {
        Path root = sourceDir.toAbsolutePath().normalize();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (Stream<Path> walk = Files.walk(root)) {
            List<Path> files = walk.filter(Files::isRegularFile)
                    .sorted((a, b) -> entryName(root, a).compareTo(entryName(root, b)))
                    .collect(Collectors.toList());

            try (ZipOutputStream zos = new ZipOutputStream(out)) {
                zos.setMethod(ZipOutputStream.DEFLATED);
                zos.setLevel(compressionLevel);
                for (Path file : files) {
                    zos.putNextEntry(new ZipEntry(entryName(root, file)));
                    Files.copy(file, zos);
                    zos.closeEntry();
                }
            }
            LOG.debug("Packed {} files from {}", files.size(), root);
        } catch (IOException e) {
            throw new ArchiveIoException(MergePhase.PACK, "Failed to create archive: " + e.getMessage(), e);
        }
        return out.toByteArray();
    }

    private static String entryName(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }
}
