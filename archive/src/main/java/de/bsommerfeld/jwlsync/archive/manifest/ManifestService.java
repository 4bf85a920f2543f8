package de.bsommerfeld.jwlsync.archive.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.inject.Singleton;
import de.bsommerfeld.jwlsync.archive.hash.HashUtil;
import de.bsommerfeld.jwlsync.core.error.ArchiveIoException;
import de.bsommerfeld.jwlsync.core.error.IncompatibleInputException;
import de.bsommerfeld.jwlsync.core.error.MergePhase;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;

/**
 * Reads, validates and rewrites backup manifests.
 */
@Singleton
public class ManifestService {

    private static final Logger LOG = LoggerFactory.getLogger(ManifestService.class);

    public static final String ARCHIVE_EXTENSION = ".jwlibrary";
    private static final DateTimeFormatter NAME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final Clock clock;

    @Inject
    public ManifestService(Clock clock) {
        this.clock = clock;
    }

    /**
     * Parses {@code manifest.json} from an unpacked archive.
     *
     * @throws IncompatibleInputException if the manifest is missing, is not a
     *                                    JSON object or lacks a numeric
     *                                    {@code userDataBackup.schemaVersion}
     */
    public Manifest read(Path archiveDir) throws IncompatibleInputException {
        Path file = archiveDir.resolve(Manifest.FILE_NAME);
        if (!Files.isRegularFile(file)) {
            throw new IncompatibleInputException(MergePhase.VALIDATE, "Backup contains no " + Manifest.FILE_NAME);
        }
        JsonNode root;
        try {
            root = mapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new IncompatibleInputException(MergePhase.VALIDATE, "Malformed " + Manifest.FILE_NAME + ": "
                    + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new IncompatibleInputException(MergePhase.VALIDATE, Manifest.FILE_NAME + " is not a JSON object");
        }
        JsonNode backup = root.get(Manifest.USER_DATA_BACKUP);
        if (backup == null || !backup.isObject() || !backup.path(Manifest.SCHEMA_VERSION).isInt()) {
            throw new IncompatibleInputException(MergePhase.VALIDATE,
                    Manifest.FILE_NAME + " has no userDataBackup.schemaVersion");
        }
        return new Manifest((ObjectNode) root);
    }

    /**
     * Resolves the store file a manifest points at.
     *
     * @throws IncompatibleInputException if the archive lacks the store
     */
    public Path storeFile(Path archiveDir, Manifest manifest) throws IncompatibleInputException {
        Path store = archiveDir.resolve(manifest.databaseName()).normalize();
        if (!store.startsWith(archiveDir.normalize()) || !Files.isRegularFile(store)) {
            throw new IncompatibleInputException(MergePhase.VALIDATE,
                    "Backup contains no database " + manifest.databaseName());
        }
        return store;
    }

    /**
     * Checks that two backups can be merged: equal schema versions and
     * {@code lastModifiedDate} values that can be compared with each other.
     *
     * @throws IncompatibleInputException if the schema versions differ or the
     *                                    modification dates are not comparable
     */
    public void validate(Manifest source, Manifest destination) throws IncompatibleInputException {
        if (source.schemaVersion() != destination.schemaVersion()) {
            LOG.error("Schema version mismatch: source {} vs destination {}",
                    source.schemaVersion(), destination.schemaVersion());
            throw new IncompatibleInputException(MergePhase.VALIDATE, "Schema versions do not match");
        }
        isLater(source.lastModifiedDate(), destination.lastModifiedDate(), MergePhase.VALIDATE);
        LOG.debug("Schema version {} on both sides", source.schemaVersion());
    }

    /**
     * Brings the destination manifest in line with the merged store.
     *
     * <ul>
     * <li>{@code hash}: SHA-256 of {@code mergedStore}</li>
     * <li>{@code lastModifiedDate}: the source's value if strictly later</li>
     * <li>{@code creationDate}: now, ISO-8601 with offset</li>
     * <li>{@code name}: {@code merged_yyyy-MM-dd_HH-mm-ss.jwlibrary}</li>
     * </ul>
     *
     * @return the new archive file name
     * @throws IncompatibleInputException if a {@code lastModifiedDate} is not a
     *                                    valid timestamp
     * @throws ArchiveIoException         if the store cannot be hashed
     */
    public String update(Manifest destination, Manifest source, Path mergedStore)
            throws IncompatibleInputException, ArchiveIoException {
        try {
            destination.setHash(HashUtil.sha256(mergedStore));
        } catch (IOException e) {
            throw new ArchiveIoException(MergePhase.MANIFEST, "Failed to hash merged database", e);
        }

        if (isLater(source.lastModifiedDate(), destination.lastModifiedDate(), MergePhase.MANIFEST)) {
            LOG.debug("Taking lastModifiedDate {} from source", source.lastModifiedDate());
            destination.setLastModifiedDate(source.lastModifiedDate());
        }

        OffsetDateTime now = OffsetDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
        destination.setCreationDate(now.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));

        String name = "merged_" + LocalDateTime.now(clock).format(NAME_FORMAT) + ARCHIVE_EXTENSION;
        destination.setName(name);
        LOG.info("Updated manifest: {}", name);
        return name;
    }

    /**
     * Writes {@code manifest} pretty-printed into {@code archiveDir}.
     *
     * @throws ArchiveIoException if the file cannot be written
     */
    public void write(Path archiveDir, Manifest manifest) throws ArchiveIoException {
        try {
            Files.writeString(archiveDir.resolve(Manifest.FILE_NAME), toJson(manifest));
        } catch (IOException e) {
            throw new ArchiveIoException(MergePhase.MANIFEST, "Failed to write " + Manifest.FILE_NAME, e);
        }
    }

    public String toJson(Manifest manifest) throws JsonProcessingException {
        return mapper.writeValueAsString(manifest.tree());
    }

    /**
     * Compares two {@code lastModifiedDate} values. Values with an offset are
     * compared as instants, values without one as local date-times.
     *
     * @throws IncompatibleInputException if a value is not an ISO date-time,
     *                                    or only one of them has an offset
     */
    private static boolean isLater(String candidate, String current, MergePhase phase)
            throws IncompatibleInputException {
        if (candidate == null) {
            return false;
        }
        if (current == null) {
            return true;
        }
        TemporalAccessor later = parse(candidate, phase);
        TemporalAccessor earlier = parse(current, phase);
        if (later instanceof OffsetDateTime laterInstant && earlier instanceof OffsetDateTime earlierInstant) {
            return laterInstant.isAfter(earlierInstant);
        }
        if (later instanceof LocalDateTime laterLocal && earlier instanceof LocalDateTime earlierLocal) {
            return laterLocal.isAfter(earlierLocal);
        }
        throw new IncompatibleInputException(phase,
                "Cannot compare lastModifiedDate " + candidate + " with " + current + ": only one has an offset");
    }

    private static TemporalAccessor parse(String timestamp, MergePhase phase) throws IncompatibleInputException {
        try {
            return DateTimeFormatter.ISO_DATE_TIME.parseBest(timestamp, OffsetDateTime::from, LocalDateTime::from);
        } catch (DateTimeParseException e) {
            throw new IncompatibleInputException(phase, "Invalid lastModifiedDate: " + timestamp, e);
        }
    }
}
