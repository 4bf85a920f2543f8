package de.bsommerfeld.jwlsync.archive.manifest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * The {@code manifest.json} of a backup archive.
 *
 * <p>
 * Wraps the parsed JSON tree rather than binding it to a fixed class, so
 * fields this tool does not know about survive a read/write cycle untouched.
 * Only the {@code userDataBackup} block and the top-level {@code name} and
 * {@code creationDate} are interpreted.
 */
public final class Manifest {

    public static final String FILE_NAME = "manifest.json";
    public static final String DEFAULT_DATABASE_NAME = "userData.db";

    static final String USER_DATA_BACKUP = "userDataBackup";
    static final String SCHEMA_VERSION = "schemaVersion";
    static final String HASH = "hash";
    static final String LAST_MODIFIED_DATE = "lastModifiedDate";
    static final String DATABASE_NAME = "databaseName";
    static final String NAME = "name";
    static final String CREATION_DATE = "creationDate";

    private final ObjectNode root;

    Manifest(ObjectNode root) {
        this.root = root;
    }

    public String name() {
        return text(root, NAME);
    }

    public String creationDate() {
        return text(root, CREATION_DATE);
    }

    public int schemaVersion() {
        return userDataBackup().path(SCHEMA_VERSION).asInt();
    }

    public String hash() {
        return text(userDataBackup(), HASH);
    }

    public String lastModifiedDate() {
        return text(userDataBackup(), LAST_MODIFIED_DATE);
    }

    /** File name of the store inside the archive, {@code userData.db} if unset. */
    public String databaseName() {
        String name = text(userDataBackup(), DATABASE_NAME);
        return name == null || name.isBlank() ? DEFAULT_DATABASE_NAME : name;
    }

    void setName(String name) {
        root.put(NAME, name);
    }

    void setCreationDate(String creationDate) {
        root.put(CREATION_DATE, creationDate);
    }

    void setHash(String hash) {
        userDataBackup().put(HASH, hash);
    }

    void setLastModifiedDate(String lastModifiedDate) {
        userDataBackup().put(LAST_MODIFIED_DATE, lastModifiedDate);
    }

    ObjectNode userDataBackup() {
        return (ObjectNode) root.get(USER_DATA_BACKUP);
    }

    ObjectNode tree() {
        return root;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    @Override
    public String toString() {
        return "Manifest[name=" + name() + ", schemaVersion=" + schemaVersion() + "]";
    }
}
