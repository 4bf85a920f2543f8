package de.bsommerfeld.jwlsync.db;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Static schema descriptor of every table the merger reconciles.
 *
 * <p>
 * Each kind knows its table name, its surrogate id column (if the table has
 * one), the remaining columns in store order, the columns that reference other
 * kinds, and the uniqueness constraints the store itself enforces. The last
 * are only consulted when an insert is rejected, to find the row that caused
 * the conflict.
 *
 * <p>
 * Declaration order is irrelevant for merging; the order tables are merged in
 * lives in {@link MergeSchedule}.
 */
public enum EntityKind {

    LOCATION("Location", "LocationId",
            List.of("BookNumber", "ChapterNumber", "DocumentId", "Track", "IssueTagNumber",
                    "KeySymbol", "MepsLanguage", "Type", "Title"),
            List.of(),
            List.of(List.of("BookNumber", "ChapterNumber", "KeySymbol", "MepsLanguage", "Type"),
                    List.of("KeySymbol", "IssueTagNumber", "MepsLanguage", "DocumentId", "Track", "Type")),
            new LocationKeyPolicy()),

    USER_MARK("UserMark", "UserMarkId",
            List.of("ColorIndex", "LocationId", "StyleIndex", "UserMarkGuid", "Version"),
            List.of(new ForeignKey("LocationId", LOCATION)),
            List.of(List.of("UserMarkGuid")),
            DuplicateKeyPolicy.ALL_COLUMNS),

    BLOCK_RANGE("BlockRange", "BlockRangeId",
            List.of("BlockType", "Identifier", "StartToken", "EndToken", "UserMarkId"),
            List.of(new ForeignKey("UserMarkId", USER_MARK)),
            List.of(),
            DuplicateKeyPolicy.ALL_COLUMNS),

    NOTE("Note", "NoteId",
            List.of("Guid", "UserMarkId", "LocationId", "Title", "Content", "LastModified",
                    "Created", "BlockType", "BlockIdentifier"),
            List.of(new ForeignKey("UserMarkId", USER_MARK), new ForeignKey("LocationId", LOCATION)),
            List.of(List.of("Guid")),
            DuplicateKeyPolicy.ALL_COLUMNS),

    PLAYLIST_ITEM("PlaylistItem", "PlaylistItemId",
            List.of("Label", "StartTrimOffsetTicks", "EndTrimOffsetTicks", "Accuracy", "EndAction",
                    "ThumbnailFilePath"),
            List.of(),
            List.of(),
            DuplicateKeyPolicy.ALL_COLUMNS),

    TAG("Tag", "TagId",
            List.of("Type", "Name"),
            List.of(),
            List.of(List.of("Type", "Name")),
            DuplicateKeyPolicy.ALL_COLUMNS),

    INPUT_FIELD("InputField", null,
            List.of("LocationId", "TextTag", "Value"),
            List.of(new ForeignKey("LocationId", LOCATION)),
            List.of(List.of("LocationId", "TextTag")),
            DuplicateKeyPolicy.ALL_COLUMNS),

    TAG_MAP("TagMap", "TagMapId",
            List.of("PlaylistItemId", "LocationId", "NoteId", "TagId", "Position"),
            List.of(new ForeignKey("PlaylistItemId", PLAYLIST_ITEM), new ForeignKey("LocationId", LOCATION),
                    new ForeignKey("NoteId", NOTE), new ForeignKey("TagId", TAG)),
            List.of(List.of("TagId", "NoteId"), List.of("TagId", "LocationId"),
                    List.of("TagId", "PlaylistItemId"), List.of("TagId", "Position")),
            DuplicateKeyPolicy.ALL_COLUMNS);

    private final String tableName;
    private final String idColumn;
    private final List<String> columns;
    private final List<ForeignKey> foreignKeys;
    private final List<List<String>> uniqueConstraints;
    private final DuplicateKeyPolicy duplicateKeyPolicy;

    EntityKind(String tableName, String idColumn, List<String> columns, List<ForeignKey> foreignKeys,
            List<List<String>> uniqueConstraints, DuplicateKeyPolicy duplicateKeyPolicy) {
        this.tableName = tableName;
        this.idColumn = idColumn;
        this.columns = columns;
        this.foreignKeys = foreignKeys;
        this.uniqueConstraints = uniqueConstraints;
        this.duplicateKeyPolicy = duplicateKeyPolicy;
    }

    public String tableName() {
        return tableName;
    }

    /** Surrogate id column, or {@code null} for tables keyed by their content. */
    public String idColumn() {
        return idColumn;
    }

    public boolean hasSurrogateId() {
        return idColumn != null;
    }

    /** All columns except the surrogate id, in store order. */
    public List<String> columns() {
        return columns;
    }

    public List<ForeignKey> foreignKeys() {
        return foreignKeys;
    }

    public List<List<String>> uniqueConstraints() {
        return uniqueConstraints;
    }

    public DuplicateKeyPolicy duplicateKeyPolicy() {
        return duplicateKeyPolicy;
    }

    /**
     * Returns the position of {@code column} within {@link #columns()}.
     *
     * @throws IllegalArgumentException if the kind has no such column
     */
    public int columnIndex(String column) {
        int index = columns.indexOf(column);
        if (index < 0) {
            throw new IllegalArgumentException(tableName + " has no column " + column);
        }
        return index;
    }

    /** Kinds this kind references through its foreign keys, without duplicates. */
    public List<EntityKind> dependencies() {
        List<EntityKind> result = new ArrayList<>();
        for (ForeignKey fk : foreignKeys) {
            if (!result.contains(fk.references())) {
                result.add(fk.references());
            }
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public String toString() {
        return tableName;
    }
}
