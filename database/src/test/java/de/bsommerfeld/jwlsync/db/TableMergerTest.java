package de.bsommerfeld.jwlsync.db;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs {@link TableMerger} against real temporary SQLite stores. Kinds are
 * merged one at a time in schedule order, the way the orchestrator does it.
 */
class TableMergerTest {

    @TempDir
    Path tempDir;

    private TestStore source;
    private TestStore dest;
    private Connection sourceConn;
    private Connection destConn;
    private final TableMerger merger = new TableMerger();
    private final IdTranslationTable translations = new IdTranslationTable();

    @BeforeEach
    void setUp() throws Exception {
        source = TestStore.create(tempDir.resolve("source.db"));
        dest = TestStore.create(tempDir.resolve("dest.db"));
        sourceConn = DriverManager.getConnection("jdbc:sqlite:" + tempDir.resolve("source.db"));
        destConn = DriverManager.getConnection("jdbc:sqlite:" + tempDir.resolve("dest.db"));
    }

    @AfterEach
    void tearDown() throws Exception {
        sourceConn.close();
        destConn.close();
        source.close();
        dest.close();
    }

    private TableMergeResult merge(EntityKind kind) throws Exception {
        List<ForeignKeyBinding> bindings = new ArrayList<>();
        kind.foreignKeys().forEach(fk -> bindings.add(translations.bind(fk)));
        return merger.merge(sourceConn, destConn, kind, bindings, translations);
    }

    // -- Insert & remap --

    @Test
    void merge_shouldInsertIntoEmptyDestinationAndRemapForeignKey() throws Exception {
        dest.bibleLocation(40, 1, "nwt");
        dest.bibleLocation(40, 2, "nwt");
        long sourceLocation = source.location(1, 3, null, null, "nwt", 0, 1, null);
        source.note("guid-a", null, sourceLocation, "A", "text");

        merge(EntityKind.LOCATION);
        merge(EntityKind.USER_MARK);
        merge(EntityKind.NOTE);

        Long newLocation = translations.lookup(EntityKind.LOCATION, sourceLocation);
        assertNotNull(newLocation);
        assertEquals(3L, newLocation);
        assertEquals(newLocation, dest.value("SELECT LocationId FROM Note WHERE Guid = 'guid-a'"));
        assertEquals(1, dest.count(EntityKind.NOTE));
    }

    @Test
    void merge_shouldReportCountsPerKind() throws Exception {
        source.tag("Favourites");
        source.tag("Study");
        dest.tag("Study");

        TableMergeResult result = merge(EntityKind.TAG);

        assertEquals(2, result.read());
        assertEquals(1, result.inserted());
        assertEquals(1, result.duplicates());
        assertEquals(0, result.conflicts());
        assertTrue(result.warnings().isEmpty());
        assertEquals(2, dest.count(EntityKind.TAG));
    }

    @Test
    void merge_shouldMapDuplicateToExistingDestinationId() throws Exception {
        dest.tag("Other");
        long existing = dest.tag("Study");
        long sourceTag = source.tag("Study");

        merge(EntityKind.TAG);

        assertEquals(existing, translations.lookup(EntityKind.TAG, sourceTag));
    }

    @Test
    void merge_shouldPassNullForeignKeysThrough() throws Exception {
        source.note("guid-null", null, null, "Loose note", "no anchor");

        TableMergeResult result = merge(EntityKind.NOTE);

        assertTrue(result.warnings().isEmpty());
        assertNull(dest.value("SELECT LocationId FROM Note WHERE Guid = 'guid-null'"));
        assertNull(dest.value("SELECT UserMarkId FROM Note WHERE Guid = 'guid-null'"));
    }

    // -- Unresolved references --

    @Test
    void merge_shouldKeepUnresolvedForeignKeyAndWarn() throws Exception {
        long location = source.bibleLocation(1, 1, "nwt");
        source.inputField(location, "tt1", "answer");
        // Location deliberately not merged: no translation exists

        TableMergeResult result = merge(EntityKind.INPUT_FIELD);

        assertEquals(1, result.inserted());
        assertEquals(1, result.warnings().size());
        MergeWarning warning = result.warnings().get(0);
        assertEquals(MergeWarning.Type.UNRESOLVED_REFERENCE, warning.type());
        assertEquals("LocationId", warning.column());
        assertEquals(location, ((Number) warning.value()).longValue());
        assertEquals(location, dest.value("SELECT LocationId FROM InputField"));
    }

    // -- Uniqueness conflicts --

    @Test
    void merge_shouldTreatUniqueConflictAsDuplicate() throws Exception {
        long destNote = dest.note("same-guid", null, null, "Title", "old content");
        long sourceNote = source.note("same-guid", null, null, "Title", "edited content");

        TableMergeResult result = merge(EntityKind.NOTE);

        assertEquals(0, result.inserted());
        assertEquals(1, result.conflicts());
        assertTrue(result.warnings().isEmpty());
        assertEquals(1, dest.count(EntityKind.NOTE));
        assertEquals(destNote, translations.lookup(EntityKind.NOTE, sourceNote));
        assertEquals("old content", dest.value("SELECT Content FROM Note"));
    }

    @Test
    void merge_shouldResolveTagMapConflictThroughTagAndNote() throws Exception {
        long destTag = dest.tag("Study");
        long destNote = dest.note("n1", null, null, "T", "C");
        long destMap = dest.tagMap(null, null, destNote, destTag, 0);

        long srcTag = source.tag("Study");
        long srcNote = source.note("n1", null, null, "T", "C");
        long srcMap = source.tagMap(null, null, srcNote, srcTag, 7);

        merge(EntityKind.NOTE);
        merge(EntityKind.TAG);
        TableMergeResult result = merge(EntityKind.TAG_MAP);

        assertEquals(1, result.conflicts());
        assertEquals(destMap, translations.lookup(EntityKind.TAG_MAP, srcMap));
        assertEquals(1, dest.count(EntityKind.TAG_MAP));
    }

    @Test
    void merge_shouldTreatInputFieldPrimaryKeyConflictAsDuplicate() throws Exception {
        long destLocation = dest.bibleLocation(1, 1, "nwt");
        dest.inputField(destLocation, "tt1", "old answer");
        long srcLocation = source.bibleLocation(1, 1, "nwt");
        source.inputField(srcLocation, "tt1", "new answer");

        merge(EntityKind.LOCATION);
        TableMergeResult result = merge(EntityKind.INPUT_FIELD);

        assertEquals(1, result.conflicts());
        assertEquals(0, result.inserted());
        assertEquals("old answer", dest.value("SELECT Value FROM InputField"));
    }

    // -- Failures --

    @Test
    void merge_shouldRaiseConstraintViolationForCheckFailure() throws Exception {
        source.insert("INSERT INTO Tag (Type, Name) VALUES (1, 'x')");
        try (var stmt = destConn.createStatement()) {
            stmt.execute("DROP TABLE Tag");
            stmt.execute("CREATE TABLE Tag (TagId INTEGER NOT NULL PRIMARY KEY, Type INTEGER NOT NULL, "
                    + "Name TEXT NOT NULL, CHECK (Type > 5))");
        }

        ConstraintViolationException e = assertThrows(ConstraintViolationException.class,
                () -> merge(EntityKind.TAG));
        assertEquals(EntityKind.TAG, e.kind());
    }

    @Test
    void merge_shouldRaiseMergeFailureWhenTableMissing() throws Exception {
        try (var stmt = destConn.createStatement()) {
            stmt.execute("DROP TABLE PlaylistItem");
        }
        source.playlistItem("Morning");

        MergeFailureException e = assertThrows(MergeFailureException.class,
                () -> merge(EntityKind.PLAYLIST_ITEM));
        assertEquals(EntityKind.PLAYLIST_ITEM, e.kind());
        assertTrue(e.getMessage().contains("PlaylistItem"));
    }
}
