package de.bsommerfeld.jwlsync.db;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceVerifierTest {

    @TempDir
    Path tempDir;

    private final ReferenceVerifier verifier = new ReferenceVerifier();

    @Test
    void verify_shouldReturnNothingForConsistentStore() throws Exception {
        Path file = tempDir.resolve("store.db");
        try (TestStore store = TestStore.create(file)) {
            long location = store.bibleLocation(1, 1, "nwt");
            long mark = store.userMark(location, "m1");
            store.note("n1", mark, location, null, "text");
        }

        try (Connection conn = new SqliteStores().open(file)) {
            assertTrue(verifier.verify(conn).isEmpty());
        }
    }

    @Test
    void verify_shouldReportEveryDanglingForeignKey() throws Exception {
        Path file = tempDir.resolve("store.db");
        try (TestStore store = TestStore.create(file)) {
            store.userMark(99, "orphan");
            store.inputField(77, "tt1", "answer");
        }

        List<MergeWarning> dangling;
        try (Connection conn = new SqliteStores().open(file)) {
            dangling = verifier.verify(conn);
        }

        assertEquals(2, dangling.size());
        MergeWarning mark = dangling.stream().filter(w -> w.kind() == EntityKind.USER_MARK).findFirst().orElseThrow();
        assertEquals(MergeWarning.Type.DANGLING_REFERENCE, mark.type());
        assertEquals("LocationId", mark.column());
        assertEquals(99L, ((Number) mark.value()).longValue());

        MergeWarning field = dangling.stream().filter(w -> w.kind() == EntityKind.INPUT_FIELD).findFirst().orElseThrow();
        assertNull(field.sourceId());
    }
}
