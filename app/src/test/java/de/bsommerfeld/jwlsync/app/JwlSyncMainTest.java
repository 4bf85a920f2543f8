package de.bsommerfeld.jwlsync.app;

import de.bsommerfeld.jwlsync.core.config.SyncConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class JwlSyncMainTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    private SyncModule module() {
        SyncConfig config = new SyncConfig(tempDir.resolve("work"), tempDir.resolve("out"), 6);
        return new SyncModule(config, Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void run_shouldPrintUsageForMissingArguments() {
        assertEquals(JwlSyncMain.EXIT_USAGE, JwlSyncMain.run(new String[] {"only-one"}, out, module()));
        assertTrue(buffer.toString(StandardCharsets.UTF_8).contains("Usage"));
    }

    @Test
    void run_shouldFailForMissingArchive() {
        String[] args = {tempDir.resolve("a.jwlibrary").toString(), tempDir.resolve("b.jwlibrary").toString()};
        assertEquals(JwlSyncMain.EXIT_FAILED, JwlSyncMain.run(args, out, module()));
        assertTrue(buffer.toString(StandardCharsets.UTF_8).contains("Merge failed"));
    }

    @Test
    void run_shouldWriteMergedArchiveToGivenDirectory() throws Exception {
        Path source = tempDir.resolve("source.jwlibrary");
        Path dest = tempDir.resolve("dest.jwlibrary");
        Files.write(source, BackupFixture.archive(tempDir.resolve("fx-source"), 14, "2024-01-01T10:00:00Z",
                "INSERT INTO Tag (Type, Name) VALUES (1, 'Study')"));
        Files.write(dest, BackupFixture.archive(tempDir.resolve("fx-dest"), 14, "2024-01-01T10:00:00Z"));
        Path outDir = tempDir.resolve("custom");

        int exit = JwlSyncMain.run(new String[] {source.toString(), dest.toString(), outDir.toString()}, out,
                module());

        assertEquals(JwlSyncMain.EXIT_OK, exit);
        assertTrue(Files.isRegularFile(outDir.resolve("merged_2024-05-01_12-00-00.jwlibrary")));
        assertTrue(buffer.toString(StandardCharsets.UTF_8).contains("[100%]"));
    }
}
