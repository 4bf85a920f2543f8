package de.bsommerfeld.jwlsync.archive.hash;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class HashUtilTest {

    @TempDir
    Path tempDir;

    @Test
    void sha256File_shouldMatchKnownValue() throws IOException {
        Path file = tempDir.resolve("empty.db");
        Files.write(file, new byte[0]);

        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
                HashUtil.sha256(file));
    }

    @Test
    void sha256File_shouldReturnLowerCaseHex() throws IOException {
        Path file = tempDir.resolve("userData.db");
        Files.writeString(file, "SQLite format 3");

        String hash = HashUtil.sha256(file);
        assertEquals(64, hash.length());
        assertTrue(hash.matches("[0-9a-f]+"));
    }

    @Test
    void sha256File_shouldHashLargerThanBuffer() throws IOException {
        byte[] data = new byte[20_000];
        for (int i = 0; i < data.length; i++) {
            data[i] = (byte) i;
        }
        Path file = tempDir.resolve("large.db");
        Files.write(file, data);

        assertEquals(HashUtil.sha256(data), HashUtil.sha256(file));
    }

    @Test
    void sha256Bytes_shouldMatchFileHash() throws IOException {
        Path file = tempDir.resolve("test.txt");
        Files.writeString(file, "hello world");

        assertEquals(HashUtil.sha256(file), HashUtil.sha256("hello world".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void sha256File_shouldThrowForNonexistentFile() {
        assertThrows(IOException.class, () -> HashUtil.sha256(tempDir.resolve("ghost.db")));
    }
}
