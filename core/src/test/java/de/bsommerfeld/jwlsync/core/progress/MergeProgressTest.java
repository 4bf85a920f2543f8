package de.bsommerfeld.jwlsync.core.progress;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MergeProgressTest {

    @Test
    void of_shouldClampNegativeToZero() {
        assertEquals(0, MergeProgress.of(-5, "x").percent());
    }

    @Test
    void of_withoutMessage_shouldLeaveMessageNull() {
        MergeProgress progress = MergeProgress.of(40);
        assertEquals(40, progress.percent());
        assertNull(progress.message());
        assertFalse(progress.isComplete());
    }
}
