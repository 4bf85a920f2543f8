package de.bsommerfeld.jwlsync.app;

import de.bsommerfeld.jwlsync.archive.ArchiveAdapter;
import de.bsommerfeld.jwlsync.archive.manifest.ManifestService;
import de.bsommerfeld.jwlsync.core.config.SyncConfig;
import de.bsommerfeld.jwlsync.core.error.MergePhase;
import de.bsommerfeld.jwlsync.core.event.ApplicationEventBus;
import de.bsommerfeld.jwlsync.core.event.SyncEvents;
import de.bsommerfeld.jwlsync.core.progress.MergeProgress;
import de.bsommerfeld.jwlsync.db.EntityKind;
import de.bsommerfeld.jwlsync.db.MergeFailureException;
import de.bsommerfeld.jwlsync.db.MergeOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MergeServiceFailureTest {

    @Mock
    private MergeOrchestrator orchestrator;

    @Mock
    private ApplicationEventBus eventBus;

    @TempDir
    Path tempDir;

    private Path workspaceRoot;
    private MergeService service;

    @BeforeEach
    void setUp() {
        workspaceRoot = tempDir.resolve("work");
        SyncConfig config = new SyncConfig(workspaceRoot, tempDir.resolve("out"), 6);
        service = new MergeService(config, new ArchiveAdapter(), new ManifestService(Clock.systemUTC()),
                orchestrator, eventBus);
    }

    @Test
    void merge_shouldPublishFailureAndReleaseWorkspaceWhenMergeFails() throws Exception {
        byte[] source = BackupFixture.archive(tempDir.resolve("source"), 14, "2024-01-01T10:00:00Z");
        byte[] destination = BackupFixture.archive(tempDir.resolve("dest"), 14, "2024-01-01T10:00:00Z");
        when(orchestrator.merge(any(), any(), any()))
                .thenThrow(new MergeFailureException(EntityKind.NOTE, new SQLException("disk I/O error")));
        List<MergeProgress> reports = new ArrayList<>();

        MergeFailureException e = assertThrows(MergeFailureException.class,
                () -> service.merge(BackupFixture.stream(source), BackupFixture.stream(destination), reports::add));

        assertEquals(EntityKind.NOTE, e.kind());
        assertEquals(35, reports.get(reports.size() - 1).percent());

        ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
        verify(eventBus).post(event.capture());
        SyncEvents.MergeFailedEvent failed = assertInstanceOf(SyncEvents.MergeFailedEvent.class, event.getValue());
        assertEquals(MergePhase.MERGE, failed.phase());

        try (Stream<Path> children = Files.list(workspaceRoot)) {
            assertEquals(0, children.count());
        }
    }
}
