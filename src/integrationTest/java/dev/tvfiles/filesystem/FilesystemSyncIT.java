package dev.tvfiles.filesystem;

import dev.tvfiles.BaseIntegrationTest;
import dev.tvfiles.reconcile.PassSummary;
import dev.tvfiles.reconcile.SourceUnavailableException;
import dev.tvfiles.sync.SourceKind;
import dev.tvfiles.sync.SyncRunStatus;
import dev.tvfiles.sync.SyncService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FilesystemSyncIT extends BaseIntegrationTest {

    @Autowired
    SyncService syncService;

    @Autowired
    ScanDirectoryService scanDirectoryService;

    @Autowired
    ScannedFileRepository scannedFileRepository;

    @TempDir
    Path tempDir;

    private Path library;

    @BeforeEach
    void registerLibrary() throws IOException {
        library = Files.createDirectories(tempDir.resolve("library"));
        scanDirectoryService.register(library.toString());
    }

    private void touch(String name) throws IOException {
        Files.writeString(library.resolve(name), name);
    }

    private String directory() throws IOException {
        return library.toRealPath().toString();
    }

    @Test
    void removed_file_is_restored_with_original_added_date() throws IOException {
        touch("a.mkv");
        touch("b.mkv");
        touch("c.mkv");

        PassSummary first = syncService.sync(SourceKind.FILESYSTEM);
        assertThat(first.seen()).isEqualTo(3);
        assertThat(first.inserted()).isEqualTo(3);
        Instant bAdded = scannedFileRepository.findByFilenameAndFilepath("b.mkv", directory())
                .orElseThrow().getAddedAt();

        Files.delete(library.resolve("b.mkv"));
        PassSummary second = syncService.sync(SourceKind.FILESYSTEM);
        assertThat(second.seen()).isEqualTo(2);
        assertThat(second.inserted()).isZero();
        assertThat(second.removed()).isEqualTo(1);
        assertThat(scannedFileRepository.findByFilenameAndFilepath("b.mkv", directory()).orElseThrow().isRemoved())
                .isTrue();

        touch("b.mkv");
        touch("d.mkv");
        PassSummary third = syncService.sync(SourceKind.FILESYSTEM);
        assertThat(third.seen()).isEqualTo(4);
        assertThat(third.inserted()).isEqualTo(1);
        assertThat(third.restored()).isEqualTo(1);
        assertThat(third.removed()).isZero();

        ScannedFile b = scannedFileRepository.findByFilenameAndFilepath("b.mkv", directory()).orElseThrow();
        assertThat(b.getRemovedAt()).isNull();
        assertThat(b.getAddedAt()).isEqualTo(bAdded);
        assertThat(scannedFileRepository.findAllByRemovedAtIsNull()).hasSize(4);
    }

    @Test
    void repeated_pass_leaves_the_table_unchanged() throws IOException {
        touch("a.mkv");
        syncService.sync(SourceKind.FILESYSTEM);

        PassSummary second = syncService.sync(SourceKind.FILESYSTEM);

        assertThat(second.inserted()).isZero();
        assertThat(second.removed()).isZero();
        assertThat(scannedFileRepository.count()).isEqualTo(1);
    }

    @Test
    void missing_scan_directory_rolls_back_files_staged_from_earlier_directories() throws IOException {
        touch("a.mkv");
        syncService.sync(SourceKind.FILESYSTEM);
        // "archive" sorts before "library", so its file is staged before the missing directory is hit
        Path archive = Files.createDirectories(tempDir.resolve("archive"));
        Files.writeString(archive.resolve("new.mkv"), "x");
        scanDirectoryService.register(archive.toString());
        String libraryDir = directory();
        Files.delete(library.resolve("a.mkv"));
        Files.delete(library);

        assertThatThrownBy(() -> syncService.sync(SourceKind.FILESYSTEM))
                .isInstanceOf(SourceUnavailableException.class);

        assertThat(scannedFileRepository.count()).isEqualTo(1);
        assertThat(scannedFileRepository.findByFilenameAndFilepath("new.mkv", archive.toRealPath().toString()))
                .isEmpty();
        assertThat(scannedFileRepository.findByFilenameAndFilepath("a.mkv", libraryDir).orElseThrow().isRemoved())
                .isFalse();
        assertThat(syncService.lastRun(SourceKind.FILESYSTEM)).hasValueSatisfying(run -> {
            assertThat(run.getStatus()).isEqualTo(SyncRunStatus.FAILED);
            assertThat(run.getErrorMessage()).contains("library");
        });
    }
}
