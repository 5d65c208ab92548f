package dev.tvfiles.filesystem;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ScanDirectoryServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private ScanDirectoryRepository scanDirectoryRepository;

    @TempDir
    Path root;

    private ScanDirectoryService service;

    @BeforeEach
    void setUp() {
        service = new ScanDirectoryService(scanDirectoryRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void registerStoresTheRealPath() throws IOException {
        Path tv = Files.createDirectories(root.resolve("tv"));
        String realPath = tv.toRealPath().toString();
        when(scanDirectoryRepository.findByDirname(realPath)).thenReturn(Optional.empty());
        when(scanDirectoryRepository.save(any(ScanDirectory.class))).thenAnswer(invocation -> invocation.getArgument(0));

        ScanDirectory registered = service.register(root.resolve("tv/../tv/.").toString());

        assertThat(registered.getDirname()).isEqualTo(realPath);
        assertThat(registered.getFirstAdded()).isEqualTo(NOW);
    }

    @Test
    void registeringTwiceKeepsTheFirstEntry() throws IOException {
        Path tv = Files.createDirectories(root.resolve("tv"));
        String realPath = tv.toRealPath().toString();
        ScanDirectory existing = new ScanDirectory(realPath, NOW.minusSeconds(86_400));
        when(scanDirectoryRepository.findByDirname(realPath)).thenReturn(Optional.of(existing));

        ScanDirectory registered = service.register(tv.toString());

        assertThat(registered).isSameAs(existing);
        verify(scanDirectoryRepository, never()).save(any());
    }

    @Test
    void symlinkRegistersItsTarget() throws IOException {
        Path tv = Files.createDirectories(root.resolve("tv"));
        Path link = Files.createSymbolicLink(root.resolve("link"), tv);
        String realPath = tv.toRealPath().toString();
        when(scanDirectoryRepository.findByDirname(realPath)).thenReturn(Optional.empty());
        when(scanDirectoryRepository.save(any(ScanDirectory.class))).thenAnswer(invocation -> invocation.getArgument(0));

        assertThat(service.register(link.toString()).getDirname()).isEqualTo(realPath);
    }

    @Test
    void missingDirectoryIsRejected() {
        assertThatThrownBy(() -> service.register(root.resolve("absent").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Not a directory");
        verify(scanDirectoryRepository, never()).save(any());
    }

    @Test
    void regularFileIsRejected() throws IOException {
        Path file = Files.writeString(root.resolve("a.mkv"), "x");

        assertThatThrownBy(() -> service.register(file.toString()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
