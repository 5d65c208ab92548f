package dev.tvfiles.filesystem;

import dev.tvfiles.reconcile.Observation;
import dev.tvfiles.reconcile.ObservationSource;
import dev.tvfiles.reconcile.SourceUnavailableException;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Walks every registered scan directory and reports each file as an observation.
 *
 * <p>Symbolic links to files are reported under the link's own name and directory. Links to
 * directories are neither reported nor descended into.
 *
 * <p>Directories are walked one at a time; the files of a directory are collected before any are
 * emitted so that a read error surfaces as {@link SourceUnavailableException} instead of a
 * truncated listing. A missing registered directory is also fatal: walking it would report zero
 * files and soft-delete everything recorded beneath it.
 */
@Component
public class FilesystemObservationSource implements ObservationSource {

    private static final Logger log = LoggerFactory.getLogger(FilesystemObservationSource.class);

    private final ScanDirectoryRepository scanDirectoryRepository;

    public FilesystemObservationSource(ScanDirectoryRepository scanDirectoryRepository) {
        this.scanDirectoryRepository = scanDirectoryRepository;
    }

    @Override
    public Stream<Observation> observe() {
        List<Path> roots = scanDirectoryRepository.findAllByOrderByDirnameAsc().stream()
                .map(dir -> Path.of(dir.getDirname()))
                .toList();
        log.info("Scanning {} registered directories", roots.size());
        return roots.stream().flatMap(root -> walk(root).stream());
    }

    /**
     * Collect every regular file below {@code root}.
     *
     * @throws SourceUnavailableException if the root is missing or any directory cannot be read
     */
    List<Observation> walk(Path root) {
        if (!Files.isDirectory(root)) {
            throw new SourceUnavailableException("Scan directory is missing or not a directory: " + root);
        }

        List<Observation> observations = new ArrayList<>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (attrs.isRegularFile() || isFileLink(file, attrs)) {
                        observations.add(Observation.ofFile(new Observation.FileInfo(
                                file.getParent().toString(),
                                file.getFileName().toString(),
                                attrs.isSymbolicLink() ? targetCreationTime(file) : creationTime(attrs))));
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) throws IOException {
                    if (e instanceof NoSuchFileException) {
                        log.debug("File vanished during scan: {}", file);
                        return FileVisitResult.CONTINUE;
                    }
                    throw e;
                }
            });
        } catch (IOException e) {
            throw new SourceUnavailableException("Cannot scan " + root + ": " + e.getMessage(), e);
        }

        log.info("Scanned: {} | files: {}", root, observations.size());
        return observations;
    }

    private static boolean isFileLink(Path file, BasicFileAttributes attrs) {
        return attrs.isSymbolicLink() && !Files.isDirectory(file);
    }

    // Dangling links have no target to stat
    private static @Nullable Instant targetCreationTime(Path link) {
        try {
            return creationTime(Files.readAttributes(link, BasicFileAttributes.class));
        } catch (IOException e) {
            log.debug("Cannot stat link target of {}: {}", link, e.getMessage());
            return null;
        }
    }

    private static @Nullable Instant creationTime(BasicFileAttributes attrs) {
        return attrs.creationTime() == null ? null : attrs.creationTime().toInstant();
    }
}
