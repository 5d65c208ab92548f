package dev.tvfiles.filesystem;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Registers the directories the filesystem source walks. */
@Service
public class ScanDirectoryService {

    private static final Logger log = LoggerFactory.getLogger(ScanDirectoryService.class);

    private final ScanDirectoryRepository scanDirectoryRepository;
    private final Clock clock;

    public ScanDirectoryService(ScanDirectoryRepository scanDirectoryRepository, Clock clock) {
        this.scanDirectoryRepository = scanDirectoryRepository;
        this.clock = clock;
    }

    /**
     * Register a directory for scanning. Registering the same directory again is a no-op.
     *
     * <p>The directory is stored as its real path, so symbolic links and relative spellings of
     * the same directory register once.
     *
     * @param dirname the directory, absolute or relative to the working directory
     * @return the registered directory
     * @throws IllegalArgumentException if the path does not exist or is not a directory
     */
    @Transactional
    public ScanDirectory register(String dirname) {
        String realPath = realDirectory(dirname);
        return scanDirectoryRepository.findByDirname(realPath)
                .orElseGet(() -> {
                    log.info("Registered scan directory {}", realPath);
                    return scanDirectoryRepository.save(new ScanDirectory(realPath, clock.instant()));
                });
    }

    private static String realDirectory(String dirname) {
        Path path = Path.of(dirname);
        if (!Files.isDirectory(path)) {
            throw new IllegalArgumentException("Not a directory: " + dirname);
        }
        try {
            return path.toRealPath().toString();
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot resolve directory " + dirname + ": " + e.getMessage(), e);
        }
    }
}
