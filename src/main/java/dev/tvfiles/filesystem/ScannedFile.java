package dev.tvfiles.filesystem;

import dev.tvfiles.persistence.TrackedFile;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;

/**
 * A file found under a registered scan directory, keyed by {@code (filename, filepath)} where
 * {@code filepath} is the canonical containing directory.
 *
 * <p>Maps to the {@code files} table managed by Flyway migrations.
 */
@Entity
@Table(name = "files", uniqueConstraints =
    @UniqueConstraint(columnNames = {"filename", "filepath"})
)
public class ScannedFile extends TrackedFile {

    @Column(nullable = false, updatable = false)
    private String filename;

    @Column(nullable = false, updatable = false)
    private String filepath;

    @Column(name = "creation_date", updatable = false)
    private Instant createdAt;

    protected ScannedFile() {
        // JPA requires no-arg constructor
    }

    /**
     * @param filename  name of the file
     * @param filepath  canonical containing directory
     * @param createdAt creation time read from the filesystem, if available
     * @param addedAt   timestamp of the pass that first saw the file
     */
    public ScannedFile(String filename, String filepath, Instant createdAt, Instant addedAt) {
        super(addedAt);
        this.filename = filename;
        this.filepath = filepath;
        this.createdAt = createdAt;
    }

    public String getFilename() {
        return filename;
    }

    public String getFilepath() {
        return filepath;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
