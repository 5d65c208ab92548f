package dev.tvfiles.filesystem;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

/**
 * A directory registered for filesystem scanning. Every filesystem pass walks all registered
 * directories.
 *
 * <p>Maps to the {@code scan_dirs} table managed by Flyway migrations.
 */
@Entity
@Table(name = "scan_dirs")
public class ScanDirectory {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, unique = true)
    private String dirname;

    @Column(name = "first_added", nullable = false, updatable = false)
    private Instant firstAdded;

    protected ScanDirectory() {
        // JPA requires no-arg constructor
    }

    /**
     * @param dirname    canonical absolute path of the directory
     * @param firstAdded when the directory was registered
     */
    public ScanDirectory(String dirname, Instant firstAdded) {
        this.dirname = dirname;
        this.firstAdded = firstAdded;
    }

    public UUID getId() {
        return id;
    }

    public String getDirname() {
        return dirname;
    }

    public Instant getFirstAdded() {
        return firstAdded;
    }
}
