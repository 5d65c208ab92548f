package dev.tvfiles.persistence;

import jakarta.persistence.Column;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;

import java.time.Instant;
import java.util.UUID;

/**
 * Common mapping for file records of every source: a generated id, the immutable {@code
 * added_date} and the soft-delete marker {@code removed_date}.
 *
 * <p>{@code removed_date} only moves between null and a timestamp; {@link #markRemoved} and
 * {@link #clearRemoved} reject any other transition.
 */
@MappedSuperclass
public abstract class TrackedFile {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "added_date", nullable = false, updatable = false)
    private Instant addedAt;

    @Column(name = "removed_date")
    private Instant removedAt;

    protected TrackedFile() {
        // JPA requires no-arg constructor
    }

    protected TrackedFile(Instant addedAt) {
        this.addedAt = addedAt;
    }

    public UUID getId() {
        return id;
    }

    public Instant getAddedAt() {
        return addedAt;
    }

    public Instant getRemovedAt() {
        return removedAt;
    }

    public boolean isRemoved() {
        return removedAt != null;
    }

    /**
     * Soft-delete this file.
     *
     * @throws IllegalStateException if the file is already marked removed
     */
    public void markRemoved(Instant at) {
        if (removedAt != null) {
            throw new IllegalStateException("File " + id + " already removed at " + removedAt);
        }
        this.removedAt = at;
    }

    /**
     * Record that this file reappeared.
     *
     * @throws IllegalStateException if the file is not marked removed
     */
    public void clearRemoved() {
        if (removedAt == null) {
            throw new IllegalStateException("File " + id + " is not removed");
        }
        this.removedAt = null;
    }
}
