package dev.tvfiles.plex;

import dev.tvfiles.persistence.TrackedFile;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;
import java.util.UUID;

/**
 * A media file Plex reports for an episode, keyed by {@code (filename, filepath)}.
 *
 * <p>{@code episodeId} is null when the file was kept without an episode link.
 *
 * <p>Maps to the {@code plex_files} table managed by Flyway migrations.
 */
@Entity
@Table(name = "plex_files", uniqueConstraints =
    @UniqueConstraint(columnNames = {"filename", "filepath"})
)
public class PlexFile extends TrackedFile {

    @Column(nullable = false, updatable = false)
    private String filename;

    @Column(nullable = false, updatable = false)
    private String filepath;

    @Column(name = "series_id", nullable = false, updatable = false)
    private UUID seriesId;

    @Column(name = "episode_id", updatable = false)
    private UUID episodeId;

    protected PlexFile() {
        // JPA requires no-arg constructor
    }

    public PlexFile(String filename, String filepath, UUID seriesId, UUID episodeId, Instant addedAt) {
        super(addedAt);
        this.filename = filename;
        this.filepath = filepath;
        this.seriesId = seriesId;
        this.episodeId = episodeId;
    }

    public String getFilename() {
        return filename;
    }

    public String getFilepath() {
        return filepath;
    }

    public UUID getSeriesId() {
        return seriesId;
    }

    public UUID getEpisodeId() {
        return episodeId;
    }
}
