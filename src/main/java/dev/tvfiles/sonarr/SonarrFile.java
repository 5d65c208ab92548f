package dev.tvfiles.sonarr;

import dev.tvfiles.persistence.TrackedFile;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.UUID;

/**
 * An episode file known to Sonarr, keyed by its canonical absolute path.
 *
 * <p>{@code episodeId} is null when Sonarr reported no usable episode for the file.
 *
 * <p>Maps to the {@code sonarr_files} table managed by Flyway migrations.
 */
@Entity
@Table(name = "sonarr_files")
public class SonarrFile extends TrackedFile {

    @Column(name = "file_path", nullable = false, unique = true, updatable = false)
    private String filePath;

    @Column(name = "series_id", nullable = false, updatable = false)
    private UUID seriesId;

    @Column(name = "episode_id", updatable = false)
    private UUID episodeId;

    protected SonarrFile() {
        // JPA requires no-arg constructor
    }

    public SonarrFile(String filePath, UUID seriesId, UUID episodeId, Instant addedAt) {
        super(addedAt);
        this.filePath = filePath;
        this.seriesId = seriesId;
        this.episodeId = episodeId;
    }

    public String getFilePath() {
        return filePath;
    }

    public UUID getSeriesId() {
        return seriesId;
    }

    public UUID getEpisodeId() {
        return episodeId;
    }
}
