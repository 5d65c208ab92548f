package dev.tvfiles.plex;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.util.UUID;

/**
 * An episode as listed by Plex, keyed by its metadata key and owned by one {@link PlexSeries}.
 *
 * <p>Maps to the {@code plex_episodes} table managed by Flyway migrations.
 */
@Entity
@Table(name = "plex_episodes")
public class PlexEpisode {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "plex_key", nullable = false, unique = true, updatable = false)
    private String plexKey;

    @Column(name = "series_id", nullable = false, updatable = false)
    private UUID seriesId;

    @Column(name = "season_number")
    private Integer seasonNumber;

    @Column(name = "episode_number")
    private Integer episodeNumber;

    protected PlexEpisode() {
        // JPA requires no-arg constructor
    }

    public PlexEpisode(String plexKey, UUID seriesId, Integer seasonNumber, Integer episodeNumber) {
        this.plexKey = plexKey;
        this.seriesId = seriesId;
        this.seasonNumber = seasonNumber;
        this.episodeNumber = episodeNumber;
    }

    public UUID getId() {
        return id;
    }

    public String getPlexKey() {
        return plexKey;
    }

    public UUID getSeriesId() {
        return seriesId;
    }

    public Integer getSeasonNumber() {
        return seasonNumber;
    }

    public Integer getEpisodeNumber() {
        return episodeNumber;
    }
}
