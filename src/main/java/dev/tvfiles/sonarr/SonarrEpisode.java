package dev.tvfiles.sonarr;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.util.UUID;

/**
 * An episode as listed by Sonarr, owned by one {@link SonarrSeries}.
 *
 * <p>Maps to the {@code sonarr_episodes} table managed by Flyway migrations.
 */
@Entity
@Table(name = "sonarr_episodes")
public class SonarrEpisode {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "sonarr_id", nullable = false, unique = true, updatable = false)
    private int sonarrId;

    @Column(name = "series_id", nullable = false, updatable = false)
    private UUID seriesId;

    @Column(name = "season_number")
    private Integer seasonNumber;

    @Column(name = "episode_number")
    private Integer episodeNumber;

    protected SonarrEpisode() {
        // JPA requires no-arg constructor
    }

    public SonarrEpisode(int sonarrId, UUID seriesId, Integer seasonNumber, Integer episodeNumber) {
        this.sonarrId = sonarrId;
        this.seriesId = seriesId;
        this.seasonNumber = seasonNumber;
        this.episodeNumber = episodeNumber;
    }

    public UUID getId() {
        return id;
    }

    public int getSonarrId() {
        return sonarrId;
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
