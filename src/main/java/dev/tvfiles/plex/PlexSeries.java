package dev.tvfiles.plex;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.util.UUID;

/**
 * A show as listed by Plex, keyed by its metadata key.
 *
 * <p>Maps to the {@code plex_series} table managed by Flyway migrations.
 */
@Entity
@Table(name = "plex_series")
public class PlexSeries {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "plex_key", nullable = false, unique = true, updatable = false)
    private String plexKey;

    @Column(nullable = false)
    private String title;

    protected PlexSeries() {
        // JPA requires no-arg constructor
    }

    public PlexSeries(String plexKey, String title) {
        this.plexKey = plexKey;
        this.title = title;
    }

    public UUID getId() {
        return id;
    }

    public String getPlexKey() {
        return plexKey;
    }

    public String getTitle() {
        return title;
    }
}
