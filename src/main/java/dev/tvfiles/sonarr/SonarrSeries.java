package dev.tvfiles.sonarr;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.util.UUID;

/**
 * A series as listed by Sonarr, keyed by Sonarr's numeric id.
 *
 * <p>Maps to the {@code sonarr_series} table managed by Flyway migrations.
 */
@Entity
@Table(name = "sonarr_series")
public class SonarrSeries {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "sonarr_id", nullable = false, unique = true, updatable = false)
    private int sonarrId;

    @Column(nullable = false)
    private String title;

    private String path;

    protected SonarrSeries() {
        // JPA requires no-arg constructor
    }

    public SonarrSeries(int sonarrId, String title, String path) {
        this.sonarrId = sonarrId;
        this.title = title;
        this.path = path;
    }

    public UUID getId() {
        return id;
    }

    public int getSonarrId() {
        return sonarrId;
    }

    public String getTitle() {
        return title;
    }

    public String getPath() {
        return path;
    }
}
