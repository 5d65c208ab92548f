package dev.tvfiles.sonarr;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

/** Episode entry of {@code GET /api/v3/episode}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SonarrEpisodeResource(
    int id, @Nullable Integer seasonNumber, @Nullable Integer episodeNumber) {}
