package dev.tvfiles.sonarr;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

/** Series entry of {@code GET /api/v3/series}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SonarrSeriesResource(int id, @Nullable String title, @Nullable String path) {}
