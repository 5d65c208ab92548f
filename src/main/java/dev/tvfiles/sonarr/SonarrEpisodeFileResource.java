package dev.tvfiles.sonarr;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Episode file entry of {@code GET /api/v3/episodefile}.
 *
 * <p>A multi-episode file lists several {@code episodeIds}; only the first is used for linking.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SonarrEpisodeFileResource(int id, @Nullable String path, List<Integer> episodeIds) {
  public SonarrEpisodeFileResource {
    episodeIds = episodeIds == null ? List.of() : List.copyOf(episodeIds);
  }

  /** The episode this file is linked to, if Sonarr reported any. */
  public Optional<Integer> primaryEpisodeId() {
    return episodeIds.isEmpty() ? Optional.empty() : Optional.of(episodeIds.get(0));
  }
}
