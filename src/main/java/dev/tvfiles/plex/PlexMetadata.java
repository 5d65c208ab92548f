package dev.tvfiles.plex;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A show, season or episode item.
 *
 * <p>{@code key} is the path to fetch the item's children (shows and seasons) or the item
 * itself (episodes). {@code index} is the season number of a season and the episode number of
 * an episode.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlexMetadata(
    String key,
    @Nullable String type,
    @Nullable String title,
    @Nullable Integer index,
    @JsonProperty("Media") List<PlexMedia> media) {
  public PlexMetadata {
    media = media == null ? List.of() : List.copyOf(media);
  }

  public boolean isSeason() {
    return "season".equals(type);
  }

  /** Every file path across all media versions and parts, in response order. */
  public List<String> filePaths() {
    return media.stream()
        .flatMap(m -> m.parts().stream())
        .map(PlexPart::file)
        .filter(Objects::nonNull)
        .toList();
  }
}
