package dev.tvfiles.plex;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Body of a Plex response. Library listings fill {@code Directory}; item listings fill {@code
 * Metadata}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlexMediaContainer(
    @JsonProperty("Directory") List<PlexDirectory> directories,
    @JsonProperty("Metadata") List<PlexMetadata> metadata) {
  public PlexMediaContainer {
    directories = directories == null ? List.of() : List.copyOf(directories);
    metadata = metadata == null ? List.of() : List.copyOf(metadata);
  }
}
