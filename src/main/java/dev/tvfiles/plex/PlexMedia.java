package dev.tvfiles.plex;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** One media version of an episode. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlexMedia(@JsonProperty("Part") List<PlexPart> parts) {
  public PlexMedia {
    parts = parts == null ? List.of() : List.copyOf(parts);
  }
}
