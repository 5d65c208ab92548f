package dev.tvfiles.plex;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** A library section as listed by {@code /library/sections}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlexDirectory(String key, String type, String title) {

  public boolean isShowLibrary() {
    return "show".equals(type);
  }
}
