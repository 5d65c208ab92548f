package dev.tvfiles.plex;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

/** One file of a media version, with its path on the Plex server's host. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlexPart(@Nullable String file) {}
