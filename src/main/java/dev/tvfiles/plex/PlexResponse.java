package dev.tvfiles.plex;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/** Envelope of every Plex JSON response. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PlexResponse(@JsonProperty("MediaContainer") @Nullable PlexMediaContainer mediaContainer) {}
