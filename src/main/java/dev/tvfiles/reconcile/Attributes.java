package dev.tvfiles.reconcile;

import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * Non-key attributes written once, when a row is first inserted.
 *
 * <p>Which fields are populated depends on the entity kind; the store adapter for each source
 * picks the ones its table has.
 *
 * @param title series title
 * @param path series root folder
 * @param seasonNumber episode season ordinal
 * @param episodeNumber episode ordinal
 * @param createdAt file creation timestamp
 */
public record Attributes(
    @Nullable String title,
    @Nullable String path,
    @Nullable Integer seasonNumber,
    @Nullable Integer episodeNumber,
    @Nullable Instant createdAt) {

  public static Attributes ofSeries(String title, @Nullable String path) {
    return new Attributes(title, path, null, null, null);
  }

  public static Attributes ofEpisode(@Nullable Integer seasonNumber, @Nullable Integer episodeNumber) {
    return new Attributes(null, null, seasonNumber, episodeNumber, null);
  }

  public static Attributes ofFile(@Nullable Instant createdAt) {
    return new Attributes(null, null, null, null, createdAt);
  }
}
