package dev.tvfiles.reconcile;

import java.time.Instant;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * One raw record from an observation source describing a file and, for catalog sources, the
 * series and episode it belongs to.
 *
 * <p>{@code series} and {@code episode} are null when the source does not know them (filesystem)
 * or could not link the file (a Sonarr file without usable {@code episodeIds}).
 *
 * @param series the owning series, if known
 * @param episode the owning episode, if known
 * @param file the observed file
 */
public record Observation(
    @Nullable SeriesInfo series, @Nullable EpisodeInfo episode, FileInfo file) {

  public Observation {
    Objects.requireNonNull(file, "file");
  }

  /** A bare file with no catalog context, as produced by a directory walk. */
  public static Observation ofFile(FileInfo file) {
    return new Observation(null, null, file);
  }

  /**
   * Series as reported by the source.
   *
   * @param externalId stable identifier assigned by the source
   * @param title display title
   * @param path root folder of the series on the source's host, if reported
   */
  public record SeriesInfo(String externalId, String title, @Nullable String path) {
    public SeriesInfo {
      Objects.requireNonNull(externalId, "externalId");
      Objects.requireNonNull(title, "title");
    }
  }

  /**
   * Episode as reported by the source.
   *
   * @param externalId stable identifier assigned by the source
   * @param seasonNumber season ordinal, if reported
   * @param episodeNumber episode ordinal within the season, if reported
   */
  public record EpisodeInfo(
      String externalId, @Nullable Integer seasonNumber, @Nullable Integer episodeNumber) {
    public EpisodeInfo {
      Objects.requireNonNull(externalId, "externalId");
    }
  }

  /**
   * File as reported by the source. The directory may be relative or non-canonical; the key
   * model canonicalizes it.
   *
   * @param directory containing directory
   * @param name file name
   * @param createdAt creation timestamp, if the source could read it
   */
  public record FileInfo(String directory, String name, @Nullable Instant createdAt) {
    public FileInfo {
      Objects.requireNonNull(directory, "directory");
      Objects.requireNonNull(name, "name");
    }

    /**
     * Splits a full file path into directory and name.
     *
     * @param path full path as reported by the source
     * @param createdAt creation timestamp, if known
     * @return the file info
     * @throws IllegalArgumentException if the path has no file name component
     */
    public static FileInfo ofPath(String path, @Nullable Instant createdAt) {
      String canonical = PathCanonicalizer.canonicalize(path);
      int separator = canonical.lastIndexOf('/');
      if (separator < 0 || separator == canonical.length() - 1) {
        throw new IllegalArgumentException("Path has no file name: " + path);
      }
      String directory = separator == 0 ? "/" : canonical.substring(0, separator);
      return new FileInfo(directory, canonical.substring(separator + 1), createdAt);
    }
  }
}
