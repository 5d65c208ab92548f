package dev.tvfiles.report;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Mount-point prefixes stripped from each inventory's paths before they are compared, bound from
 * {@code tvfiles.report.*}. The first matching prefix of a path is removed.
 *
 * @param filesystemPrefixes prefixes of locally scanned paths, e.g. {@code /mnt/nas/videos/}
 * @param plexPrefixes prefixes of paths as the Plex server sees them
 * @param sonarrPrefixes prefixes of paths as Sonarr sees them
 */
@ConfigurationProperties(prefix = "tvfiles.report")
public record ReportProperties(
    List<String> filesystemPrefixes, List<String> plexPrefixes, List<String> sonarrPrefixes) {
  public ReportProperties {
    filesystemPrefixes = filesystemPrefixes == null ? List.of() : List.copyOf(filesystemPrefixes);
    plexPrefixes = plexPrefixes == null ? List.of() : List.copyOf(plexPrefixes);
    sonarrPrefixes = sonarrPrefixes == null ? List.of() : List.copyOf(sonarrPrefixes);
  }
}
