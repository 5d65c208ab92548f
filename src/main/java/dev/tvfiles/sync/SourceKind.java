package dev.tvfiles.sync;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/** The independent inventories a pass can reconcile. Each syncs on its own. */
public enum SourceKind {
  /** Files found by walking the registered scan directories. */
  FILESYSTEM,
  /** Episode files listed by the Plex media server catalog. */
  PLEX,
  /** Episode files tracked by Sonarr. */
  SONARR;

  /** The lower-case name used on the command line and in logs. */
  public String cliName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parse a command-line source name, case-insensitively.
   *
   * @throws IllegalArgumentException if the name matches no source
   */
  public static SourceKind fromCliName(String name) {
    for (SourceKind kind : values()) {
      if (kind.cliName().equalsIgnoreCase(name.trim())) {
        return kind;
      }
    }
    throw new IllegalArgumentException(
        "Unknown source '"
            + name
            + "', expected one of "
            + Arrays.stream(values()).map(SourceKind::cliName).collect(Collectors.joining(", ")));
  }
}
