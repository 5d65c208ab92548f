package dev.tvfiles.report;

import dev.tvfiles.filesystem.ScannedFileRepository;
import dev.tvfiles.plex.PlexFileRepository;
import dev.tvfiles.sonarr.SonarrFile;
import dev.tvfiles.sonarr.SonarrFileRepository;
import dev.tvfiles.sync.SourceKind;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Compares the active files of the three inventories and reports every path that is not present
 * in all of them.
 *
 * <p>Each inventory sees the library through its own mount point, so paths are first made
 * relative by stripping the configured prefixes. Inventories without any active file are left
 * out of the comparison. Nothing is written.
 */
@Service
public class MismatchReportService {

  private static final Logger log = LoggerFactory.getLogger(MismatchReportService.class);

  private final ScannedFileRepository scannedFileRepository;
  private final PlexFileRepository plexFileRepository;
  private final SonarrFileRepository sonarrFileRepository;
  private final ReportProperties properties;

  public MismatchReportService(
      ScannedFileRepository scannedFileRepository,
      PlexFileRepository plexFileRepository,
      SonarrFileRepository sonarrFileRepository,
      ReportProperties properties) {
    this.scannedFileRepository = scannedFileRepository;
    this.plexFileRepository = plexFileRepository;
    this.sonarrFileRepository = sonarrFileRepository;
    this.properties = properties;
  }

  /**
   * Paths active in at least one compared inventory but missing from another, sorted by path.
   *
   * @return the mismatches; empty when fewer than two inventories hold active files
   */
  @Transactional(readOnly = true)
  public List<InventoryMismatch> mismatches() {
    Map<SourceKind, Set<String>> inventories = new EnumMap<>(SourceKind.class);
    inventories.put(
        SourceKind.FILESYSTEM,
        relativize(
            scannedFileRepository.findAllByRemovedAtIsNull().stream()
                .map(f -> join(f.getFilepath(), f.getFilename())),
            properties.filesystemPrefixes()));
    inventories.put(
        SourceKind.PLEX,
        relativize(
            plexFileRepository.findAllByRemovedAtIsNull().stream()
                .map(f -> join(f.getFilepath(), f.getFilename())),
            properties.plexPrefixes()));
    inventories.put(
        SourceKind.SONARR,
        relativize(
            sonarrFileRepository.findAllByRemovedAtIsNull().stream().map(SonarrFile::getFilePath),
            properties.sonarrPrefixes()));

    Set<SourceKind> compared = EnumSet.noneOf(SourceKind.class);
    inventories.forEach(
        (kind, paths) -> {
          if (paths.isEmpty()) {
            log.info("Skipping {}: no active files", kind.cliName());
          } else {
            compared.add(kind);
          }
        });
    if (compared.size() < 2) {
      log.info("Nothing to compare: {} inventories hold active files", compared.size());
      return List.of();
    }

    Map<String, Set<SourceKind>> presence = new TreeMap<>();
    for (SourceKind kind : compared) {
      for (String path : inventories.get(kind)) {
        presence.computeIfAbsent(path, p -> EnumSet.noneOf(SourceKind.class)).add(kind);
      }
    }

    List<InventoryMismatch> mismatches = new ArrayList<>();
    presence.forEach(
        (path, presentIn) -> {
          if (presentIn.size() < compared.size()) {
            Set<SourceKind> missingFrom = EnumSet.copyOf(compared);
            missingFrom.removeAll(presentIn);
            mismatches.add(new InventoryMismatch(path, presentIn, missingFrom));
          }
        });
    log.info("Compared {}: {} paths, {} mismatches", compared, presence.size(), mismatches.size());
    return mismatches;
  }

  private static Set<String> relativize(Stream<String> paths, List<String> prefixes) {
    Set<String> relative = new HashSet<>();
    paths.forEach(path -> relative.add(stripPrefix(path, prefixes)));
    return relative;
  }

  static String stripPrefix(String path, List<String> prefixes) {
    for (String prefix : prefixes) {
      if (!prefix.isEmpty() && path.startsWith(prefix)) {
        return path.substring(prefix.length());
      }
    }
    return path;
  }

  private static String join(String directory, String filename) {
    return directory.endsWith("/") ? directory + filename : directory + "/" + filename;
  }
}
