package dev.tvfiles.cli;

import dev.tvfiles.filesystem.ScanDirectoryService;
import dev.tvfiles.reconcile.SourceUnavailableException;
import dev.tvfiles.report.InventoryMismatch;
import dev.tvfiles.report.MismatchReportService;
import dev.tvfiles.reconcile.StoreUnavailableException;
import dev.tvfiles.sync.SourceKind;
import dev.tvfiles.sync.SyncService;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Command-line entry point.
 *
 * <ul>
 *   <li>{@code --dirname=<path>} registers a scan directory and implies a filesystem pass
 *   <li>{@code --update} runs a filesystem pass
 *   <li>{@code --source=filesystem|plex|sonarr|all} runs a pass of each named source; repeatable
 *       or comma separated
 *   <li>{@code --status} logs the most recent run of every source
 *   <li>{@code --mismatches} logs every file active in one inventory but missing from another
 * </ul>
 *
 * <p>Requested sources run in a fixed order and independently: a failing source does not stop
 * the others. The exit code is that of the first failure: 2 when a source was unavailable, 3 when
 * the store was, 1 for anything else.
 */
@Component
public class SyncCommandRunner implements ApplicationRunner, ExitCodeGenerator {

  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;
  static final int EXIT_SOURCE_UNAVAILABLE = 2;
  static final int EXIT_STORE_UNAVAILABLE = 3;

  private static final Logger log = LoggerFactory.getLogger(SyncCommandRunner.class);

  private final SyncService syncService;
  private final ScanDirectoryService scanDirectoryService;
  private final MismatchReportService mismatchReportService;

  private int exitCode = EXIT_OK;

  public SyncCommandRunner(
      SyncService syncService,
      ScanDirectoryService scanDirectoryService,
      MismatchReportService mismatchReportService) {
    this.syncService = syncService;
    this.scanDirectoryService = scanDirectoryService;
    this.mismatchReportService = mismatchReportService;
  }

  @Override
  public void run(ApplicationArguments args) {
    Set<SourceKind> sources;
    try {
      sources = requestedSources(args);
    } catch (IllegalArgumentException e) {
      log.error(e.getMessage());
      exitCode = EXIT_FAILURE;
      return;
    }

    List<String> dirnames = optionValues(args, "dirname");
    boolean status = args.containsOption("status");
    boolean mismatches = args.containsOption("mismatches");
    if (dirnames.isEmpty() && sources.isEmpty() && !status && !mismatches) {
      log.info(
          "Nothing to do. Options: --dirname=<path> --update --source=<{}> --status --mismatches",
          sourceNames());
      return;
    }

    for (String dirname : dirnames) {
      if (!attempt("register " + dirname, () -> scanDirectoryService.register(dirname))) {
        return;
      }
    }
    for (SourceKind source : sources) {
      attempt(source.cliName() + " sync", () -> syncService.sync(source));
    }
    if (status) {
      logStatus();
    }
    if (mismatches) {
      attempt("mismatch report", this::logMismatches);
    }
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  private Set<SourceKind> requestedSources(ApplicationArguments args) {
    Set<SourceKind> sources = EnumSet.noneOf(SourceKind.class);
    for (String value : optionValues(args, "source")) {
      for (String name : value.split(",")) {
        if (name.isBlank()) {
          continue;
        }
        if ("all".equalsIgnoreCase(name.trim())) {
          sources.addAll(EnumSet.allOf(SourceKind.class));
        } else {
          sources.add(SourceKind.fromCliName(name));
        }
      }
    }
    if (args.containsOption("update") || args.containsOption("dirname")) {
      sources.add(SourceKind.FILESYSTEM);
    }
    return sources;
  }

  private boolean attempt(String action, Runnable command) {
    try {
      command.run();
      return true;
    } catch (SourceUnavailableException e) {
      log.error("{} failed, source unavailable: {}", action, e.getMessage());
      recordFailure(EXIT_SOURCE_UNAVAILABLE);
    } catch (StoreUnavailableException | DataAccessException e) {
      log.error("{} failed, store unavailable: {}", action, e.getMessage());
      recordFailure(EXIT_STORE_UNAVAILABLE);
    } catch (RuntimeException e) {
      log.error("{} failed: {}", action, e.getMessage(), e);
      recordFailure(EXIT_FAILURE);
    }
    return false;
  }

  private void recordFailure(int code) {
    if (exitCode == EXIT_OK) {
      exitCode = code;
    }
  }

  private void logStatus() {
    for (SourceKind source : SourceKind.values()) {
      syncService
          .lastRun(source)
          .ifPresentOrElse(
              run ->
                  log.info(
                      "{}: {} started {} finished {} (seen={}, inserted={}, removed={}){}",
                      source.cliName(),
                      run.getStatus(),
                      run.getStartedAt(),
                      run.getFinishedAt(),
                      run.getFilesSeen(),
                      run.getFilesInserted(),
                      run.getFilesRemoved(),
                      run.getErrorMessage() == null ? "" : " error: " + run.getErrorMessage()),
              () -> log.info("{}: never run", source.cliName()));
    }
  }

  private void logMismatches() {
    List<InventoryMismatch> report = mismatchReportService.mismatches();
    for (InventoryMismatch mismatch : report) {
      log.info("{} | present in {} | missing from {}", mismatch.path(), names(mismatch.presentIn()),
          names(mismatch.missingFrom()));
    }
    log.info("{} mismatched files", report.size());
  }

  private static String names(Set<SourceKind> kinds) {
    return kinds.stream().map(SourceKind::cliName).collect(Collectors.joining(", "));
  }

  private static List<String> optionValues(ApplicationArguments args, String name) {
    List<String> values = args.getOptionValues(name);
    return values == null ? List.of() : values;
  }

  private static String sourceNames() {
    StringBuilder names = new StringBuilder();
    for (SourceKind kind : SourceKind.values()) {
      names.append(kind.cliName()).append('|');
    }
    return names.append("all").toString();
  }
}
