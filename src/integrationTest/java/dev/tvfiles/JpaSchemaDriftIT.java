package dev.tvfiles;

import dev.tvfiles.filesystem.ScanDirectory;
import dev.tvfiles.filesystem.ScanDirectoryRepository;
import dev.tvfiles.filesystem.ScannedFile;
import dev.tvfiles.filesystem.ScannedFileRepository;
import dev.tvfiles.plex.PlexEpisode;
import dev.tvfiles.plex.PlexEpisodeRepository;
import dev.tvfiles.plex.PlexFile;
import dev.tvfiles.plex.PlexFileRepository;
import dev.tvfiles.plex.PlexSeries;
import dev.tvfiles.plex.PlexSeriesRepository;
import dev.tvfiles.reconcile.PassSummary;
import dev.tvfiles.sonarr.SonarrEpisode;
import dev.tvfiles.sonarr.SonarrEpisodeRepository;
import dev.tvfiles.sonarr.SonarrFile;
import dev.tvfiles.sonarr.SonarrFileRepository;
import dev.tvfiles.sonarr.SonarrSeries;
import dev.tvfiles.sonarr.SonarrSeriesRepository;
import dev.tvfiles.sync.SourceKind;
import dev.tvfiles.sync.SyncRun;
import dev.tvfiles.sync.SyncRunRepository;
import dev.tvfiles.sync.SyncRunStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Compensates for ddl-auto=none by verifying each JPA entity
 * can be persisted and read back against the Flyway schema.
 */
@Transactional
class JpaSchemaDriftIT extends BaseIntegrationTest {

    private static final Instant NOW = Instant.now().truncatedTo(ChronoUnit.MICROS);

    @Autowired
    private ScanDirectoryRepository scanDirectoryRepository;

    @Autowired
    private ScannedFileRepository scannedFileRepository;

    @Autowired
    private PlexSeriesRepository plexSeriesRepository;

    @Autowired
    private PlexEpisodeRepository plexEpisodeRepository;

    @Autowired
    private PlexFileRepository plexFileRepository;

    @Autowired
    private SonarrSeriesRepository sonarrSeriesRepository;

    @Autowired
    private SonarrEpisodeRepository sonarrEpisodeRepository;

    @Autowired
    private SonarrFileRepository sonarrFileRepository;

    @Autowired
    private SyncRunRepository syncRunRepository;

    @Test
    void filesystemEntitiesRoundtripAgainstFlywaySchema() {
        ScanDirectory dir = scanDirectoryRepository.saveAndFlush(new ScanDirectory("/media/tv", NOW));
        ScannedFile file = new ScannedFile("a.mkv", "/media/tv", NOW.minusSeconds(60), NOW);
        file.markRemoved(NOW.plusSeconds(60));
        ScannedFile saved = scannedFileRepository.saveAndFlush(file);

        assertThat(scanDirectoryRepository.findByDirname("/media/tv")).hasValueSatisfying(found ->
                assertThat(found.getId()).isEqualTo(dir.getId()));
        ScannedFile found = scannedFileRepository.findByFilenameAndFilepath("a.mkv", "/media/tv").orElseThrow();
        assertThat(found.getId()).isEqualTo(saved.getId());
        assertThat(found.getCreatedAt()).isEqualTo(NOW.minusSeconds(60));
        assertThat(found.getRemovedAt()).isEqualTo(NOW.plusSeconds(60));
        assertThat(scannedFileRepository.findAllByRemovedAtIsNull()).isEmpty();
    }

    @Test
    void compositeFileKeyIsUnique() {
        scannedFileRepository.saveAndFlush(new ScannedFile("a.mkv", "/media/tv", null, NOW));

        assertThatThrownBy(() -> scannedFileRepository.saveAndFlush(new ScannedFile("a.mkv", "/media/tv", null, NOW)))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void plexEntitiesRoundtripAgainstFlywaySchema() {
        PlexSeries series = plexSeriesRepository.saveAndFlush(new PlexSeries("/library/metadata/10/children", "Show"));
        PlexEpisode episode = plexEpisodeRepository.saveAndFlush(
                new PlexEpisode("/library/metadata/20", series.getId(), 1, 2));
        plexFileRepository.saveAndFlush(new PlexFile("s01e02.mkv", "/data/tv/Show", series.getId(), episode.getId(), NOW));
        plexFileRepository.saveAndFlush(new PlexFile("extra.mkv", "/data/tv/Show", series.getId(), null, NOW));

        PlexEpisode foundEpisode = plexEpisodeRepository.findByPlexKey("/library/metadata/20").orElseThrow();
        assertThat(foundEpisode.getSeriesId()).isEqualTo(series.getId());
        assertThat(foundEpisode.getEpisodeNumber()).isEqualTo(2);
        assertThat(plexFileRepository.findAllByRemovedAtIsNull()).hasSize(2);
    }

    @Test
    void sonarrEntitiesRoundtripAgainstFlywaySchema() {
        SonarrSeries series = sonarrSeriesRepository.saveAndFlush(new SonarrSeries(3, "Show", "/tv/Show"));
        SonarrEpisode episode = sonarrEpisodeRepository.saveAndFlush(new SonarrEpisode(31, series.getId(), 1, 1));
        sonarrFileRepository.saveAndFlush(new SonarrFile("/tv/Show/s01e01.mkv", series.getId(), episode.getId(), NOW));

        assertThat(sonarrSeriesRepository.findBySonarrId(3)).hasValueSatisfying(found ->
                assertThat(found.getPath()).isEqualTo("/tv/Show"));
        assertThat(sonarrFileRepository.findByFilePath("/tv/Show/s01e01.mkv")).hasValueSatisfying(found ->
                assertThat(found.getEpisodeId()).isEqualTo(episode.getId()));
    }

    @Test
    void syncRunRoundtripsAgainstFlywaySchema() {
        SyncRun run = new SyncRun(SourceKind.PLEX, NOW);
        run.complete(new PassSummary(NOW, 5, 4, 1, 3, 2, 1, 12), NOW.plusSeconds(1));
        syncRunRepository.saveAndFlush(run);

        SyncRun found = syncRunRepository.findFirstBySourceOrderByStartedAtDesc(SourceKind.PLEX).orElseThrow();
        assertThat(found.getStatus()).isEqualTo(SyncRunStatus.COMPLETED);
        assertThat(found.getFilesSeen()).isEqualTo(5);
        assertThat(found.getFilesUnresolved()).isEqualTo(2);
        assertThat(found.getFinishedAt()).isEqualTo(NOW.plusSeconds(1));
    }
}
