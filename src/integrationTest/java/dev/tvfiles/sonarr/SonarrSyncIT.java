package dev.tvfiles.sonarr;

import dev.tvfiles.BaseIntegrationTest;
import dev.tvfiles.reconcile.PassSummary;
import dev.tvfiles.reconcile.SourceUnavailableException;
import dev.tvfiles.sync.SourceKind;
import dev.tvfiles.sync.SyncService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

class SonarrSyncIT extends BaseIntegrationTest {

    @MockitoBean
    SonarrClient sonarrClient;

    @Autowired
    SyncService syncService;

    @Autowired
    SonarrSeriesRepository seriesRepository;

    @Autowired
    SonarrEpisodeRepository episodeRepository;

    @Autowired
    SonarrFileRepository fileRepository;

    private void stubSeries(int id, String title) {
        when(sonarrClient.episodes(id)).thenReturn(List.of(new SonarrEpisodeResource(id * 10 + 1, 1, 1)));
        when(sonarrClient.episodeFiles(id)).thenReturn(List.of(
                new SonarrEpisodeFileResource(id * 100, "/tv/" + title + "/s01e01.mkv", List.of(id * 10 + 1)),
                new SonarrEpisodeFileResource(id * 100 + 1, "/tv/" + title + "/extra.mkv", List.of())));
    }

    @Test
    void series_episodes_and_files_are_written_with_links() {
        when(sonarrClient.series()).thenReturn(List.of(new SonarrSeriesResource(3, "Show", "/tv/Show")));
        stubSeries(3, "Show");

        PassSummary summary = syncService.sync(SourceKind.SONARR);

        assertThat(summary.seen()).isEqualTo(2);
        assertThat(summary.inserted()).isEqualTo(2);
        assertThat(summary.linked()).isEqualTo(1);
        assertThat(summary.unresolved()).isEqualTo(1);

        SonarrSeries series = seriesRepository.findBySonarrId(3).orElseThrow();
        SonarrEpisode episode = episodeRepository.findBySonarrId(31).orElseThrow();
        assertThat(episode.getSeriesId()).isEqualTo(series.getId());
        assertThat(fileRepository.findByFilePath("/tv/Show/s01e01.mkv")).hasValueSatisfying(file -> {
            assertThat(file.getSeriesId()).isEqualTo(series.getId());
            assertThat(file.getEpisodeId()).isEqualTo(episode.getId());
        });
        assertThat(fileRepository.findByFilePath("/tv/Show/extra.mkv")).hasValueSatisfying(file ->
                assertThat(file.getEpisodeId()).isNull());
    }

    @Test
    void failure_on_a_later_series_rolls_back_the_whole_pass() {
        when(sonarrClient.series()).thenReturn(List.of(
                new SonarrSeriesResource(3, "Show", "/tv/Show"),
                new SonarrSeriesResource(4, "Other", "/tv/Other")));
        stubSeries(3, "Show");
        when(sonarrClient.episodes(4)).thenThrow(new SourceUnavailableException("Sonarr request failed"));

        assertThatThrownBy(() -> syncService.sync(SourceKind.SONARR))
                .isInstanceOf(SourceUnavailableException.class);

        assertThat(seriesRepository.count()).isZero();
        assertThat(episodeRepository.count()).isZero();
        assertThat(fileRepository.count()).isZero();
    }

    @Test
    void file_missing_from_sonarr_is_soft_deleted() {
        when(sonarrClient.series()).thenReturn(List.of(new SonarrSeriesResource(3, "Show", "/tv/Show")));
        stubSeries(3, "Show");
        syncService.sync(SourceKind.SONARR);

        when(sonarrClient.episodeFiles(3)).thenReturn(List.of(
                new SonarrEpisodeFileResource(300, "/tv/Show/s01e01.mkv", List.of(31))));
        PassSummary summary = syncService.sync(SourceKind.SONARR);

        assertThat(summary.removed()).isEqualTo(1);
        assertThat(fileRepository.findByFilePath("/tv/Show/extra.mkv").orElseThrow().isRemoved()).isTrue();
        assertThat(seriesRepository.count()).isEqualTo(1);
    }
}
