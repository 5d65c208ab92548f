package dev.tvfiles.plex;

import dev.tvfiles.BaseIntegrationTest;
import dev.tvfiles.reconcile.PassSummary;
import dev.tvfiles.sync.SourceKind;
import dev.tvfiles.sync.SyncService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

class PlexSyncIT extends BaseIntegrationTest {

    private static final String SHOW_KEY = "/library/metadata/10/children";
    private static final String SEASON_KEY = "/library/metadata/11/children";

    @MockitoBean
    PlexClient plexClient;

    @Autowired
    SyncService syncService;

    @Autowired
    PlexSeriesRepository seriesRepository;

    @Autowired
    PlexFileRepository fileRepository;

    @BeforeEach
    void stubLibrary() {
        when(plexClient.librarySections()).thenReturn(List.of(new PlexDirectory("1", "show", "TV Shows")));
        when(plexClient.sectionItems("1")).thenReturn(List.of(
                new PlexMetadata(SHOW_KEY, "show", "The Show", null, null)));
        when(plexClient.children(SHOW_KEY)).thenReturn(List.of(
                new PlexMetadata(SEASON_KEY, "season", "Season 1", 1, null)));
    }

    private static PlexMetadata episode(String key, int index, String file) {
        return new PlexMetadata(key, "episode", null, index,
                List.of(new PlexMedia(List.of(new PlexPart(file)))));
    }

    @Test
    void same_file_reported_twice_is_tracked_once() {
        when(plexClient.children(SEASON_KEY)).thenReturn(List.of(
                episode("/library/metadata/20", 1, "/data/tv/The Show/s01e01.mkv"),
                episode("/library/metadata/20", 1, "/data/tv/The Show/./s01e01.mkv")));

        PassSummary summary = syncService.sync(SourceKind.PLEX);

        assertThat(summary.seen()).isEqualTo(2);
        assertThat(summary.inserted()).isEqualTo(1);
        assertThat(seriesRepository.count()).isEqualTo(1);
        assertThat(fileRepository.findByFilenameAndFilepath("s01e01.mkv", "/data/tv/The Show")).isPresent();
    }

    @Test
    void vanished_episode_file_is_soft_deleted_and_restored() {
        when(plexClient.children(SEASON_KEY)).thenReturn(List.of(
                episode("/library/metadata/20", 1, "/data/tv/The Show/s01e01.mkv"),
                episode("/library/metadata/21", 2, "/data/tv/The Show/s01e02.mkv")));
        syncService.sync(SourceKind.PLEX);

        when(plexClient.children(SEASON_KEY)).thenReturn(List.of(
                episode("/library/metadata/20", 1, "/data/tv/The Show/s01e01.mkv")));
        assertThat(syncService.sync(SourceKind.PLEX).removed()).isEqualTo(1);

        when(plexClient.children(SEASON_KEY)).thenReturn(List.of(
                episode("/library/metadata/20", 1, "/data/tv/The Show/s01e01.mkv"),
                episode("/library/metadata/21", 2, "/data/tv/The Show/s01e02.mkv")));
        PassSummary third = syncService.sync(SourceKind.PLEX);

        assertThat(third.restored()).isEqualTo(1);
        assertThat(third.inserted()).isZero();
        assertThat(fileRepository.findAllByRemovedAtIsNull()).hasSize(2);
    }
}
