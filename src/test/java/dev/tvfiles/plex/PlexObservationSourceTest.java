package dev.tvfiles.plex;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.tvfiles.reconcile.Observation;
import dev.tvfiles.reconcile.SourceUnavailableException;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class PlexObservationSourceTest {

    private static final String SHOW_KEY = "/library/metadata/10/children";
    private static final String SEASON_KEY = "/library/metadata/11/children";

    @Mock
    private PlexClient plexClient;

    private PlexObservationSource source;

    @BeforeEach
    void setUp() {
        source = new PlexObservationSource(plexClient);
    }

    private static PlexMetadata episode(String key, int index, String... files) {
        List<PlexPart> parts = Arrays.stream(files).map(PlexPart::new).toList();
        return new PlexMetadata(key, "episode", "Episode " + index, index,
                List.of(new PlexMedia(parts)));
    }

    private void stubShowLibrary() {
        when(plexClient.librarySections()).thenReturn(List.of(
                new PlexDirectory("1", "show", "TV Shows"),
                new PlexDirectory("2", "movie", "Movies")));
        when(plexClient.sectionItems("1")).thenReturn(List.of(
                new PlexMetadata(SHOW_KEY, "show", "The Show", null, null)));
        when(plexClient.children(SHOW_KEY)).thenReturn(List.of(
                new PlexMetadata(SEASON_KEY, "season", "Season 2", 2, null),
                new PlexMetadata("/library/metadata/12", "clip", "Trailer", null, null)));
    }

    @Test
    void everyEpisodeFileBecomesAnObservation() {
        stubShowLibrary();
        when(plexClient.children(SEASON_KEY)).thenReturn(List.of(
                episode("/library/metadata/20", 1, "/data/tv/The Show/s02e01.mkv"),
                episode("/library/metadata/21", 2, "/data/tv/The Show/s02e02.mkv", "/data/tv/The Show/s02e02.srt")));

        List<Observation> observations = source.observe().toList();

        assertThat(observations).hasSize(3);
        Observation first = observations.get(0);
        assertThat(first.series().externalId()).isEqualTo(SHOW_KEY);
        assertThat(first.series().title()).isEqualTo("The Show");
        assertThat(first.episode().externalId()).isEqualTo("/library/metadata/20");
        assertThat(first.episode().seasonNumber()).isEqualTo(2);
        assertThat(first.episode().episodeNumber()).isEqualTo(1);
        assertThat(first.file().directory()).isEqualTo("/data/tv/The Show");
        assertThat(first.file().name()).isEqualTo("s02e01.mkv");
        assertThat(observations).extracting(o -> o.file().name())
                .containsExactly("s02e01.mkv", "s02e02.mkv", "s02e02.srt");
    }

    @Test
    void nonShowSectionsAndNonSeasonChildrenAreSkipped() {
        stubShowLibrary();
        when(plexClient.children(SEASON_KEY)).thenReturn(List.of());

        assertThat(source.observe().toList()).isEmpty();

        verify(plexClient, never()).sectionItems("2");
        verify(plexClient, never()).children("/library/metadata/12");
    }

    @Test
    void unusablePathIsSkipped() {
        stubShowLibrary();
        when(plexClient.children(SEASON_KEY)).thenReturn(List.of(
                episode("/library/metadata/20", 1, "/"),
                episode("/library/metadata/21", 2, "/data/tv/The Show/s02e02.mkv")));

        assertThat(source.observe().toList()).extracting(o -> o.file().name()).containsExactly("s02e02.mkv");
    }

    @Test
    void listingFailurePropagates() {
        stubShowLibrary();
        when(plexClient.children(SEASON_KEY)).thenThrow(new SourceUnavailableException("Plex request failed"));

        assertThatThrownBy(() -> source.observe().toList())
                .isInstanceOf(SourceUnavailableException.class);
    }
}
