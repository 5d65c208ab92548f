package dev.tvfiles.sonarr;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import dev.tvfiles.reconcile.Observation;
import dev.tvfiles.reconcile.SourceUnavailableException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SonarrObservationSourceTest {

    @Mock
    private SonarrClient sonarrClient;

    private SonarrObservationSource source;

    @BeforeEach
    void setUp() {
        source = new SonarrObservationSource(sonarrClient);
        when(sonarrClient.series()).thenReturn(List.of(new SonarrSeriesResource(3, "The Show", "/tv/The Show")));
    }

    @Test
    void fileIsLinkedToItsFirstEpisode() {
        when(sonarrClient.episodes(3)).thenReturn(List.of(
                new SonarrEpisodeResource(31, 1, 1),
                new SonarrEpisodeResource(32, 1, 2)));
        when(sonarrClient.episodeFiles(3)).thenReturn(List.of(
                new SonarrEpisodeFileResource(9, "/tv/The Show/Season 1/s01e01-e02.mkv", List.of(32, 31))));

        List<Observation> observations = source.observe().toList();

        assertThat(observations).singleElement().satisfies(observation -> {
            assertThat(observation.series().externalId()).isEqualTo("3");
            assertThat(observation.series().path()).isEqualTo("/tv/The Show");
            assertThat(observation.episode().externalId()).isEqualTo("32");
            assertThat(observation.episode().episodeNumber()).isEqualTo(2);
            assertThat(observation.file().directory()).isEqualTo("/tv/The Show/Season 1");
            assertThat(observation.file().name()).isEqualTo("s01e01-e02.mkv");
        });
    }

    @Test
    void fileWithoutEpisodeIdsIsObservedUnlinked() {
        when(sonarrClient.episodes(3)).thenReturn(List.of(new SonarrEpisodeResource(31, 1, 1)));
        when(sonarrClient.episodeFiles(3)).thenReturn(List.of(
                new SonarrEpisodeFileResource(9, "/tv/The Show/extra.mkv", List.of())));

        assertThat(source.observe().toList()).singleElement().satisfies(observation -> {
            assertThat(observation.series()).isNotNull();
            assertThat(observation.episode()).isNull();
        });
    }

    @Test
    void fileLinkedToUnknownEpisodeIsObservedUnlinked() {
        when(sonarrClient.episodes(3)).thenReturn(List.of());
        when(sonarrClient.episodeFiles(3)).thenReturn(List.of(
                new SonarrEpisodeFileResource(9, "/tv/The Show/s01e01.mkv", List.of(99))));

        assertThat(source.observe().toList()).singleElement()
                .satisfies(observation -> assertThat(observation.episode()).isNull());
    }

    @Test
    void fileWithoutPathIsSkipped() {
        when(sonarrClient.episodes(3)).thenReturn(List.of());
        when(sonarrClient.episodeFiles(3)).thenReturn(List.of(new SonarrEpisodeFileResource(9, null, List.of())));

        assertThat(source.observe().toList()).isEmpty();
    }

    @Test
    void episodeListingFailurePropagates() {
        when(sonarrClient.episodes(3)).thenThrow(new SourceUnavailableException("Sonarr request failed"));

        assertThatThrownBy(() -> source.observe().toList()).isInstanceOf(SourceUnavailableException.class);
    }
}
