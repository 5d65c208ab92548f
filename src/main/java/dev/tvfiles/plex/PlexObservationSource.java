package dev.tvfiles.plex;

import dev.tvfiles.reconcile.Observation;
import dev.tvfiles.reconcile.ObservationSource;
import java.util.Optional;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Walks every show library: sections, then shows, seasons, episodes and the files of each
 * episode. Each file yields one observation carrying its show and episode.
 *
 * <p>The walk is lazy; each listing is fetched when the stream reaches it.
 */
@Component
public class PlexObservationSource implements ObservationSource {

    private static final Logger log = LoggerFactory.getLogger(PlexObservationSource.class);

    private final PlexClient plexClient;

    public PlexObservationSource(PlexClient plexClient) {
        this.plexClient = plexClient;
    }

    @Override
    public Stream<Observation> observe() {
        return plexClient.librarySections().stream()
                .filter(PlexDirectory::isShowLibrary)
                .flatMap(this::sectionObservations);
    }

    private Stream<Observation> sectionObservations(PlexDirectory section) {
        log.info("Library: {}", section.title());
        return plexClient.sectionItems(section.key()).stream()
                .flatMap(this::showObservations);
    }

    private Stream<Observation> showObservations(PlexMetadata show) {
        log.info("Series: {}", show.title());
        var series = new Observation.SeriesInfo(show.key(), titleOf(show), null);
        return plexClient.children(show.key()).stream()
                .filter(PlexMetadata::isSeason)
                .flatMap(season -> plexClient.children(season.key()).stream()
                        .flatMap(episode -> episodeObservations(series, season, episode)));
    }

    private Stream<Observation> episodeObservations(
            Observation.SeriesInfo series, PlexMetadata season, PlexMetadata episode) {
        var episodeInfo = new Observation.EpisodeInfo(episode.key(), season.index(), episode.index());
        return episode.filePaths().stream()
                .map(PlexObservationSource::fileInfo)
                .flatMap(Optional::stream)
                .map(file -> new Observation(series, episodeInfo, file));
    }

    private static Optional<Observation.FileInfo> fileInfo(String path) {
        try {
            return Optional.of(Observation.FileInfo.ofPath(path, null));
        } catch (IllegalArgumentException e) {
            log.warn("Skipping unusable Plex file path '{}': {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    private static String titleOf(PlexMetadata show) {
        return show.title() == null ? show.key() : show.title();
    }
}
