package dev.tvfiles.sonarr;

import dev.tvfiles.reconcile.Observation;
import dev.tvfiles.reconcile.ObservationSource;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Lists every Sonarr series with its episodes and episode files. Each file yields one
 * observation; the episode is taken from the first entry of the file's {@code episodeIds}.
 *
 * <p>A file whose episode is unknown is still observed, with no episode, so the reconciler can
 * count it as unresolved.
 */
@Component
public class SonarrObservationSource implements ObservationSource {

    private static final Logger log = LoggerFactory.getLogger(SonarrObservationSource.class);

    private final SonarrClient sonarrClient;

    public SonarrObservationSource(SonarrClient sonarrClient) {
        this.sonarrClient = sonarrClient;
    }

    @Override
    public Stream<Observation> observe() {
        return sonarrClient.series().stream().flatMap(this::seriesObservations);
    }

    private Stream<Observation> seriesObservations(SonarrSeriesResource resource) {
        String title = resource.title() == null ? String.valueOf(resource.id()) : resource.title();
        log.info("Series: {}", title);
        var series = new Observation.SeriesInfo(String.valueOf(resource.id()), title, resource.path());

        Map<Integer, SonarrEpisodeResource> episodes = sonarrClient.episodes(resource.id()).stream()
                .collect(Collectors.toMap(SonarrEpisodeResource::id, Function.identity(), (a, b) -> a));

        return sonarrClient.episodeFiles(resource.id()).stream()
                .flatMap(file -> observation(series, file, episodes).stream());
    }

    private static Optional<Observation> observation(
            Observation.SeriesInfo series,
            SonarrEpisodeFileResource file,
            Map<Integer, SonarrEpisodeResource> episodes) {
        if (file.path() == null) {
            log.warn("Skipping Sonarr episode file {} without a path", file.id());
            return Optional.empty();
        }

        Observation.FileInfo fileInfo;
        try {
            fileInfo = Observation.FileInfo.ofPath(file.path(), null);
        } catch (IllegalArgumentException e) {
            log.warn("Skipping unusable Sonarr file path '{}': {}", file.path(), e.getMessage());
            return Optional.empty();
        }

        Observation.EpisodeInfo episode = file.primaryEpisodeId()
                .map(episodes::get)
                .map(e -> new Observation.EpisodeInfo(String.valueOf(e.id()), e.seasonNumber(), e.episodeNumber()))
                .orElse(null);
        if (episode == null) {
            log.debug("No episode for {}", file.path());
        }
        return Optional.of(new Observation(series, episode, fileInfo));
    }
}
