package dev.tvfiles.sonarr;

import dev.tvfiles.reconcile.SourceUnavailableException;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Read-only access to the Sonarr v3 series, episode and episode file endpoints.
 *
 * <p>Any transport or HTTP failure, and any empty body, surfaces as {@link
 * SourceUnavailableException}.
 */
@Service
public class SonarrClient {

    private static final Logger log = LoggerFactory.getLogger(SonarrClient.class);

    private static final ParameterizedTypeReference<List<SonarrSeriesResource>> SERIES_LIST =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<SonarrEpisodeResource>> EPISODE_LIST =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<List<SonarrEpisodeFileResource>> EPISODE_FILE_LIST =
            new ParameterizedTypeReference<>() {};

    private final RestClient restClient;
    private final SonarrProperties properties;

    public SonarrClient(@Qualifier("sonarrRestClient") RestClient restClient, SonarrProperties properties) {
        this.restClient = restClient;
        this.properties = properties;
    }

    public List<SonarrSeriesResource> series() {
        return fetch("/api/v3/series", SERIES_LIST);
    }

    public List<SonarrEpisodeResource> episodes(int seriesId) {
        return fetch("/api/v3/episode?seriesId=" + seriesId, EPISODE_LIST);
    }

    public List<SonarrEpisodeFileResource> episodeFiles(int seriesId) {
        return fetch("/api/v3/episodefile?seriesId=" + seriesId, EPISODE_FILE_LIST);
    }

    private <T> List<T> fetch(String path, ParameterizedTypeReference<List<T>> type) {
        if (!properties.isConfigured()) {
            throw new SourceUnavailableException("Sonarr is not configured: set tvfiles.sonarr.base-url");
        }
        log.debug("GET {}", path);

        List<T> body;
        try {
            body = restClient.get()
                    .uri(path)
                    .retrieve()
                    .body(type);
        } catch (RestClientException e) {
            throw new SourceUnavailableException("Sonarr request " + path + " failed: " + e.getMessage(), e);
        }

        if (body == null) {
            throw new SourceUnavailableException("Sonarr returned an empty response for " + path);
        }
        return body;
    }
}
