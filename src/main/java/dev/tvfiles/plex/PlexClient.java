package dev.tvfiles.plex;

import dev.tvfiles.reconcile.SourceUnavailableException;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Read-only access to the Plex library endpoints.
 *
 * <p>Every failure (connection, timeout, non-2xx status, empty body) surfaces as {@link
 * SourceUnavailableException}; the client never returns a partial listing.
 */
@Service
public class PlexClient {

    private static final Logger log = LoggerFactory.getLogger(PlexClient.class);

    private final RestClient restClient;
    private final PlexProperties properties;

    public PlexClient(@Qualifier("plexRestClient") RestClient restClient, PlexProperties properties) {
        this.restClient = restClient;
        this.properties = properties;
    }

    /** All library sections, of every type. */
    public List<PlexDirectory> librarySections() {
        return fetch("/library/sections").directories();
    }

    /** Top-level items of a library section; the shows of a show library. */
    public List<PlexMetadata> sectionItems(String sectionKey) {
        return fetch("/library/sections/" + sectionKey + "/all").metadata();
    }

    /**
     * Children of an item, fetched through the item's {@code key} path: seasons of a show,
     * episodes of a season.
     */
    public List<PlexMetadata> children(String itemKey) {
        return fetch(itemKey).metadata();
    }

    private PlexMediaContainer fetch(String path) {
        if (!properties.isConfigured()) {
            throw new SourceUnavailableException("Plex is not configured: set tvfiles.plex.base-url");
        }
        log.debug("GET {}", path);

        PlexResponse response;
        try {
            response = restClient.get()
                    .uri(path)
                    .retrieve()
                    .body(PlexResponse.class);
        } catch (RestClientException e) {
            throw new SourceUnavailableException("Plex request " + path + " failed: " + e.getMessage(), e);
        }

        if (response == null || response.mediaContainer() == null) {
            throw new SourceUnavailableException("Plex returned an empty response for " + path);
        }
        return response.mediaContainer();
    }
}
