package dev.tvfiles.plex;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Plex connection settings, bound from {@code tvfiles.plex.*}.
 *
 * @param baseUrl server base URL, e.g. {@code http://host:32400}; blank disables the source
 * @param token value sent as {@code X-Plex-Token}
 * @param connectTimeoutMs TCP connect timeout
 * @param readTimeoutMs response read timeout per request
 */
@ConfigurationProperties(prefix = "tvfiles.plex")
public record PlexProperties(
        @DefaultValue("") String baseUrl,
        @DefaultValue("") String token,
        @DefaultValue("10000") int connectTimeoutMs,
        @DefaultValue("60000") int readTimeoutMs
) {
    public boolean isConfigured() {
        return baseUrl != null && !baseUrl.isBlank();
    }
}
