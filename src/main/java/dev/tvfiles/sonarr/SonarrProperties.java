package dev.tvfiles.sonarr;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Sonarr connection settings, bound from {@code tvfiles.sonarr.*}.
 *
 * @param baseUrl server base URL, e.g. {@code http://host:8989}; blank disables the source
 * @param apiKey value sent as {@code X-Api-Key}
 * @param connectTimeoutMs TCP connect timeout
 * @param readTimeoutMs response read timeout per request
 */
@ConfigurationProperties(prefix = "tvfiles.sonarr")
public record SonarrProperties(
        @DefaultValue("") String baseUrl,
        @DefaultValue("") String apiKey,
        @DefaultValue("10000") int connectTimeoutMs,
        @DefaultValue("30000") int readTimeoutMs
) {
    public boolean isConfigured() {
        return baseUrl != null && !baseUrl.isBlank();
    }
}
