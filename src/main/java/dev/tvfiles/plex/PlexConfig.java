package dev.tvfiles.plex;

import java.time.Duration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient} used to read the Plex catalog.
 *
 * <p>Plex answers with XML unless asked otherwise, so the client always sends {@code Accept:
 * application/json}. The token is sent on every request as {@code X-Plex-Token}.
 */
@Configuration
public class PlexConfig {

    /**
     * Creates the REST client bean qualified as {@code "plexRestClient"}.
     *
     * @param builder    Spring-provided builder with the Jackson message converters
     * @param properties Plex connection settings
     * @return the client used by {@link PlexClient}
     */
    @Bean
    public RestClient plexRestClient(RestClient.Builder builder, PlexProperties properties) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofMillis(properties.connectTimeoutMs()));
        requestFactory.setReadTimeout(Duration.ofMillis(properties.readTimeoutMs()));

        RestClient.Builder configured = builder
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        if (properties.isConfigured()) {
            configured.baseUrl(StringUtils.trimTrailingCharacter(properties.baseUrl().trim(), '/'));
        }
        if (StringUtils.hasText(properties.token())) {
            configured.defaultHeader("X-Plex-Token", properties.token());
        }
        return configured.build();
    }
}
