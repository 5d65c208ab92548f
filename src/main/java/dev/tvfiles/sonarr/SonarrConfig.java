package dev.tvfiles.sonarr;

import java.time.Duration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

/** Configures the {@link RestClient} used against the Sonarr v3 API. */
@Configuration
public class SonarrConfig {

    @Bean
    public RestClient sonarrRestClient(RestClient.Builder builder, SonarrProperties properties) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofMillis(properties.connectTimeoutMs()));
        requestFactory.setReadTimeout(Duration.ofMillis(properties.readTimeoutMs()));

        RestClient.Builder configured = builder
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        if (properties.isConfigured()) {
            configured.baseUrl(StringUtils.trimTrailingCharacter(properties.baseUrl().trim(), '/'));
        }
        if (StringUtils.hasText(properties.apiKey())) {
            configured.defaultHeader("X-Api-Key", properties.apiKey());
        }
        return configured.build();
    }
}
