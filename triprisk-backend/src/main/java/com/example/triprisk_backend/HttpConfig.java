package com.example.triprisk_backend;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.DefaultUriBuilderFactory;

@Configuration
public class HttpConfig {

    // Nominatim and Overpass reject anonymous clients
    static final String USER_AGENT = "trip-risk-backend/0.0.1";

    // Open-Meteo hourly series and Overpass answers outgrow the 256 KB default
    static final int MAX_BODY_BYTES = 8 * 1024 * 1024;

    @Bean
    WebClient webClient() {
        // every provider passes absolute URLs; only expanded values get encoded
        DefaultUriBuilderFactory factory = new DefaultUriBuilderFactory();
        factory.setEncodingMode(DefaultUriBuilderFactory.EncodingMode.VALUES_ONLY);
        return WebClient.builder()
            .uriBuilderFactory(factory)
            .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
            .codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_BODY_BYTES))
            .build();
    }
}
