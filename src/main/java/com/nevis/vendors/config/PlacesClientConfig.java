package com.nevis.vendors.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.Collections;
import java.util.List;

@Configuration
public class PlacesClientConfig {

    public static final String API_KEY_HEADER = "X-Goog-Api-Key";

    @Bean("placesRestClient")
    public RestClient placesRestClient(RestClient.Builder builder, PlacesProperties properties,
                                       DispatchProperties dispatch) {
        // search and details share this client, so the longer call timeout applies to both
        Duration readTimeout = Collections.max(List.of(
            dispatch.placeSearch().callTimeout(),
            dispatch.placeDetails().callTimeout()
        ));

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.connectTimeout());
        requestFactory.setReadTimeout(readTimeout);

        return builder
            .baseUrl(properties.baseUrl())
            .defaultHeader(API_KEY_HEADER, properties.apiKey())
            .requestFactory(requestFactory)
            .build();
    }
}
