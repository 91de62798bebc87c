package com.rulesync.rulesync.chronicle;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rulesync.rulesync.api.ApiClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

/**
 * Binds Chronicle settings and wires the rule client with bearer authentication.
 */
@Configuration
@EnableConfigurationProperties(ChronicleProperties.class)
public class ChronicleConfig {

    @Bean
    public ChronicleRuleClient chronicleRuleClient(ChronicleProperties chronicleProperties,
                                                   RestClient.Builder restClientBuilder,
                                                   ObjectMapper objectMapper) {
        chronicleProperties.validate();
        RestClient restClient = restClientBuilder
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + chronicleProperties.getAccessToken())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
        ApiClient apiClient = new ApiClient(ChronicleConstants.SERVICE_NAME, restClient, objectMapper);
        return new ChronicleRuleClient(apiClient, chronicleProperties.resolveBaseUrl());
    }
}
