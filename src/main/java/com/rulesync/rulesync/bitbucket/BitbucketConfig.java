package com.rulesync.rulesync.bitbucket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rulesync.rulesync.api.ApiClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

/**
 * Binds repository settings and wires the rule file fetcher with bearer authentication.
 */
@Configuration
@EnableConfigurationProperties(BitbucketProperties.class)
public class BitbucketConfig {

    @Bean
    public BitbucketRuleFetcher bitbucketRuleFetcher(BitbucketProperties bitbucketProperties,
                                                     RestClient.Builder restClientBuilder,
                                                     ObjectMapper objectMapper) {
        bitbucketProperties.validate();
        RestClient restClient = restClientBuilder
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + bitbucketProperties.getAccessToken())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
        ApiClient apiClient = new ApiClient(BitbucketConstants.SERVICE_NAME, restClient, objectMapper);
        return new BitbucketRuleFetcher(apiClient, bitbucketProperties);
    }
}
