package com.rulesync.rulesync.chronicle;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Chronicle connection settings bound from {@code application.properties}, which maps them
 * from the {@code CHRONICLE_*} environment variables.
 */
@ConfigurationProperties(prefix = "chronicle")
public class ChronicleProperties {

    private String region;
    private String accessToken;
    private String baseUrl;

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    public String getAccessToken() {
        return accessToken;
    }

    public void setAccessToken(String accessToken) {
        this.accessToken = accessToken;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    /**
     * Explicit base URL when configured, otherwise the regional backstory endpoint.
     */
    public String resolveBaseUrl() {
        if (baseUrl != null && !baseUrl.isBlank()) {
            return stripTrailingSlash(baseUrl.trim());
        }
        return ChronicleConstants.BASE_URL_TEMPLATE.formatted(region.trim());
    }

    /**
     * Fails fast when any required setting is absent.
     */
    public void validate() {
        List<String> missing = new ArrayList<>();
        if (isBlank(accessToken)) {
            missing.add(ChronicleConstants.ENV_ACCESS_TOKEN);
        }
        if (isBlank(region)) {
            missing.add(ChronicleConstants.ENV_REGION);
        }
        if (!missing.isEmpty()) {
            throw new IllegalStateException(
                    ChronicleConstants.MSG_MISSING_ENVIRONMENT.formatted(String.join(", ", missing)));
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
