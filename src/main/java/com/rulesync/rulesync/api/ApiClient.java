package com.rulesync.rulesync.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;

/**
 * Issues HTTP calls against one remote service and normalizes every outcome into an
 * {@link ApiResult}. Transport errors, unexpected status codes and undecodable bodies are
 * logged here and never propagate to callers.
 */
public class ApiClient {

    private static final Logger log = LoggerFactory.getLogger(ApiClient.class);

    private final String serviceName;
    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public ApiClient(String serviceName, RestClient restClient, ObjectMapper objectMapper) {
        this.serviceName = serviceName;
        this.restClient = restClient;
        this.objectMapper = objectMapper;
    }

    public ApiResult<JsonNode> getJson(URI uri) {
        return decodeJson(HttpMethod.GET, uri, send(HttpMethod.GET, uri, null));
    }

    public ApiResult<JsonNode> postJson(URI uri, Object body) {
        return decodeJson(HttpMethod.POST, uri, send(HttpMethod.POST, uri, body));
    }

    /**
     * Fetches a raw (non-JSON) payload such as a repository file.
     */
    public ApiResult<byte[]> getBytes(URI uri) {
        return send(HttpMethod.GET, uri, null);
    }

    private ApiResult<byte[]> send(HttpMethod method, URI uri, Object body) {
        RawResponse response;
        try {
            RestClient.RequestBodySpec request = restClient.method(method).uri(uri);
            if (body != null) {
                request.contentType(MediaType.APPLICATION_JSON).body(body);
            }
            response = request.exchange((clientRequest, clientResponse) -> new RawResponse(
                    clientResponse.getStatusCode().value(),
                    StreamUtils.copyToByteArray(clientResponse.getBody())
            ));
        } catch (RestClientException ex) {
            log.error("{} API Request Error ({} {}): {}", serviceName, method, uri, ex.getMessage());
            return ApiResult.failure(ApiResult.NO_STATUS, ex.getMessage());
        }

        if (response.status() != HttpStatus.OK.value()) {
            log.error("{} API Request Error ({} {}): Unexpected status code. Status: {}. Body: {}",
                    serviceName, method, uri, response.status(), describeBody(response.body()));
            return ApiResult.failure(response.status(), "Unexpected status code " + response.status());
        }
        if (response.body().length == 0) {
            return ApiResult.success(null, response.status());
        }
        return ApiResult.success(response.body(), response.status());
    }

    private ApiResult<JsonNode> decodeJson(HttpMethod method, URI uri, ApiResult<byte[]> raw) {
        if (!raw.hasBody()) {
            return raw.isSuccess()
                    ? ApiResult.success(null, raw.status())
                    : ApiResult.failure(raw.status(), raw.error());
        }
        try {
            return ApiResult.success(objectMapper.readTree(raw.body()), raw.status());
        } catch (IOException ex) {
            log.error("Failed to decode JSON response from {} {}: {}", method, uri, ex.getMessage());
            log.error("Response Text: {}", new String(raw.body(), StandardCharsets.UTF_8));
            return ApiResult.failure(raw.status(), "Malformed JSON response");
        }
    }

    private String describeBody(byte[] body) {
        if (body.length == 0) {
            return "<empty>";
        }
        try {
            return objectMapper.writeValueAsString(objectMapper.readTree(body));
        } catch (IOException ex) {
            return new String(body, StandardCharsets.UTF_8);
        }
    }

    private record RawResponse(int status, byte[] body) {
    }
}
