package com.rulesync.rulesync.bitbucket;

import com.fasterxml.jackson.databind.JsonNode;
import com.rulesync.rulesync.api.ApiClient;
import com.rulesync.rulesync.api.ApiResult;
import com.rulesync.rulesync.api.Page;
import com.rulesync.rulesync.api.PageFetchException;
import com.rulesync.rulesync.api.PagedIterator;
import com.rulesync.rulesync.api.RemoteServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads rule files from a directory of a Bitbucket repository at a given branch or commit.
 */
public class BitbucketRuleFetcher implements RuleSource {

    private static final Logger log = LoggerFactory.getLogger(BitbucketRuleFetcher.class);

    private final ApiClient apiClient;
    private final BitbucketProperties properties;

    public BitbucketRuleFetcher(ApiClient apiClient, BitbucketProperties properties) {
        this.apiClient = apiClient;
        this.properties = properties;
    }

    @Override
    public String ruleFileExtension() {
        return properties.getRuleFileExtension();
    }

    @Override
    public String rulesDirectory() {
        return properties.getRulesDir();
    }

    @Override
    public List<RuleCandidate> listRuleCandidates() {
        log.info("Fetching rule files from Bitbucket: {}/{}/{} @ {}",
                properties.getWorkspace(), properties.getRepoSlug(), properties.getRulesDir(), properties.getBranchOrCommit());
        PagedIterator<JsonNode> entries = new PagedIterator<>("Bitbucket directory listing", this::fetchDirectoryPage);
        List<RuleCandidate> candidates = new ArrayList<>();

        try {
            while (entries.hasNext()) {
                JsonNode entry = entries.next();
                if (!isRuleFile(entry)) {
                    continue;
                }
                String filePath = entry.get(BitbucketConstants.FIELD_PATH).asText();
                log.info("Found rule file: {}", filePath);
                RuleCandidate candidate = readCandidate(filePath);
                if (candidate != null) {
                    candidates.add(candidate);
                }
            }
        } catch (PageFetchException ex) {
            String message = BitbucketConstants.MSG_LIST_FAILED.formatted(properties.getRulesDir());
            log.error(message);
            throw new RemoteServiceException(message, ex);
        }

        log.info("Finished fetching files from Bitbucket. Found {} rule files across {} listing pages.",
                candidates.size(), entries.pagesFetched());
        return candidates;
    }

    private ApiResult<Page<JsonNode>> fetchDirectoryPage(String nextLink) {
        URI uri;
        try {
            uri = nextLink == null ? directoryUri() : URI.create(nextLink);
        } catch (IllegalArgumentException ex) {
            log.error("Invalid next page link from Bitbucket: {}", nextLink);
            return ApiResult.failure(ApiResult.NO_STATUS, "Invalid next page link: " + ex.getMessage());
        }
        log.debug("Fetching file list page: {}", uri);
        ApiResult<JsonNode> result = apiClient.getJson(uri);
        if (!result.hasBody() || !result.body().has(BitbucketConstants.FIELD_VALUES)) {
            return ApiResult.failure(result.status(), result.isSuccess() ? "listing has no values" : result.error());
        }

        JsonNode body = result.body();
        List<JsonNode> values = new ArrayList<>();
        body.get(BitbucketConstants.FIELD_VALUES).forEach(values::add);
        return ApiResult.success(new Page<>(values, body.path(BitbucketConstants.FIELD_NEXT).asText(null)), result.status());
    }

    private boolean isRuleFile(JsonNode entry) {
        String type = entry.path(BitbucketConstants.FIELD_TYPE).asText("");
        if (!BitbucketConstants.TYPE_COMMIT_FILE.equals(type) && !BitbucketConstants.TYPE_FILE.equals(type)) {
            return false;
        }
        return entry.path(BitbucketConstants.FIELD_PATH).asText("").endsWith(properties.getRuleFileExtension());
    }

    private RuleCandidate readCandidate(String filePath) {
        ApiResult<byte[]> content = apiClient.getBytes(fileUri(filePath));
        if (!content.isSuccess()) {
            log.error("Failed to fetch content for rule file: {}", filePath);
            return null;
        }

        byte[] bytes = content.body() == null ? new byte[0] : content.body();
        String ruleText;
        try {
            ruleText = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException ex) {
            log.error("Could not decode content of file '{}' as UTF-8. Skipping.", filePath);
            return null;
        }

        if (ruleText.isBlank()) {
            log.warn("Rule file '{}' is empty. Skipping.", filePath);
            return null;
        }
        log.debug("Successfully fetched content for {}", filePath);
        return new RuleCandidate(ruleNameOf(filePath), ruleText, filePath);
    }

    /**
     * File name without directories and without its final extension.
     */
    static String ruleNameOf(String filePath) {
        String fileName = filePath.substring(filePath.lastIndexOf('/') + 1);
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private URI directoryUri() {
        return repositorySrc().pathSegment(segments(properties.getRulesDir())).build().encode().toUri();
    }

    private URI fileUri(String filePath) {
        return repositorySrc().pathSegment(segments(filePath)).build().encode().toUri();
    }

    private UriComponentsBuilder repositorySrc() {
        return UriComponentsBuilder.fromUriString(properties.getBaseUrl())
                .pathSegment(
                        BitbucketConstants.SEGMENT_REPOSITORIES,
                        properties.getWorkspace(),
                        properties.getRepoSlug(),
                        BitbucketConstants.SEGMENT_SRC
                )
                .pathSegment(segments(properties.getBranchOrCommit()));
    }

    private static String[] segments(String path) {
        return Arrays.stream(path.split("/"))
                .filter(segment -> !segment.isEmpty())
                .toArray(String[]::new);
    }
}
