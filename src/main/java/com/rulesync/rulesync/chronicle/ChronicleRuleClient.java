package com.rulesync.rulesync.chronicle;

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
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Talks to the Chronicle v2 detection rules API: lists registered rules, verifies rule
 * syntax and creates new rules.
 */
public class ChronicleRuleClient implements RemoteRuleDirectory {

    private static final Logger log = LoggerFactory.getLogger(ChronicleRuleClient.class);

    private final ApiClient apiClient;
    private final String baseUrl;

    public ChronicleRuleClient(ApiClient apiClient, String baseUrl) {
        this.apiClient = apiClient;
        this.baseUrl = baseUrl;
    }

    @Override
    public Set<String> listRuleNames() {
        log.info("Fetching existing rules from Chronicle v2 ({})...", ChronicleConstants.PATH_RULES);
        PagedIterator<JsonNode> rules = new PagedIterator<>("Chronicle rules", this::fetchRulePage);
        Set<String> ruleNames = new HashSet<>();
        int totalRules = 0;
        int namedRules = 0;

        try {
            while (rules.hasNext()) {
                JsonNode rule = rules.next();
                totalRules++;
                String ruleName = rule.path(ChronicleConstants.FIELD_RULE_NAME).asText("");
                if (ruleName.isEmpty()) {
                    log.warn("Chronicle rule found without a ruleName (ID: {}). This rule cannot be matched by filename.",
                            ruleIdOf(rule));
                    continue;
                }
                ruleNames.add(ruleName);
                namedRules++;
            }
        } catch (PageFetchException ex) {
            if (ex.isFirstPage()) {
                log.error(ChronicleConstants.MSG_INITIAL_PAGE_FAILED);
                throw new RemoteServiceException(ChronicleConstants.MSG_INITIAL_PAGE_FAILED, ex);
            }
            log.error("Failed to retrieve page {} of rules from Chronicle. Proceeding with previously fetched data.",
                    ex.getPageNumber());
        }

        log.info("Chronicle API returned {} total rules.", totalRules);
        log.info("Found {} rules with ruleNames for matching.", namedRules);
        return ruleNames;
    }

    @Override
    public boolean verify(String ruleName, String ruleText) {
        log.info("Verifying rule with Chronicle v2 using endpoint '{}' (Target Name: {})...",
                ChronicleConstants.PATH_VERIFY_RULE, ruleName);
        URI uri = UriComponentsBuilder.fromUriString(baseUrl)
                .path(ChronicleConstants.PATH_VERIFY_RULE)
                .build()
                .toUri();
        ApiResult<JsonNode> result = apiClient.postJson(uri, Map.of(ChronicleConstants.FIELD_VERIFY_RULE_TEXT, ruleText));

        if (result.hasBody()) {
            log.info("Rule syntax for '{}' verified successfully by Chronicle v2.", ruleName);
            return true;
        }
        log.error("Rule syntax verification for '{}' failed with Chronicle v2.", ruleName);
        return false;
    }

    @Override
    public boolean upload(String ruleName, String ruleText) {
        log.info("Uploading rule to Chronicle v2 as '{}'...", ruleName);
        URI uri = UriComponentsBuilder.fromUriString(baseUrl)
                .path(ChronicleConstants.PATH_RULES)
                .build()
                .toUri();
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put(ChronicleConstants.FIELD_RULE_NAME, ruleName);
        payload.put(ChronicleConstants.FIELD_RULE_TEXT, ruleText);

        ApiResult<JsonNode> result = apiClient.postJson(uri, payload);
        String ruleId = result.hasBody() ? identifierOf(result.body()) : null;
        if (ruleId != null) {
            log.info("Rule '{}' uploaded successfully to Chronicle v2. Rule ID: {}", ruleName, ruleId);
            return true;
        }
        if (result.hasBody()) {
            log.error("Rule '{}' upload failed with Chronicle v2. Response: {}", ruleName, result.body());
        } else {
            log.error("Rule '{}' upload failed with Chronicle v2.", ruleName);
        }
        return false;
    }

    private ApiResult<Page<JsonNode>> fetchRulePage(String pageToken) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(baseUrl)
                .path(ChronicleConstants.PATH_RULES);
        URI uri;
        if (pageToken == null) {
            uri = builder.build().toUri();
        } else {
            uri = builder.queryParam(ChronicleConstants.PARAM_PAGE_TOKEN, "{pageToken}")
                    .encode()
                    .buildAndExpand(pageToken)
                    .toUri();
        }

        ApiResult<JsonNode> result = apiClient.getJson(uri);
        if (!result.hasBody()) {
            return ApiResult.failure(result.status(), result.isSuccess() ? "empty response" : result.error());
        }

        JsonNode body = result.body();
        List<JsonNode> rules = new ArrayList<>();
        body.path(ChronicleConstants.FIELD_RULES).forEach(rules::add);
        String nextPageToken = body.path(ChronicleConstants.FIELD_NEXT_PAGE_TOKEN).asText(null);
        return ApiResult.success(new Page<>(rules, nextPageToken), result.status());
    }

    private static String ruleIdOf(JsonNode rule) {
        String id = identifierOf(rule);
        return id == null ? "Unknown ID" : id;
    }

    private static String identifierOf(JsonNode node) {
        if (node.hasNonNull(ChronicleConstants.FIELD_RULE_ID)) {
            return node.get(ChronicleConstants.FIELD_RULE_ID).asText();
        }
        if (node.hasNonNull(ChronicleConstants.FIELD_ID)) {
            return node.get(ChronicleConstants.FIELD_ID).asText();
        }
        return null;
    }
}
