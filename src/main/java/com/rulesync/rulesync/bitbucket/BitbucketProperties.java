package com.rulesync.rulesync.bitbucket;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Repository location and credentials bound from {@code application.properties}, which maps
 * them from the {@code BITBUCKET_*} and {@code RULES_DIR} environment variables.
 */
@ConfigurationProperties(prefix = "bitbucket")
public class BitbucketProperties {

    private String workspace;
    private String repoSlug;
    private String accessToken;
    private String branchOrCommit = BitbucketConstants.DEFAULT_BRANCH_OR_COMMIT;
    private String rulesDir = BitbucketConstants.DEFAULT_RULES_DIR;
    private String ruleFileExtension = BitbucketConstants.DEFAULT_RULE_FILE_EXTENSION;
    private String baseUrl = BitbucketConstants.DEFAULT_BASE_URL;

    public String getWorkspace() {
        return workspace;
    }

    public void setWorkspace(String workspace) {
        this.workspace = workspace;
    }

    public String getRepoSlug() {
        return repoSlug;
    }

    public void setRepoSlug(String repoSlug) {
        this.repoSlug = repoSlug;
    }

    public String getAccessToken() {
        return accessToken;
    }

    public void setAccessToken(String accessToken) {
        this.accessToken = accessToken;
    }

    public String getBranchOrCommit() {
        return branchOrCommit;
    }

    public void setBranchOrCommit(String branchOrCommit) {
        this.branchOrCommit = isBlank(branchOrCommit) ? BitbucketConstants.DEFAULT_BRANCH_OR_COMMIT : branchOrCommit.trim();
    }

    public String getRulesDir() {
        return rulesDir;
    }

    /**
     * Leading and trailing slashes are dropped so the value can be appended to a path.
     */
    public void setRulesDir(String rulesDir) {
        String value = rulesDir == null ? "" : rulesDir.trim();
        while (value.startsWith("/")) {
            value = value.substring(1);
        }
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        this.rulesDir = value;
    }

    public String getRuleFileExtension() {
        return ruleFileExtension;
    }

    public void setRuleFileExtension(String ruleFileExtension) {
        if (isBlank(ruleFileExtension)) {
            this.ruleFileExtension = BitbucketConstants.DEFAULT_RULE_FILE_EXTENSION;
            return;
        }
        String value = ruleFileExtension.trim();
        this.ruleFileExtension = value.startsWith(".") ? value : "." + value;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        if (isBlank(baseUrl)) {
            this.baseUrl = BitbucketConstants.DEFAULT_BASE_URL;
            return;
        }
        String value = baseUrl.trim();
        this.baseUrl = value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }

    /**
     * Fails fast when any required setting is absent.
     */
    public void validate() {
        List<String> missing = new ArrayList<>();
        if (isBlank(workspace)) {
            missing.add(BitbucketConstants.ENV_WORKSPACE);
        }
        if (isBlank(repoSlug)) {
            missing.add(BitbucketConstants.ENV_REPO_SLUG);
        }
        if (isBlank(accessToken)) {
            missing.add(BitbucketConstants.ENV_ACCESS_TOKEN);
        }
        if (!missing.isEmpty()) {
            throw new IllegalStateException(
                    BitbucketConstants.MSG_MISSING_ENVIRONMENT.formatted(String.join(", ", missing)));
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
