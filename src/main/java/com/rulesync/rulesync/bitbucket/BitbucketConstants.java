package com.rulesync.rulesync.bitbucket;

/**
 * Shared constants for reading rule files through the Bitbucket Cloud 2.0 API.
 */
public final class BitbucketConstants {

    private BitbucketConstants() {
    }

    public static final String SERVICE_NAME = "Bitbucket";
    public static final String DEFAULT_BASE_URL = "https://api.bitbucket.org/2.0";
    public static final String DEFAULT_BRANCH_OR_COMMIT = "main";
    public static final String DEFAULT_RULES_DIR = "rules";
    public static final String DEFAULT_RULE_FILE_EXTENSION = ".yaral";

    public static final String SEGMENT_REPOSITORIES = "repositories";
    public static final String SEGMENT_SRC = "src";

    public static final String FIELD_VALUES = "values";
    public static final String FIELD_NEXT = "next";
    public static final String FIELD_TYPE = "type";
    public static final String FIELD_PATH = "path";

    public static final String TYPE_COMMIT_FILE = "commit_file";
    public static final String TYPE_FILE = "file";

    public static final String ENV_WORKSPACE = "BITBUCKET_WORKSPACE";
    public static final String ENV_REPO_SLUG = "BITBUCKET_REPO_SLUG";
    public static final String ENV_ACCESS_TOKEN = "BITBUCKET_ACCESS_TOKEN";

    public static final String MSG_MISSING_ENVIRONMENT = "Missing required Bitbucket environment variables: %s";
    public static final String MSG_LIST_FAILED =
            "Failed to list files in Bitbucket directory: %s. Check path, permissions, and branch/commit.";
}
