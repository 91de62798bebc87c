package com.rulesync.rulesync.chronicle;

/**
 * Shared constants for the Chronicle detection rules API (v2).
 */
public final class ChronicleConstants {

    private ChronicleConstants() {
    }

    public static final String SERVICE_NAME = "Chronicle";
    public static final String BASE_URL_TEMPLATE = "https://%s-backstory.googleapis.com/v2";

    public static final String PATH_RULES = "/detect/rules";
    public static final String PATH_VERIFY_RULE = "/detect/rules:verifyRule";

    public static final String PARAM_PAGE_TOKEN = "pageToken";

    public static final String FIELD_RULES = "rules";
    public static final String FIELD_RULE_NAME = "ruleName";
    public static final String FIELD_RULE_TEXT = "ruleText";
    public static final String FIELD_RULE_ID = "ruleId";
    public static final String FIELD_ID = "id";
    public static final String FIELD_NEXT_PAGE_TOKEN = "nextPageToken";
    public static final String FIELD_VERIFY_RULE_TEXT = "rule_text";

    public static final String ENV_ACCESS_TOKEN = "CHRONICLE_ACCESS_TOKEN";
    public static final String ENV_REGION = "CHRONICLE_REGION";

    public static final String MSG_MISSING_ENVIRONMENT = "Missing required Chronicle environment variables: %s";
    public static final String MSG_INITIAL_PAGE_FAILED = "Failed to retrieve initial page of rules from Chronicle.";
}
