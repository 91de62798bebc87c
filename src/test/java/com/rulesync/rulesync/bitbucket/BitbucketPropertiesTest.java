package com.rulesync.rulesync.bitbucket;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BitbucketPropertiesTest {

    @Test
    void shouldApplyDefaults() {
        BitbucketProperties properties = new BitbucketProperties();

        assertEquals("main", properties.getBranchOrCommit());
        assertEquals("rules", properties.getRulesDir());
        assertEquals(".yaral", properties.getRuleFileExtension());
        assertEquals("https://api.bitbucket.org/2.0", properties.getBaseUrl());
    }

    @Test
    void shouldNormalizeConfiguredValues() {
        BitbucketProperties properties = new BitbucketProperties();
        properties.setRulesDir("//detections/yaral/");
        properties.setRuleFileExtension("yl2");
        properties.setBranchOrCommit(" ");
        properties.setBaseUrl("https://bitbucket.internal/api/2.0/");

        assertEquals("detections/yaral", properties.getRulesDir());
        assertEquals(".yl2", properties.getRuleFileExtension());
        assertEquals("main", properties.getBranchOrCommit());
        assertEquals("https://bitbucket.internal/api/2.0", properties.getBaseUrl());
    }

    @Test
    void shouldListEveryMissingVariable() {
        BitbucketProperties properties = new BitbucketProperties();
        properties.setWorkspace("acme");

        IllegalStateException ex = assertThrows(IllegalStateException.class, properties::validate);
        assertEquals("Missing required Bitbucket environment variables: BITBUCKET_REPO_SLUG, BITBUCKET_ACCESS_TOKEN",
                ex.getMessage());

        properties.setRepoSlug("detections");
        properties.setAccessToken("token");
        assertDoesNotThrow(properties::validate);
    }
}
