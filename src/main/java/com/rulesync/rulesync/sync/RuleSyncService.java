package com.rulesync.rulesync.sync;

import com.rulesync.rulesync.api.RemoteServiceException;
import com.rulesync.rulesync.bitbucket.RuleCandidate;
import com.rulesync.rulesync.bitbucket.RuleSource;
import com.rulesync.rulesync.chronicle.RemoteRuleDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

/**
 * Deploys repository rules that are not yet registered remotely: lists remote rule names,
 * lists repository rule files, then verifies and uploads every unmatched rule.
 * Each remote call is made once; nothing is rolled back.
 */
@Service
public class RuleSyncService {

    private static final Logger log = LoggerFactory.getLogger(RuleSyncService.class);

    private final RemoteRuleDirectory ruleDirectory;
    private final RuleSource ruleSource;
    private final RuleSyncProperties ruleSyncProperties;

    public RuleSyncService(RemoteRuleDirectory ruleDirectory, RuleSource ruleSource, RuleSyncProperties ruleSyncProperties) {
        this.ruleDirectory = ruleDirectory;
        this.ruleSource = ruleSource;
        this.ruleSyncProperties = ruleSyncProperties;
    }

    /**
     * Runs one full synchronization pass.
     */
    public RuleSyncResult synchronize() {
        log.info("--- Starting Chronicle Rule Deployment Pipeline (API v2 - using ruleName) ---");

        log.info("--- Step 1: Get Existing Rule Names (Chronicle v2) ---");
        Set<String> existingRuleNames;
        try {
            existingRuleNames = ruleDirectory.listRuleNames();
        } catch (RemoteServiceException ex) {
            log.error("Failed to get initial rule data from Chronicle. Aborting.");
            return RuleSyncResult.abortedRun();
        }
        log.info("Using {} ruleNames for existence checks.", existingRuleNames.size());

        log.info("--- Step 2: Fetch Rules from Bitbucket Repository ---");
        List<RuleCandidate> candidates;
        try {
            candidates = ruleSource.listRuleCandidates();
        } catch (RemoteServiceException ex) {
            log.error("Failed to fetch rules from Bitbucket. Aborting.");
            return RuleSyncResult.abortedRun();
        }
        if (candidates.isEmpty()) {
            log.warn("No '{}' rule files found in Bitbucket directory '{}'. Exiting.",
                    ruleSource.ruleFileExtension(), ruleSource.rulesDirectory());
            return RuleSyncResult.nothingToDo();
        }

        log.info("--- Step 3: Verify and Upload Rules to Chronicle v2 ---");
        RuleSyncResult result = deploy(candidates, existingRuleNames);
        logSummary(result);

        if (ruleSyncProperties.isFinalCountEnabled()) {
            log.info("--- Step 4: Get Final Rule Counts (Chronicle v2) ---");
            logFinalCount();
        }

        log.info("--- Chronicle Rule Deployment Pipeline Finished ---");
        return result;
    }

    private RuleSyncResult deploy(List<RuleCandidate> candidates, Set<String> existingRuleNames) {
        int processed = 0;
        int skipped = 0;
        int uploaded = 0;
        int failedVerification = 0;
        int failedUpload = 0;

        for (RuleCandidate candidate : candidates) {
            processed++;
            String ruleName = candidate.name();
            log.info("Processing rule from Bitbucket path: {} (Target ruleName: {})", candidate.sourcePath(), ruleName);

            if (existingRuleNames.contains(ruleName)) {
                log.info("Rule with matching ruleName '{}' found in Chronicle. Skipping upload.", ruleName);
                skipped++;
                continue;
            }

            log.info("No rule with ruleName '{}' found in existing Chronicle rules. Proceeding with verification.", ruleName);
            if (!ruleDirectory.verify(ruleName, candidate.text())) {
                failedVerification++;
            } else if (ruleDirectory.upload(ruleName, candidate.text())) {
                uploaded++;
            } else {
                failedUpload++;
            }
        }

        return new RuleSyncResult(processed, skipped, uploaded, failedVerification, failedUpload, false);
    }

    private void logSummary(RuleSyncResult result) {
        log.info("--- Rule Upload Summary ---");
        log.info("Rule files processed from Bitbucket: {}", result.processed());
        log.info("Rules skipped (matching ruleName found in Chronicle): {}", result.skipped());
        log.info("Rules successfully verified and uploaded to Chronicle: {}", result.uploaded());
        log.info("Rules failed Chronicle verification: {}", result.failedVerification());
        log.info("Rules failed Chronicle upload (after verification): {}", result.failedUpload());
    }

    /**
     * Logs the rule count after deployment; a listing failure here is only reported.
     */
    private void logFinalCount() {
        try {
            Set<String> finalRuleNames = ruleDirectory.listRuleNames();
            log.info("Chronicle now reports {} rules with ruleNames.", finalRuleNames.size());
        } catch (RemoteServiceException ex) {
            log.warn("Could not retrieve final rule count from Chronicle: {}", ex.getMessage());
        }
    }
}
