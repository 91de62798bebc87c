package com.rulesync.rulesync.sync;

import com.rulesync.rulesync.api.RemoteServiceException;
import com.rulesync.rulesync.bitbucket.RuleCandidate;
import com.rulesync.rulesync.bitbucket.RuleSource;
import com.rulesync.rulesync.chronicle.RemoteRuleDirectory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ExtendWith(OutputCaptureExtension.class)
class RuleSyncServiceTest {

    private TestRuleDirectory ruleDirectory;
    private TestRuleSource ruleSource;
    private RuleSyncProperties properties;
    private RuleSyncService service;

    @BeforeEach
    void setUp() {
        ruleDirectory = new TestRuleDirectory();
        ruleSource = new TestRuleSource();
        properties = new RuleSyncProperties();
        service = new RuleSyncService(ruleDirectory, ruleSource, properties);
    }

    @Test
    void shouldSkipExistingRuleAndUploadNewOne() {
        ruleDirectory.enqueueListing(Set.of("ruleA"));
        ruleSource.candidates = List.of(candidate("ruleA", "text1"), candidate("ruleB", "text2"));

        RuleSyncResult result = service.synchronize();

        assertEquals(new RuleSyncResult(2, 1, 1, 0, 0, false), result);
        assertEquals(0, result.exitCode());
        assertEquals(List.of("verify:ruleB", "upload:ruleB"), ruleDirectory.calls);
    }

    @Test
    void shouldFailRunWhenUploadFails() {
        ruleDirectory.enqueueListing(Set.of("ruleA"));
        ruleDirectory.failingUploads.add("ruleB");
        ruleSource.candidates = List.of(candidate("ruleA", "text1"), candidate("ruleB", "text2"));

        RuleSyncResult result = service.synchronize();

        assertEquals(0, result.uploaded());
        assertEquals(1, result.failedUpload());
        assertEquals(1, result.skipped());
        assertEquals(1, result.exitCode());
    }

    @Test
    void shouldNotUploadWhenVerificationFails() {
        ruleDirectory.enqueueListing(Set.of());
        ruleDirectory.failingVerifications.add("broken");
        ruleSource.candidates = List.of(candidate("broken", "rule {"), candidate("fine", "rule fine {}"));

        RuleSyncResult result = service.synchronize();

        assertEquals(new RuleSyncResult(2, 0, 1, 1, 0, false), result);
        assertEquals(List.of("verify:broken", "verify:fine", "upload:fine"), ruleDirectory.calls);
        assertFalse(result.isSuccess());
    }

    @Test
    void shouldMakeNoRemoteCallsForKnownRules() {
        ruleDirectory.enqueueListing(Set.of("a", "b", "c"));
        ruleSource.candidates = List.of(candidate("a", "x"), candidate("b", "y"), candidate("c", "z"));

        RuleSyncResult result = service.synchronize();

        assertEquals(3, result.skipped());
        assertTrue(ruleDirectory.calls.isEmpty());
        assertEquals(0, result.exitCode());
    }

    @Test
    void shouldAbortWhenInitialListingFails() {
        ruleDirectory.failListing = true;
        ruleSource.candidates = List.of(candidate("ruleB", "text2"));

        RuleSyncResult result = service.synchronize();

        assertTrue(result.aborted());
        assertEquals(0, result.processed());
        assertEquals(1, result.exitCode());
        assertEquals(0, ruleSource.invocations);
        assertTrue(ruleDirectory.calls.isEmpty());
    }

    @Test
    void shouldAbortWhenRepositoryListingFails() {
        ruleDirectory.enqueueListing(Set.of());
        ruleSource.fail = true;

        RuleSyncResult result = service.synchronize();

        assertTrue(result.aborted());
        assertEquals(1, result.exitCode());
        assertEquals(1, ruleDirectory.listings);
    }

    @Test
    void shouldSucceedWithNothingToDoWhenRepositoryHasNoRules() {
        ruleDirectory.enqueueListing(Set.of("ruleA"));
        ruleSource.candidates = List.of();

        RuleSyncResult result = service.synchronize();

        assertEquals(RuleSyncResult.nothingToDo(), result);
        assertEquals(0, result.exitCode());
        assertEquals(1, ruleDirectory.listings);
    }

    @Test
    void shouldNameExtensionAndDirectoryWhenNoRuleFilesFound(CapturedOutput output) {
        ruleDirectory.enqueueListing(Set.of());
        ruleSource.candidates = List.of();

        service.synchronize();

        assertTrue(output.getOut().contains("No '.yaral' rule files found in Bitbucket directory 'rules'"),
                output.getOut());
    }

    @Test
    void shouldRequeryRuleCountAfterDeploymentWithoutAffectingOutcome() {
        ruleDirectory.enqueueListing(Set.of());
        ruleSource.candidates = List.of(candidate("ruleB", "text2"));

        RuleSyncResult result = service.synchronize();

        assertEquals(2, ruleDirectory.listings);
        assertEquals(0, result.exitCode());
    }

    @Test
    void shouldSkipFinalCountWhenDisabled() {
        properties.setFinalCountEnabled(false);
        ruleDirectory.enqueueListing(Set.of());
        ruleSource.candidates = List.of(candidate("ruleB", "text2"));

        service.synchronize();

        assertEquals(1, ruleDirectory.listings);
    }

    @Test
    void shouldProcessCandidatesInListingOrder() {
        ruleDirectory.enqueueListing(Set.of());
        ruleSource.candidates = List.of(candidate("zulu", "z"), candidate("alpha", "a"), candidate("mike", "m"));

        service.synchronize();

        assertEquals(List.of("verify:zulu", "upload:zulu", "verify:alpha", "upload:alpha", "verify:mike", "upload:mike"),
                ruleDirectory.calls);
    }

    private static RuleCandidate candidate(String name, String text) {
        return new RuleCandidate(name, text, "rules/" + name + ".yaral");
    }

    static class TestRuleDirectory implements RemoteRuleDirectory {
        private final Queue<Set<String>> listingQueue = new ArrayDeque<>();
        private final Set<String> failingVerifications = new HashSet<>();
        private final Set<String> failingUploads = new HashSet<>();
        private final List<String> calls = new ArrayList<>();
        private boolean failListing;
        private int listings;

        void enqueueListing(Set<String> names) {
            listingQueue.add(names);
        }

        @Override
        public Set<String> listRuleNames() {
            listings++;
            if (failListing) {
                throw new RemoteServiceException("Failed to retrieve initial page of rules from Chronicle.");
            }
            Set<String> next = listingQueue.poll();
            return next == null ? Set.of() : next;
        }

        @Override
        public boolean verify(String ruleName, String ruleText) {
            calls.add("verify:" + ruleName);
            return !failingVerifications.contains(ruleName);
        }

        @Override
        public boolean upload(String ruleName, String ruleText) {
            calls.add("upload:" + ruleName);
            return !failingUploads.contains(ruleName);
        }
    }

    static class TestRuleSource implements RuleSource {
        private List<RuleCandidate> candidates = List.of();
        private boolean fail;
        private int invocations;

        @Override
        public List<RuleCandidate> listRuleCandidates() {
            invocations++;
            if (fail) {
                throw new RemoteServiceException("Failed to list files in Bitbucket directory: rules.");
            }
            return candidates;
        }

        @Override
        public String ruleFileExtension() {
            return ".yaral";
        }

        @Override
        public String rulesDirectory() {
            return "rules";
        }
    }
}
