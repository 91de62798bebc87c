package com.rulesync.rulesync.bitbucket;

import java.util.List;

/**
 * Abstraction for obtaining rule source files from a version-controlled store.
 */
public interface RuleSource {

    /**
     * Reads every qualifying rule file, in listing order. Unreadable individual files are skipped.
     *
     * @throws com.rulesync.rulesync.api.RemoteServiceException when the file listing itself fails
     */
    List<RuleCandidate> listRuleCandidates();

    /**
     * Extension a file must carry to be treated as a rule, including the leading dot.
     */
    String ruleFileExtension();

    /**
     * Repository directory the rule files are read from.
     */
    String rulesDirectory();
}
