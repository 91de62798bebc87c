package com.rulesync.rulesync.chronicle;

import java.util.Set;

/**
 * The remote rule-management service that rules are deployed to.
 */
public interface RemoteRuleDirectory {

    /**
     * Lists the declared names of every rule registered remotely.
     *
     * @throws com.rulesync.rulesync.api.RemoteServiceException when the first listing page cannot be loaded
     */
    Set<String> listRuleNames();

    /**
     * Asks the service to check the rule syntax. Any failure, including transport errors, yields {@code false}.
     */
    boolean verify(String ruleName, String ruleText);

    /**
     * Creates a new rule. Succeeds only when the service returns the new rule's identifier.
     */
    boolean upload(String ruleName, String ruleText);
}
