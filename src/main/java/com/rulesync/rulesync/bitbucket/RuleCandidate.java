package com.rulesync.rulesync.bitbucket;

/**
 * A rule file read from the repository, named after its file name without extension.
 */
public record RuleCandidate(String name, String text, String sourcePath) {
}
