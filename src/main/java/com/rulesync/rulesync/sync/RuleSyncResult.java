package com.rulesync.rulesync.sync;

/**
 * Outcome counts of one synchronization pass.
 */
public record RuleSyncResult(
        int processed,
        int skipped,
        int uploaded,
        int failedVerification,
        int failedUpload,
        boolean aborted
) {

    public static RuleSyncResult abortedRun() {
        return new RuleSyncResult(0, 0, 0, 0, 0, true);
    }

    public static RuleSyncResult nothingToDo() {
        return new RuleSyncResult(0, 0, 0, 0, 0, false);
    }

    public boolean isSuccess() {
        return !aborted && failedVerification + failedUpload == 0;
    }

    public int exitCode() {
        return isSuccess() ? 0 : 1;
    }
}
