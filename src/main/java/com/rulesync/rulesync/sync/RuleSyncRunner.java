package com.rulesync.rulesync.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Runs one synchronization pass at startup and reports its outcome as the process exit code.
 */
@Component
public class RuleSyncRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(RuleSyncRunner.class);

    private final RuleSyncService ruleSyncService;
    private int exitCode;

    public RuleSyncRunner(RuleSyncService ruleSyncService) {
        this.ruleSyncService = ruleSyncService;
    }

    @Override
    public void run(ApplicationArguments args) {
        RuleSyncResult result = ruleSyncService.synchronize();
        exitCode = result.exitCode();
        log.info("Rule sync complete. processed={}, skipped={}, uploaded={}, failedVerification={}, failedUpload={}, exitCode={}",
                result.processed(), result.skipped(), result.uploaded(),
                result.failedVerification(), result.failedUpload(), exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
