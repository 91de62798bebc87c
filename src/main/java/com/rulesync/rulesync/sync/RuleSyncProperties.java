package com.rulesync.rulesync.sync;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Pipeline behaviour switches bound from {@code application.properties}.
 */
@ConfigurationProperties(prefix = "rulesync")
public class RuleSyncProperties {

    private boolean finalCountEnabled = true;

    public boolean isFinalCountEnabled() {
        return finalCountEnabled;
    }

    public void setFinalCountEnabled(boolean finalCountEnabled) {
        this.finalCountEnabled = finalCountEnabled;
    }
}
