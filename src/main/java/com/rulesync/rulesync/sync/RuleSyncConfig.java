package com.rulesync.rulesync.sync;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables binding of pipeline configuration properties.
 */
@Configuration
@EnableConfigurationProperties(RuleSyncProperties.class)
public class RuleSyncConfig {
}
