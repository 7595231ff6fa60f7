/*
 * Where: Watch configuration binding
 * What: Holds retention cleanup settings
 * Why: Keep retention policy and schedule tunable per environment
 */
package com.engagewatch.watch.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "watch.retention")
public record RetentionProperties(boolean enabled, int retentionDays, Duration cleanupInterval) {}
