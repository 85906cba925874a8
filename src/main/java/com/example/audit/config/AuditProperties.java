package com.example.audit.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

/**
 * Configuration properties for the audit system.
 *
 * @param strategyTimeout    Time each strategy is allotted per batch; exceeding it counts as a failure
 * @param maxPromptChars     Contract text longer than this is truncated before prompting
 * @param disabledStrategies Strategy names excluded from the router (e.g. "flash_loan")
 * @param llmMaxRetries      Retries of a failed model call within one strategy
 * @param llmRetryBackoff    Pause before the first retry, growing linearly with each attempt
 */
@ConfigurationProperties(prefix = "audit")
public record AuditProperties(
        @DefaultValue("180s") Duration strategyTimeout,
        @DefaultValue("200000") int maxPromptChars,
        @DefaultValue List<String> disabledStrategies,
        @DefaultValue("2") int llmMaxRetries,
        @DefaultValue("2s") Duration llmRetryBackoff
) {
    public AuditProperties {
        disabledStrategies = disabledStrategies != null ? List.copyOf(disabledStrategies) : List.of();
    }
}
