package com.example.audit.config;

import com.example.audit.event.AuditEventListener;
import com.example.audit.merge.SimilarityMerger;
import com.example.audit.router.StrategyRouter;
import com.example.audit.strategy.AnalysisStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Wires the strategy beans into the router, minus the ones disabled in configuration.
 * Disabling every strategy fails startup with a {@code StrategySetupException}.
 */
@Configuration
public class StrategyConfig {

    private static final Logger log = LoggerFactory.getLogger(StrategyConfig.class);

    @Bean(destroyMethod = "close")
    public StrategyRouter strategyRouter(ObjectProvider<AnalysisStrategy> strategies,
                                         SimilarityMerger merger,
                                         AuditEventListener listener,
                                         AuditProperties properties) {
        List<AnalysisStrategy> enabled = strategies.orderedStream()
                .filter(s -> {
                    boolean disabled = properties.disabledStrategies().contains(s.name());
                    if (disabled) log.info("Strategy {} disabled by configuration", s.name());
                    return !disabled;
                })
                .toList();
        return new StrategyRouter(enabled, merger, properties.strategyTimeout(), listener);
    }
}
