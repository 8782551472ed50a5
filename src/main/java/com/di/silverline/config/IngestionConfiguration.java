package com.di.silverline.config;

import com.di.silverline.strategy.StrategyRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the strategy registry at startup. An invalid strategy file fails context creation,
 * so no table is ever processed against a broken configuration.
 */
@Configuration
public class IngestionConfiguration {

    @Bean
    public StrategyRegistry strategyRegistry(StrategyConfigLoader loader) {
        return loader.load();
    }
}
