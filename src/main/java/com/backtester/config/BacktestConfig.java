package com.backtester.config;

import com.backtester.pricing.ConfiguredTickPolicy;
import com.backtester.pricing.TickPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class BacktestConfig {

    @Bean
    public TickPolicy tickPolicy(BacktestProperties backtestProperties) {
        return new ConfiguredTickPolicy(backtestProperties.getTicks(), backtestProperties.getDefaultTick());
    }
}
