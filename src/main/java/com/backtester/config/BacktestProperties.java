package com.backtester.config;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for backtest runs.
 *
 * <p>Tick sizes are used when a strategy places a percentage-based stop or limit and
 * the resulting price has to be rounded to a tradable level.
 */
@Configuration
@ConfigurationProperties(prefix = "backtester")
@Getter
@Setter
public class BacktestProperties {

    /** Tick size for symbols without an explicit entry in {@link #ticks}. */
    private BigDecimal defaultTick = new BigDecimal("0.01");

    /** Per-symbol tick sizes, e.g. {@code backtester.ticks[ES]=0.25}. */
    private Map<String, BigDecimal> ticks = new HashMap<>();
}
