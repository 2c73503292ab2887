package com.backtester.pricing;

import com.backtester.exception.ValidationException;
import java.math.BigDecimal;
import java.util.Map;

/**
 * Tick sizes from an explicit symbol map, falling back to a default tick for symbols
 * the map does not list.
 */
public class ConfiguredTickPolicy implements TickPolicy {

    private final Map<String, BigDecimal> ticks;
    private final BigDecimal defaultTick;

    public ConfiguredTickPolicy(Map<String, BigDecimal> ticks, BigDecimal defaultTick) {
        requirePositive("default", defaultTick);
        ticks.forEach((symbol, tick) -> requirePositive(symbol, tick));
        this.ticks = Map.copyOf(ticks);
        this.defaultTick = defaultTick;
    }

    public static ConfiguredTickPolicy uniform(BigDecimal tick) {
        return new ConfiguredTickPolicy(Map.of(), tick);
    }

    @Override
    public BigDecimal getTick(String symbol) {
        return ticks.getOrDefault(symbol, defaultTick);
    }

    private static void requirePositive(String symbol, BigDecimal tick) {
        if (tick == null || tick.signum() <= 0) {
            throw new ValidationException("Tick size for " + symbol + " must be positive: " + tick);
        }
    }
}
