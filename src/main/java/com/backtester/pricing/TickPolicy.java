package com.backtester.pricing;

import java.math.BigDecimal;

/**
 * Minimum price increment per symbol. Only consulted when a percentage-based stop or
 * limit is converted to an absolute order price.
 */
@FunctionalInterface
public interface TickPolicy {

    BigDecimal getTick(String symbol);
}
